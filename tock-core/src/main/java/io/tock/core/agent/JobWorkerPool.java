package io.tock.core.agent;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import com.google.common.base.Optional;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.Inject;
import io.tock.core.ErrorReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Threads that run job occurrences.
 *
 * Every timer firing, one-off job, dependency trigger and manual trigger
 * becomes one task here.
 */
public class JobWorkerPool
{
    private static final Logger logger = LoggerFactory.getLogger(JobWorkerPool.class);

    private final ErrorReporter errorReporter;
    private final ThreadPoolExecutor executor;
    private final AtomicInteger activeTaskCount = new AtomicInteger(0);

    @Inject
    public JobWorkerPool(ExecutorConfig config, ErrorReporter errorReporter)
    {
        this.errorReporter = errorReporter;

        ThreadFactory threadFactory = new ThreadFactoryBuilder()
            .setDaemon(false)  // shutting down the engine must not kill running commands
            .setNameFormat("job-thread-%d")
            .build();

        BlockingQueue<Runnable> queue;
        if (config.getMaxThreads() > 0) {
            queue = new LinkedBlockingQueue<Runnable>();
            this.executor = new ThreadPoolExecutor(
                    config.getMaxThreads(), config.getMaxThreads(),
                    0L, TimeUnit.SECONDS,
                    queue, threadFactory);
        }
        else {
            // no upper limit. Hand tasks over directly; SynchronousQueue.size() is always 0
            queue = new SynchronousQueue<Runnable>();
            this.executor = new ThreadPoolExecutor(
                    0, Integer.MAX_VALUE,
                    60L, TimeUnit.SECONDS,
                    queue, threadFactory);
        }
    }

    /**
     * @return false if the pool is shut down and the task was dropped
     */
    public boolean submit(String description, Runnable task)
    {
        activeTaskCount.incrementAndGet();
        try {
            executor.execute(() -> {
                try {
                    task.run();
                }
                catch (Throwable t) {
                    logger.error("Uncaught exception during {}. Ignoring.", description, t);
                    errorReporter.reportUncaughtError(t);
                }
                finally {
                    activeTaskCount.decrementAndGet();
                }
            });
            return true;
        }
        catch (RejectedExecutionException ex) {
            activeTaskCount.decrementAndGet();
            logger.warn("Worker pool is shut down. Dropping {}", description);
            return false;
        }
    }

    public int getActiveTaskCount()
    {
        return activeTaskCount.get();
    }

    public boolean isShutdown()
    {
        return executor.isShutdown();
    }

    public void shutdown(Optional<Duration> maximumCompletionWait)
        throws InterruptedException
    {
        executor.shutdown();
        int activeTasks = activeTaskCount.get();
        if (activeTasks > 0) {
            logger.info("Waiting for completion of {} running jobs...", activeTasks);
        }
        if (maximumCompletionWait.isPresent()) {
            long millis = maximumCompletionWait.get().toMillis();
            if (!executor.awaitTermination(millis, TimeUnit.MILLISECONDS)) {
                logger.warn("Some jobs didn't finish within maximum wait time ({} ms)", millis);
            }
        }
        else {
            while (!executor.awaitTermination(24, TimeUnit.HOURS))
                ;
        }
    }
}
