package io.tock.core.schedule;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import com.google.common.base.Optional;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.Inject;
import io.tock.core.ErrorReporter;
import io.tock.core.agent.JobRunner;
import io.tock.core.agent.RunTrigger;
import io.tock.core.job.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Keeps one pending timer per scheduled job.
 *
 * When a timer fires it consumes one repeat, hands the occurrence to the
 * {@link JobRunner} and arms the next timer. The step is resolved from the
 * current time, not from the previous fire time. Timer threads never run
 * commands.
 */
public class JobTimer
{
    private static final Logger logger = LoggerFactory.getLogger(JobTimer.class);

    private final JobRunner runner;
    private final ErrorReporter errorReporter;
    private final ScheduledExecutorService timer;

    @Inject
    public JobTimer(JobRunner runner, ErrorReporter errorReporter)
    {
        this.runner = runner;
        this.errorReporter = errorReporter;
        this.timer = Executors.newSingleThreadScheduledExecutor(
                new ThreadFactoryBuilder()
                .setDaemon(true)
                .setNameFormat("job-timer-%d")
                .build()
                );
    }

    /**
     * Arms the first timer of a scheduled job.
     */
    public void start(Job job)
    {
        checkArgument(job.getIntervalSchedule().isPresent(), "Job %s has no parsed schedule", job.getId());
        arm(job, job.nextWait(Instant.now()));
    }

    /**
     * Disables the job and cancels its pending timer. A timer that is firing
     * concurrently finds the job disabled and does nothing.
     */
    public void disable(Job job)
    {
        if (job.disable()) {
            logger.info("Job {} disabled", job.getName());
        }
    }

    public boolean isShutdown()
    {
        return timer.isShutdown();
    }

    public void shutdown()
    {
        timer.shutdownNow();
    }

    private void arm(Job job, Duration wait)
    {
        boolean armed;
        try {
            armed = job.armTimer(() -> timer.schedule(() -> fire(job), wait.toMillis(), TimeUnit.MILLISECONDS));
        }
        catch (RejectedExecutionException ex) {
            logger.warn("Timer is shut down. Job {} is not scheduled", job.getName());
            return;
        }
        if (armed) {
            logger.info("Job {} scheduled to run in {}", job.getName(), wait);
        }
        else {
            logger.debug("Job {} is disabled. Not arming its timer", job.getName());
        }
    }

    private void fire(Job job)
    {
        try {
            Optional<Boolean> more = job.fireTimer();
            if (!more.isPresent()) {
                logger.debug("Job {} is disabled. Ignoring its timer", job.getName());
                return;
            }
            submit(job);
            if (more.get()) {
                rearm(job);
            }
            else {
                logger.info("Job {} has no more occurrences after this run", job.getName());
            }
        }
        catch (Throwable t) {
            logger.error("Uncaught exception while firing job {}. Ignoring.", job.getName(), t);
            errorReporter.reportUncaughtError(t);
        }
    }

    private void submit(Job job)
    {
        try {
            runner.submit(job, RunTrigger.SCHEDULE);
        }
        catch (RuntimeException ex) {
            logger.error("Failed to submit job {}. Ignoring this occurrence.", job.getName(), ex);
            errorReporter.reportUncaughtError(ex);
        }
    }

    // the current occurrence is already submitted when this fails
    private void rearm(Job job)
    {
        Duration wait;
        try {
            wait = job.nextWait(Instant.now());
        }
        catch (DateTimeException | ArithmeticException ex) {
            logger.error("Can't compute the next occurrence of job {}. It won't run again by its schedule.", job.getName(), ex);
            errorReporter.reportUncaughtError(ex);
            return;
        }
        arm(job, wait);
    }
}
