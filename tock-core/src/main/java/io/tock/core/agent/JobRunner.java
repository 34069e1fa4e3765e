package io.tock.core.agent;

import java.time.Instant;
import java.util.List;
import com.google.inject.Inject;
import io.tock.core.job.Job;
import io.tock.spi.CommandExecutionException;
import io.tock.spi.CommandExecutor;
import io.tock.spi.CommandRequest;
import io.tock.spi.CommandStatus;
import io.tock.spi.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one occurrence of a job: executes its command, retries failures
 * within the retry budget, records statistics, saves the job record and
 * triggers dependents on success.
 *
 * Execution errors never leave this class, including runtime exceptions
 * thrown by a {@link CommandExecutor}. They are logged and recorded on the
 * job.
 */
public class JobRunner
{
    private static final Logger logger = LoggerFactory.getLogger(JobRunner.class);

    private final CommandExecutor executor;
    private final JobWorkerPool workerPool;
    private final DependencyPropagator propagator;
    private final JobStore store;
    private final ExecutorConfig config;

    @Inject
    public JobRunner(CommandExecutor executor, JobWorkerPool workerPool,
            DependencyPropagator propagator, JobStore store, ExecutorConfig config)
    {
        this.executor = executor;
        this.workerPool = workerPool;
        this.propagator = propagator;
        this.store = store;
        this.config = config;
    }

    /**
     * Runs the job on the worker pool without waiting for it.
     *
     * At most one occurrence per job waits for a worker. A trigger that
     * arrives while one is already waiting is merged into it.
     *
     * @return false if the worker pool is shut down
     */
    public boolean submit(Job job, RunTrigger trigger)
    {
        if (!job.queueOccurrence()) {
            logger.info("Job {} already has an occurrence waiting to run. Merging {} run into it", job.getName(), trigger);
            return true;
        }
        boolean submitted = workerPool.submit(
                String.format("%s run of job %s", trigger, job.getName()),
                () -> run(job, trigger));
        if (!submitted) {
            job.dequeueOccurrence();
        }
        return submitted;
    }

    /**
     * Runs one occurrence in the calling thread.
     *
     * Blocks while another occurrence of the same job is running.
     *
     * @return true if the command succeeded
     */
    public boolean run(Job job, RunTrigger trigger)
    {
        job.lockOccurrence();
        try {
            job.dequeueOccurrence();
            if (!job.beginOccurrence()) {
                logger.info("Job {} is disabled. Skipping {} run", job.getName(), trigger);
                return false;
            }
            logger.info("Job {} running ({})", job.getName(), trigger);

            boolean success;
            try {
                success = runAttempts(job);
            }
            finally {
                job.endOccurrence();
            }

            if (!job.saveTo(store)) {
                logger.info("Job {} was deleted while running. Dropping its result", job.getName());
                return false;
            }

            if (success) {
                logger.info("{} was successful!", job.getName());
                propagator.propagate(job);
            }
            return success;
        }
        finally {
            job.unlockOccurrence();
        }
    }

    private boolean runAttempts(Job job)
    {
        RetryControl retryControl = RetryControl.prepare(job);
        while (true) {
            job.recordAttempt(Instant.now());
            try {
                attempt(job);
                job.recordSuccess(Instant.now());
                return true;
            }
            catch (CommandExecutionException | RuntimeException ex) {
                // executor plugins may throw unchecked exceptions too
                logger.error("Run command of job {} got an error: {}", job.getName(), ex.getMessage(), ex);
                job.recordAttemptError(Instant.now());
                if (!retryControl.evaluate()) {
                    job.recordFailure();
                    if (retryControl.getRetryCount() > 0) {
                        logger.warn("Job {} failed after {} retries", job.getName(), retryControl.getRetryCount());
                    }
                    return false;
                }
                logger.info("Retrying job {} (retry {}, {} left)", job.getName(),
                        retryControl.getRetryCount(), retryControl.getRemainingRetries());
            }
        }
    }

    private void attempt(Job job)
        throws CommandExecutionException
    {
        List<String> commandLine = CommandLines.tokenize(job.getCommand());
        if (commandLine.isEmpty()) {
            throw new CommandExecutionException("Command is empty");
        }
        CommandRequest request = CommandRequest.builder()
            .jobId(job.getId())
            .jobName(job.getName())
            .commandLine(commandLine)
            .timeout(config.getCommandTimeout())
            .build();
        CommandStatus status = executor.run(request);
        if (!status.isSuccess()) {
            throw new CommandExecutionException(String.format(
                        "Command '%s' exited with status %d", commandLine.get(0), status.getStatusCode()));
        }
    }
}
