package io.tock.core;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import com.google.common.base.Optional;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;
import io.tock.client.api.RestJob;
import io.tock.core.agent.ExecutorConfig;
import io.tock.core.agent.JobRunner;
import io.tock.core.agent.JobWorkerPool;
import io.tock.core.agent.RunTrigger;
import io.tock.core.job.IdGenerationException;
import io.tock.core.job.Job;
import io.tock.core.job.JobDefinition;
import io.tock.core.job.JobRegistry;
import io.tock.core.job.ResourceNotFoundException;
import io.tock.core.schedule.IntervalSchedule;
import io.tock.core.schedule.IntervalScheduleParser;
import io.tock.core.schedule.JobTimer;
import io.tock.spi.JobIdGenerator;
import io.tock.spi.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Preconditions.checkState;

/**
 * Entry point for creation and management layers.
 *
 * <ul>
 * <li>{@link #create(JobDefinition)} assigns an id and initializes a job.</li>
 * <li>{@link #disable(String)}, {@link #delete(String)} and {@link #runNow(String)} act on registered jobs.</li>
 * <li>{@link #start()} restores jobs from the {@link JobStore}; {@link #shutdown()} cancels every pending timer.</li>
 * </ul>
 */
public class JobEngine
{
    private static final Logger logger = LoggerFactory.getLogger(JobEngine.class);

    private final JobRegistry registry;
    private final IntervalScheduleParser parser;
    private final JobTimer timer;
    private final JobRunner runner;
    private final JobWorkerPool workerPool;
    private final JobStore store;
    private final JobIdGenerator idGenerator;
    private final ExecutorConfig config;

    private boolean started = false;

    @Inject
    public JobEngine(JobRegistry registry, IntervalScheduleParser parser, JobTimer timer,
            JobRunner runner, JobWorkerPool workerPool, JobStore store,
            JobIdGenerator idGenerator, ExecutorConfig config)
    {
        this.registry = registry;
        this.parser = parser;
        this.timer = timer;
        this.runner = runner;
        this.workerPool = workerPool;
        this.store = store;
        this.idGenerator = idGenerator;
        this.config = config;
    }

    public Job create(JobDefinition def)
        throws JobInitException
    {
        Job job = Job.of(generateId(), def);
        init(job);
        job.saveTo(store);
        return job;
    }

    /**
     * Registers a new job and decides how it runs.
     *
     * <ul>
     * <li>A job with parents is linked under them and runs only when one of them succeeds.</li>
     * <li>A job without a schedule runs once, right away, on the worker pool.</li>
     * <li>Otherwise the schedule is parsed and the first timer is armed.</li>
     * </ul>
     *
     * On failure the job is neither registered nor linked.
     */
    public void init(Job job)
        throws JobInitException
    {
        if (job.hasParents()) {
            registry.registerDependent(job);
            logger.info("Job {} added as a dependent of {}", job.getName(), job.getParentJobs());
        }
        else if (job.getSchedule().isEmpty()) {
            registry.register(job);
            if (!job.isDisabled()) {
                runner.submit(job, RunTrigger.ONE_OFF);
            }
        }
        else {
            IntervalSchedule schedule = parser.parseFutureSchedule(job.getSchedule(), Instant.now());
            job.applySchedule(schedule);
            registry.register(job);
            if (!job.isDisabled()) {
                timer.start(job);
            }
        }
    }

    /**
     * Loads jobs from the store and resumes them.
     *
     * Stored statistics and links are kept. A scheduled job whose start time
     * has passed runs one step from now. A one-off job that already ran
     * isn't run again. A job that can't be restored is logged and dropped
     * from the registry but kept in the store.
     */
    public synchronized void start()
    {
        checkState(!started, "JobEngine is already started");
        started = true;

        List<RestJob> records = store.getJobs();
        ImmutableList.Builder<Job> restored = ImmutableList.builder();
        for (RestJob record : records) {
            Job job = Job.fromRecord(record);
            try {
                registry.register(job);
                restored.add(job);
            }
            catch (IllegalStateException ex) {
                logger.warn("Ignoring stored job with duplicated id {}", record.getId());
            }
        }
        for (Job job : restored.build()) {
            try {
                restore(job);
            }
            catch (JobInitException ex) {
                logger.error("Failed to restore job {} ({}): {}", job.getName(), job.getId(), ex.getMessage());
                registry.remove(job.getId());
            }
        }
        if (!records.isEmpty()) {
            logger.info("Restored {} of {} stored jobs", registry.size(), records.size());
        }
    }

    private void restore(Job job)
        throws JobInitException
    {
        if (job.hasParents()) {
            registry.link(job);
        }
        else if (job.getSchedule().isEmpty()) {
            if (!job.isDisabled() && !job.getLastAttemptedRun().isPresent()) {
                runner.submit(job, RunTrigger.ONE_OFF);
            }
        }
        else {
            job.applySchedule(parser.parse(job.getSchedule()));
            if (!job.isDisabled()) {
                timer.start(job);
            }
        }
    }

    public Job getJob(String id)
        throws ResourceNotFoundException
    {
        return registry.getJob(id);
    }

    public List<Job> getJobs()
    {
        return registry.getJobs();
    }

    public void disable(String id)
        throws ResourceNotFoundException
    {
        disable(registry.getJob(id));
    }

    public void disable(Job job)
    {
        timer.disable(job);
        job.saveTo(store);
    }

    /**
     * Runs the job once now, outside its schedule. Repeats are not consumed.
     */
    public void runNow(String id)
        throws ResourceNotFoundException
    {
        runner.submit(registry.getJob(id), RunTrigger.MANUAL);
    }

    /**
     * Removes the job from the registry and the store. A run that is in
     * progress finishes, but its result is neither saved nor propagated.
     */
    public void delete(String id)
        throws ResourceNotFoundException
    {
        Job job = registry.getJob(id);
        job.deleteFrom(store);
        registry.remove(id);
        logger.info("Job {} deleted", job.getName());
    }

    public void shutdown()
        throws InterruptedException
    {
        for (Job job : registry.getJobs()) {
            job.cancelTimer();
        }
        timer.shutdown();
        workerPool.shutdown(Optional.of(Duration.ofSeconds(config.getShutdownWaitSeconds())));
    }

    private String generateId()
        throws IdGenerationException
    {
        String id;
        try {
            id = idGenerator.generate();
        }
        catch (RuntimeException ex) {
            logger.error("Error occurred when generating a job id", ex);
            throw new IdGenerationException("Failed to generate a job id", ex);
        }
        if (Strings.isNullOrEmpty(id)) {
            throw new IdGenerationException("Job id generator returned an empty id", null);
        }
        return id;
    }
}
