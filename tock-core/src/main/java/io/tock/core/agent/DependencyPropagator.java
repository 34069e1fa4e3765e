package io.tock.core.agent;

import com.google.common.base.Optional;
import com.google.inject.Inject;
import com.google.inject.Provider;
import io.tock.core.job.Job;
import io.tock.core.job.JobRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Starts the dependents of a job after it succeeds.
 *
 * Each dependent becomes its own task on the worker pool. Nothing waits for
 * the dependents and their outcomes don't flow back to the parent.
 */
public class DependencyPropagator
{
    private static final Logger logger = LoggerFactory.getLogger(DependencyPropagator.class);

    private final JobRegistry registry;
    private final Provider<JobRunner> runner;

    @Inject
    public DependencyPropagator(JobRegistry registry, Provider<JobRunner> runner)
    {
        this.registry = registry;
        this.runner = runner;
    }

    /**
     * @return number of dependents submitted
     */
    public int propagate(Job parent)
    {
        int submitted = 0;
        for (String dependentId : parent.getDependentJobs()) {
            Optional<Job> dependent = registry.get(dependentId);
            if (!dependent.isPresent()) {
                logger.warn("Dependent job {} of {} is not registered. Skipping.", dependentId, parent.getName());
                continue;
            }
            logger.debug("Triggering dependent job {} of {}", dependent.get().getName(), parent.getName());
            if (runner.get().submit(dependent.get(), RunTrigger.DEPENDENCY)) {
                submitted++;
            }
        }
        return submitted;
    }
}
