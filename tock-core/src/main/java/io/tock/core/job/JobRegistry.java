package io.tock.core.job;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Jobs by id.
 *
 * Lookups are lock-free. Changes to the dependency graph (linking a job
 * under its parents, unlinking on removal) are serialized so that the
 * acyclicity check sees a stable graph.
 */
public class JobRegistry
{
    private static final Logger logger = LoggerFactory.getLogger(JobRegistry.class);

    private final ConcurrentMap<String, Job> jobs = new ConcurrentHashMap<>();
    private final Object linkLock = new Object();

    public Optional<Job> get(String id)
    {
        return Optional.fromNullable(jobs.get(id));
    }

    public Job getJob(String id)
        throws ResourceNotFoundException
    {
        Job job = jobs.get(id);
        if (job == null) {
            throw new ResourceNotFoundException("Job not found: " + id);
        }
        return job;
    }

    public List<Job> getJobs()
    {
        return ImmutableList.copyOf(jobs.values());
    }

    public int size()
    {
        return jobs.size();
    }

    public void register(Job job)
    {
        Job existing = jobs.putIfAbsent(job.getId(), job);
        if (existing != null) {
            throw new IllegalStateException("Duplicated job id: " + job.getId());
        }
    }

    /**
     * Links a job under its parents and registers it in one step.
     */
    public void registerDependent(Job job)
        throws UnresolvedParentException, CyclicDependencyException
    {
        synchronized (linkLock) {
            link(job);
            register(job);
        }
    }

    /**
     * Appends the job's id to the dependent list of each of its parents.
     *
     * Either every parent is linked or none is.
     */
    public void link(Job job)
        throws UnresolvedParentException, CyclicDependencyException
    {
        synchronized (linkLock) {
            ImmutableList.Builder<Job> parents = ImmutableList.builder();
            for (String parentId : job.getParentJobs()) {
                Job parent = jobs.get(parentId);
                if (parent == null) {
                    throw new UnresolvedParentException(parentId);
                }
                if (parentId.equals(job.getId()) || isReachable(job.getId(), parentId)) {
                    throw new CyclicDependencyException(String.format(
                                "Job %s can't depend on %s because %s already runs after %s",
                                job.getId(), parentId, parentId, job.getId()));
                }
                parents.add(parent);
            }
            for (Job parent : parents.build()) {
                parent.addDependentJob(job.getId());
                logger.debug("Linked job {} as a dependent of {}", job.getId(), parent.getId());
            }
        }
    }

    /**
     * Removes a job and drops it from the dependent lists of its parents.
     * Jobs that depend on the removed job keep their reference; it resolves
     * to nothing from then on.
     */
    public Optional<Job> remove(String id)
    {
        synchronized (linkLock) {
            Job removed = jobs.remove(id);
            if (removed == null) {
                return Optional.absent();
            }
            for (String parentId : removed.getParentJobs()) {
                Job parent = jobs.get(parentId);
                if (parent != null) {
                    parent.removeDependentJob(id);
                }
            }
            return Optional.of(removed);
        }
    }

    // true if target runs (directly or transitively) after a run of from
    private boolean isReachable(String from, String target)
    {
        Set<String> visited = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(from);
        while (!queue.isEmpty()) {
            String id = queue.poll();
            if (!visited.add(id)) {
                continue;
            }
            Job job = jobs.get(id);
            if (job == null) {
                continue;
            }
            for (String dependentId : job.getDependentJobs()) {
                if (dependentId.equals(target)) {
                    return true;
                }
                queue.add(dependentId);
            }
        }
        return false;
    }
}
