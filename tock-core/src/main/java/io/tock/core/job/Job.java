package io.tock.core.job;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import io.tock.client.api.RestJob;
import io.tock.core.schedule.IntervalSchedule;
import io.tock.spi.JobStore;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

/**
 * A job and its run statistics.
 *
 * All mutable fields are guarded by this object's monitor. Runs of the same
 * job are serialized by a separate occurrence lock (see
 * {@link #lockOccurrence()}) so that the monitor is never held while a
 * command is executing and {@link #disable()} never blocks on a run.
 */
public class Job
{
    private final String id;
    private final String name;
    private final String owner;
    private final String command;
    private final String schedule;
    private final int retries;
    private final List<String> parentJobs;

    private final ReentrantLock occurrenceLock = new ReentrantLock();

    private boolean disabled;
    private boolean deleted = false;
    private final Set<String> dependentJobs = new LinkedHashSet<>();

    private Optional<IntervalSchedule> intervalSchedule = Optional.absent();
    private long repeatCount = 0;
    private boolean anchorConsumed = false;
    private ScheduledFuture<?> pendingTimer = null;
    private boolean running = false;
    private boolean occurrenceQueued = false;

    private int currentRetries = 0;

    private long successCount = 0;
    private Optional<Instant> lastSuccess = Optional.absent();
    private long errorCount = 0;
    private Optional<Instant> lastError = Optional.absent();
    private Optional<Instant> lastAttemptedRun = Optional.absent();

    private Job(String id, String name, String owner, String command, String schedule,
            int retries, List<String> parentJobs, boolean disabled)
    {
        checkArgument(!id.isEmpty(), "id must not be empty");
        this.id = id;
        this.name = name;
        this.owner = owner;
        this.command = command;
        this.schedule = schedule;
        this.retries = retries;
        this.parentJobs = ImmutableList.copyOf(new LinkedHashSet<>(parentJobs));
        this.disabled = disabled;
    }

    public static Job of(String id, JobDefinition def)
    {
        return new Job(id, def.getName(), def.getOwner(), def.getCommand(), def.getSchedule(),
                def.getRetries(), def.getParentJobs(), def.getDisabled());
    }

    public static Job fromRecord(RestJob record)
    {
        Job job = new Job(record.getId(), record.getName(), record.getOwner(), record.getCommand(),
                record.getSchedule(), record.getRetries(), record.getParentJobs(), record.getDisabled());
        job.dependentJobs.addAll(record.getDependentJobs());
        job.successCount = record.getSuccessCount();
        job.lastSuccess = record.getLastSuccess();
        job.errorCount = record.getErrorCount();
        job.lastError = record.getLastError();
        job.lastAttemptedRun = record.getLastAttemptedRun();
        return job;
    }

    public synchronized RestJob toRecord()
    {
        return RestJob.builder()
            .id(id)
            .name(name)
            .owner(owner)
            .command(command)
            .disabled(disabled)
            .dependentJobs(dependentJobs)
            .parentJobs(parentJobs)
            .schedule(schedule)
            .retries(retries)
            .successCount(successCount)
            .lastSuccess(lastSuccess)
            .errorCount(errorCount)
            .lastError(lastError)
            .lastAttemptedRun(lastAttemptedRun)
            .build();
    }

    public String getId()
    {
        return id;
    }

    public String getName()
    {
        return name;
    }

    public String getOwner()
    {
        return owner;
    }

    public String getCommand()
    {
        return command;
    }

    public String getSchedule()
    {
        return schedule;
    }

    public int getRetries()
    {
        return retries;
    }

    public List<String> getParentJobs()
    {
        return parentJobs;
    }

    public boolean hasParents()
    {
        return !parentJobs.isEmpty();
    }

    public synchronized List<String> getDependentJobs()
    {
        return ImmutableList.copyOf(dependentJobs);
    }

    public synchronized boolean addDependentJob(String dependentId)
    {
        return dependentJobs.add(dependentId);
    }

    public synchronized boolean removeDependentJob(String dependentId)
    {
        return dependentJobs.remove(dependentId);
    }

    public synchronized boolean isDisabled()
    {
        return disabled;
    }

    /**
     * Marks this job disabled and cancels its pending timer.
     *
     * A run that already started is not interrupted, but no run starts after
     * this method returns.
     *
     * @return false if the job was already disabled
     */
    public synchronized boolean disable()
    {
        cancelTimer();
        if (disabled) {
            return false;
        }
        disabled = true;
        return true;
    }

    public synchronized boolean isDeleted()
    {
        return deleted;
    }

    /**
     * Saves this job's record unless the job has been deleted.
     *
     * The record is written while holding this job's monitor, so a run
     * that finishes concurrently with {@link #deleteFrom(JobStore)} can't
     * bring the record back.
     *
     * @return false if the job is deleted and nothing was saved
     */
    public synchronized boolean saveTo(JobStore store)
    {
        if (deleted) {
            return false;
        }
        store.putJob(toRecord());
        return true;
    }

    /**
     * Disables this job, cancels its pending timer and removes its record.
     * No record of this job is saved afterwards.
     */
    public synchronized void deleteFrom(JobStore store)
    {
        cancelTimer();
        disabled = true;
        deleted = true;
        store.deleteJob(id);
    }

    public synchronized JobState getState()
    {
        if (disabled) {
            return JobState.DISABLED;
        }
        else if (running) {
            return JobState.RUNNING;
        }
        else if (pendingTimer != null) {
            return JobState.SCHEDULED;
        }
        else if (intervalSchedule.isPresent() && anchorConsumed && repeatCount == 0) {
            return JobState.COMPLETED;
        }
        return JobState.IDLE;
    }

    // Timer state

    public synchronized Optional<IntervalSchedule> getIntervalSchedule()
    {
        return intervalSchedule;
    }

    public synchronized void applySchedule(IntervalSchedule parsed)
    {
        checkState(!hasParents(), "A job with parent jobs is never scheduled: %s", id);
        this.intervalSchedule = Optional.of(parsed);
        this.repeatCount = parsed.getRepeatCount();
        this.anchorConsumed = false;
    }

    public synchronized long getRepeatCount()
    {
        return repeatCount;
    }

    /**
     * Time to wait from {@code now} until the next occurrence.
     *
     * The first call waits for the anchor time unless it has already passed.
     * Every later call resolves the step from {@code now}.
     */
    public synchronized Duration nextWait(Instant now)
    {
        IntervalSchedule s = intervalSchedule.get();
        if (!anchorConsumed) {
            anchorConsumed = true;
            if (s.getAnchorTime().isAfter(now)) {
                return Duration.between(now, s.getAnchorTime());
            }
        }
        return s.getStep().waitFrom(now);
    }

    /**
     * Replaces the pending timer with one created by {@code scheduler}.
     *
     * The timer is created while holding this job's monitor, so it can't
     * fire before it is recorded here.
     *
     * @return false if the job is disabled; no timer is created in that case
     */
    public synchronized boolean armTimer(Supplier<ScheduledFuture<?>> scheduler)
    {
        if (disabled) {
            return false;
        }
        cancelTimer();
        this.pendingTimer = scheduler.get();
        return true;
    }

    public synchronized void cancelTimer()
    {
        if (pendingTimer != null) {
            pendingTimer.cancel(false);
            pendingTimer = null;
        }
    }

    /**
     * Called by a timer when it fires. Clears the pending timer and
     * consumes one repeat.
     *
     * @return absent if the job is disabled, otherwise whether another
     *     occurrence remains after this one
     */
    public synchronized Optional<Boolean> fireTimer()
    {
        if (disabled) {
            return Optional.absent();
        }
        pendingTimer = null;
        if (repeatCount == 0) {
            return Optional.of(false);
        }
        if (repeatCount > 0) {
            repeatCount--;
        }
        return Optional.of(true);
    }

    // Run state

    /**
     * Serializes runs of this job. Hold it for a whole occurrence including
     * its retries.
     */
    public void lockOccurrence()
    {
        occurrenceLock.lock();
    }

    public void unlockOccurrence()
    {
        occurrenceLock.unlock();
    }

    /**
     * Marks an occurrence as waiting for a worker.
     *
     * @return false if another occurrence is already waiting; the caller
     *     merges into that one instead of queueing another
     */
    public synchronized boolean queueOccurrence()
    {
        if (occurrenceQueued) {
            return false;
        }
        occurrenceQueued = true;
        return true;
    }

    public synchronized void dequeueOccurrence()
    {
        occurrenceQueued = false;
    }

    /**
     * @return false if the job is disabled and must not run
     */
    public synchronized boolean beginOccurrence()
    {
        if (disabled) {
            return false;
        }
        running = true;
        return true;
    }

    public synchronized void endOccurrence()
    {
        running = false;
    }

    public synchronized int getCurrentRetries()
    {
        return currentRetries;
    }

    public synchronized void prepareRetries()
    {
        if (currentRetries == 0 && retries != 0) {
            currentRetries = retries;
        }
    }

    public synchronized boolean takeRetry()
    {
        if (currentRetries <= 0) {
            return false;
        }
        currentRetries--;
        return true;
    }

    // Statistics

    public synchronized void recordAttempt(Instant at)
    {
        lastAttemptedRun = Optional.of(at);
    }

    public synchronized void recordAttemptError(Instant at)
    {
        lastError = Optional.of(at);
    }

    public synchronized void recordSuccess(Instant at)
    {
        successCount++;
        lastSuccess = Optional.of(at);
    }

    public synchronized void recordFailure()
    {
        errorCount++;
    }

    public synchronized long getSuccessCount()
    {
        return successCount;
    }

    public synchronized Optional<Instant> getLastSuccess()
    {
        return lastSuccess;
    }

    public synchronized long getErrorCount()
    {
        return errorCount;
    }

    public synchronized Optional<Instant> getLastError()
    {
        return lastError;
    }

    public synchronized Optional<Instant> getLastAttemptedRun()
    {
        return lastAttemptedRun;
    }

    @Override
    public String toString()
    {
        return String.format("Job{id=%s, name=%s}", id, name);
    }
}
