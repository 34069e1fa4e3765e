package io.tock.core.job;

public enum JobState
{
    /**
     * Not armed. Dependent jobs, one-off jobs and manually triggered jobs
     * rest here between runs.
     */
    IDLE,

    /**
     * A timer is pending.
     */
    SCHEDULED,

    RUNNING,

    /**
     * All occurrences of the schedule have fired.
     */
    COMPLETED,

    DISABLED;
}
