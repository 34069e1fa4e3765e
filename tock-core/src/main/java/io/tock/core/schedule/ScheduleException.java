package io.tock.core.schedule;

import io.tock.core.JobInitException;

public abstract class ScheduleException
        extends JobInitException
{
    protected ScheduleException(String message)
    {
        super(message);
    }

    protected ScheduleException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
