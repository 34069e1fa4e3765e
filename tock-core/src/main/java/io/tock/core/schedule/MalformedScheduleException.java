package io.tock.core.schedule;

/**
 * The schedule does not have exactly three '/'-separated parts.
 */
public class MalformedScheduleException
        extends ScheduleException
{
    public MalformedScheduleException(String message)
    {
        super(message);
    }

    public MalformedScheduleException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
