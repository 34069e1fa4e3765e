package io.tock.core.schedule;

/**
 * The step part of a schedule is not a positive ISO-8601 duration.
 */
public class DurationParseException
        extends ScheduleException
{
    public DurationParseException(String message)
    {
        super(message);
    }

    public DurationParseException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
