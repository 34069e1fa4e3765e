package io.tock.core.schedule;

/**
 * The start part of a schedule is not an ISO-8601 date-time with an offset.
 */
public class TimestampParseException
        extends ScheduleException
{
    public TimestampParseException(String message)
    {
        super(message);
    }

    public TimestampParseException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
