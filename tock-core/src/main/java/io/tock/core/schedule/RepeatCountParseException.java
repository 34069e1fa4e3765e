package io.tock.core.schedule;

public class RepeatCountParseException
        extends ScheduleException
{
    public RepeatCountParseException(String message)
    {
        super(message);
    }

    public RepeatCountParseException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
