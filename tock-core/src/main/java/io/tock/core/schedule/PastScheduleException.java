package io.tock.core.schedule;

import java.time.Instant;

public class PastScheduleException
        extends ScheduleException
{
    private final Instant startTime;

    public PastScheduleException(String message, Instant startTime)
    {
        super(message);
        this.startTime = startTime;
    }

    public Instant getStartTime()
    {
        return startTime;
    }
}
