package io.tock.spi;

import java.time.Duration;

public class CommandTimeoutException
        extends CommandExecutionException
{
    private final Duration timeout;

    public CommandTimeoutException(String message, Duration timeout)
    {
        super(message);
        this.timeout = timeout;
    }

    public Duration getTimeout()
    {
        return timeout;
    }
}
