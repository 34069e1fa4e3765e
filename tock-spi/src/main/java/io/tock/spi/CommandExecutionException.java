package io.tock.spi;

/**
 * A command attempt failed: the process could not be started, exited with a
 * non-zero status, or was interrupted.
 */
public class CommandExecutionException
        extends Exception
{
    public CommandExecutionException(String message)
    {
        super(message);
    }

    public CommandExecutionException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
