package io.tock.spi;

public interface CommandExecutor
{
    /**
     * Runs a command and blocks until it exits.
     *
     * A non-zero status code is returned, not thrown. Failures to launch the
     * process, interruption, and timeouts are thrown.
     */
    CommandStatus run(CommandRequest request)
        throws CommandExecutionException;
}
