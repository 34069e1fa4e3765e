package io.tock.core;

/**
 * A job could not be created. The job is neither registered nor scheduled.
 *
 * This exception is deterministic: retrying the same definition fails the
 * same way, except for {@link io.tock.core.job.IdGenerationException}.
 */
public abstract class JobInitException
        extends Exception
{
    protected JobInitException(String message)
    {
        super(message);
    }

    protected JobInitException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
