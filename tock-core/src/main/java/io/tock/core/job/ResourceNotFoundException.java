package io.tock.core.job;

/**
 * An exception thrown when a job id is not registered.
 */
public class ResourceNotFoundException extends Exception
{
    public ResourceNotFoundException(String message)
    {
        super(message);
    }
}
