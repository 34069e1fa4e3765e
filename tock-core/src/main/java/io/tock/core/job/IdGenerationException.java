package io.tock.core.job;

import io.tock.core.JobInitException;

public class IdGenerationException
        extends JobInitException
{
    public IdGenerationException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
