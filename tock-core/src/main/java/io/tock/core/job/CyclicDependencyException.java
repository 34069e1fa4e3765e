package io.tock.core.job;

import io.tock.core.JobInitException;

/**
 * Linking a job under its parents would let the job trigger itself.
 */
public class CyclicDependencyException
        extends JobInitException
{
    public CyclicDependencyException(String message)
    {
        super(message);
    }
}
