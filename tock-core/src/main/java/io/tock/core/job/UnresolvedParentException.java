package io.tock.core.job;

import io.tock.core.JobInitException;

public class UnresolvedParentException
        extends JobInitException
{
    private final String parentId;

    public UnresolvedParentException(String parentId)
    {
        super("Parent job does not exist: " + parentId);
        this.parentId = parentId;
    }

    public String getParentId()
    {
        return parentId;
    }
}
