package io.tock.core.store;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import com.google.common.collect.ImmutableList;
import io.tock.client.api.RestJob;
import io.tock.spi.JobStore;

public class MemoryJobStore
        implements JobStore
{
    private final Map<String, RestJob> jobs = new ConcurrentHashMap<>();

    @Override
    public List<RestJob> getJobs()
    {
        return ImmutableList.copyOf(jobs.values());
    }

    @Override
    public void putJob(RestJob job)
    {
        jobs.put(job.getId(), job);
    }

    @Override
    public void deleteJob(String id)
    {
        jobs.remove(id);
    }
}
