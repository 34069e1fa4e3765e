package io.tock.spi;

import java.util.List;
import io.tock.client.api.RestJob;

/**
 * Persistence boundary for job records.
 *
 * Implementations must be safe to call from multiple threads. putJob
 * replaces any record with the same id.
 */
public interface JobStore
{
    List<RestJob> getJobs();

    void putJob(RestJob job);

    void deleteJob(String id);
}
