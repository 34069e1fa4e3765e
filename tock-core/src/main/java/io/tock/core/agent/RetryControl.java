package io.tock.core.agent;

import io.tock.core.job.Job;

/**
 * Retry budget of one occurrence.
 *
 * The budget lives on the job: it is re-seeded from the job's configured
 * retries only after it has been used up, so an occurrence that succeeds
 * part way through its budget leaves the remainder to the next occurrence.
 */
public class RetryControl
{
    public static RetryControl prepare(Job job)
    {
        job.prepareRetries();
        return new RetryControl(job);
    }

    private final Job job;
    private int retryCount = 0;

    private RetryControl(Job job)
    {
        this.job = job;
    }

    public int getRetryCount()
    {
        return retryCount;
    }

    public int getRemainingRetries()
    {
        return job.getCurrentRetries();
    }

    /**
     * Consumes one retry.
     *
     * @return true if another attempt is allowed
     */
    public boolean evaluate()
    {
        if (job.takeRetry()) {
            retryCount++;
            return true;
        }
        return false;
    }
}
