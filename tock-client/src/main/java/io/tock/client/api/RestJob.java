package io.tock.client.api;

import java.time.Instant;
import java.util.List;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.common.base.Optional;
import org.immutables.value.Value;

/**
 * Externally visible fields of a job.
 *
 * This is what a management layer lists and what a job store saves. Runtime
 * state that cannot survive a restart (pending timers, remaining retries,
 * remaining repeats) is not part of the record.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableRestJob.class)
@JsonDeserialize(as = ImmutableRestJob.class)
public interface RestJob
{
    String getName();

    String getId();

    String getCommand();

    @Value.Default
    default String getOwner()
    {
        return "";
    }

    @Value.Default
    default boolean getDisabled()
    {
        return false;
    }

    @JsonProperty("dependent_jobs")
    List<String> getDependentJobs();

    @JsonProperty("parent_jobs")
    List<String> getParentJobs();

    @Value.Default
    default String getSchedule()
    {
        return "";
    }

    @Value.Default
    default int getRetries()
    {
        return 0;
    }

    @JsonProperty("success_count")
    @Value.Default
    default long getSuccessCount()
    {
        return 0L;
    }

    @JsonProperty("last_success")
    Optional<Instant> getLastSuccess();

    @JsonProperty("error_count")
    @Value.Default
    default long getErrorCount()
    {
        return 0L;
    }

    @JsonProperty("last_error")
    Optional<Instant> getLastError();

    @JsonProperty("last_attempted_run")
    Optional<Instant> getLastAttemptedRun();

    static ImmutableRestJob.Builder builder()
    {
        return ImmutableRestJob.builder();
    }
}
