package io.tock.core.job;

import java.util.List;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.common.base.CharMatcher;
import org.immutables.value.Value;

import static com.google.common.base.Preconditions.checkState;

/**
 * What a caller supplies to create a job. The id is generated at creation.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableJobDefinition.class)
@JsonDeserialize(as = ImmutableJobDefinition.class)
public interface JobDefinition
{
    String getName();

    @Value.Default
    default String getOwner()
    {
        return "";
    }

    /**
     * Executable and arguments separated by whitespace, e.g. {@code bash /path/to/script.sh}.
     * Quoting is not supported.
     */
    String getCommand();

    /**
     * Interval-notation schedule. Empty means run once right away.
     * Ignored when {@link #getParentJobs()} is not empty.
     */
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

    @JsonProperty("parent_jobs")
    List<String> getParentJobs();

    @Value.Default
    default boolean getDisabled()
    {
        return false;
    }

    @Value.Check
    default void check()
    {
        checkState(!CharMatcher.whitespace().trimFrom(getCommand()).isEmpty(), "command must not be empty");
        checkState(getRetries() >= 0, "retries must not be negative: %s", getRetries());
    }

    static ImmutableJobDefinition.Builder builder()
    {
        return ImmutableJobDefinition.builder();
    }
}
