package io.tock.spi;

import java.time.Duration;
import java.util.List;
import com.google.common.base.Optional;
import org.immutables.value.Value;

import static com.google.common.base.Preconditions.checkState;

@Value.Immutable
public interface CommandRequest
{
    String getJobId();

    String getJobName();

    /**
     * Executable path followed by its arguments.
     */
    List<String> getCommandLine();

    Optional<Duration> getTimeout();

    @Value.Check
    default void check()
    {
        checkState(!getCommandLine().isEmpty(), "command line must not be empty");
    }

    static ImmutableCommandRequest.Builder builder()
    {
        return ImmutableCommandRequest.builder();
    }
}
