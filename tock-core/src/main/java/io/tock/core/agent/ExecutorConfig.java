package io.tock.core.agent;

import java.time.Duration;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.common.base.Optional;
import io.tock.client.config.Config;
import io.tock.client.config.ConfigException;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableExecutorConfig.class)
@JsonDeserialize(as = ImmutableExecutorConfig.class)
public interface ExecutorConfig
{
    int DEFAULT_MAX_THREADS = 0;
    long DEFAULT_COMMAND_TIMEOUT = 0L;
    long DEFAULT_SHUTDOWN_WAIT = 30L;

    /**
     * Upper limit of concurrently running commands. 0 means no limit.
     */
    int getMaxThreads();

    /**
     * Seconds a command may run before it is killed. 0 means no limit.
     */
    long getCommandTimeoutSeconds();

    long getShutdownWaitSeconds();

    default Optional<Duration> getCommandTimeout()
    {
        long seconds = getCommandTimeoutSeconds();
        return seconds > 0 ? Optional.of(Duration.ofSeconds(seconds)) : Optional.absent();
    }

    @Value.Check
    default void check()
    {
        if (getMaxThreads() < 0) {
            throw new ConfigException("executor.max-threads must not be negative: " + getMaxThreads());
        }
        if (getCommandTimeoutSeconds() < 0) {
            throw new ConfigException("executor.command-timeout must not be negative: " + getCommandTimeoutSeconds());
        }
    }

    static ImmutableExecutorConfig.Builder defaultBuilder()
    {
        return ImmutableExecutorConfig.builder()
            .maxThreads(DEFAULT_MAX_THREADS)
            .commandTimeoutSeconds(DEFAULT_COMMAND_TIMEOUT)
            .shutdownWaitSeconds(DEFAULT_SHUTDOWN_WAIT);
    }

    static ExecutorConfig convertFrom(Config config)
    {
        return defaultBuilder()
            .maxThreads(config.get("executor.max-threads", int.class, DEFAULT_MAX_THREADS))
            .commandTimeoutSeconds(config.get("executor.command-timeout", long.class, DEFAULT_COMMAND_TIMEOUT))
            .shutdownWaitSeconds(config.get("executor.shutdown-wait", long.class, DEFAULT_SHUTDOWN_WAIT))
            .build();
    }
}
