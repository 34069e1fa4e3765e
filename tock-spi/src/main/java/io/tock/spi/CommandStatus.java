package io.tock.spi;

import org.immutables.value.Value;

@Value.Immutable
public interface CommandStatus
{
    int getStatusCode();

    default boolean isSuccess()
    {
        return getStatusCode() == 0;
    }

    static CommandStatus of(int statusCode)
    {
        return ImmutableCommandStatus.builder()
            .statusCode(statusCode)
            .build();
    }
}
