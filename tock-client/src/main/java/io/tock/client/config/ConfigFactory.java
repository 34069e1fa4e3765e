package io.tock.client.config;

import javax.inject.Inject;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Holds the {@link ObjectMapper} that {@link Config} converts values with.
 */
public class ConfigFactory
{
    final ObjectMapper objectMapper;

    @Inject
    public ConfigFactory(ObjectMapper objectMapper)
    {
        this.objectMapper = objectMapper;
    }
}
