package io.tock.core.config;

import com.google.inject.Inject;
import com.google.inject.Provider;
import io.tock.client.config.Config;
import io.tock.client.config.ConfigElement;
import io.tock.client.config.ConfigFactory;

/**
 * Provides the system configuration to each consumer as its own {@link Config}.
 */
public class SystemConfigProvider
    implements Provider<Config>
{
    private final ConfigElement systemConfig;
    private final ConfigFactory cf;

    @Inject
    public SystemConfigProvider(ConfigElement systemConfig, ConfigFactory cf)
    {
        this.systemConfig = systemConfig;
        this.cf = cf;
    }

    @Override
    public Config get()
    {
        return systemConfig.toConfig(cf);
    }
}
