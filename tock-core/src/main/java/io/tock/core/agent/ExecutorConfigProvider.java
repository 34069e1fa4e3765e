package io.tock.core.agent;

import com.google.inject.Inject;
import com.google.inject.Provider;
import io.tock.client.config.Config;

public class ExecutorConfigProvider
    implements Provider<ExecutorConfig>
{
    private final ExecutorConfig config;

    @Inject
    public ExecutorConfigProvider(Config systemConfig)
    {
        this.config = ExecutorConfig.convertFrom(systemConfig);
    }

    @Override
    public ExecutorConfig get()
    {
        return config;
    }
}
