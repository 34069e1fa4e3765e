package io.tock.core;

import com.google.inject.Binder;
import com.google.inject.Module;
import com.google.inject.Scopes;
import com.google.inject.multibindings.OptionalBinder;
import io.tock.client.config.Config;
import io.tock.client.config.ConfigFactory;
import io.tock.core.agent.DependencyPropagator;
import io.tock.core.agent.ExecutorConfig;
import io.tock.core.agent.ExecutorConfigProvider;
import io.tock.core.agent.JobRunner;
import io.tock.core.agent.JobWorkerPool;
import io.tock.core.config.SystemConfigProvider;
import io.tock.core.job.JobRegistry;
import io.tock.core.job.RandomJobIdGenerator;
import io.tock.core.schedule.IntervalScheduleParser;
import io.tock.core.schedule.JobTimer;
import io.tock.core.store.MemoryJobStore;
import io.tock.spi.JobIdGenerator;
import io.tock.spi.JobStore;

/**
 * Binds the scheduling engine. A {@link io.tock.spi.CommandExecutor}
 * binding must come from another module.
 */
public class JobEngineModule
        implements Module
{
    @Override
    public void configure(Binder binder)
    {
        binder.bind(ConfigFactory.class).in(Scopes.SINGLETON);
        binder.bind(Config.class).toProvider(SystemConfigProvider.class);
        binder.bind(ExecutorConfig.class).toProvider(ExecutorConfigProvider.class).in(Scopes.SINGLETON);

        OptionalBinder.newOptionalBinder(binder, ErrorReporter.class)
            .setDefault().toInstance(ErrorReporter.empty());
        OptionalBinder.newOptionalBinder(binder, JobStore.class)
            .setDefault().to(MemoryJobStore.class).in(Scopes.SINGLETON);
        OptionalBinder.newOptionalBinder(binder, JobIdGenerator.class)
            .setDefault().to(RandomJobIdGenerator.class).in(Scopes.SINGLETON);

        binder.bind(IntervalScheduleParser.class).in(Scopes.SINGLETON);
        binder.bind(JobRegistry.class).in(Scopes.SINGLETON);
        binder.bind(JobWorkerPool.class).in(Scopes.SINGLETON);
        binder.bind(DependencyPropagator.class).in(Scopes.SINGLETON);
        binder.bind(JobRunner.class).in(Scopes.SINGLETON);
        binder.bind(JobTimer.class).in(Scopes.SINGLETON);
        binder.bind(JobEngine.class).in(Scopes.SINGLETON);
    }
}
