package io.tock.core;

import java.util.List;
import com.fasterxml.jackson.datatype.guava.GuavaModule;
import com.fasterxml.jackson.module.guice.ObjectMapperModule;
import com.google.common.collect.ImmutableList;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Module;
import io.tock.client.api.JacksonTimeModule;
import io.tock.client.config.ConfigElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds an injector with the scheduling engine and starts it.
 *
 * <pre>
 * try (TockEmbed tock = new TockEmbed.Bootstrap()
 *         .setSystemConfig(PropertyUtils.loadConfigElement(path))
 *         .addModules(new CommandExecutorModule())
 *         .initialize()) {
 *     tock.getJobEngine().create(definition);
 * }
 * </pre>
 */
public class TockEmbed
        implements AutoCloseable
{
    private static final Logger logger = LoggerFactory.getLogger(TockEmbed.class);

    public static class Bootstrap
    {
        private ConfigElement systemConfig = ConfigElement.empty();
        private final ImmutableList.Builder<Module> modules = ImmutableList.builder();

        public Bootstrap setSystemConfig(ConfigElement systemConfig)
        {
            this.systemConfig = systemConfig;
            return this;
        }

        public Bootstrap addModules(Module... additional)
        {
            modules.add(additional);
            return this;
        }

        public TockEmbed initialize()
        {
            List<Module> all = ImmutableList.<Module>builder()
                .add(new ObjectMapperModule()
                        .registerModule(new GuavaModule())
                        .registerModule(new JacksonTimeModule()))
                .add(new JobEngineModule())
                .add((binder) -> binder.bind(ConfigElement.class).toInstance(systemConfig))
                .addAll(modules.build())
                .build();
            Injector injector = Guice.createInjector(all);
            TockEmbed embed = new TockEmbed(injector);
            embed.getJobEngine().start();
            return embed;
        }
    }

    private final Injector injector;

    private TockEmbed(Injector injector)
    {
        this.injector = injector;
    }

    public Injector getInjector()
    {
        return injector;
    }

    public JobEngine getJobEngine()
    {
        return injector.getInstance(JobEngine.class);
    }

    @Override
    public void close()
    {
        try {
            getJobEngine().shutdown();
        }
        catch (InterruptedException ex) {
            logger.warn("Interrupted while waiting for running jobs to finish");
            Thread.currentThread().interrupt();
        }
    }
}
