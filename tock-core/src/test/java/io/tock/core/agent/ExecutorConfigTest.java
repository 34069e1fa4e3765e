package io.tock.core.agent;

import java.time.Duration;
import java.util.Properties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Optional;
import io.tock.client.config.Config;
import io.tock.client.config.ConfigElement;
import io.tock.client.config.ConfigException;
import io.tock.client.config.ConfigFactory;
import org.junit.Before;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

public class ExecutorConfigTest
{
    private Properties props;

    @Before
    public void setUp()
    {
        props = new Properties();
    }

    private Config config()
    {
        return ConfigElement.ofProperties(props).toConfig(new ConfigFactory(new ObjectMapper()));
    }

    @Test
    public void defaults()
    {
        ExecutorConfig ec = ExecutorConfig.convertFrom(config());
        assertThat(ec.getMaxThreads(), is(0));
        assertThat(ec.getCommandTimeoutSeconds(), is(0L));
        assertThat(ec.getCommandTimeout(), is(Optional.<Duration>absent()));
        assertThat(ec.getShutdownWaitSeconds(), is(30L));
    }

    @Test
    public void readStringValues()
    {
        props.setProperty("executor.max-threads", "4");
        props.setProperty("executor.command-timeout", "90");
        props.setProperty("executor.shutdown-wait", "5");

        ExecutorConfig ec = new ExecutorConfigProvider(config()).get();
        assertThat(ec.getMaxThreads(), is(4));
        assertThat(ec.getCommandTimeout(), is(Optional.of(Duration.ofSeconds(90))));
        assertThat(ec.getShutdownWaitSeconds(), is(5L));
    }

    @Test(expected = ConfigException.class)
    public void rejectNegativeThreads()
    {
        props.setProperty("executor.max-threads", "-1");
        ExecutorConfig.convertFrom(config());
    }

    @Test(expected = ConfigException.class)
    public void rejectNonNumber()
    {
        props.setProperty("executor.command-timeout", "forever");
        ExecutorConfig.convertFrom(config());
    }
}
