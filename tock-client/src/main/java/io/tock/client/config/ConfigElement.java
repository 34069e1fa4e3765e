package io.tock.client.config;

import java.util.Properties;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * The system configuration as Guice binds it.
 *
 * Each consumer reads it through its own {@link Config} made by
 * {@link #toConfig(ConfigFactory)}.
 */
public class ConfigElement
{
    public static ConfigElement empty()
    {
        return new ConfigElement(JsonNodeFactory.instance.objectNode());
    }

    public static ConfigElement ofProperties(Properties props)
    {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        for (String key : props.stringPropertyNames()) {
            node.put(key, props.getProperty(key));
        }
        return new ConfigElement(node);
    }

    private final ObjectNode object;  // never exposed without a copy

    private ConfigElement(ObjectNode node)
    {
        this.object = node;
    }

    public Config toConfig(ConfigFactory factory)
    {
        return new Config(factory.objectMapper, object.deepCopy());
    }

    @Override
    public String toString()
    {
        return object.toString();
    }
}
