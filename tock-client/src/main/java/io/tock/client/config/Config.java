package io.tock.client.config;

import com.google.common.base.Throwables;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import static java.util.Locale.ENGLISH;

/**
 * Flat key-value configuration backed by a Jackson {@link ObjectNode}.
 *
 * Values are converted on read, so a value loaded from a properties file as
 * {@code "4"} can be read as {@code int.class}. Keys are dotted names such as
 * {@code executor.max-threads}.
 */
public class Config
{
    private final ObjectMapper mapper;
    private final ObjectNode object;

    Config(ObjectMapper mapper, ObjectNode object)
    {
        this.mapper = mapper;
        this.object = object;
    }

    public <E> E get(String key, Class<E> type, E defaultValue)
    {
        JsonNode value = object.get(key);
        if (value == null || value.isNull()) {
            return defaultValue;
        }
        return readObject(mapper.getTypeFactory().constructType(type), value, key);
    }

    private <E> E readObject(JavaType type, JsonNode value, String key)
    {
        try {
            return mapper.readValue(mapper.treeAsTokens(value), type);
        }
        catch (Exception ex) {
            Throwables.throwIfInstanceOf(ex, ConfigException.class);
            String message = String.format(ENGLISH, "Expected %s for key '%s' but got %s (%s)",
                    typeNameOf(type), key, jsonSample(value), value.getNodeType().toString().toLowerCase(ENGLISH));
            throw new ConfigException(message, ex);
        }
    }

    private static String typeNameOf(JavaType type)
    {
        Class<?> raw = type.getRawClass();
        if (raw.equals(String.class)) {
            return "string type";
        }
        else if (raw.equals(int.class) || raw.equals(Integer.class)) {
            return "integer (int) type";
        }
        else if (raw.equals(long.class) || raw.equals(Long.class)) {
            return "integer (long) type";
        }
        else if (raw.equals(boolean.class) || raw.equals(Boolean.class)) {
            return "'true' or 'false'";
        }
        return type.toString();
    }

    private static String jsonSample(JsonNode value)
    {
        String json = value.toString();
        if (json.length() < 100) {
            return json;
        }
        return json.substring(0, 97) + "...";
    }

    @Override
    public String toString()
    {
        return object.toString();
    }
}
