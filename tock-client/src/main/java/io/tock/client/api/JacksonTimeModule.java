package io.tock.client.api;

import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.std.FromStringDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;

/**
 * Writes {@link Instant} as an ISO-8601 UTC string and reads any ISO-8601
 * date-time with an offset.
 */
public class JacksonTimeModule
    extends SimpleModule
{
    public JacksonTimeModule()
    {
        super();
        addSerializer(Instant.class, new InstantSerializer());
        addDeserializer(Instant.class, new InstantDeserializer());
    }

    public static class InstantSerializer
            extends JsonSerializer<Instant>
    {
        @Override
        public void serialize(Instant value, JsonGenerator jgen, SerializerProvider provider)
                throws IOException
        {
            jgen.writeString(DateTimeFormatter.ISO_INSTANT.format(value));
        }
    }

    public static class InstantDeserializer
            extends FromStringDeserializer<Instant>
    {
        public InstantDeserializer()
        {
            super(Instant.class);
        }

        @Override
        protected Instant _deserialize(String value, DeserializationContext context)
                throws JsonMappingException
        {
            try {
                return Instant.from(DateTimeFormatter.ISO_OFFSET_DATE_TIME.parse(value));
            }
            catch (DateTimeParseException ex) {
                throw new JsonMappingException(context.getParser(), "Invalid ISO time format: " + value, ex);
            }
        }
    }
}
