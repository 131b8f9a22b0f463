package org.abstractica.turnsync.impl.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import org.abstractica.turnsync.state.StateValue;

import java.io.IOException;
import java.util.Map;

/**
 * Jackson module mapping {@link StateValue} trees to plain JSON.
 *
 * <p>A JSON {@code null} reads as {@link StateValue.NullValue}; an omitted
 * property reads as Java {@code null}, which is how an absent
 * {@code previousValue} survives a round trip.</p>
 */
public class StateValueModule extends SimpleModule
{
    public StateValueModule()
    {
        super("StateValueModule");
        addSerializer(StateValue.class, new Serializer());
        addDeserializer(StateValue.class, new Deserializer());
    }

    static final class Serializer extends StdSerializer<StateValue>
    {
        Serializer()
        {
            super(StateValue.class);
        }

        @Override
        public void serialize(StateValue value, JsonGenerator gen, SerializerProvider provider) throws IOException
        {
            write(value, gen);
        }

        private static void write(StateValue value, JsonGenerator gen) throws IOException
        {
            if (value instanceof StateValue.ObjectValue object)
            {
                gen.writeStartObject();
                for (Map.Entry<String, StateValue> entry : object.entries().entrySet())
                {
                    gen.writeFieldName(entry.getKey());
                    write(entry.getValue(), gen);
                }
                gen.writeEndObject();
            }
            else if (value instanceof StateValue.ArrayValue array)
            {
                gen.writeStartArray();
                for (StateValue element : array.elements())
                {
                    write(element, gen);
                }
                gen.writeEndArray();
            }
            else if (value instanceof StateValue.StringValue string)
            {
                gen.writeString(string.value());
            }
            else if (value instanceof StateValue.NumberValue number)
            {
                gen.writeNumber(number.value());
            }
            else if (value instanceof StateValue.BooleanValue bool)
            {
                gen.writeBoolean(bool.value());
            }
            else
            {
                gen.writeNull();
            }
        }
    }

    static final class Deserializer extends StdDeserializer<StateValue>
    {
        Deserializer()
        {
            super(StateValue.class);
        }

        @Override
        public StateValue deserialize(JsonParser p, DeserializationContext ctxt) throws IOException
        {
            JsonNode node = p.readValueAsTree();
            try
            {
                return StateValues.fromNode(node);
            }
            catch (IllegalArgumentException e)
            {
                throw JsonMappingException.from(p, e.getMessage(), e);
            }
        }

        @Override
        public StateValue getNullValue(DeserializationContext ctxt)
        {
            return StateValue.nullValue();
        }

        @Override
        public Object getAbsentValue(DeserializationContext ctxt)
        {
            return null;
        }
    }
}
