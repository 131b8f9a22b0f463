package org.abstractica.turnsync.impl.serialization;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import org.abstractica.turnsync.state.StateValue;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Writes state trees in a canonical JSON form.
 *
 * <p>Object keys are sorted in UTF-16 code unit order, there is no
 * whitespace, integral numbers are written without fraction or exponent and
 * other numbers in plain notation without trailing zeros. Equal trees
 * (in the sense of {@link StateValue} equality) produce identical text.
 * Numbers must lie within {@link NumberLimits}.</p>
 */
public final class CanonicalJson
{
    private static final JsonFactory FACTORY = new JsonFactory();

    private CanonicalJson()
    {
    }

    /**
     * Returns the canonical JSON text of a state tree.
     *
     * @param value the state tree
     * @return canonical JSON
     * @throws IllegalArgumentException if a number is outside {@link NumberLimits}
     */
    public static String write(StateValue value)
    {
        StringWriter out = new StringWriter();
        try (JsonGenerator gen = FACTORY.createGenerator(out))
        {
            write(value, gen);
        }
        catch (IOException e)
        {
            throw new UncheckedIOException("Failed to write canonical JSON", e);
        }
        return out.toString();
    }

    private static void write(StateValue value, JsonGenerator gen) throws IOException
    {
        if (value instanceof StateValue.ObjectValue object)
        {
            List<String> keys = new ArrayList<>(object.entries().keySet());
            Collections.sort(keys);
            gen.writeStartObject();
            for (String key : keys)
            {
                gen.writeFieldName(key);
                write(object.entries().get(key), gen);
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
            gen.writeNumber(canonicalNumber(number.value()));
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

    static String canonicalNumber(BigDecimal value)
    {
        if (value.signum() == 0)
        {
            return "0";
        }
        if (!NumberLimits.isWithinLimits(value))
        {
            throw new IllegalArgumentException(NumberLimits.describe(value));
        }
        BigDecimal stripped = value.stripTrailingZeros();
        if (stripped.scale() <= 0)
        {
            return stripped.toBigIntegerExact().toString();
        }
        return stripped.toPlainString();
    }
}
