package org.abstractica.turnsync.impl.serialization;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.abstractica.turnsync.state.StateValue;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Conversions between {@link StateValue} trees and Jackson {@link JsonNode} trees.
 */
public final class StateValues
{
    private StateValues()
    {
    }

    /**
     * Converts a JSON tree to a state tree.
     *
     * @param node the JSON node; null and missing nodes become {@link StateValue.NullValue}
     * @return the state tree
     * @throws IllegalArgumentException for binary or embedded object nodes and for
     *                                  numbers outside {@link NumberLimits}
     */
    public static StateValue fromNode(JsonNode node)
    {
        if (node == null || node.isNull() || node.isMissingNode())
        {
            return StateValue.nullValue();
        }
        if (node.isObject())
        {
            Map<String, StateValue> entries = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext())
            {
                Map.Entry<String, JsonNode> field = fields.next();
                entries.put(field.getKey(), fromNode(field.getValue()));
            }
            return new StateValue.ObjectValue(entries);
        }
        if (node.isArray())
        {
            List<StateValue> elements = new ArrayList<>(node.size());
            for (JsonNode element : node)
            {
                elements.add(fromNode(element));
            }
            return new StateValue.ArrayValue(elements);
        }
        if (node.isTextual())
        {
            return StateValue.of(node.textValue());
        }
        if (node.isNumber())
        {
            BigDecimal number = node.decimalValue();
            if (!NumberLimits.isWithinLimits(number))
            {
                throw new IllegalArgumentException(NumberLimits.describe(number));
            }
            return StateValue.of(number);
        }
        if (node.isBoolean())
        {
            return StateValue.of(node.booleanValue());
        }
        throw new IllegalArgumentException("Unsupported JSON node: " + node.getNodeType());
    }

    /**
     * Converts a state tree to a JSON tree.
     *
     * @param value the state tree
     * @return the JSON node
     */
    public static JsonNode toNode(StateValue value)
    {
        JsonNodeFactory factory = JsonNodeFactory.instance;
        if (value instanceof StateValue.ObjectValue object)
        {
            ObjectNode node = factory.objectNode();
            object.entries().forEach((key, child) -> node.set(key, toNode(child)));
            return node;
        }
        if (value instanceof StateValue.ArrayValue array)
        {
            ArrayNode node = factory.arrayNode(array.size());
            array.elements().forEach(child -> node.add(toNode(child)));
            return node;
        }
        if (value instanceof StateValue.StringValue string)
        {
            return factory.textNode(string.value());
        }
        if (value instanceof StateValue.NumberValue number)
        {
            return factory.numberNode(number.value());
        }
        if (value instanceof StateValue.BooleanValue bool)
        {
            return factory.booleanNode(bool.value());
        }
        return factory.nullNode();
    }
}
