package io.topicvote.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.topicvote.core.error.ValueTypeException;
import io.topicvote.core.spi.VariableContext;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Converts between {@link Value}s and Jackson trees. JSON integers map to Int, other numbers to
 * Float, arrays to Tuple and {@code null} to Empty. Objects have no value equivalent except at
 * the top of a context document.
 */
public final class ValueJson {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private ValueJson() {
        // utility class
    }

    /**
     * @throws ValueTypeException for JSON objects and other nodes without a value equivalent
     */
    public static Value toValue(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return Value.EMPTY;
        }
        if (node.isTextual()) {
            return Value.of(node.textValue());
        }
        if (node.isBoolean()) {
            return Value.of(node.booleanValue());
        }
        if (node.isIntegralNumber() && node.canConvertToLong()) {
            return Value.of(node.longValue());
        }
        if (node.isNumber()) {
            return Value.of(node.doubleValue());
        }
        if (node.isArray()) {
            List<Value> values = new ArrayList<>(node.size());
            for (JsonNode element : node) {
                values.add(toValue(element));
            }
            return Value.tuple(values);
        }
        throw new ValueTypeException("JSON scalar or array", node.getNodeType().name());
    }

    public static JsonNode toJson(Value value) {
        if (value instanceof Value.StringValue s) {
            return NODES.textNode(s.value());
        }
        if (value instanceof Value.IntValue i) {
            return NODES.numberNode(i.value());
        }
        if (value instanceof Value.FloatValue f) {
            return NODES.numberNode(f.value());
        }
        if (value instanceof Value.BooleanValue b) {
            return NODES.booleanNode(b.value());
        }
        if (value instanceof Value.TupleValue t) {
            ArrayNode array = NODES.arrayNode();
            t.values().forEach(element -> array.add(toJson(element)));
            return array;
        }
        return NODES.nullNode();
    }

    /** Reads every field of a JSON object into a new context. */
    public static VotingContext toContext(JsonNode object) {
        VotingContext context = VotingContext.empty();
        if (object == null || object.isNull() || object.isMissingNode()) {
            return context;
        }
        if (!object.isObject()) {
            throw new ValueTypeException("JSON object", object.getNodeType().name());
        }
        Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            context.set(field.getKey(), toValue(field.getValue()));
        }
        return context;
    }

    public static ObjectNode toJson(VariableContext context) {
        ObjectNode object = NODES.objectNode();
        context.snapshot().forEach((name, value) -> object.set(name, toJson(value)));
        return object;
    }
}
