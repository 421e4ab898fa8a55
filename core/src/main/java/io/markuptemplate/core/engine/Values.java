package io.markuptemplate.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.markuptemplate.core.error.ExpressionEvalException;
import io.markuptemplate.core.model.Undefined;
import java.lang.reflect.Array;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Conversions shared by the directives, the filters and the expression engines: truth values,
 * text rendering, iteration, destructuring and Jackson node unwrapping.
 *
 * <p>Thread-safe and stateless.
 */
public final class Values {

    private Values() {}

    /**
     * Truth value of a context value: {@code null}, undefined, {@code false}, zero, empty strings,
     * collections, maps, arrays and JSON containers are false; everything else is true.
     */
    public static boolean isTruthy(Object value) {
        if (Undefined.isAbsent(value)) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            return n.doubleValue() != 0.0;
        }
        if (value instanceof CharSequence cs) {
            return cs.length() > 0;
        }
        if (value instanceof Collection<?> c) {
            return !c.isEmpty();
        }
        if (value instanceof Map<?, ?> m) {
            return !m.isEmpty();
        }
        if (value.getClass().isArray()) {
            return Array.getLength(value) > 0;
        }
        if (value instanceof JsonNode node) {
            return isTruthy(fromJson(node)) && !(node.isContainerNode() && node.isEmpty());
        }
        return true;
    }

    /** Text rendering of a value; {@code null} and undefined render as the empty string. */
    public static String toText(Object value) {
        if (Undefined.isAbsent(value)) {
            return "";
        }
        if (value instanceof JsonNode node) {
            return node.isValueNode() ? node.asText() : node.toString();
        }
        return String.valueOf(value);
    }

    /**
     * Unwraps scalar JSON nodes into Java values: text to {@code String}, numbers to {@code
     * Number}, booleans to {@code Boolean}, null and missing nodes to {@code null}. Arrays and
     * objects are returned as nodes.
     */
    public static Object fromJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isIntegralNumber()) {
            return node.canConvertToInt() ? (Object) node.intValue() : (Object) node.longValue();
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        return node;
    }

    /**
     * Returns an iterator over an iterable value: collections and other iterables, arrays, maps
     * (their keys), strings (their characters), JSON arrays (their elements, unwrapped) and JSON
     * objects (their field names).
     *
     * @throws ExpressionEvalException if the value cannot be iterated
     */
    public static Iterator<?> iterate(Object value) {
        if (value instanceof Iterable<?> iterable) {
            return iterable.iterator();
        }
        if (value instanceof Iterator<?> iterator) {
            return iterator;
        }
        if (value instanceof Map<?, ?> map) {
            return map.keySet().iterator();
        }
        if (value instanceof CharSequence cs) {
            List<String> chars = new ArrayList<>(cs.length());
            cs.codePoints().forEach(cp -> chars.add(new String(Character.toChars(cp))));
            return chars.iterator();
        }
        if (value instanceof JsonNode node) {
            List<Object> items = new ArrayList<>();
            if (node.isArray()) {
                node.forEach(element -> items.add(fromJson(element)));
            } else if (node.isObject()) {
                node.fieldNames().forEachRemaining(items::add);
            } else {
                throw new ExpressionEvalException("JSON value is not iterable: " + node, null);
            }
            return items.iterator();
        }
        if (value != null && value.getClass().isArray()) {
            return asList(value).iterator();
        }
        throw new ExpressionEvalException("Value is not iterable: " + describe(value), null);
    }

    /**
     * Destructures a loop item into {@code count} components: list and array elements, JSON array
     * elements, or the key and value of a map entry.
     *
     * @throws ExpressionEvalException if the item does not have exactly {@code count} components
     */
    public static List<Object> unpack(Object item, int count) {
        List<Object> parts = new ArrayList<>(count);
        if (item instanceof Map.Entry<?, ?> entry) {
            parts.add(entry.getKey());
            parts.add(entry.getValue());
        } else if (item instanceof JsonNode node && node.isArray()) {
            node.forEach(element -> parts.add(fromJson(element)));
        } else if (item instanceof Iterable<?> iterable) {
            iterable.forEach(parts::add);
        } else if (item != null && item.getClass().isArray()) {
            parts.addAll(asList(item));
        } else {
            throw new ExpressionEvalException("Cannot unpack " + describe(item) + " into " + count + " names", null);
        }
        if (parts.size() != count) {
            throw new ExpressionEvalException(
                    "Expected " + count + " values to unpack but got " + parts.size(), null);
        }
        return parts;
    }

    /**
     * Interprets a value as name/value pairs: a map, a JSON object, or an iterable of two-element
     * sequences or map entries.
     *
     * @throws ExpressionEvalException if the value has no pair structure
     */
    public static List<Map.Entry<String, Object>> pairs(Object value) {
        List<Map.Entry<String, Object>> pairs = new ArrayList<>();
        if (value instanceof Map<?, ?> map) {
            map.forEach((k, v) -> pairs.add(new AbstractMap.SimpleEntry<>(String.valueOf(k), v)));
        } else if (value instanceof JsonNode node && node.isObject()) {
            node.fields().forEachRemaining(field ->
                    pairs.add(new AbstractMap.SimpleEntry<>(field.getKey(), fromJson(field.getValue()))));
        } else {
            Iterator<?> items = iterate(value);
            while (items.hasNext()) {
                List<Object> pair = unpack(items.next(), 2);
                pairs.add(new AbstractMap.SimpleEntry<>(String.valueOf(pair.get(0)), pair.get(1)));
            }
        }
        return pairs;
    }

    /** Wraps a Java array (of any component type) as a list. */
    public static List<Object> asList(Object array) {
        int length = Array.getLength(array);
        List<Object> list = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            list.add(Array.get(array, i));
        }
        return list;
    }

    /** Short description of a value's type for error messages. */
    public static String describe(Object value) {
        if (value == null) {
            return "None";
        }
        if (value == Undefined.INSTANCE) {
            return "an undefined value";
        }
        return "a value of type " + value.getClass().getSimpleName();
    }
}
