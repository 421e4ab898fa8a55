package io.markuptemplate.core.engine.simple;

import com.fasterxml.jackson.databind.JsonNode;
import io.markuptemplate.core.engine.Values;
import io.markuptemplate.core.error.ExpressionEvalException;
import io.markuptemplate.core.spi.TemplateCallable;
import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Functions available to every expression unless the context binds the same name: {@code len},
 * {@code str}, {@code range} and {@code enumerate}. {@code defined(name)} is handled by the
 * call node because it needs the context.
 */
final class Builtins {

    private static final Map<String, TemplateCallable> FUNCTIONS = Map.of(
            "len", (args, kwargs) -> len(single("len", args)),
            "str", (args, kwargs) -> Values.toText(single("str", args)),
            "range", (args, kwargs) -> range(args),
            "enumerate", (args, kwargs) -> enumerate(args, kwargs));

    private Builtins() {}

    static boolean has(String name) {
        return FUNCTIONS.containsKey(name);
    }

    static TemplateCallable get(String name) {
        return FUNCTIONS.get(name);
    }

    private static Object single(String name, List<Object> args) {
        if (args.size() != 1) {
            throw new ExpressionEvalException(name + "() takes exactly one argument (" + args.size() + " given)", null);
        }
        return args.get(0);
    }

    private static int len(Object value) {
        if (value instanceof CharSequence text) {
            return text.length();
        }
        if (value instanceof Collection<?> collection) {
            return collection.size();
        }
        if (value instanceof Map<?, ?> map) {
            return map.size();
        }
        if (value instanceof JsonNode node && node.isContainerNode()) {
            return node.size();
        }
        if (value != null && value.getClass().isArray()) {
            return Array.getLength(value);
        }
        throw new ExpressionEvalException("Object has no len(): " + Values.describe(value), null);
    }

    private static List<Integer> range(List<Object> args) {
        if (args.isEmpty() || args.size() > 3) {
            throw new ExpressionEvalException("range() takes one to three arguments", null);
        }
        int start = 0;
        int step = 1;
        int stop;
        if (args.size() == 1) {
            stop = integer(args.get(0));
        } else {
            start = integer(args.get(0));
            stop = integer(args.get(1));
            if (args.size() == 3) {
                step = integer(args.get(2));
            }
        }
        if (step == 0) {
            throw new ExpressionEvalException("range() step must not be zero", null);
        }
        List<Integer> values = new ArrayList<>();
        for (int i = start; step > 0 ? i < stop : i > stop; i += step) {
            values.add(i);
        }
        return values;
    }

    private static List<List<Object>> enumerate(List<Object> args, Map<String, Object> kwargs) {
        if (args.isEmpty() || args.size() > 2) {
            throw new ExpressionEvalException("enumerate() takes one or two arguments", null);
        }
        Object startArg = args.size() == 2 ? args.get(1) : kwargs.getOrDefault("start", 0);
        int index = integer(startArg);
        List<List<Object>> pairs = new ArrayList<>();
        Iterator<?> items = Values.iterate(args.get(0));
        while (items.hasNext()) {
            pairs.add(Arrays.asList(index++, items.next()));
        }
        return pairs;
    }

    private static int integer(Object value) {
        if (value instanceof Number number) {
            return number.intValue();
        }
        throw new ExpressionEvalException("Expected an integer but got " + Values.describe(value), null);
    }
}
