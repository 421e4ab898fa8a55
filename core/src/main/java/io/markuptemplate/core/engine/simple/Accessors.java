package io.markuptemplate.core.engine.simple;

import com.fasterxml.jackson.databind.JsonNode;
import io.markuptemplate.core.engine.Values;
import io.markuptemplate.core.error.ExpressionEvalException;
import io.markuptemplate.core.model.Undefined;
import io.markuptemplate.core.spi.TemplateCallable;
import java.lang.reflect.Array;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Attribute lookup, subscripts and calls on arbitrary Java values. Lookups that find nothing
 * yield {@link Undefined#INSTANCE} rather than failing; calls that cannot be made fail with
 * {@link ExpressionEvalException}.
 */
final class Accessors {

    private static final Set<String> MAP_METHODS = Set.of("items", "keys", "values", "get");

    private Accessors() {}

    static Object attribute(Object target, String name) {
        if (Undefined.isAbsent(target)) {
            return Undefined.INSTANCE;
        }
        if (target instanceof Map<?, ?> map) {
            if (map.containsKey(name)) {
                return map.get(name);
            }
            return MAP_METHODS.contains(name) ? new BoundMethod(target, name) : Undefined.INSTANCE;
        }
        if (target instanceof JsonNode node) {
            return node.isObject() && node.has(name) ? Values.fromJson(node.get(name)) : Undefined.INSTANCE;
        }
        String suffix = Character.toUpperCase(name.charAt(0)) + name.substring(1);
        Class<?> type = target.getClass();
        for (String getter : List.of("get" + suffix, "is" + suffix)) {
            Method method = publicMethod(type, getter, new Class<?>[0]);
            if (method != null) {
                return invoke(method, target, List.of());
            }
        }
        if (type.isRecord()) {
            Method accessor = publicMethod(type, name, new Class<?>[0]);
            if (accessor != null) {
                return invoke(accessor, target, List.of());
            }
        }
        for (Field field : type.getFields()) {
            if (field.getName().equals(name)
                    && !Modifier.isStatic(field.getModifiers())
                    && Modifier.isPublic(field.getDeclaringClass().getModifiers())) {
                try {
                    return field.get(target);
                } catch (IllegalAccessException e) {
                    throw new ExpressionEvalException("Cannot read field " + name + ": " + e.getMessage(), e, null);
                }
            }
        }
        for (Method method : type.getMethods()) {
            if (method.getName().equals(name) && !Modifier.isStatic(method.getModifiers())) {
                return new BoundMethod(target, name);
            }
        }
        return Undefined.INSTANCE;
    }

    static Object item(Object target, Object key) {
        if (Undefined.isAbsent(target)) {
            return Undefined.INSTANCE;
        }
        if (target instanceof Map<?, ?> map) {
            if (map.containsKey(key)) {
                return map.get(key);
            }
            String text = Values.toText(key);
            return map.containsKey(text) ? map.get(text) : Undefined.INSTANCE;
        }
        if (target instanceof JsonNode node) {
            if (node.isArray() && key instanceof Number index) {
                int i = wrap(index.intValue(), node.size());
                return i >= 0 ? Values.fromJson(node.get(i)) : Undefined.INSTANCE;
            }
            return node.isObject() && node.has(Values.toText(key))
                    ? Values.fromJson(node.get(Values.toText(key)))
                    : Undefined.INSTANCE;
        }
        if (key instanceof Number index) {
            if (target instanceof List<?> list) {
                int i = wrap(index.intValue(), list.size());
                return i >= 0 ? list.get(i) : Undefined.INSTANCE;
            }
            if (target.getClass().isArray()) {
                int i = wrap(index.intValue(), Array.getLength(target));
                return i >= 0 ? Array.get(target, i) : Undefined.INSTANCE;
            }
            if (target instanceof CharSequence text) {
                int i = wrap(index.intValue(), text.length());
                return i >= 0 ? String.valueOf(text.charAt(i)) : Undefined.INSTANCE;
            }
        }
        if (key instanceof CharSequence name && name.length() > 0) {
            return attribute(target, name.toString());
        }
        return Undefined.INSTANCE;
    }

    @SuppressWarnings("unchecked")
    static Object call(Object function, List<Object> args, Map<String, Object> kwargs, String name) {
        if (function instanceof TemplateCallable callable) {
            return callable.call(args, kwargs);
        }
        if (function instanceof BoundMethod method) {
            requireNoKeywords(kwargs, name);
            return callMethod(method, args);
        }
        if (Undefined.isUndefined(function)) {
            throw new ExpressionEvalException("\"" + name + "\" is not defined", null);
        }
        if (function instanceof Supplier<?> supplier && args.isEmpty()) {
            requireNoKeywords(kwargs, name);
            return supplier.get();
        }
        if (function instanceof Function<?, ?> f && args.size() == 1) {
            requireNoKeywords(kwargs, name);
            return ((Function<Object, Object>) f).apply(args.get(0));
        }
        if (function instanceof BiFunction<?, ?, ?> f && args.size() == 2) {
            requireNoKeywords(kwargs, name);
            return ((BiFunction<Object, Object, Object>) f).apply(args.get(0), args.get(1));
        }
        throw new ExpressionEvalException("\"" + name + "\" is not callable: " + Values.describe(function), null);
    }

    private static Object callMethod(BoundMethod method, List<Object> args) {
        if (method.target() instanceof Map<?, ?> map && MAP_METHODS.contains(method.name())) {
            switch (method.name()) {
                case "items" -> {
                    return new ArrayList<>(map.entrySet());
                }
                case "keys" -> {
                    return new ArrayList<>(map.keySet());
                }
                case "values" -> {
                    return new ArrayList<>(map.values());
                }
                default -> {
                    if (args.isEmpty() || args.size() > 2) {
                        throw new ExpressionEvalException("get() takes one or two arguments", null);
                    }
                    Object value = map.get(args.get(0));
                    return value != null || map.containsKey(args.get(0)) ? value : (args.size() == 2 ? args.get(1) : null);
                }
            }
        }
        Class<?> type = method.target().getClass();
        for (Method candidate : type.getMethods()) {
            if (candidate.getName().equals(method.name())
                    && candidate.getParameterCount() == args.size()
                    && accepts(candidate.getParameterTypes(), args)) {
                Method callable = publicMethod(type, candidate.getName(), candidate.getParameterTypes());
                if (callable != null) {
                    return invoke(callable, method.target(), convert(candidate.getParameterTypes(), args));
                }
            }
        }
        throw new ExpressionEvalException("No method " + method.name() + " accepting " + args.size()
                + " argument(s) on " + Values.describe(method.target()), null);
    }

    private static void requireNoKeywords(Map<String, Object> kwargs, String name) {
        if (!kwargs.isEmpty()) {
            throw new ExpressionEvalException("\"" + name + "\" does not accept keyword arguments", null);
        }
    }

    private static Object invoke(Method method, Object target, List<Object> args) {
        try {
            return method.invoke(target, args.toArray());
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new ExpressionEvalException(
                    method.getName() + "() failed: " + cause.getMessage(), cause, null);
        } catch (IllegalAccessException e) {
            throw new ExpressionEvalException("Cannot access " + method.getName() + "(): " + e.getMessage(), e, null);
        }
    }

    // Finds the method in a public class or interface so it can be invoked on instances of
    // non-public implementation classes.
    private static Method publicMethod(Class<?> type, String name, Class<?>[] parameterTypes) {
        if (type == null) {
            return null;
        }
        if (Modifier.isPublic(type.getModifiers())) {
            try {
                Method method = type.getMethod(name, parameterTypes);
                if (!Modifier.isStatic(method.getModifiers())) {
                    return method;
                }
            } catch (NoSuchMethodException e) {
                return null;
            }
        }
        for (Class<?> iface : type.getInterfaces()) {
            Method method = publicMethod(iface, name, parameterTypes);
            if (method != null) {
                return method;
            }
        }
        return publicMethod(type.getSuperclass(), name, parameterTypes);
    }

    private static boolean accepts(Class<?>[] types, List<Object> args) {
        for (int i = 0; i < types.length; i++) {
            Object arg = args.get(i);
            Class<?> type = box(types[i]);
            if (arg == null) {
                if (types[i].isPrimitive()) {
                    return false;
                }
            } else if (!type.isInstance(arg) && !(arg instanceof Number && Number.class.isAssignableFrom(type))) {
                return false;
            }
        }
        return true;
    }

    private static List<Object> convert(Class<?>[] types, List<Object> args) {
        List<Object> converted = new ArrayList<>(args.size());
        for (int i = 0; i < types.length; i++) {
            Object arg = args.get(i);
            Class<?> type = box(types[i]);
            if (arg instanceof Number n && !type.isInstance(arg)) {
                if (type == Integer.class) {
                    arg = n.intValue();
                } else if (type == Long.class) {
                    arg = n.longValue();
                } else if (type == Double.class) {
                    arg = n.doubleValue();
                } else if (type == Float.class) {
                    arg = n.floatValue();
                } else if (type == Short.class) {
                    arg = n.shortValue();
                } else if (type == Byte.class) {
                    arg = n.byteValue();
                }
            }
            converted.add(arg);
        }
        return converted;
    }

    private static Class<?> box(Class<?> type) {
        if (!type.isPrimitive()) {
            return type;
        }
        if (type == int.class) {
            return Integer.class;
        }
        if (type == long.class) {
            return Long.class;
        }
        if (type == double.class) {
            return Double.class;
        }
        if (type == boolean.class) {
            return Boolean.class;
        }
        if (type == float.class) {
            return Float.class;
        }
        if (type == short.class) {
            return Short.class;
        }
        if (type == byte.class) {
            return Byte.class;
        }
        return Character.class;
    }

    private static int wrap(int index, int size) {
        int i = index < 0 ? size + index : index;
        return i >= 0 && i < size ? i : -1;
    }
}
