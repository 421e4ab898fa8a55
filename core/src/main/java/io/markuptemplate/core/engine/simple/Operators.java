package io.markuptemplate.core.engine.simple;

import com.fasterxml.jackson.databind.JsonNode;
import io.markuptemplate.core.engine.Values;
import io.markuptemplate.core.error.ExpressionEvalException;
import io.markuptemplate.core.model.Undefined;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Arithmetic and comparison semantics of the {@code simple} language. */
final class Operators {

    private Operators() {}

    static Object arithmetic(String operator, Object left, Object right) {
        left = normalize(left);
        right = normalize(right);
        if (operator.equals("+")) {
            if (left instanceof CharSequence || right instanceof CharSequence) {
                if (left instanceof CharSequence && right instanceof CharSequence) {
                    return left.toString() + right;
                }
                throw unsupported(operator, left, right);
            }
            if (left instanceof List<?> a && right instanceof List<?> b) {
                List<Object> joined = new ArrayList<>(a);
                joined.addAll(b);
                return joined;
            }
        }
        if (operator.equals("*") && left instanceof CharSequence text && isIntegral(right)) {
            return text.toString().repeat(Math.max(0, ((Number) right).intValue()));
        }
        if (!(left instanceof Number a) || !(right instanceof Number b)) {
            throw unsupported(operator, left, right);
        }
        if (isIntegral(a) && isIntegral(b)) {
            return integral(operator, a.longValue(), b.longValue());
        }
        double x = a.doubleValue();
        double y = b.doubleValue();
        return switch (operator) {
            case "+" -> x + y;
            case "-" -> x - y;
            case "*" -> x * y;
            case "/" -> {
                requireNonZero(y);
                yield x / y;
            }
            case "//" -> {
                requireNonZero(y);
                yield Math.floor(x / y);
            }
            case "%" -> {
                requireNonZero(y);
                yield x - Math.floor(x / y) * y;
            }
            default -> throw unsupported(operator, left, right);
        };
    }

    private static Object integral(String operator, long x, long y) {
        long result;
        switch (operator) {
            case "+" -> result = Math.addExact(x, y);
            case "-" -> result = Math.subtractExact(x, y);
            case "*" -> result = Math.multiplyExact(x, y);
            case "/" -> {
                requireNonZero(y);
                if (x % y != 0) {
                    return (double) x / y;
                }
                result = x / y;
            }
            case "//" -> {
                requireNonZero(y);
                result = Math.floorDiv(x, y);
            }
            case "%" -> {
                requireNonZero(y);
                result = Math.floorMod(x, y);
            }
            default -> throw new ExpressionEvalException("Unsupported operator " + operator, null);
        }
        return narrow(result);
    }

    static Object negate(Object value) {
        value = normalize(value);
        if (value instanceof Number n) {
            return isIntegral(n) ? narrow(Math.negateExact(n.longValue())) : -n.doubleValue();
        }
        throw new ExpressionEvalException("Bad operand for unary -: " + Values.describe(value), null);
    }

    static boolean compare(String operator, Object left, Object right) {
        left = normalize(left);
        right = normalize(right);
        return switch (operator) {
            case "==" -> equal(left, right);
            case "!=" -> !equal(left, right);
            case "is" -> identical(left, right);
            case "is not" -> !identical(left, right);
            case "in" -> contains(right, left);
            case "not in" -> !contains(right, left);
            default -> {
                int order = order(operator, left, right);
                yield switch (operator) {
                    case "<" -> order < 0;
                    case "<=" -> order <= 0;
                    case ">" -> order > 0;
                    case ">=" -> order >= 0;
                    default -> throw new ExpressionEvalException("Unsupported operator " + operator, null);
                };
            }
        };
    }

    static boolean equal(Object left, Object right) {
        if (Undefined.isAbsent(left) || Undefined.isAbsent(right)) {
            return Undefined.isAbsent(left) && Undefined.isAbsent(right);
        }
        if (left instanceof Number a && right instanceof Number b) {
            return toBigDecimal(a).compareTo(toBigDecimal(b)) == 0;
        }
        return Objects.equals(left, right);
    }

    private static boolean identical(Object left, Object right) {
        if (Undefined.isAbsent(left) || Undefined.isAbsent(right)) {
            return Undefined.isAbsent(left) && Undefined.isAbsent(right);
        }
        if (left instanceof Boolean || left instanceof Number) {
            return left.equals(right);
        }
        return left == right;
    }

    private static boolean contains(Object container, Object item) {
        if (container instanceof CharSequence text) {
            if (!(item instanceof CharSequence)) {
                throw new ExpressionEvalException(
                        "'in <string>' requires a string as left operand, not " + Values.describe(item), null);
            }
            return text.toString().contains(item.toString());
        }
        if (container instanceof Map<?, ?> map) {
            return map.containsKey(item);
        }
        if (container instanceof JsonNode node && node.isObject()) {
            return item instanceof CharSequence name && node.has(name.toString());
        }
        if (container instanceof Collection<?> || container instanceof Iterable<?>
                || container instanceof JsonNode
                || (container != null && container.getClass().isArray())) {
            Iterator<?> items = Values.iterate(container);
            while (items.hasNext()) {
                if (equal(normalize(items.next()), item)) {
                    return true;
                }
            }
            return false;
        }
        throw new ExpressionEvalException("Argument of 'in' is not a container: " + Values.describe(container), null);
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static int order(String operator, Object left, Object right) {
        if (left instanceof Number a && right instanceof Number b) {
            return toBigDecimal(a).compareTo(toBigDecimal(b));
        }
        if (left instanceof CharSequence && right instanceof CharSequence) {
            return left.toString().compareTo(right.toString());
        }
        if (left instanceof Comparable comparable && right != null && left.getClass() == right.getClass()) {
            return comparable.compareTo(right);
        }
        throw unsupported(operator, left, right);
    }

    private static Object normalize(Object value) {
        return value instanceof JsonNode node ? Values.fromJson(node) : value;
    }

    private static boolean isIntegral(Object value) {
        return value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte
                || value instanceof BigInteger;
    }

    private static Object narrow(long value) {
        return value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE ? (Object) (int) value : (Object) value;
    }

    private static BigDecimal toBigDecimal(Number number) {
        if (number instanceof BigDecimal decimal) {
            return decimal;
        }
        if (number instanceof BigInteger integer) {
            return new BigDecimal(integer);
        }
        if (isIntegral(number)) {
            return BigDecimal.valueOf(number.longValue());
        }
        return BigDecimal.valueOf(number.doubleValue());
    }

    private static void requireNonZero(double divisor) {
        if (divisor == 0) {
            throw new ExpressionEvalException("Division by zero", null);
        }
    }

    private static ExpressionEvalException unsupported(String operator, Object left, Object right) {
        return new ExpressionEvalException("Unsupported operand types for " + operator + ": "
                + Values.describe(left) + " and " + Values.describe(right), null);
    }
}
