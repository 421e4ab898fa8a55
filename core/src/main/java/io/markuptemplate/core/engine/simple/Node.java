package io.markuptemplate.core.engine.simple;

import io.markuptemplate.core.engine.Values;
import io.markuptemplate.core.error.ExpressionEvalException;
import io.markuptemplate.core.model.Context;
import io.markuptemplate.core.model.Undefined;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Syntax tree of a {@code simple} expression. Nodes are immutable and evaluate against a context. */
sealed interface Node {

    Object evaluate(Context context);

    record Literal(Object value) implements Node {
        @Override
        public Object evaluate(Context context) {
            return value;
        }
    }

    record Name(String name) implements Node {
        @Override
        public Object evaluate(Context context) {
            Object value = context.get(name);
            if (Undefined.isUndefined(value) && Builtins.has(name)) {
                return Builtins.get(name);
            }
            return value;
        }
    }

    record GetAttribute(Node target, String name) implements Node {
        @Override
        public Object evaluate(Context context) {
            return Accessors.attribute(target.evaluate(context), name);
        }
    }

    record GetItem(Node target, Node key) implements Node {
        @Override
        public Object evaluate(Context context) {
            return Accessors.item(target.evaluate(context), key.evaluate(context));
        }
    }

    record Call(Node callee, List<Node> args, Map<String, Node> kwargs) implements Node {
        @Override
        public Object evaluate(Context context) {
            if (callee instanceof Name name && name.name().equals("defined") && !context.has("defined")) {
                if (args.size() != 1 || !kwargs.isEmpty()) {
                    throw new ExpressionEvalException("defined() takes exactly one argument", null);
                }
                return context.has(Values.toText(args.get(0).evaluate(context)));
            }
            Object function = callee.evaluate(context);
            List<Object> argValues = new ArrayList<>(args.size());
            for (Node arg : args) {
                argValues.add(arg.evaluate(context));
            }
            Map<String, Object> kwargValues = new LinkedHashMap<>();
            kwargs.forEach((key, node) -> kwargValues.put(key, node.evaluate(context)));
            return Accessors.call(function, argValues, kwargValues, describe());
        }

        private String describe() {
            if (callee instanceof Name name) {
                return name.name();
            }
            if (callee instanceof GetAttribute attribute) {
                return attribute.name();
            }
            return "expression";
        }
    }

    record ListDisplay(List<Node> items) implements Node {
        @Override
        public Object evaluate(Context context) {
            List<Object> values = new ArrayList<>(items.size());
            for (Node item : items) {
                values.add(item.evaluate(context));
            }
            return values;
        }
    }

    record DictDisplay(List<Node> keys, List<Node> values) implements Node {
        @Override
        public Object evaluate(Context context) {
            Map<Object, Object> map = new LinkedHashMap<>();
            for (int i = 0; i < keys.size(); i++) {
                map.put(keys.get(i).evaluate(context), values.get(i).evaluate(context));
            }
            return map;
        }
    }

    record Not(Node operand) implements Node {
        @Override
        public Object evaluate(Context context) {
            return !Values.isTruthy(operand.evaluate(context));
        }
    }

    record Negate(Node operand) implements Node {
        @Override
        public Object evaluate(Context context) {
            return Operators.negate(operand.evaluate(context));
        }
    }

    /** {@code and} / {@code or}; yields the deciding operand, not a boolean. */
    record Logical(boolean and, Node left, Node right) implements Node {
        @Override
        public Object evaluate(Context context) {
            Object value = left.evaluate(context);
            boolean truthy = Values.isTruthy(value);
            if (and ? !truthy : truthy) {
                return value;
            }
            return right.evaluate(context);
        }
    }

    record Binary(String operator, Node left, Node right) implements Node {
        @Override
        public Object evaluate(Context context) {
            return Operators.arithmetic(operator, left.evaluate(context), right.evaluate(context));
        }
    }

    /** A comparison chain such as {@code a < b <= c}. */
    record Compare(Node first, List<String> operators, List<Node> operands) implements Node {
        @Override
        public Object evaluate(Context context) {
            Object left = first.evaluate(context);
            for (int i = 0; i < operators.size(); i++) {
                Object right = operands.get(i).evaluate(context);
                if (!Operators.compare(operators.get(i), left, right)) {
                    return false;
                }
                left = right;
            }
            return true;
        }
    }

    record Conditional(Node test, Node whenTrue, Node whenFalse) implements Node {
        @Override
        public Object evaluate(Context context) {
            return Values.isTruthy(test.evaluate(context)) ? whenTrue.evaluate(context) : whenFalse.evaluate(context);
        }
    }
}
