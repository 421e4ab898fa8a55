package io.markuptemplate.core.engine.jslt;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.schibsted.spt.data.jslt.Expression;
import com.schibsted.spt.data.jslt.JsltException;
import com.schibsted.spt.data.jslt.Parser;
import io.markuptemplate.core.engine.Values;
import io.markuptemplate.core.error.ExpressionCompileException;
import io.markuptemplate.core.error.ExpressionEvalException;
import io.markuptemplate.core.model.Context;
import io.markuptemplate.core.model.MarkupStream;
import io.markuptemplate.core.model.Undefined;
import io.markuptemplate.core.spi.CompiledExpression;
import io.markuptemplate.core.spi.ExpressionEngine;
import io.markuptemplate.core.spi.TemplateCallable;
import java.util.HashMap;
import java.util.Map;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Expression engine backed by Schibsted JSLT. The context is converted into a JSON object that
 * serves as the expression input, so {@code .user.name} reads the {@code user} binding; every
 * binding is also available as a JSLT variable ({@code $user}). A bare dotted path such as
 * {@code user.name} is accepted as shorthand for {@code .user.name}.
 *
 * <p>Bindings that Jackson cannot convert (template functions, markup streams) are left out.
 * Scalar results are unwrapped into Java values; arrays and objects stay {@link JsonNode}s.
 */
public final class JsltExpressionEngine implements ExpressionEngine {

    public static final String ENGINE_ID = "jslt";

    private static final Logger LOG = LoggerFactory.getLogger(JsltExpressionEngine.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Pattern BARE_PATH = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)*");

    @Override
    public String id() {
        return ENGINE_ID;
    }

    @Override
    public CompiledExpression compile(String expression) {
        String source = expression.strip();
        String jslt = BARE_PATH.matcher(source).matches() && !isLiteral(source) ? "." + source : source;
        try {
            return new JsltCompiledExpression(expression, Parser.compileString(jslt));
        } catch (JsltException e) {
            throw new ExpressionCompileException(
                    "Failed to compile JSLT expression: " + e.getMessage(), e, expression, -1);
        }
    }

    private static boolean isLiteral(String source) {
        return source.equals("true") || source.equals("false") || source.equals("null");
    }

    /** Thread-safe compiled JSLT expression handle. */
    private static final class JsltCompiledExpression implements CompiledExpression {

        private final String source;
        private final Expression jsltExpression;

        JsltCompiledExpression(String source, Expression jsltExpression) {
            this.source = source;
            this.jsltExpression = jsltExpression;
        }

        @Override
        public String source() {
            return source;
        }

        @Override
        public Object evaluate(Context context) {
            ObjectNode input = MAPPER.createObjectNode();
            Map<String, JsonNode> variables = new HashMap<>();
            context.snapshot().forEach((name, value) -> {
                JsonNode node = toJson(value);
                if (node != null) {
                    input.set(name, node);
                    variables.put(name, node);
                }
            });
            try {
                return Values.fromJson(jsltExpression.apply(variables, input));
            } catch (JsltException e) {
                throw new ExpressionEvalException("JSLT evaluation failed: " + e.getMessage(), e, source);
            }
        }

        private static JsonNode toJson(Object value) {
            if (Undefined.isUndefined(value) || value instanceof TemplateCallable || value instanceof MarkupStream) {
                return null;
            }
            if (value instanceof JsonNode node) {
                return node;
            }
            try {
                return MAPPER.valueToTree(value);
            } catch (IllegalArgumentException e) {
                LOG.debug("Binding of type {} has no JSON form: {}", value.getClass().getName(), e.getMessage());
                return null;
            }
        }

        @Override
        public String toString() {
            return "<JsltExpression \"" + source + "\">";
        }
    }
}
