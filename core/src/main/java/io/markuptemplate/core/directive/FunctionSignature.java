package io.markuptemplate.core.directive;

import io.markuptemplate.core.error.TemplateSyntaxException;
import io.markuptemplate.core.spi.CompiledExpression;
import io.markuptemplate.core.spi.DirectiveSite;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Parsed {@code def} signature: a function name followed by an optional parenthesized parameter
 * list. Parameters are plain names or {@code name=default}; defaults are expressions of the
 * template's expression language, compiled here and evaluated at call time.
 */
public record FunctionSignature(String name, List<String> parameters, Map<String, CompiledExpression> defaults) {

    private static final Pattern IDENTIFIER = Pattern.compile("[a-zA-Z_][a-zA-Z0-9_]*");

    public FunctionSignature {
        parameters = List.copyOf(parameters);
        defaults = Map.copyOf(defaults);
    }

    /**
     * @throws TemplateSyntaxException if the name or a parameter is not an identifier, or the
     *     parameter list is not closed
     */
    public static FunctionSignature parse(String signature, DirectiveSite site) {
        String text = signature.strip();
        int open = text.indexOf('(');
        String name = open < 0 ? text : text.substring(0, open).strip();
        if (!IDENTIFIER.matcher(name).matches()) {
            throw invalid(signature, "\"" + name + "\" is not a valid function name", site);
        }
        List<String> parameters = new ArrayList<>();
        Map<String, CompiledExpression> defaults = new LinkedHashMap<>();
        if (open >= 0) {
            if (!text.endsWith(")")) {
                throw invalid(signature, "missing \")\"", site);
            }
            for (String parameter : splitTopLevel(text.substring(open + 1, text.length() - 1))) {
                int eq = parameter.indexOf('=');
                String paramName = (eq < 0 ? parameter : parameter.substring(0, eq)).strip();
                if (!IDENTIFIER.matcher(paramName).matches()) {
                    throw invalid(signature, "\"" + paramName + "\" is not a valid parameter name", site);
                }
                parameters.add(paramName);
                if (eq >= 0) {
                    defaults.put(paramName, site.compile(parameter.substring(eq + 1).strip()));
                }
            }
        }
        return new FunctionSignature(name, parameters, defaults);
    }

    private static TemplateSyntaxException invalid(String signature, String reason, DirectiveSite site) {
        return new TemplateSyntaxException("Invalid \"def\" signature \"" + signature + "\": " + reason, site.position());
    }

    // Splits on commas that are not nested in brackets or quotes.
    private static List<String> splitTopLevel(String text) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        char quote = 0;
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
            } else if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
            } else if (c == ',' && depth == 0) {
                parts.add(text.substring(start, i));
                start = i + 1;
            }
        }
        String last = text.substring(start);
        if (!last.isBlank() || !parts.isEmpty()) {
            parts.add(last);
        }
        return parts;
    }
}
