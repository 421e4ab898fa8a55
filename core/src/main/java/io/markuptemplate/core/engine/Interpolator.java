package io.markuptemplate.core.engine;

import io.markuptemplate.core.model.Event;
import io.markuptemplate.core.model.Position;
import io.markuptemplate.core.spi.CompiledExpression;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits text into literal TEXT fragments and EXPR fragments.
 *
 * <p>Two forms are recognized: {@code ${expression}} and the short form {@code $name.attr}. A
 * {@code $} preceded by another {@code $} does not start an expression, and {@code $$} in literal
 * text becomes a single {@code $}. Every fragment carries the position of the text it came from.
 */
public final class Interpolator {

    private static final Pattern SHORT = Pattern.compile(
            "(?<!\\$)\\$([a-zA-Z_][a-zA-Z0-9_]*(?:\\.[a-zA-Z_][a-zA-Z0-9_]*)*)");

    private Interpolator() {}

    /**
     * Interpolates {@code text}.
     *
     * @param compiler compiles expression sources; its exceptions propagate unchanged
     * @return the fragments in source order, without empty literals
     */
    public static List<Event> interpolate(
            String text, Position position, Function<String, CompiledExpression> compiler) {
        List<Event> fragments = new ArrayList<>();
        int cursor = 0;
        int start;
        while ((start = findBraced(text, cursor)) >= 0) {
            int close = closingBrace(text, start + 2);
            if (close < 0) {
                break;
            }
            shortForms(text.substring(cursor, start), position, compiler, fragments);
            String source = text.substring(start + 2, close);
            if (!source.isBlank()) {
                fragments.add(Event.expr(compiler.apply(source.strip()), position));
            }
            cursor = close + 1;
        }
        shortForms(text.substring(cursor), position, compiler, fragments);
        return fragments;
    }

    private static void shortForms(
            String text,
            Position position,
            Function<String, CompiledExpression> compiler,
            List<Event> fragments) {
        Matcher matcher = SHORT.matcher(text);
        int cursor = 0;
        while (matcher.find()) {
            literal(text.substring(cursor, matcher.start()), position, fragments);
            fragments.add(Event.expr(compiler.apply(matcher.group(1)), position));
            cursor = matcher.end();
        }
        literal(text.substring(cursor), position, fragments);
    }

    private static void literal(String text, Position position, List<Event> fragments) {
        if (!text.isEmpty()) {
            fragments.add(Event.text(text.replace("$$", "$"), position));
        }
    }

    private static int findBraced(String text, int from) {
        int index = text.indexOf("${", from);
        while (index > 0 && text.charAt(index - 1) == '$') {
            index = text.indexOf("${", index + 1);
        }
        return index;
    }

    // Index of the brace closing an expression body starting at from, honoring nested braces
    // and quoted strings.
    private static int closingBrace(String text, int from) {
        int depth = 0;
        char quote = 0;
        for (int i = from; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                if (depth == 0) {
                    return i;
                }
                depth--;
            }
        }
        return -1;
    }
}
