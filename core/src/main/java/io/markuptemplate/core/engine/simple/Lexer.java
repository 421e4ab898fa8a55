package io.markuptemplate.core.engine.simple;

import io.markuptemplate.core.engine.simple.Token.Type;
import io.markuptemplate.core.error.ExpressionCompileException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/** Splits expression source into tokens. */
final class Lexer {

    static final Set<String> KEYWORDS = Set.of("and", "or", "not", "in", "is", "if", "else", "True", "False", "None");

    private static final List<String> OPERATORS = List.of(
            "==", "!=", "<=", ">=", "//", "<", ">", "+", "-", "*", "/", "%", "(", ")", "[", "]", "{", "}", ",",
            ".", ":", "=");

    private final String source;
    private int pos;

    private Lexer(String source) {
        this.source = source;
    }

    static List<Token> tokenize(String source) {
        return new Lexer(source).run();
    }

    private List<Token> run() {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (pos >= source.length()) {
                tokens.add(new Token(Type.END, "", null, pos));
                return tokens;
            }
            char c = source.charAt(pos);
            if (Character.isDigit(c)) {
                tokens.add(number());
            } else if (c == '\'' || c == '"') {
                tokens.add(string(c));
            } else if (Character.isLetter(c) || c == '_') {
                int start = pos;
                while (pos < source.length()
                        && (Character.isLetterOrDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
                    pos++;
                }
                String word = source.substring(start, pos);
                tokens.add(new Token(KEYWORDS.contains(word) ? Type.KEYWORD : Type.NAME, word, null, start));
            } else {
                tokens.add(operator());
            }
        }
    }

    private void skipWhitespace() {
        while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) {
            pos++;
        }
    }

    private Token number() {
        int start = pos;
        while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
            pos++;
        }
        boolean decimal = false;
        if (pos + 1 < source.length() && source.charAt(pos) == '.' && Character.isDigit(source.charAt(pos + 1))) {
            decimal = true;
            pos++;
            while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
                pos++;
            }
        }
        String text = source.substring(start, pos);
        Object value;
        if (decimal) {
            value = Double.parseDouble(text);
        } else {
            long parsed;
            try {
                parsed = Long.parseLong(text);
            } catch (NumberFormatException e) {
                throw new ExpressionCompileException("Integer literal out of range: " + text, e, source, start);
            }
            value = parsed >= Integer.MIN_VALUE && parsed <= Integer.MAX_VALUE ? (Object) (int) parsed : (Object) parsed;
        }
        return new Token(Type.NUMBER, text, value, start);
    }

    private Token string(char quote) {
        int start = pos++;
        StringBuilder value = new StringBuilder();
        while (pos < source.length()) {
            char c = source.charAt(pos++);
            if (c == quote) {
                return new Token(Type.STRING, source.substring(start, pos), value.toString(), start);
            }
            if (c == '\\' && pos < source.length()) {
                char escaped = source.charAt(pos++);
                switch (escaped) {
                    case 'n' -> value.append('\n');
                    case 't' -> value.append('\t');
                    case 'r' -> value.append('\r');
                    default -> value.append(escaped);
                }
            } else {
                value.append(c);
            }
        }
        throw new ExpressionCompileException("Unterminated string literal", source, start);
    }

    private Token operator() {
        for (String op : OPERATORS) {
            if (source.startsWith(op, pos)) {
                int start = pos;
                pos += op.length();
                return new Token(Type.OPERATOR, op, null, start);
            }
        }
        throw new ExpressionCompileException("Unexpected character '" + source.charAt(pos) + "'", source, pos);
    }
}
