package io.markuptemplate.core.engine.simple;

/** A lexical token with its offset in the expression source. */
record Token(Type type, String text, Object value, int offset) {

    enum Type {
        NUMBER,
        STRING,
        NAME,
        KEYWORD,
        OPERATOR,
        END
    }

    boolean is(Type expected, String expectedText) {
        return type == expected && text.equals(expectedText);
    }

    boolean isOperator(String op) {
        return is(Type.OPERATOR, op);
    }

    boolean isKeyword(String keyword) {
        return is(Type.KEYWORD, keyword);
    }

    @Override
    public String toString() {
        return type == Type.END ? "end of expression" : "\"" + text + "\"";
    }
}
