package io.markuptemplate.core.engine.simple;

import io.markuptemplate.core.engine.simple.Token.Type;
import io.markuptemplate.core.error.ExpressionCompileException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Recursive-descent parser for the {@code simple} language. Precedence, lowest first: conditional
 * ({@code a if test else b}), {@code or}, {@code and}, {@code not}, comparisons, {@code + -},
 * {@code * / // %}, unary minus, then attribute access, subscripts and calls.
 */
final class ExpressionParser {

    private final String source;
    private final List<Token> tokens;
    private int index;

    private ExpressionParser(String source) {
        this.source = source;
        this.tokens = Lexer.tokenize(source);
    }

    static Node parse(String source) {
        ExpressionParser parser = new ExpressionParser(source);
        if (parser.peek().type() == Type.END) {
            throw new ExpressionCompileException("Empty expression", source, 0);
        }
        Node node = parser.expression();
        if (parser.peek().type() != Type.END) {
            throw parser.unexpected(parser.peek());
        }
        return node;
    }

    private Node expression() {
        Node value = or();
        if (peek().isKeyword("if")) {
            advance();
            Node test = or();
            expectKeyword("else");
            return new Node.Conditional(test, value, expression());
        }
        return value;
    }

    private Node or() {
        Node left = and();
        while (peek().isKeyword("or")) {
            advance();
            left = new Node.Logical(false, left, and());
        }
        return left;
    }

    private Node and() {
        Node left = not();
        while (peek().isKeyword("and")) {
            advance();
            left = new Node.Logical(true, left, not());
        }
        return left;
    }

    private Node not() {
        if (peek().isKeyword("not")) {
            advance();
            return new Node.Not(not());
        }
        return comparison();
    }

    private Node comparison() {
        Node first = additive();
        List<String> operators = new ArrayList<>();
        List<Node> operands = new ArrayList<>();
        while (true) {
            Token token = peek();
            String operator;
            if (token.type() == Type.OPERATOR && List.of("==", "!=", "<", "<=", ">", ">=").contains(token.text())) {
                advance();
                operator = token.text();
            } else if (token.isKeyword("in")) {
                advance();
                operator = "in";
            } else if (token.isKeyword("not") && peek(1).isKeyword("in")) {
                advance();
                advance();
                operator = "not in";
            } else if (token.isKeyword("is")) {
                advance();
                if (peek().isKeyword("not")) {
                    advance();
                    operator = "is not";
                } else {
                    operator = "is";
                }
            } else {
                break;
            }
            operators.add(operator);
            operands.add(additive());
        }
        return operators.isEmpty() ? first : new Node.Compare(first, operators, operands);
    }

    private Node additive() {
        Node left = term();
        while (peek().isOperator("+") || peek().isOperator("-")) {
            String operator = advance().text();
            left = new Node.Binary(operator, left, term());
        }
        return left;
    }

    private Node term() {
        Node left = unary();
        while (peek().isOperator("*") || peek().isOperator("/") || peek().isOperator("//") || peek().isOperator("%")) {
            String operator = advance().text();
            left = new Node.Binary(operator, left, unary());
        }
        return left;
    }

    private Node unary() {
        if (peek().isOperator("-")) {
            advance();
            return new Node.Negate(unary());
        }
        if (peek().isOperator("+")) {
            advance();
            return unary();
        }
        return postfix();
    }

    private Node postfix() {
        Node node = primary();
        while (true) {
            if (peek().isOperator(".")) {
                advance();
                Token name = advance();
                if (name.type() != Type.NAME && name.type() != Type.KEYWORD) {
                    throw unexpected(name);
                }
                node = new Node.GetAttribute(node, name.text());
            } else if (peek().isOperator("[")) {
                advance();
                Node key = expression();
                expectOperator("]");
                node = new Node.GetItem(node, key);
            } else if (peek().isOperator("(")) {
                advance();
                node = call(node);
            } else {
                return node;
            }
        }
    }

    private Node call(Node callee) {
        List<Node> args = new ArrayList<>();
        Map<String, Node> kwargs = new LinkedHashMap<>();
        while (!peek().isOperator(")")) {
            if (peek().type() == Type.NAME && peek(1).isOperator("=")) {
                String name = advance().text();
                advance();
                kwargs.put(name, expression());
            } else {
                if (!kwargs.isEmpty()) {
                    throw new ExpressionCompileException(
                            "Positional argument follows keyword argument", source, peek().offset());
                }
                args.add(expression());
            }
            if (!peek().isOperator(",")) {
                break;
            }
            advance();
        }
        expectOperator(")");
        return new Node.Call(callee, args, kwargs);
    }

    private Node primary() {
        Token token = advance();
        switch (token.type()) {
            case NUMBER, STRING -> {
                return new Node.Literal(token.value());
            }
            case NAME -> {
                return new Node.Name(token.text());
            }
            case KEYWORD -> {
                switch (token.text()) {
                    case "True" -> {
                        return new Node.Literal(Boolean.TRUE);
                    }
                    case "False" -> {
                        return new Node.Literal(Boolean.FALSE);
                    }
                    case "None" -> {
                        return new Node.Literal(null);
                    }
                    default -> throw unexpected(token);
                }
            }
            case OPERATOR -> {
                switch (token.text()) {
                    case "(" -> {
                        return parenthesized();
                    }
                    case "[" -> {
                        List<Node> items = sequence("]");
                        return new Node.ListDisplay(items);
                    }
                    case "{" -> {
                        return dict();
                    }
                    default -> throw unexpected(token);
                }
            }
            default -> throw unexpected(token);
        }
    }

    // (expr) groups; (a, b) and () build tuples, represented as lists.
    private Node parenthesized() {
        if (peek().isOperator(")")) {
            advance();
            return new Node.ListDisplay(List.of());
        }
        Node first = expression();
        if (peek().isOperator(")")) {
            advance();
            return first;
        }
        List<Node> items = new ArrayList<>();
        items.add(first);
        expectOperator(",");
        items.addAll(sequence(")"));
        return new Node.ListDisplay(items);
    }

    private List<Node> sequence(String close) {
        List<Node> items = new ArrayList<>();
        while (!peek().isOperator(close)) {
            items.add(expression());
            if (!peek().isOperator(",")) {
                break;
            }
            advance();
        }
        expectOperator(close);
        return items;
    }

    private Node dict() {
        List<Node> keys = new ArrayList<>();
        List<Node> values = new ArrayList<>();
        while (!peek().isOperator("}")) {
            keys.add(expression());
            expectOperator(":");
            values.add(expression());
            if (!peek().isOperator(",")) {
                break;
            }
            advance();
        }
        expectOperator("}");
        return new Node.DictDisplay(keys, values);
    }

    private Token peek() {
        return peek(0);
    }

    private Token peek(int ahead) {
        return tokens.get(Math.min(index + ahead, tokens.size() - 1));
    }

    private Token advance() {
        Token token = peek();
        if (token.type() != Type.END) {
            index++;
        }
        return token;
    }

    private void expectOperator(String op) {
        Token token = advance();
        if (!token.isOperator(op)) {
            throw new ExpressionCompileException(
                    "Expected \"" + op + "\" but found " + token, source, token.offset());
        }
    }

    private void expectKeyword(String keyword) {
        Token token = advance();
        if (!token.isKeyword(keyword)) {
            throw new ExpressionCompileException(
                    "Expected \"" + keyword + "\" but found " + token, source, token.offset());
        }
    }

    private ExpressionCompileException unexpected(Token token) {
        return new ExpressionCompileException("Unexpected " + token, source, token.offset());
    }
}
