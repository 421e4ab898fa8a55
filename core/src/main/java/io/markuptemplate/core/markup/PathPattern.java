package io.markuptemplate.core.markup;

import io.markuptemplate.core.model.Attribute;
import io.markuptemplate.core.model.Event;
import io.markuptemplate.core.model.EventKind;
import io.markuptemplate.core.model.StartElement;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * A restricted structural path language used by match templates and {@code select()}.
 *
 * <p>Grammar:
 *
 * <pre>
 * pattern   := path ('|' path)*
 * path      := ('/' | '//')? step (('/' | '//') step)*
 * step      := '.' | '*' | name | '@' name | '@*' | 'text()' | 'node()', followed by predicates
 * predicate := '[' '@' name (('=' | '!=') quoted-string)? ']'
 * </pre>
 *
 * <p>{@code /} separates a child step, {@code //} a descendant step. A path starting with {@code
 * /} is anchored at the root of the stream. When used as a match pattern, a relative path may
 * match at any depth, so {@code div/greeting} matches every {@code greeting} element whose parent
 * is a {@code div}.
 *
 * <p>Immutable and thread-safe.
 */
public final class PathPattern {

    private final String source;
    private final List<LocationPath> paths;

    private PathPattern(String source, List<LocationPath> paths) {
        this.source = source;
        this.paths = paths;
    }

    /**
     * Parses a pattern.
     *
     * @throws IllegalArgumentException if the pattern is malformed
     */
    public static PathPattern compile(String source) {
        Objects.requireNonNull(source, "source must not be null");
        return new PathPattern(source, new PatternParser(source).parse());
    }

    public String source() {
        return source;
    }

    /** Returns {@code true} if every step of every alternative tests elements. */
    public boolean isElementPattern() {
        for (LocationPath path : paths) {
            for (Step step : path.steps) {
                if (step.test.kind == TestKind.ATTRIBUTE || step.test.kind == TestKind.TEXT) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * Tests whether the last element of {@code path} (ordered from the outermost ancestor to the
     * element itself) matches this pattern.
     */
    public boolean matches(List<StartElement> path) {
        if (path.isEmpty()) {
            return false;
        }
        for (LocationPath alternative : paths) {
            List<Step> steps = alternative.steps;
            if (matchesAt(alternative, steps.size() - 1, path, path.size() - 1)) {
                return true;
            }
        }
        return false;
    }

    private static boolean matchesAt(LocationPath alternative, int stepIndex, List<StartElement> path, int depth) {
        Step step = alternative.steps.get(stepIndex);
        if (!step.matchesElement(path.get(depth))) {
            return false;
        }
        if (stepIndex == 0) {
            return !alternative.absolute || step.axis == Axis.DESCENDANT || depth == 0;
        }
        if (step.axis == Axis.CHILD) {
            return depth > 0 && matchesAt(alternative, stepIndex - 1, path, depth - 1);
        }
        for (int ancestor = depth - 1; ancestor >= 0; ancestor--) {
            if (matchesAt(alternative, stepIndex - 1, path, ancestor)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Selects the events addressed by this pattern from a buffered stream.
     *
     * @param events          the buffered events
     * @param fromRootElement if {@code true}, relative paths are evaluated against the first
     *                        element of the stream (the matched element of a match template);
     *                        otherwise against the stream's top-level nodes
     * @return the selected events in document order; attribute values are returned as TEXT events
     */
    public List<Event> select(List<Event> events, boolean fromRootElement) {
        Node root = Node.build(events);
        Node contextNode = root;
        if (fromRootElement) {
            for (Node child : root.children) {
                if (child.element != null) {
                    contextNode = child;
                    break;
                }
            }
        }

        Map<Long, List<Event>> selected = new TreeMap<>();
        for (LocationPath alternative : paths) {
            List<Node> current = List.of(alternative.absolute ? root : contextNode);
            for (int i = 0; i < alternative.steps.size(); i++) {
                Step step = alternative.steps.get(i);
                if (step.test.kind == TestKind.ATTRIBUTE) {
                    collectAttributes(step, current, selected);
                    current = List.of();
                    break;
                }
                current = evaluate(step, current);
            }
            for (Node node : current) {
                if (node != root) {
                    selected.putIfAbsent(order(node.start, 0), events.subList(node.start, node.end + 1));
                }
            }
        }
        List<Event> result = new ArrayList<>();
        selected.values().forEach(result::addAll);
        return result;
    }

    private static long order(int eventIndex, int attributeIndex) {
        return ((long) eventIndex << 20) | attributeIndex;
    }

    private static List<Node> evaluate(Step step, List<Node> contexts) {
        List<Node> result = new ArrayList<>();
        for (Node context : contexts) {
            if (step.test.kind == TestKind.SELF) {
                addUnique(result, context);
                continue;
            }
            List<Node> candidates = step.axis == Axis.CHILD ? context.children : context.descendants();
            for (Node candidate : candidates) {
                if (step.matchesNode(candidate)) {
                    addUnique(result, candidate);
                }
            }
        }
        result.sort(Comparator.comparingInt(node -> node.start));
        return result;
    }

    private static void addUnique(List<Node> nodes, Node node) {
        if (!nodes.contains(node)) {
            nodes.add(node);
        }
    }

    private static void collectAttributes(Step step, List<Node> contexts, Map<Long, List<Event>> selected) {
        for (Node context : contexts) {
            if (context.element == null) {
                continue;
            }
            List<Attribute> attributes = context.element.attributes().asList();
            for (int i = 0; i < attributes.size(); i++) {
                Attribute attribute = attributes.get(i);
                if (step.test.name == null || step.test.name.equals(attribute.name().localName())) {
                    Event start = context.event;
                    selected.putIfAbsent(
                            order(context.start, i + 1), List.of(Event.text(attribute.text(), start.position())));
                }
            }
        }
    }

    @Override
    public String toString() {
        return source;
    }

    // ── Model ──

    private enum Axis {
        CHILD,
        DESCENDANT
    }

    private enum TestKind {
        ELEMENT,
        ANY_ELEMENT,
        ATTRIBUTE,
        TEXT,
        NODE,
        SELF
    }

    private record NodeTest(TestKind kind, String name) {}

    private record Predicate(String attribute, String value, boolean negated) {

        boolean test(StartElement element) {
            String actual = element.attributes().get(attribute);
            if (value == null) {
                return actual != null;
            }
            boolean equal = value.equals(actual);
            return negated ? !equal && actual != null : equal;
        }
    }

    private record Step(Axis axis, NodeTest test, List<Predicate> predicates) {

        boolean matchesElement(StartElement element) {
            boolean nameMatches =
                    switch (test.kind) {
                        case ELEMENT -> test.name.equals(element.tag().localName())
                                || test.name.equals(element.tag().qualifiedName());
                        case ANY_ELEMENT, NODE, SELF -> true;
                        case ATTRIBUTE, TEXT -> false;
                    };
            if (!nameMatches) {
                return false;
            }
            for (Predicate predicate : predicates) {
                if (!predicate.test(element)) {
                    return false;
                }
            }
            return true;
        }

        boolean matchesNode(Node node) {
            if (node.element != null) {
                return test.kind != TestKind.TEXT && matchesElement(node.element);
            }
            if (node.event.is(EventKind.TEXT)) {
                return (test.kind == TestKind.TEXT || test.kind == TestKind.NODE) && predicates.isEmpty();
            }
            return test.kind == TestKind.NODE && predicates.isEmpty();
        }
    }

    private record LocationPath(boolean absolute, List<Step> steps) {}

    /** Lightweight tree over a buffered event list; nodes refer to index ranges of the list. */
    private static final class Node {

        final Event event;
        final StartElement element;
        final int start;
        int end;
        final List<Node> children = new ArrayList<>();

        Node(Event event, int start) {
            this.event = event;
            this.element = elementOf(event);
            this.start = start;
            this.end = start;
        }

        // A SUB event stands for the element it wraps.
        private static StartElement elementOf(Event event) {
            if (event == null) {
                return null;
            }
            if (event.is(EventKind.START)) {
                return event.startElement();
            }
            if (event.is(EventKind.SUB)) {
                List<Event> wrapped = event.subProgram().events();
                if (!wrapped.isEmpty() && wrapped.get(0).is(EventKind.START)) {
                    return wrapped.get(0).startElement();
                }
            }
            return null;
        }

        static Node build(List<Event> events) {
            Node root = new Node(null, -1);
            List<Node> stack = new ArrayList<>();
            stack.add(root);
            for (int i = 0; i < events.size(); i++) {
                Event event = events.get(i);
                Node parent = stack.get(stack.size() - 1);
                switch (event.kind()) {
                    case START -> {
                        Node node = new Node(event, i);
                        parent.children.add(node);
                        stack.add(node);
                    }
                    case END -> {
                        if (stack.size() > 1) {
                            stack.remove(stack.size() - 1).end = i;
                        }
                    }
                    case START_NS, END_NS -> {
                        // namespace scoping is not addressable
                    }
                    default -> parent.children.add(new Node(event, i));
                }
            }
            for (int i = stack.size() - 1; i > 0; i--) {
                stack.get(i).end = events.size() - 1;
            }
            root.end = events.size() - 1;
            return root;
        }

        List<Node> descendants() {
            List<Node> result = new ArrayList<>();
            for (Node child : children) {
                result.add(child);
                result.addAll(child.descendants());
            }
            return result;
        }
    }

    // ── Parsing ──

    private static final class PatternParser {

        private final String text;
        private int pos;

        PatternParser(String text) {
            this.text = text;
        }

        List<LocationPath> parse() {
            List<LocationPath> paths = new ArrayList<>();
            paths.add(parsePath());
            skipSpaces();
            while (pos < text.length() && text.charAt(pos) == '|') {
                pos++;
                paths.add(parsePath());
                skipSpaces();
            }
            if (pos < text.length()) {
                throw error("Unexpected character '" + text.charAt(pos) + "'");
            }
            return List.copyOf(paths);
        }

        private LocationPath parsePath() {
            skipSpaces();
            boolean absolute = false;
            Axis axis = Axis.CHILD;
            if (lookingAt("//")) {
                pos += 2;
                absolute = true;
                axis = Axis.DESCENDANT;
            } else if (lookingAt("/")) {
                pos++;
                absolute = true;
            }
            List<Step> steps = new ArrayList<>();
            steps.add(parseStep(axis));
            while (true) {
                skipSpaces();
                if (lookingAt("//")) {
                    pos += 2;
                    steps.add(parseStep(Axis.DESCENDANT));
                } else if (lookingAt("/")) {
                    pos++;
                    steps.add(parseStep(Axis.CHILD));
                } else {
                    break;
                }
            }
            for (int i = 0; i < steps.size() - 1; i++) {
                if (steps.get(i).test.kind == TestKind.ATTRIBUTE || steps.get(i).test.kind == TestKind.TEXT) {
                    throw error("Attribute and text() steps must be the last step of a path");
                }
            }
            return new LocationPath(absolute, List.copyOf(steps));
        }

        private Step parseStep(Axis axis) {
            skipSpaces();
            NodeTest test;
            if (lookingAt(".")) {
                pos++;
                test = new NodeTest(TestKind.SELF, null);
            } else if (lookingAt("@")) {
                pos++;
                if (lookingAt("*")) {
                    pos++;
                    test = new NodeTest(TestKind.ATTRIBUTE, null);
                } else {
                    test = new NodeTest(TestKind.ATTRIBUTE, name());
                }
            } else if (lookingAt("*")) {
                pos++;
                test = new NodeTest(TestKind.ANY_ELEMENT, null);
            } else {
                String name = name();
                if (lookingAt("()")) {
                    pos += 2;
                    test = switch (name) {
                        case "text" -> new NodeTest(TestKind.TEXT, null);
                        case "node" -> new NodeTest(TestKind.NODE, null);
                        default -> throw error("Unsupported function \"" + name + "()\"");
                    };
                } else {
                    test = new NodeTest(TestKind.ELEMENT, name);
                }
            }
            List<Predicate> predicates = new ArrayList<>();
            skipSpaces();
            while (lookingAt("[")) {
                pos++;
                predicates.add(parsePredicate());
                skipSpaces();
            }
            return new Step(axis, test, List.copyOf(predicates));
        }

        private Predicate parsePredicate() {
            skipSpaces();
            if (!lookingAt("@")) {
                throw error("Only attribute predicates are supported");
            }
            pos++;
            String attribute = name();
            skipSpaces();
            String value = null;
            boolean negated = false;
            if (lookingAt("!=")) {
                pos += 2;
                negated = true;
                value = quoted();
            } else if (lookingAt("=")) {
                pos++;
                value = quoted();
            }
            skipSpaces();
            if (!lookingAt("]")) {
                throw error("Expected ']'");
            }
            pos++;
            return new Predicate(attribute, value, negated);
        }

        private String quoted() {
            skipSpaces();
            if (pos >= text.length() || (text.charAt(pos) != '"' && text.charAt(pos) != '\'')) {
                throw error("Expected a quoted string");
            }
            char quote = text.charAt(pos++);
            int end = text.indexOf(quote, pos);
            if (end < 0) {
                throw error("Unterminated string");
            }
            String value = text.substring(pos, end);
            pos = end + 1;
            return value;
        }

        private String name() {
            int start = pos;
            while (pos < text.length()) {
                char c = text.charAt(pos);
                if (Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == ':'
                        || (c == '.' && pos > start)) {
                    pos++;
                } else {
                    break;
                }
            }
            if (start == pos) {
                throw error("Expected a name");
            }
            return text.substring(start, pos);
        }

        private boolean lookingAt(String token) {
            return text.startsWith(token, pos);
        }

        private void skipSpaces() {
            while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
                pos++;
            }
        }

        private IllegalArgumentException error(String message) {
            return new IllegalArgumentException(message + " at offset " + pos + " in path \"" + text + "\"");
        }
    }
}
