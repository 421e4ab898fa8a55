package io.markuptemplate.core.engine;

import io.markuptemplate.core.directive.DirectiveRegistry;
import io.markuptemplate.core.directive.DirectiveRegistry.Registration;
import io.markuptemplate.core.engine.simple.SimpleExpressionEngine;
import io.markuptemplate.core.error.BadDirectiveException;
import io.markuptemplate.core.error.ExpressionCompileException;
import io.markuptemplate.core.error.TemplateSyntaxException;
import io.markuptemplate.core.filter.EvalFilter;
import io.markuptemplate.core.filter.WhitespaceFilter;
import io.markuptemplate.core.markup.XmlMarkupParser;
import io.markuptemplate.core.model.Attribute;
import io.markuptemplate.core.model.Attributes;
import io.markuptemplate.core.model.Event;
import io.markuptemplate.core.model.EventKind;
import io.markuptemplate.core.model.NamespaceDecl;
import io.markuptemplate.core.model.Position;
import io.markuptemplate.core.model.QName;
import io.markuptemplate.core.model.StartElement;
import io.markuptemplate.core.spi.CompiledExpression;
import io.markuptemplate.core.spi.Directive;
import io.markuptemplate.core.spi.DirectiveSite;
import io.markuptemplate.core.spi.ExpressionEngine;
import io.markuptemplate.core.spi.MarkupParser;
import io.markuptemplate.core.spi.TemplateFilter;
import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles markup source into a {@link Template} in a single forward pass over the parsed events.
 *
 * <p>Elements carrying attributes in the directive namespace are collapsed into one SUB event
 * holding their directives (in priority order) and the element's events. Text and ordinary
 * attribute values are split into literal and expression fragments. Declarations of the
 * directive namespace are dropped.
 *
 * <p>Instances are immutable and thread-safe; use {@link #builder()} to configure one.
 */
public final class TemplateCompiler {

    public static final String DEFAULT_NAMESPACE = "http://markuptemplate.io/ns/directives";

    private static final Logger LOG = LoggerFactory.getLogger(TemplateCompiler.class);

    private final MarkupParser markupParser;
    private final ExpressionEngine expressionEngine;
    private final DirectiveRegistry directives;
    private final String namespace;
    private final List<TemplateFilter> preFilters;
    private final List<TemplateFilter> postFilters;

    private TemplateCompiler(
            MarkupParser markupParser,
            ExpressionEngine expressionEngine,
            DirectiveRegistry directives,
            String namespace,
            List<TemplateFilter> preFilters,
            List<TemplateFilter> postFilters) {
        this.markupParser = markupParser;
        this.expressionEngine = expressionEngine;
        this.directives = directives;
        this.namespace = namespace;
        this.preFilters = List.copyOf(preFilters);
        this.postFilters = List.copyOf(postFilters);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Returns a compiler with the default parser, the {@code simple} language and all built-ins. */
    public static TemplateCompiler defaults() {
        return builder().build();
    }

    /** Returns a copy of this compiler that also installs {@code filter} after the existing pre-filters. */
    public TemplateCompiler withPreFilter(TemplateFilter filter) {
        List<TemplateFilter> filters = new ArrayList<>(preFilters);
        filters.add(Objects.requireNonNull(filter, "filter must not be null"));
        return new TemplateCompiler(markupParser, expressionEngine, directives, namespace, filters, postFilters);
    }

    public ExpressionEngine expressionEngine() {
        return expressionEngine;
    }

    public String namespace() {
        return namespace;
    }

    public Template compile(String source) {
        return compile(new StringReader(source), null);
    }

    /**
     * Compiles a template.
     *
     * @param filename name used in positions and error messages, {@code null} for a string source
     * @throws TemplateSyntaxException if the markup, a directive value or an expression is invalid
     * @throws BadDirectiveException if an attribute in the directive namespace names no directive
     */
    public Template compile(Reader source, String filename) {
        String name = filename != null ? filename : Position.STRING_SOURCE;
        List<Event> parsed = markupParser.parse(source, name);
        Pass pass = new Pass(name);
        for (Event event : parsed) {
            pass.accept(event);
        }
        LOG.debug("Compiled template: name={}, events={}, matchFilters={}", name, pass.out.size(), pass.filters.size());
        return new Template(name, pass.out, preFilters, pass.filters, postFilters);
    }

    private record ElementKey(int depth, QName tag) {}

    private record PendingElement(List<Directive> directives, int offset) {}

    /** State of one compilation. */
    private final class Pass {

        private final String filename;
        private final List<Event> out = new ArrayList<>();
        private final List<TemplateFilter> filters = new ArrayList<>();
        private final Map<ElementKey, PendingElement> pending = new HashMap<>();
        private final Set<String> directivePrefixes = new HashSet<>();
        private int depth;

        Pass(String filename) {
            this.filename = filename;
        }

        void accept(Event event) {
            switch (event.kind()) {
                case START_NS -> {
                    NamespaceDecl declaration = (NamespaceDecl) event.data();
                    if (namespace.equals(declaration.uri())) {
                        directivePrefixes.add(declaration.prefix());
                    } else {
                        out.add(event);
                    }
                }
                case END_NS -> {
                    if (!directivePrefixes.remove((String) event.data())) {
                        out.add(event);
                    }
                }
                case START -> start(event);
                case END -> end(event);
                case TEXT -> out.addAll(Interpolator.interpolate(
                        event.text(), event.position(), source -> compileExpression(source, event.position())));
                default -> out.add(event);
            }
        }

        private void start(Event event) {
            StartElement element = event.startElement();
            List<Registration> found = new ArrayList<>();
            List<String> values = new ArrayList<>();
            List<Attribute> ordinary = new ArrayList<>();
            for (Attribute attribute : element.attributes()) {
                if (namespace.equals(attribute.name().namespace())) {
                    String directiveName = attribute.name().localName();
                    Registration registration = directives.lookup(directiveName)
                            .orElseThrow(() -> new BadDirectiveException(
                                    directiveName, filename, event.position().line()));
                    found.add(registration);
                    values.add(attribute.text());
                } else {
                    ordinary.add(new Attribute(attribute.name(), Interpolator.interpolate(
                            attribute.text(), event.position(), source -> compileExpression(source, event.position()))));
                }
            }
            if (!found.isEmpty()) {
                List<Integer> order = new ArrayList<>();
                for (int i = 0; i < found.size(); i++) {
                    order.add(i);
                }
                order.sort(Comparator.comparingInt(i -> found.get(i).priority()));
                Site site = new Site(event.position(), filters);
                List<Directive> created = new ArrayList<>(found.size());
                for (int i : order) {
                    created.add(found.get(i).factory().create(values.get(i), site));
                }
                pending.put(new ElementKey(depth, element.tag()), new PendingElement(created, out.size()));
            }
            out.add(new Event(EventKind.START, element.withAttributes(new Attributes(ordinary)), event.position()));
            depth++;
        }

        private void end(Event event) {
            depth--;
            out.add(event);
            PendingElement element = pending.remove(new ElementKey(depth, event.endTag()));
            if (element != null) {
                List<Event> tail = out.subList(element.offset(), out.size());
                List<Event> slice = new ArrayList<>(tail);
                tail.clear();
                out.add(Event.sub(element.directives(), slice, slice.get(0).position()));
            }
        }

        private CompiledExpression compileExpression(String source, Position position) {
            try {
                return expressionEngine.compile(source);
            } catch (ExpressionCompileException e) {
                int column = position.column() >= 0 ? position.column() + Math.max(e.offset(), 0) : -1;
                throw new TemplateSyntaxException(
                        e.detail(), e, new Position(position.filename(), position.line(), column));
            }
        }
    }

    /** The directive's view of the element being compiled. */
    private final class Site implements DirectiveSite {

        private final Position position;
        private final List<TemplateFilter> filters;

        Site(Position position, List<TemplateFilter> filters) {
            this.position = position;
            this.filters = filters;
        }

        @Override
        public Position position() {
            return position;
        }

        @Override
        public CompiledExpression compile(String source) {
            try {
                return expressionEngine.compile(source);
            } catch (ExpressionCompileException e) {
                throw new TemplateSyntaxException(e.detail(), e, position);
            }
        }

        @Override
        public void addRuntimeFilter(TemplateFilter filter) {
            filters.add(filter);
        }
    }

    /** Builder with defaults for every collaborator. */
    public static final class Builder {

        private MarkupParser markupParser = new XmlMarkupParser();
        private ExpressionEngine expressionEngine = new SimpleExpressionEngine();
        private DirectiveRegistry directives = DirectiveRegistry.builtIns();
        private String namespace = DEFAULT_NAMESPACE;
        private boolean collapseWhitespace = true;

        private Builder() {}

        public Builder markupParser(MarkupParser markupParser) {
            this.markupParser = Objects.requireNonNull(markupParser, "markupParser must not be null");
            return this;
        }

        public Builder expressionEngine(ExpressionEngine expressionEngine) {
            this.expressionEngine = Objects.requireNonNull(expressionEngine, "expressionEngine must not be null");
            return this;
        }

        public Builder directives(DirectiveRegistry directives) {
            this.directives = Objects.requireNonNull(directives, "directives must not be null");
            return this;
        }

        public Builder namespace(String namespace) {
            this.namespace = Objects.requireNonNull(namespace, "namespace must not be null");
            return this;
        }

        public Builder collapseWhitespace(boolean collapseWhitespace) {
            this.collapseWhitespace = collapseWhitespace;
            return this;
        }

        public TemplateCompiler build() {
            return new TemplateCompiler(
                    markupParser,
                    expressionEngine,
                    directives,
                    namespace,
                    List.of(new EvalFilter()),
                    collapseWhitespace ? List.of(new WhitespaceFilter()) : List.of());
        }
    }
}
