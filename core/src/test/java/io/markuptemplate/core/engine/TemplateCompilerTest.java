package io.markuptemplate.core.engine;

import static io.markuptemplate.core.testkit.TestTemplates.div;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.markuptemplate.core.directive.ForDirective;
import io.markuptemplate.core.directive.IfDirective;
import io.markuptemplate.core.directive.StripDirective;
import io.markuptemplate.core.error.BadDirectiveException;
import io.markuptemplate.core.error.TemplateSyntaxException;
import io.markuptemplate.core.filter.MatchFilter;
import io.markuptemplate.core.model.Event;
import io.markuptemplate.core.model.EventKind;
import io.markuptemplate.core.model.SubProgram;
import io.markuptemplate.core.spi.TemplateFilter;
import java.io.StringReader;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("TemplateCompiler")
class TemplateCompilerTest {

    private final TemplateCompiler compiler = TemplateCompiler.defaults();

    private static SubProgram onlySub(Template template) {
        return template.events().stream()
                .filter(e -> e.is(EventKind.SUB))
                .findFirst()
                .orElseThrow()
                .subProgram();
    }

    @Nested
    @DisplayName("directive elements")
    class DirectiveElements {

        @Test
        void elementWithDirectiveBecomesSubEvent() {
            Template template = compiler.compile(div("<p py:if=\"x\">a</p>"));

            assertThat(template.events()).extracting(Event::kind)
                    .containsExactly(EventKind.START, EventKind.SUB, EventKind.END);
            SubProgram sub = onlySub(template);
            assertThat(sub.directives()).singleElement().isInstanceOf(IfDirective.class);
            assertThat(sub.events()).extracting(Event::kind)
                    .containsExactly(EventKind.START, EventKind.TEXT, EventKind.END);
        }

        @Test
        void directiveAttributesAreRemovedFromStartTag() {
            SubProgram sub = onlySub(compiler.compile(div("<p class=\"c\" py:if=\"x\">a</p>")));

            assertThat(sub.events().get(0).startElement().attributes().asList())
                    .extracting(a -> a.name().localName())
                    .containsExactly("class");
        }

        @Test
        void directivesAreOrderedByPriorityNotAttributeOrder() {
            SubProgram sub = onlySub(compiler.compile(
                    div("<p py:strip=\"\" py:if=\"ok\" py:for=\"x in items\">a</p>")));

            assertThat(sub.directives()).hasExactlyElementsOfTypes(
                    ForDirective.class, IfDirective.class, StripDirective.class);
        }

        @Test
        void nestedDirectiveElementsNestSubEvents() {
            SubProgram outer = onlySub(compiler.compile(
                    div("<ul py:if=\"a\"><li py:for=\"x in xs\">$x</li></ul>")));

            assertThat(outer.events()).extracting(Event::kind)
                    .containsExactly(EventKind.START, EventKind.SUB, EventKind.END);
        }

        @Test
        void directiveNamespaceDeclarationIsDropped() {
            Template template = compiler.compile(div("<p py:if=\"x\">a</p>"));

            assertThat(template.events()).noneMatch(e -> e.is(EventKind.START_NS) || e.is(EventKind.END_NS));
        }

        @Test
        void matchDirectiveRegistersRuntimeFilter() {
            Template template = compiler.compile(div("<b py:match=\"greeting\">hi</b>"));

            assertThat(template.filters()).singleElement().isInstanceOf(MatchFilter.class);
        }

        @Test
        void customNamespaceIsRecognized() {
            TemplateCompiler custom = TemplateCompiler.builder().namespace("urn:t").build();

            String rendered = custom.compile("<div xmlns:t=\"urn:t\"><p t:if=\"False\">a</p></div>")
                    .generate(Map.of())
                    .render();

            assertThat(rendered).isEqualTo("<div/>");
        }
    }

    @Nested
    @DisplayName("errors")
    class Errors {

        @Test
        void unknownDirectiveIsBadDirective() {
            assertThatThrownBy(() -> compiler.compile(div("<p py:bogus=\"x\">a</p>")))
                    .isInstanceOf(BadDirectiveException.class)
                    .satisfies(e -> {
                        BadDirectiveException error = (BadDirectiveException) e;
                        assertThat(error.directiveName()).isEqualTo("bogus");
                        assertThat(error.line()).isEqualTo(1);
                        assertThat(error.filename()).isEqualTo("<string>");
                    });
        }

        @Test
        void invalidExpressionIsSyntaxErrorAtTemplateLine() {
            assertThatThrownBy(() -> compiler.compile(new StringReader("<div>\n<p>${1 +}</p>\n</div>"), "page.html"))
                    .isInstanceOf(TemplateSyntaxException.class)
                    .satisfies(e -> {
                        TemplateSyntaxException error = (TemplateSyntaxException) e;
                        assertThat(error.filename()).isEqualTo("page.html");
                        assertThat(error.line()).isEqualTo(2);
                    });
        }

        @Test
        void invalidForDirectiveIsSyntaxError() {
            assertThatThrownBy(() -> compiler.compile(div("<p py:for=\"items\">a</p>")))
                    .isInstanceOf(TemplateSyntaxException.class)
                    .hasMessageContaining("Invalid \"for\" directive");
        }

        @Test
        void invalidMatchPatternIsSyntaxError() {
            assertThatThrownBy(() -> compiler.compile(div("<p py:match=\"a[\">a</p>")))
                    .isInstanceOf(TemplateSyntaxException.class)
                    .hasMessageContaining("Invalid \"match\" pattern");
        }
    }

    @Nested
    @DisplayName("filters and whitespace")
    class Filters {

        @Test
        void collapsesBlankLinesByDefault() {
            assertThat(compiler.compile("<div>\n\n\n<p/>  \n</div>").generate(Map.of()).render())
                    .isEqualTo("<div>\n<p/>\n</div>");
        }

        @Test
        void keepsWhitespaceWhenCollapsingIsOff() {
            TemplateCompiler verbatim = TemplateCompiler.builder().collapseWhitespace(false).build();

            assertThat(verbatim.compile("<div>\n\n<p/></div>").generate(Map.of()).render())
                    .isEqualTo("<div>\n\n<p/></div>");
        }

        @Test
        void withPreFilterReturnsExtendedCopy() {
            TemplateFilter upper = (stream, context) -> new PullIterator<>() {
                @Override
                protected Event computeNext() {
                    if (!stream.hasNext()) {
                        return endOfData();
                    }
                    Event event = stream.next();
                    return event.is(EventKind.TEXT)
                            ? Event.text(event.text().toUpperCase(), event.position())
                            : event;
                }
            };
            TemplateCompiler extended = compiler.withPreFilter(upper);

            assertThat(extended.compile("<p>${'hi'} there</p>").generate(Map.of()).render())
                    .isEqualTo("<p>HI THERE</p>");
            assertThat(compiler.compile("<p>hi</p>").generate(Map.of()).render()).isEqualTo("<p>hi</p>");
        }
    }

    @Test
    void templateWithoutDirectivesKeepsItsEvents() {
        Template template = compiler.compile("<a><b>t</b></a>");

        assertThat(template.events()).extracting(Event::kind)
                .doesNotContain(EventKind.SUB, EventKind.EXPR);
        assertThat(template.filters()).isEmpty();
        assertThat(List.copyOf(template.events())).hasSize(5);
    }
}
