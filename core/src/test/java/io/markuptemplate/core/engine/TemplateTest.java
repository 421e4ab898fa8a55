package io.markuptemplate.core.engine;

import static io.markuptemplate.core.testkit.TestTemplates.compile;
import static io.markuptemplate.core.testkit.TestTemplates.div;
import static io.markuptemplate.core.testkit.TestTemplates.render;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.markuptemplate.core.error.ExpressionEvalException;
import io.markuptemplate.core.error.TemplateException;
import io.markuptemplate.core.error.TemplateRuntimeException;
import io.markuptemplate.core.model.Context;
import io.markuptemplate.core.model.MarkupStream;
import java.io.StringReader;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("Template")
class TemplateTest {

    @Nested
    @DisplayName("generation")
    class Generation {

        @Test
        void templateWithoutDirectivesRendersUnchanged() {
            String source = "<doc><a href=\"x\">t</a><!--c--><empty/></doc>";

            assertThat(render(source)).isEqualTo(source);
        }

        @Test
        void evaluatesTextAndAttributeExpressions() {
            String rendered = render("<p class=\"${kind}-box\">Hello $name</p>", Map.of("kind", "info", "name", "World"));

            assertThat(rendered).isEqualTo("<p class=\"info-box\">Hello World</p>");
        }

        @Test
        void nothingIsEvaluatedBeforeEventsArePulled() {
            AtomicInteger calls = new AtomicInteger();
            Supplier<String> probe = () -> "call " + calls.incrementAndGet();

            MarkupStream stream = compile("<p>${probe()}</p>").generate(Map.of("probe", probe));
            assertThat(calls).hasValue(0);

            assertThat(stream.render()).isEqualTo("<p>call 1</p>");
            assertThat(calls).hasValue(1);
        }

        @Test
        void sameTemplateGeneratesRepeatedly() {
            Template template = compile(div("<b py:for=\"i in items\">$i</b>"));

            assertThat(template.generate(Map.of("items", List.of(1, 2))).render()).isEqualTo("<div><b>1</b><b>2</b></div>");
            assertThat(template.generate(Map.of("items", List.of(3))).render()).isEqualTo("<div><b>3</b></div>");
        }

        @Test
        void deeplyNestedDirectivesDoNotExhaustStack() {
            int depth = 2000;
            String source = "<b py:strip=\"\">".repeat(depth) + "x" + "</b>".repeat(depth);

            assertThat(render(div(source))).isEqualTo("<div>x</div>");
        }
    }

    @Nested
    @DisplayName("context")
    class ContextHandling {

        @ParameterizedTest(name = "{0} items")
        @ValueSource(ints = {0, 1, 3})
        void contextDepthIsRestoredAfterFullGeneration(int count) {
            List<Integer> items = IntStream.rangeClosed(1, count).boxed().collect(Collectors.toList());
            Context context = new Context(Map.of("items", items));

            String rendered = compile(div("<i py:for=\"n in items\">$n</i>")).generate(context).render();

            String expected = items.stream().map(n -> "<i>" + n + "</i>").collect(Collectors.joining());
            assertThat(rendered).isEqualTo(expected.isEmpty() ? "<div/>" : "<div>" + expected + "</div>");
            assertThat(context.depth()).isEqualTo(1);
        }

        @Test
        void contextDepthIsRestoredWhenLoopingOverNone() {
            Map<String, Object> data = new HashMap<>();
            data.put("items", null);
            Context context = new Context(data);

            String rendered = compile(div("<i py:for=\"n in items\">$n</i>")).generate(context).render();

            assertThat(rendered).isEqualTo("<div/>");
            assertThat(context.depth()).isEqualTo(1);
        }

        @Test
        void functionAndMatchFramesAreReleased() {
            Context context = new Context(Map.of());
            String source = div("<p py:def=\"greet(name)\">Hi $name</p>${greet('Ann')}"
                    + "<b py:match=\"x\">[${select('@v')}]</b><x v=\"1\"/>");

            String rendered = compile(source).generate(context).render();

            assertThat(rendered).isEqualTo("<div><p>Hi Ann</p><b>[1]</b></div>");
            assertThat(context.depth()).isEqualTo(1);
        }

        @Test
        void closingStreamEarlyUnwindsPushedFrames() {
            Context context = new Context(Map.of("items", List.of(1, 2, 3)));
            MarkupStream stream = compile(div("<i py:for=\"n in items\">$n</i>")).generate(context);

            Iterator<?> events = stream.iterator();
            events.next();
            events.next();
            assertThat(context.depth()).isEqualTo(2);

            stream.close();
            assertThat(context.depth()).isEqualTo(1);
        }

        @Test
        void loopVariablesDoNotLeakIntoCallerContext() {
            Context context = new Context(Map.of("items", List.of("a")));

            compile(div("<i py:for=\"item in items\">$item</i>")).generate(context).render();

            assertThat(context.has("item")).isFalse();
        }
    }

    @Nested
    @DisplayName("error translation")
    class Errors {

        @Test
        void textExpressionFailureCarriesTemplatePosition() {
            Template template = TemplateCompiler.defaults()
                    .compile(new StringReader("<div>\n<p>${missing()}</p>\n</div>"), "page.html");

            assertThatThrownBy(() -> template.generate(Map.of()).render())
                    .isInstanceOf(TemplateRuntimeException.class)
                    .hasMessageContaining("missing")
                    .hasCauseInstanceOf(ExpressionEvalException.class)
                    .satisfies(e -> {
                        TemplateRuntimeException error = (TemplateRuntimeException) e;
                        assertThat(error.filename()).isEqualTo("page.html");
                        assertThat(error.line()).isEqualTo(2);
                        assertThat(error.phase()).isEqualTo(TemplateException.Phase.GENERATE);
                    });
        }

        @Test
        void directiveExpressionFailureIsTranslated() {
            Template template = compile(div("\n<p py:if=\"1 // 0\">x</p>"));

            assertThatThrownBy(() -> template.generate(Map.of()).render())
                    .isInstanceOf(TemplateRuntimeException.class)
                    .hasMessageContaining("Division by zero")
                    .satisfies(e -> assertThat(((TemplateRuntimeException) e).line()).isEqualTo(2));
        }

        @Test
        void exceptionFromUserCodeIsWrapped() {
            Supplier<String> failing = () -> {
                throw new IllegalStateException("boom");
            };

            assertThatThrownBy(() -> render("<p>${fail()}</p>", Map.of("fail", failing)))
                    .isInstanceOf(TemplateRuntimeException.class)
                    .hasMessageContaining("boom");
        }
    }
}
