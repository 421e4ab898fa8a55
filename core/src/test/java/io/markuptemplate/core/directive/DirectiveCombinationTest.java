package io.markuptemplate.core.directive;

import static io.markuptemplate.core.testkit.TestTemplates.NS;
import static io.markuptemplate.core.testkit.TestTemplates.div;
import static io.markuptemplate.core.testkit.TestTemplates.render;
import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Several directives on one element, applied in priority order regardless of attribute order. */
@DisplayName("directive combinations")
class DirectiveCombinationTest {

    @Test
    void ifOnLoopElementIsEvaluatedOnceOutsideTheLoop() {
        String source = "<ul " + NS + "><li py:if=\"i > 0\" py:for=\"i in items\">$i</li></ul>";

        assertThat(render(source, Map.of("items", List.of(1, 2, 3), "i", 0))).isEqualTo("<ul/>");
        assertThat(render(source, Map.of("items", List.of(1, 2), "i", 5))).isEqualTo("<ul><li>1</li><li>2</li></ul>");
    }

    @Test
    void contentIsEvaluatedPerIteration() {
        String source = div("<li py:content=\"i * 2\" py:for=\"i in items\">x</li>");

        assertThat(render(source, Map.of("items", List.of(1, 2)))).isEqualTo("<div><li>2</li><li>4</li></div>");
    }

    @Test
    void attrsOnLoopElementIsEvaluatedOnceBeforeTheLoop() {
        AtomicInteger calls = new AtomicInteger();
        Supplier<Integer> counter = calls::incrementAndGet;
        String source = div("<b py:for=\"i in items\" py:attrs=\"{'n': count()}\">$i</b>");

        assertThat(render(source, Map.of("items", List.of(1, 2, 3), "count", counter)))
                .isEqualTo("<div><b n=\"1\">1</b><b n=\"1\">2</b><b n=\"1\">3</b></div>");
        assertThat(calls).hasValue(1);
    }

    @Test
    void stripWithContentLeavesOnlyContent() {
        assertThat(render(div("<p py:strip=\"\" py:content=\"'x'\">y</p>"))).isEqualTo("<div>x</div>");
    }

    @Test
    void replaceInsideLoop() {
        String source = div("<br py:for=\"w in words\" py:replace=\"w + ' '\"/>");

        assertThat(render(source, Map.of("words", List.of("a", "b")))).isEqualTo("<div>a b </div>");
    }

    @Test
    void falseIfSuppressesEveryIteration() {
        String source = div("<b py:if=\"False\" py:for=\"i in items\">$i</b>");

        assertThat(render(source, Map.of("items", List.of(1, 2)))).isEqualTo("<div/>");
    }
}
