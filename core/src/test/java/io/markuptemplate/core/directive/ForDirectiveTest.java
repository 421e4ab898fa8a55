package io.markuptemplate.core.directive;

import static io.markuptemplate.core.testkit.TestTemplates.NS;
import static io.markuptemplate.core.testkit.TestTemplates.div;
import static io.markuptemplate.core.testkit.TestTemplates.render;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.markuptemplate.core.error.TemplateRuntimeException;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("for directive")
class ForDirectiveTest {

    private static final String LIST = "<ul " + NS + "><li py:for=\"i in items\">$i</li></ul>";

    @Test
    void repeatsElementPerItem() {
        assertThat(render(LIST, Map.of("items", List.of(1, 2, 3)))).isEqualTo("<ul><li>1</li><li>2</li><li>3</li></ul>");
    }

    @Test
    void emptyIterableProducesNothing() {
        assertThat(render(LIST, Map.of("items", List.of()))).isEqualTo("<ul/>");
    }

    @Test
    void noneIterableProducesNothing() {
        Map<String, Object> data = new HashMap<>();
        data.put("items", null);

        assertThat(render(LIST, data)).isEqualTo("<ul/>");
    }

    @Test
    void destructuresSequences() {
        String source = div("<i py:for=\"k, v in pairs\">$k=$v</i>");

        assertThat(render(source, Map.of("pairs", List.of(List.of("a", 1), List.of("b", 2)))))
                .isEqualTo("<div><i>a=1</i><i>b=2</i></div>");
    }

    @Test
    void destructuresMapItems() {
        Map<String, Object> prices = new LinkedHashMap<>();
        prices.put("tea", 3);
        prices.put("cake", 5);

        assertThat(render(div("<i py:for=\"(name, price) in prices.items()\">$name:$price</i>"), Map.of("prices", prices)))
                .isEqualTo("<div><i>tea:3</i><i>cake:5</i></div>");
    }

    @Test
    void nestedLoopsSeeOuterVariables() {
        String source = div("<p py:for=\"row in rows\"><b py:for=\"col in cols\">$row$col</b></p>");

        assertThat(render(source, Map.of("rows", List.of("a", "b"), "cols", List.of(1, 2))))
                .isEqualTo("<div><p><b>a1</b><b>a2</b></p><p><b>b1</b><b>b2</b></p></div>");
    }

    @Test
    void loopVariableShadowsOuterBindingOnlyInsideLoop() {
        String source = div("<b py:for=\"x in items\">$x</b><i>$x</i>");

        assertThat(render(source, Map.of("items", List.of(1, 2), "x", "outer")))
                .isEqualTo("<div><b>1</b><b>2</b><i>outer</i></div>");
    }

    @Test
    void iteratesBuiltinRanges() {
        assertThat(render(div("<b py:for=\"i, c in enumerate(range(3), 1)\">$i$c</b>")))
                .isEqualTo("<div><b>10</b><b>21</b><b>32</b></div>");
    }

    @Test
    void nonIterableValueFailsAtGenerate() {
        assertThatThrownBy(() -> render(LIST, Map.of("items", 42)))
                .isInstanceOf(TemplateRuntimeException.class)
                .hasMessageContaining("not iterable");
    }

    @Test
    void wrongUnpackCountFails() {
        assertThatThrownBy(() -> render(div("<i py:for=\"a, b in items\">$a</i>"), Map.of("items", List.of(List.of(1, 2, 3)))))
                .isInstanceOf(TemplateRuntimeException.class)
                .hasMessageContaining("Expected 2 values");
    }
}
