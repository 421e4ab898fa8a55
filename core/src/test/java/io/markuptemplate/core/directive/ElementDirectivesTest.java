package io.markuptemplate.core.directive;

import static io.markuptemplate.core.testkit.TestTemplates.NS;
import static io.markuptemplate.core.testkit.TestTemplates.div;
import static io.markuptemplate.core.testkit.TestTemplates.render;
import static org.assertj.core.api.Assertions.assertThat;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("element directives")
class ElementDirectivesTest {

    @Nested
    @DisplayName("if")
    class If {

        @Test
        void falseConditionRemovesElement() {
            assertThat(render(div("<p py:if=\"False\">x</p>"))).isEqualTo("<div/>");
        }

        @Test
        void truthyConditionKeepsElement() {
            assertThat(render(div("<p py:if=\"items\">x</p>"), Map.of("items", List.of(1)))).isEqualTo("<div><p>x</p></div>");
        }

        @Test
        void undefinedNameIsFalsy() {
            assertThat(render(div("<p py:if=\"nowhere\">x</p>"))).isEqualTo("<div/>");
        }
    }

    @Nested
    @DisplayName("content")
    class Content {

        @Test
        void replacesChildren() {
            assertThat(render("<p py:content=\"'new'\" " + NS + ">old <b>x</b></p>"))
                    .isEqualTo("<p>new</p>");
        }

        @Test
        void noneLeavesElementEmpty() {
            assertThat(render(div("<p py:content=\"None\">old</p>"))).isEqualTo("<div><p/></div>");
        }

        @Test
        void markupResultIsSpliced() {
            String source = div("<b py:def=\"bold(t)\">$t</b><p py:content=\"bold('x')\">old</p>");

            assertThat(render(source)).isEqualTo("<div><p><b>x</b></p></div>");
        }
    }

    @Nested
    @DisplayName("replace")
    class Replace {

        @Test
        void replacesWholeElement() {
            assertThat(render(div("<span py:replace=\"'gone'\">x</span>"))).isEqualTo("<div>gone</div>");
        }

        @Test
        void emptyValueRemovesElement() {
            assertThat(render(div("<span py:replace=\"\">x</span>"))).isEqualTo("<div/>");
        }

        @Test
        void valueIsEvaluatedAgainstContext() {
            assertThat(render(div("<span py:replace=\"title.toUpperCase()\">x</span>"), Map.of("title", "hi")))
                    .isEqualTo("<div>HI</div>");
        }
    }

    @Nested
    @DisplayName("attrs")
    class Attrs {

        @Test
        void noneValueRemovesAttributeAndOthersAreSet() {
            assertThat(render(div("<a href=\"x\" py:attrs=\"{'href': None, 'title': 'T'}\">l</a>")))
                    .isEqualTo("<div><a title=\"T\">l</a></div>");
        }

        @Test
        void existingAttributeIsOverwritten() {
            assertThat(render(div("<a class=\"old\" py:attrs=\"{'class': 'new'}\">l</a>")))
                    .isEqualTo("<div><a class=\"new\">l</a></div>");
        }

        @Test
        void valuesAreTrimmed() {
            assertThat(render(div("<a py:attrs=\"{'title': '  padded  '}\">l</a>")))
                    .isEqualTo("<div><a title=\"padded\">l</a></div>");
        }

        @Test
        void emptyOrNoneLeavesAttributesUnchanged() {
            assertThat(render(div("<a id=\"k\" py:attrs=\"{}\">l</a>"))).isEqualTo("<div><a id=\"k\">l</a></div>");
            assertThat(render(div("<a id=\"k\" py:attrs=\"None\">l</a>"))).isEqualTo("<div><a id=\"k\">l</a></div>");
        }

        @Test
        void acceptsSequenceOfPairs() {
            assertThat(render(div("<a py:attrs=\"[('id', 'x'), ('rel', 'next')]\">l</a>")))
                    .isEqualTo("<div><a id=\"x\" rel=\"next\">l</a></div>");
        }

        @Test
        void acceptsJavaMapFromContext() {
            Map<String, Object> attrs = new HashMap<>();
            attrs.put("data-id", 7);

            assertThat(render(div("<a py:attrs=\"extra\">l</a>"), Map.of("extra", attrs)))
                    .isEqualTo("<div><a data-id=\"7\">l</a></div>");
        }
    }

    @Nested
    @DisplayName("strip")
    class Strip {

        @Test
        void emptyValueAlwaysStrips() {
            assertThat(render(div("<span py:strip=\"\">text</span>"))).isEqualTo("<div>text</div>");
        }

        @Test
        void falseConditionKeepsTags() {
            assertThat(render(div("<span py:strip=\"False\">text</span>"))).isEqualTo("<div><span>text</span></div>");
        }

        @Test
        void keepsNestedChildren() {
            assertThat(render(div("<span py:strip=\"flag\"><b>a</b><i>b</i></span>"), Map.of("flag", true)))
                    .isEqualTo("<div><b>a</b><i>b</i></div>");
        }

        @Test
        void emptyElementStripsToNothing() {
            assertThat(render(div("<span py:strip=\"\"/>"))).isEqualTo("<div/>");
        }
    }
}
