package io.markuptemplate.core.directive;

import static io.markuptemplate.core.testkit.TestTemplates.NS;
import static io.markuptemplate.core.testkit.TestTemplates.div;
import static io.markuptemplate.core.testkit.TestTemplates.render;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.markuptemplate.core.error.TemplateRuntimeException;
import io.markuptemplate.core.error.TemplateSyntaxException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("match directive")
class MatchDirectiveTest {

    @Nested
    @DisplayName("replacement")
    class Replacement {

        @Test
        void replacesMatchedElementWithBody() {
            String source = div("<span py:match=\"div/greeting\" class=\"greeting\">Hello ${select('@name')}</span>"
                    + "<div><greeting name=\"Dude\"/></div>");

            assertThat(render(source)).isEqualTo("<div><div><span class=\"greeting\">Hello Dude</span></div></div>");
        }

        @Test
        void unmatchedElementsPassThrough() {
            String source = div("<b py:match=\"div/greeting\">x</b><p><greeting/></p>");

            assertThat(render(source)).isEqualTo("<div><p><greeting/></p></div>");
        }

        @Test
        void everyOccurrenceIsReplaced() {
            String source = div("<em py:match=\"item\">${select('text()')}</em><item>a</item><item>b</item>");

            assertThat(render(source)).isEqualTo("<div><em>a</em><em>b</em></div>");
        }

        @Test
        void firstRegisteredMatchWins() {
            String source = div("<b py:match=\"greeting\">first</b><i py:match=\"greeting\">second</i><greeting/>");

            assertThat(render(source)).isEqualTo("<div><b>first</b></div>");
        }

        @Test
        void bodyIsNotMatchedAgainByItsOwnTemplate() {
            String source = div("<greeting py:match=\"greeting\" class=\"x\">${select('text()')}</greeting>"
                    + "<greeting>hi</greeting>");

            assertThat(render(source)).isEqualTo("<div><greeting class=\"x\">hi</greeting></div>");
        }

        @Test
        void otherMatchTemplatesApplyInsideBody() {
            String source = div("<b py:match=\"inner\">B</b>"
                    + "<section py:match=\"outer\"><inner/></section>"
                    + "<outer/>");

            assertThat(render(source)).isEqualTo("<div><section><b>B</b></section></div>");
        }

        @Test
        void bodyEvaluatesAgainstCallerContext() {
            String source = div("<p py:match=\"note\">$prefix: ${select('text()')}</p><note>read me</note>");

            assertThat(render(source, Map.of("prefix", "NB"))).isEqualTo("<div><p>NB: read me</p></div>");
        }

        @Test
        void matchesElementsProducedByLoops() {
            String source = div("<b py:match=\"item\">[${select('@n')}]</b><item py:for=\"i in items\" n=\"$i\"/>");

            assertThat(render(source, Map.of("items", List.of(1, 2)))).isEqualTo("<div><b>[1]</b><b>[2]</b></div>");
        }
    }

    @Nested
    @DisplayName("ancestry across directive elements")
    class Ancestry {

        private String body(String content) {
            return "<body " + NS + ">" + content + "</body>";
        }

        @Test
        void parentOutsideDirectiveElementIsSeen() {
            String source = body("<span py:match=\"div/p\">M</span><div><p py:if=\"True\">x</p></div>");

            assertThat(render(source)).isEqualTo("<body><div><span>M</span></div></body>");
        }

        @Test
        void childOfDirectiveElementSeesFullPath() {
            String source = body("<span py:match=\"body/div/p\">M</span><div py:if=\"True\"><p>x</p></div>");

            assertThat(render(source)).isEqualTo("<body><div><span>M</span></div></body>");
        }

        @Test
        void absolutePatternMatchesLoopItems() {
            String source = body("<li py:match=\"/body/ul/li\">#${select('@n')}</li>"
                    + "<ul><li py:for=\"i in items\" n=\"$i\"/></ul>");

            assertThat(render(source, Map.of("items", List.of(1, 2))))
                    .isEqualTo("<body><ul><li>#1</li><li>#2</li></ul></body>");
        }

        @Test
        void wrongParentStillDoesNotMatch() {
            String source = body("<span py:match=\"section/p\">M</span><div><p py:if=\"True\">x</p></div>");

            assertThat(render(source)).isEqualTo("<body><div><p>x</p></div></body>");
        }
    }

    @Nested
    @DisplayName("select()")
    class Select {

        @Test
        void selectsChildElements() {
            String source = div("<section py:match=\"box\" class=\"box\">${select('*')}</section>"
                    + "<box><b>x</b>ignored</box>");

            assertThat(render(source)).isEqualTo("<div><section class=\"box\"><b>x</b></section></div>");
        }

        @Test
        void selectedChildrenKeepTheirDirectives() {
            String source = div("<p py:match=\"greeting\">${select('*')}</p>"
                    + "<greeting><b py:if=\"show\">x</b><i py:if=\"not show\">y</i></greeting>");

            assertThat(render(source, Map.of("show", true))).isEqualTo("<div><p><b>x</b></p></div>");
        }

        @Test
        void missingAttributeSelectsNothing() {
            String source = div("<p py:match=\"greeting\">[${select('@missing')}]</p><greeting/>");

            assertThat(render(source)).isEqualTo("<div><p>[]</p></div>");
        }

        @Test
        void invalidPathFailsAtGenerate() {
            String source = div("<p py:match=\"greeting\">${select('a[')}</p><greeting/>");

            assertThatThrownBy(() -> render(source))
                    .isInstanceOf(TemplateRuntimeException.class)
                    .hasMessageContaining("Invalid path");
        }
    }

    @Test
    void attributePatternIsRejected() {
        assertThatThrownBy(() -> render(div("<p py:match=\"greeting/@name\">x</p>")))
                .isInstanceOf(TemplateSyntaxException.class)
                .hasMessageContaining("must select elements");
    }
}
