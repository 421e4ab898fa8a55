package io.markuptemplate.core.loader;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.markuptemplate.core.engine.Template;
import io.markuptemplate.core.engine.TemplateCompiler;
import io.markuptemplate.core.error.TemplateNotFoundException;
import io.markuptemplate.core.error.TemplateRuntimeException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

@DisplayName("TemplateLoader")
class TemplateLoaderTest {

    @TempDir
    Path root;

    private Path primary;
    private Path secondary;
    private ListAppender<ILoggingEvent> logAppender;
    private Logger loaderLogger;

    @BeforeEach
    void setUp() throws IOException {
        primary = Files.createDirectory(root.resolve("primary"));
        secondary = Files.createDirectory(root.resolve("secondary"));

        loaderLogger = (Logger) LoggerFactory.getLogger(TemplateLoader.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        loaderLogger.addAppender(logAppender);
    }

    @AfterEach
    void tearDown() {
        loaderLogger.detachAppender(logAppender);
        logAppender.stop();
    }

    private TemplateLoader loader(boolean autoReload) {
        return new TemplateLoader(List.of(primary, secondary), autoReload, TemplateCompiler.defaults());
    }

    private List<String> infoMessages() {
        return logAppender.list.stream()
                .filter(e -> e.getLevel() == Level.INFO)
                .map(ILoggingEvent::getFormattedMessage)
                .toList();
    }

    @Nested
    @DisplayName("resolution")
    class Resolution {

        @Test
        void firstDirectoryOnSearchPathWins() throws IOException {
            Files.writeString(primary.resolve("page.html"), "<p>primary</p>");
            Files.writeString(secondary.resolve("page.html"), "<p>secondary</p>");

            Template template = loader(false).load("page.html");

            assertThat(template.generate(Map.of()).render()).isEqualTo("<p>primary</p>");
            assertThat(template.filename()).isEqualTo(primary.resolve("page.html").toString());
        }

        @Test
        void errorPositionsNameResolvedFile() throws IOException {
            Files.writeString(secondary.resolve("broken.html"), "<div>\n<p>${missing()}</p>\n</div>");

            Template template = loader(false).load("broken.html");

            assertThatThrownBy(() -> template.generate(Map.of()).render())
                    .isInstanceOf(TemplateRuntimeException.class)
                    .satisfies(e -> {
                        TemplateRuntimeException error = (TemplateRuntimeException) e;
                        assertThat(error.filename()).isEqualTo(secondary.resolve("broken.html").toString());
                        assertThat(error.line()).isEqualTo(2);
                    });
        }

        @Test
        void laterDirectoriesAreSearched() throws IOException {
            Files.createDirectories(secondary.resolve("parts"));
            Files.writeString(secondary.resolve("parts/footer.html"), "<footer/>");

            assertThat(loader(false).load("parts/footer.html").generate(Map.of()).render()).isEqualTo("<footer/>");
        }

        @Test
        void missingTemplateReportsSearchPath() {
            assertThatThrownBy(() -> loader(false).load("nope.html"))
                    .isInstanceOf(TemplateNotFoundException.class)
                    .satisfies(e -> {
                        TemplateNotFoundException error = (TemplateNotFoundException) e;
                        assertThat(error.name()).isEqualTo("nope.html");
                        assertThat(error.searchPath()).containsExactly(primary, secondary);
                    });
        }

        @Test
        void loadIsLoggedAtInfo() throws IOException {
            Files.writeString(primary.resolve("page.html"), "<p/>");

            loader(false).load("page.html");

            assertThat(infoMessages()).hasSize(1);
            assertThat(infoMessages().get(0)).contains("Loaded template: name=page.html");
        }
    }

    @Nested
    @DisplayName("cache")
    class Cache {

        @Test
        void repeatedLoadsReturnCachedTemplate() throws IOException {
            Files.writeString(primary.resolve("page.html"), "<p/>");
            TemplateLoader loader = loader(false);

            Template first = loader.load("page.html");
            Template second = loader.load("./page.html");

            assertThat(second).isSameAs(first);
            assertThat(loader.cacheSize()).isEqualTo(1);
        }

        @Test
        void changesAreIgnoredWithoutAutoReload() throws IOException {
            Path file = Files.writeString(primary.resolve("page.html"), "<p>v1</p>");
            TemplateLoader loader = loader(false);
            loader.load("page.html");

            Files.writeString(file, "<p>v2</p>");
            Files.setLastModifiedTime(file, FileTime.from(Instant.now().plusSeconds(60)));

            assertThat(loader.load("page.html").generate(Map.of()).render()).isEqualTo("<p>v1</p>");
        }

        @Test
        void modifiedFileIsRecompiledWithAutoReload() throws IOException {
            Path file = Files.writeString(primary.resolve("page.html"), "<p>v1</p>");
            TemplateLoader loader = loader(true);
            Template first = loader.load("page.html");

            Files.writeString(file, "<p>v2</p>");
            Files.setLastModifiedTime(file, FileTime.from(Instant.now().plusSeconds(60)));
            Template second = loader.load("page.html");

            assertThat(second).isNotSameAs(first);
            assertThat(second.generate(Map.of()).render()).isEqualTo("<p>v2</p>");
            assertThat(infoMessages()).anyMatch(m -> m.startsWith("Reloaded template: name=page.html"));
        }

        @Test
        void clearEmptiesCache() throws IOException {
            Files.writeString(primary.resolve("page.html"), "<p/>");
            TemplateLoader loader = loader(false);
            loader.load("page.html");

            loader.clear();

            assertThat(loader.cacheSize()).isZero();
        }
    }
}
