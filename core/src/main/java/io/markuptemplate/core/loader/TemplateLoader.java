package io.markuptemplate.core.loader;

import io.markuptemplate.core.engine.Template;
import io.markuptemplate.core.engine.TemplateCompiler;
import io.markuptemplate.core.error.TemplateNotFoundException;
import io.markuptemplate.core.filter.IncludeFilter;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads templates by name from a list of directories and caches the compiled result.
 *
 * <p>Names are resolved against each search path directory in order; the first existing file
 * wins. With auto-reload enabled, a cached template is recompiled when its file's modification
 * time changes. Every template compiled by the loader handles {@code xi:include} elements by
 * loading the referenced name through the same loader.
 *
 * <p>Thread-safe. Two threads missing the cache for the same name concurrently may both compile
 * it; the last one to finish is cached.
 */
public final class TemplateLoader {

    private static final Logger LOG = LoggerFactory.getLogger(TemplateLoader.class);

    private record CachedTemplate(Template template, Path file, FileTime modified) {}

    private final List<Path> searchPath;
    private final boolean autoReload;
    private final TemplateCompiler compiler;
    private final Map<String, CachedTemplate> cache = new ConcurrentHashMap<>();

    public TemplateLoader(List<Path> searchPath, boolean autoReload, TemplateCompiler compiler) {
        this.searchPath = List.copyOf(searchPath);
        this.autoReload = autoReload;
        this.compiler = compiler.withPreFilter(new IncludeFilter(this));
    }

    public List<Path> searchPath() {
        return searchPath;
    }

    public boolean autoReload() {
        return autoReload;
    }

    /**
     * Returns the compiled template for {@code name}, from the cache when possible.
     *
     * @throws TemplateNotFoundException if no search path directory contains the file
     * @throws UncheckedIOException if the file exists but cannot be read
     */
    public Template load(String name) {
        String key = Path.of(name).normalize().toString();
        CachedTemplate cached = cache.get(key);
        if (cached != null && (!autoReload || !isModified(cached))) {
            return cached.template();
        }
        for (Path directory : searchPath) {
            Path file = directory.resolve(key);
            if (Files.isRegularFile(file)) {
                CachedTemplate loaded = compile(file);
                cache.put(key, loaded);
                if (cached == null) {
                    LOG.info("Loaded template: name={}, path={}", key, file);
                } else {
                    LOG.info("Reloaded template: name={}, path={}", key, file);
                }
                return loaded.template();
            }
        }
        throw new TemplateNotFoundException(name, searchPath);
    }

    /** Compiles a template from a string, with includes resolved through this loader. Not cached. */
    public Template compile(String source) {
        return compiler.compile(source);
    }

    /** Number of cached templates. */
    public int cacheSize() {
        return cache.size();
    }

    public void clear() {
        cache.clear();
        LOG.debug("Template cache cleared");
    }

    // Compiled under the resolved path so that error positions name the search path directory.
    private CachedTemplate compile(Path file) {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            FileTime modified = Files.getLastModifiedTime(file);
            return new CachedTemplate(compiler.compile(reader, file.toString()), file, modified);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read template " + file, e);
        }
    }

    private static boolean isModified(CachedTemplate cached) {
        try {
            return !Files.exists(cached.file())
                    || !Files.getLastModifiedTime(cached.file()).equals(cached.modified());
        } catch (IOException e) {
            LOG.warn("Cannot check modification time of {}: {}", cached.file(), e.getMessage());
            return true;
        }
    }
}
