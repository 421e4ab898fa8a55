package io.markuptemplate.core.directive;

import io.markuptemplate.core.spi.DirectiveFactory;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps directive attribute names to factories and priorities. The built-in directives take the
 * priorities of {@link DirectiveKind}; custom directives registered later rank after all of them,
 * in registration order. Thread-safe.
 */
public final class DirectiveRegistry {

    /** A registered directive. Lower priority values are applied outermost. */
    public record Registration(String name, int priority, DirectiveFactory factory) {}

    private final Map<String, Registration> registrations = new ConcurrentHashMap<>();

    private DirectiveRegistry() {}

    /** Returns a registry holding the built-in directives. */
    public static DirectiveRegistry builtIns() {
        DirectiveRegistry registry = new DirectiveRegistry();
        for (DirectiveKind kind : DirectiveKind.values()) {
            registry.register(kind.localName(), kind.factory());
        }
        return registry;
    }

    /**
     * Registers a custom directive with a priority below every directive registered so far.
     *
     * @throws IllegalArgumentException if the name is empty or already registered
     */
    public synchronized void register(String name, DirectiveFactory factory) {
        Objects.requireNonNull(factory, "factory must not be null");
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("directive name must not be null or empty");
        }
        if (registrations.containsKey(name)) {
            throw new IllegalArgumentException("Directive already registered: '" + name + "'");
        }
        registrations.put(name, new Registration(name, registrations.size(), factory));
    }

    public Optional<Registration> lookup(String name) {
        return Optional.ofNullable(registrations.get(name));
    }

    /** Registered names in priority order. */
    public List<String> names() {
        return registrations.values().stream()
                .sorted((a, b) -> Integer.compare(a.priority(), b.priority()))
                .map(Registration::name)
                .toList();
    }

    public int size() {
        return registrations.size();
    }
}
