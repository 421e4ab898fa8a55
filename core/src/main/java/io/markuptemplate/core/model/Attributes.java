package io.markuptemplate.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Immutable, ordered collection of attributes of a START event. Mutators return new instances.
 * Lookups by plain string match the local name of un-namespaced attributes.
 */
public final class Attributes implements Iterable<Attribute> {

    public static final Attributes EMPTY = new Attributes(List.of());

    private final List<Attribute> attributes;

    public Attributes(List<Attribute> attributes) {
        this.attributes = Collections.unmodifiableList(new ArrayList<>(attributes));
    }

    public int size() {
        return attributes.size();
    }

    public boolean isEmpty() {
        return attributes.isEmpty();
    }

    public List<Attribute> asList() {
        return attributes;
    }

    @Override
    public Iterator<Attribute> iterator() {
        return attributes.iterator();
    }

    public Attribute find(QName name) {
        for (Attribute attribute : attributes) {
            if (attribute.name().equals(name)) {
                return attribute;
            }
        }
        return null;
    }

    /** Returns the literal text of the named attribute, or {@code null} if absent. */
    public String get(String name) {
        Attribute attribute = find(QName.of(name));
        return attribute != null ? attribute.text() : null;
    }

    public boolean contains(String name) {
        return find(QName.of(name)) != null;
    }

    /**
     * Returns a copy with the named attribute set to a literal value. An existing attribute keeps
     * its position in the list; a new one is appended.
     */
    public Attributes set(String name, String value, Position position) {
        QName qname = QName.of(name);
        Attribute replacement = Attribute.literal(qname, value, position);
        List<Attribute> copy = new ArrayList<>(attributes.size() + 1);
        boolean replaced = false;
        for (Attribute attribute : attributes) {
            if (!replaced && attribute.name().equals(qname)) {
                copy.add(replacement);
                replaced = true;
            } else {
                copy.add(attribute);
            }
        }
        if (!replaced) {
            copy.add(replacement);
        }
        return new Attributes(copy);
    }

    /** Returns a copy without the named attribute (or this instance if it is absent). */
    public Attributes remove(String name) {
        QName qname = QName.of(name);
        if (find(qname) == null) {
            return this;
        }
        List<Attribute> copy = new ArrayList<>(attributes);
        copy.removeIf(attribute -> attribute.name().equals(qname));
        return new Attributes(copy);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Attributes other && attributes.equals(other.attributes);
    }

    @Override
    public int hashCode() {
        return attributes.hashCode();
    }

    @Override
    public String toString() {
        return attributes.toString();
    }
}
