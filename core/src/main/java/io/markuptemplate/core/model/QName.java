package io.markuptemplate.core.model;

import java.util.Objects;

/**
 * Qualified name of an element or attribute. Two names are equal when namespace URI and local name
 * match; the prefix only matters for serialization.
 *
 * @param namespace the namespace URI, empty for no namespace
 * @param localName the local part of the name
 * @param prefix    the prefix used in the source, empty for none
 */
public record QName(String namespace, String localName, String prefix) {

    public QName {
        namespace = namespace != null ? namespace : "";
        prefix = prefix != null ? prefix : "";
        Objects.requireNonNull(localName, "localName must not be null");
    }

    /** Creates an un-namespaced name. */
    public static QName of(String localName) {
        return new QName("", localName, "");
    }

    /** Returns the name as written in markup, e.g. {@code xi:include}. */
    public String qualifiedName() {
        return prefix.isEmpty() ? localName : prefix + ":" + localName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof QName other)) {
            return false;
        }
        return namespace.equals(other.namespace) && localName.equals(other.localName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(namespace, localName);
    }

    @Override
    public String toString() {
        return namespace.isEmpty() ? localName : "{" + namespace + "}" + localName;
    }
}
