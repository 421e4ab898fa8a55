package io.markuptemplate.core.model;

/**
 * Source location of an event: the template file name plus line and column. Propagated verbatim
 * from the markup parser through every stage so that errors can be tracked back to the template
 * source.
 *
 * @param filename the template file name, {@code <string>} for templates compiled from a string
 * @param line     the 1-based line number, or -1 if unknown
 * @param column   the column number, or -1 if unknown
 */
public record Position(String filename, int line, int column) {

    /** Name used for templates that were not loaded from a file. */
    public static final String STRING_SOURCE = "<string>";

    /** Position for synthesized events that have no source location. */
    public static final Position UNKNOWN = new Position(STRING_SOURCE, -1, -1);

    public Position {
        filename = filename != null ? filename : STRING_SOURCE;
    }

    @Override
    public String toString() {
        return filename + ":" + line + ":" + column;
    }
}
