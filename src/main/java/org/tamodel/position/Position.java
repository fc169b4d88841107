package org.tamodel.position;

/**
 * A range in the model source, as handed to the document by the parser.
 * Offsets are absolute character positions; the {@link PositionTable} maps them
 * back to lines and files.
 *
 * @param start The first offset of the range.
 * @param end   The offset just after the range.
 * @param path  The XML path or file the range belongs to, may be empty.
 */
public record Position(int start, int end, String path) {

    /** Position used for entities that do not originate from source text. */
    public static final Position UNKNOWN = new Position(-1, -1, "");

    public Position {
        if (path == null) path = "";
    }

    /**
     * Creates a position without a path.
     * @param start The first offset.
     * @param end The offset after the range.
     * @return The position.
     */
    public static Position of(int start, int end) {
        return new Position(start, end, "");
    }

    public boolean isKnown() {
        return start >= 0;
    }

    @Override
    public String toString() {
        if (!isKnown()) return "?";
        return path.isEmpty() ? start + "-" + end : path + ":" + start + "-" + end;
    }
}
