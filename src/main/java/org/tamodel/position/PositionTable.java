package org.tamodel.position;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Maps absolute source offsets to lines. The parser registers the start of every
 * line in increasing order; lookups find the line containing an offset.
 */
public class PositionTable {

    private final List<SourceLine> lines = new ArrayList<>();

    public PositionTable() {}

    /**
     * Creates a copy of another table.
     * @param other The table to copy.
     */
    public PositionTable(PositionTable other) {
        lines.addAll(other.lines);
    }

    /**
     * Registers the start of a line.
     *
     * @param position The absolute offset of the first character of the line.
     * @param offset   The offset relative to the enclosing document part.
     * @param line     The line number.
     * @param path     The file or XML path.
     * @throws IllegalArgumentException if {@code position} is smaller than the last registered one.
     */
    public void add(int position, int offset, int line, String path) {
        if (!lines.isEmpty() && lines.get(lines.size() - 1).position() > position) {
            throw new IllegalArgumentException("Positions must be added in increasing order: " + position);
        }
        lines.add(new SourceLine(position, offset, line, path));
    }

    /**
     * Finds the line containing the given absolute offset, i.e. the last registered
     * line whose start is not after {@code position}.
     *
     * @param position The absolute offset.
     * @return The line, or empty if the offset lies before the first registered line.
     */
    public Optional<SourceLine> find(int position) {
        int low = 0;
        int high = lines.size() - 1;
        int found = -1;
        while (low <= high) {
            int mid = (low + high) >>> 1;
            if (lines.get(mid).position() <= position) {
                found = mid;
                low = mid + 1;
            } else {
                high = mid - 1;
            }
        }
        return found < 0 ? Optional.empty() : Optional.of(lines.get(found));
    }

    public List<SourceLine> getLines() {
        return Collections.unmodifiableList(lines);
    }

    public int size() {
        return lines.size();
    }
}
