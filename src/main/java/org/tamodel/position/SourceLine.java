package org.tamodel.position;

/**
 * One entry of the {@link PositionTable}.
 *
 * @param position The absolute offset at which the line starts.
 * @param offset   The offset of the line within its own document part.
 * @param line     The line number within {@code path}.
 * @param path     The file or XML path of the line.
 */
public record SourceLine(int position, int offset, int line, String path) {}
