/*
 * Copyright (c) 2018 Cadix Development (https://www.cadixdev.org)
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Public License 2.0 which accompanies this distribution,
 * and is available at https://www.eclipse.org/legal/epl-2.0/
 *
 * SPDX-License-Identifier: EPL-2.0
 */

package org.cadixdev.reprinter.text;

import java.util.Arrays;
import java.util.Objects;

/**
 * Converts between character offsets and {@link Position positions} of one
 * source text.
 *
 * <p>Offsets are 0-based UTF-16 indices into the string, the first character
 * is at offset 0 and position (1, 1). Columns count code points, so a
 * surrogate pair takes up a single column. A newline belongs to the line it
 * terminates.</p>
 */
public final class LineMap {

    private final String source;
    private final int length;
    private final int[] lineStarts;

    private LineMap(String source, int[] lineStarts) {
        this.source = source;
        this.length = source.length();
        this.lineStarts = lineStarts;
    }

    public static LineMap of(String source) {
        Objects.requireNonNull(source, "source");

        int[] starts = new int[16];
        int count = 1;
        for (int i = 0; i < source.length(); i++) {
            if (source.charAt(i) == '\n') {
                if (count == starts.length) {
                    starts = Arrays.copyOf(starts, count * 2);
                }
                starts[count++] = i + 1;
            }
        }

        return new LineMap(source, Arrays.copyOf(starts, count));
    }

    public int getLineCount() {
        return this.lineStarts.length;
    }

    /**
     * Gets the position of the character at the given offset. The offset equal
     * to the length of the text is the position just past its end.
     *
     * @param offset The character offset
     * @return The position of that offset
     * @throws IndexOutOfBoundsException If the offset is negative or past the end
     */
    public Position position(int offset) {
        Objects.checkIndex(offset, this.length + 1);

        int line = Arrays.binarySearch(this.lineStarts, offset);
        if (line < 0) {
            line = -line - 2;
        }
        int start = this.lineStarts[line];
        return Position.of(line + 1, this.source.codePointCount(start, offset) + 1);
    }

    /**
     * Checks whether a position lies within the text: on one of its lines, at
     * most one column past the last character before the line's newline.
     *
     * @param position The position
     * @return {@code true} if the text can be sliced up to the position
     */
    public boolean contains(Position position) {
        int line = position.line().value() - 1;
        if (line >= this.lineStarts.length) {
            return false;
        }

        int start = this.lineStarts[line];
        int end = line + 1 < this.lineStarts.length ? this.lineStarts[line + 1] - 1 : this.length;
        return position.column().value() <= this.source.codePointCount(start, end) + 1;
    }

    /**
     * Gets the offset of a position. Columns past the end of their line map to
     * the start of the next line, the same place {@link TextSlicer} stops at.
     * Positions past the end of the text map to its length.
     *
     * @param position The position
     * @return The character offset
     */
    public int offset(Position position) {
        int line = position.line().value() - 1;
        if (line >= this.lineStarts.length) {
            return this.length;
        }

        int limit = line + 1 < this.lineStarts.length ? this.lineStarts[line + 1] : this.length;
        int offset = this.lineStarts[line];
        for (int column = 1; column < position.column().value() && offset < limit; column++) {
            offset += Character.charCount(this.source.codePointAt(offset));
        }
        return Math.min(offset, limit);
    }

    /**
     * Gets the span covering {@code length} characters starting at
     * {@code offset}.
     */
    public Span span(int offset, int length) {
        return new Span(position(offset), position(offset + length));
    }

}
