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

import java.util.Comparator;
import java.util.Objects;

/**
 * A position in a source text, imagine a cursor sitting on a character.
 *
 * <p>Positions are ordered by line first, then by column. The only ways to move
 * a position forward are {@link #advanceLine()}, {@link #advanceColumn()} and
 * {@link #advance(char)}.</p>
 */
public record Position(Line line, Column column) implements Comparable<Position> {

    public static final Position INITIAL = new Position(Line.INITIAL, Column.INITIAL);

    private static final Comparator<Position> COMPARATOR = Comparator
            .comparing(Position::line)
            .thenComparing(Position::column);

    public Position {
        Objects.requireNonNull(line, "line");
        Objects.requireNonNull(column, "column");
    }

    /**
     * Creates a position from raw line and column numbers.
     *
     * @param line The line, starting at 1
     * @param column The column, starting at 1
     * @return The position
     * @throws IllegalArgumentException If either value is less than 1
     */
    public static Position of(int line, int column) {
        return new Position(Line.of(line), Column.of(column));
    }

    /**
     * Goes down a line, back to the initial column.
     */
    public Position advanceLine() {
        return new Position(this.line.next(), Column.INITIAL);
    }

    /**
     * Advances by one column on the same line.
     */
    public Position advanceColumn() {
        return new Position(this.line, this.column.next());
    }

    /**
     * Advances past the given character: a newline moves to the next line,
     * anything else to the next column.
     */
    public Position advance(char c) {
        return c == '\n' ? advanceLine() : advanceColumn();
    }

    public boolean isBefore(Position other) {
        return compareTo(other) < 0;
    }

    @Override
    public int compareTo(Position other) {
        return COMPARATOR.compare(this, other);
    }

    @Override
    public String toString() {
        return this.line + ":" + this.column;
    }

}
