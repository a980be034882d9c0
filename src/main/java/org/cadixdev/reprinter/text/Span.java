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
 * A half-open range {@code [lower, upper)} of source text. A span whose bounds
 * are equal covers no characters and denotes an insertion point.
 */
public record Span(Position lower, Position upper) implements Comparable<Span> {

    private static final Comparator<Span> COMPARATOR = Comparator
            .comparing(Span::lower)
            .thenComparing(Span::upper);

    public Span {
        Objects.requireNonNull(lower, "lower");
        Objects.requireNonNull(upper, "upper");
        if (upper.isBefore(lower)) {
            throw new IllegalArgumentException("Span: upper bound " + upper + " is before lower bound " + lower);
        }
    }

    public static Span of(int lowerLine, int lowerColumn, int upperLine, int upperColumn) {
        return new Span(Position.of(lowerLine, lowerColumn), Position.of(upperLine, upperColumn));
    }

    /**
     * Creates a zero-width span at the given position.
     */
    public static Span at(Position position) {
        return new Span(position, position);
    }

    public boolean isEmpty() {
        return this.lower.equals(this.upper);
    }

    public boolean contains(Position position) {
        return !position.isBefore(this.lower) && position.isBefore(this.upper);
    }

    /**
     * Checks whether the spans intersect. Spans that only share a bound do not
     * overlap, and neither do two empty spans.
     */
    public boolean overlaps(Span other) {
        return this.lower.isBefore(other.upper) && other.lower.isBefore(this.upper);
    }

    @Override
    public int compareTo(Span other) {
        return COMPARATOR.compare(this, other);
    }

    @Override
    public String toString() {
        return "[" + this.lower + ", " + this.upper + ")";
    }

}
