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

/**
 * A line within a source text. Lines start at 1.
 */
public record Line(int value) implements Comparable<Line> {

    public static final Line INITIAL = new Line(1);

    public Line {
        if (value < 1) {
            throw new IllegalArgumentException("Line.of: called with: " + value + ". Minimum is 1.");
        }
    }

    public static Line of(int value) {
        return new Line(value);
    }

    public Line next() {
        return new Line(this.value + 1);
    }

    @Override
    public int compareTo(Line other) {
        return Integer.compare(this.value, other.value);
    }

    @Override
    public String toString() {
        return String.valueOf(this.value);
    }

}
