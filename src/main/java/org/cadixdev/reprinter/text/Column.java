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
 * A column within a line of source text. Columns start at 1.
 */
public record Column(int value) implements Comparable<Column> {

    public static final Column INITIAL = new Column(1);

    public Column {
        if (value < 1) {
            throw new IllegalArgumentException("Column.of: called with: " + value + ". Minimum is 1.");
        }
    }

    public static Column of(int value) {
        return new Column(value);
    }

    public Column next() {
        return new Column(this.value + 1);
    }

    @Override
    public int compareTo(Column other) {
        return Integer.compare(this.value, other.value);
    }

    @Override
    public String toString() {
        return String.valueOf(this.value);
    }

}
