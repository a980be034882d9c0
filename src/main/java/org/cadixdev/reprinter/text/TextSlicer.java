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
 * Splits a source text at logical positions.
 */
public final class TextSlicer {

    private TextSlicer() {
    }

    /**
     * Consumes characters from {@code remaining}, whose first character sits at
     * {@code cursor}, for as long as the position is strictly before
     * {@code bound}.
     *
     * <p>A column is one code point: a surrogate pair is consumed as a whole
     * and advances the column once. If the source runs out before
     * {@code bound} is reached, the slice simply ends there.</p>
     *
     * @param cursor The position of the first remaining character
     * @param bound The position to stop at
     * @param remaining The source to consume from
     * @return The consumed text, the position reached and the rest of the source
     */
    public static Slice slice(Position cursor, Position bound, SourceText remaining) {
        Position position = cursor;
        int consumed = 0;
        int length = remaining.length();

        while (consumed < length && position.isBefore(bound)) {
            char c = remaining.charAt(consumed++);
            if (Character.isHighSurrogate(c) && consumed < length
                    && Character.isLowSurrogate(remaining.charAt(consumed))) {
                consumed++;
            }
            position = position.advance(c);
        }

        SourceText rest = remaining.drop(consumed);
        return new Slice(remaining.until(rest), position, rest);
    }

}
