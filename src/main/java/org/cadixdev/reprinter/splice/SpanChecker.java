/*
 * Copyright (c) 2018 Cadix Development (https://www.cadixdev.org)
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Public License 2.0 which accompanies this distribution,
 * and is available at https://www.eclipse.org/legal/epl-2.0/
 *
 * SPDX-License-Identifier: EPL-2.0
 */

package org.cadixdev.reprinter.splice;

import org.cadixdev.reprinter.Directive;
import org.cadixdev.reprinter.ReprintException;
import org.cadixdev.reprinter.text.LineMap;
import org.cadixdev.reprinter.text.Position;

import java.util.List;

/**
 * Verifies that ordered directives can be spliced into a source text: no two
 * directives overlap and every bound lies within the text.
 */
public final class SpanChecker {

    private SpanChecker() {
    }

    /**
     * Checks the directives against the source.
     *
     * @param directives The directives, sorted by span
     * @param source The source text they were collected for
     * @throws ReprintException If two directives overlap, or a bound lies past
     *     the end of its line or of the source
     */
    public static void check(List<Directive> directives, String source) {
        LineMap lines = LineMap.of(source);
        Position end = lines.position(source.length());

        Directive previous = null;
        for (Directive directive : directives) {
            if (end.isBefore(directive.span().upper())) {
                throw new ReprintException("Directive " + directive + " ends past the end of the source at " + end);
            }
            checkBound(lines, directive, directive.span().lower());
            checkBound(lines, directive, directive.span().upper());

            if (previous != null && directive.span().lower().isBefore(previous.span().upper())) {
                throw new ReprintException("Directive " + directive + " overlaps " + previous);
            }

            previous = directive;
        }
    }

    private static void checkBound(LineMap lines, Directive directive, Position bound) {
        if (!lines.contains(bound)) {
            throw new ReprintException("Directive " + directive + " has bound " + bound + " past the end of its line");
        }
    }

}
