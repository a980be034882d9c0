/*
 * Copyright (c) 2018 Cadix Development (https://www.cadixdev.org)
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Public License 2.0 which accompanies this distribution,
 * and is available at https://www.eclipse.org/legal/epl-2.0/
 *
 * SPDX-License-Identifier: EPL-2.0
 */

package org.cadixdev.reprinter;

import org.cadixdev.reprinter.text.Span;

import java.util.Comparator;
import java.util.Objects;

/**
 * An instruction describing how the source text covered by one node is altered
 * in the output.
 *
 * @param type The kind of change
 * @param text The text to insert, or the replacement text
 * @param span The span of the node's original text
 */
public record Directive(RefactorType type, String text, Span span) {

    /**
     * Orders directives by their span, lower bound first.
     */
    public static final Comparator<Directive> COMPARATOR = Comparator.comparing(Directive::span);

    public Directive {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(span, "span");
    }

    public static Directive replace(Span span, String text) {
        return new Directive(RefactorType.REPLACE, text, span);
    }

    public static Directive before(Span span, String text) {
        return new Directive(RefactorType.BEFORE, text, span);
    }

    public static Directive after(Span span, String text) {
        return new Directive(RefactorType.AFTER, text, span);
    }

}
