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
import org.cadixdev.reprinter.text.Position;
import org.cadixdev.reprinter.text.Slice;
import org.cadixdev.reprinter.text.SourceText;
import org.cadixdev.reprinter.text.Span;
import org.cadixdev.reprinter.text.TextSlicer;

import java.util.List;
import java.util.Objects;

/**
 * Applies ordered directives to the source text they were collected for, in a
 * single pass over the text.
 *
 * <p>Text outside of every directive's span is copied verbatim. Directives
 * must be sorted by span and must not overlap; neither is checked here, see
 * {@link SpanChecker} for that.</p>
 */
public final class Splicer {

    private Position cursor = Position.INITIAL;
    private SourceText remaining;
    private final StringBuilder output = new StringBuilder();

    private Splicer(String source) {
        this.remaining = SourceText.of(source);
    }

    /**
     * Splices the directives into the source.
     *
     * @param directives The directives, sorted by span
     * @param source The source text
     * @return The new source text
     */
    public static String splice(List<Directive> directives, String source) {
        Objects.requireNonNull(directives, "directives");
        Splicer splicer = new Splicer(Objects.requireNonNull(source, "source"));
        for (Directive directive : directives) {
            splicer.apply(directive);
        }
        return splicer.finish();
    }

    private void apply(Directive directive) {
        Span span = directive.span();

        switch (directive.type()) {
            case REPLACE: {
                Slice prefix = TextSlicer.slice(this.cursor, span.lower(), this.remaining);
                // the node's own text is dropped
                Slice node = TextSlicer.slice(span.lower(), span.upper(), prefix.remaining());
                this.output.append(prefix.text()).append(directive.text());
                this.remaining = node.remaining();
                break;
            }
            case BEFORE: {
                Slice prefix = TextSlicer.slice(this.cursor, span.lower(), this.remaining);
                Slice node = TextSlicer.slice(span.lower(), span.upper(), prefix.remaining());
                this.output.append(prefix.text()).append(directive.text()).append(node.text());
                this.remaining = node.remaining();
                break;
            }
            case AFTER: {
                Slice through = TextSlicer.slice(this.cursor, span.upper(), this.remaining);
                this.output.append(through.text()).append(directive.text());
                this.remaining = through.remaining();
                break;
            }
        }

        this.cursor = span.upper();
    }

    private String finish() {
        return this.output.append(this.remaining).toString();
    }

}
