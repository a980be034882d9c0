/*
 * Copyright (c) 2018 Cadix Development (https://www.cadixdev.org)
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Public License 2.0 which accompanies this distribution,
 * and is available at https://www.eclipse.org/legal/epl-2.0/
 *
 * SPDX-License-Identifier: EPL-2.0
 */

package org.cadixdev.reprinter.jdt;

import org.cadixdev.reprinter.text.LineMap;
import org.cadixdev.reprinter.text.Span;
import org.eclipse.jdt.core.dom.ASTNode;
import org.eclipse.jdt.core.dom.CompilationUnit;

import java.util.Objects;

/**
 * Computes the {@link Span spans} of the nodes of one compilation unit.
 */
public final class JdtSpans {

    private final CompilationUnit compilationUnit;
    private final LineMap lines;

    public JdtSpans(CompilationUnit compilationUnit, String source) {
        this.compilationUnit = Objects.requireNonNull(compilationUnit, "compilationUnit");
        this.lines = LineMap.of(source);
    }

    /**
     * Gets the span of the node's own text.
     */
    public Span span(ASTNode node) {
        return this.lines.span(node.getStartPosition(), node.getLength());
    }

    /**
     * Gets the span of the node's text including the comments and whitespace
     * the parser attributes to it.
     */
    public Span extendedSpan(ASTNode node) {
        return this.lines.span(
                this.compilationUnit.getExtendedStartPosition(node),
                this.compilationUnit.getExtendedLength(node)
        );
    }

}
