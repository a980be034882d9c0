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

import org.cadixdev.reprinter.RefactorType;
import org.cadixdev.reprinter.Reprinting;
import org.cadixdev.reprinter.Reprintings;
import org.eclipse.jdt.core.dom.ASTNode;

import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The changes marked on the nodes of one compilation unit. Marking a node
 * again replaces its previous mark.
 *
 * <p>A marked node owns its whole text, marks on nodes nested inside it are
 * never applied.</p>
 */
public final class JdtEdits {

    private final JdtSpans spans;
    private final Map<ASTNode, Mark> marks = new IdentityHashMap<>();

    public JdtEdits(JdtSpans spans) {
        this.spans = Objects.requireNonNull(spans, "spans");
    }

    public void replace(ASTNode node, String text) {
        mark(node, RefactorType.REPLACE, text);
    }

    /**
     * Replaces the node together with the comments attached to it, see
     * {@link JdtSpans#extendedSpan(ASTNode)}.
     */
    public void replaceExtended(ASTNode node, String text) {
        mark(node, new Mark(RefactorType.REPLACE, Objects.requireNonNull(text, "text"), true));
    }

    public void insertBefore(ASTNode node, String text) {
        mark(node, RefactorType.BEFORE, text);
    }

    public void insertAfter(ASTNode node, String text) {
        mark(node, RefactorType.AFTER, text);
    }

    public boolean isMarked(ASTNode node) {
        return this.marks.containsKey(node);
    }

    public int size() {
        return this.marks.size();
    }

    private void mark(ASTNode node, RefactorType type, String text) {
        mark(node, new Mark(type, Objects.requireNonNull(text, "text"), false));
    }

    private void mark(ASTNode node, Mark mark) {
        this.marks.put(Objects.requireNonNull(node, "node"), mark);
    }

    /**
     * Creates the reprinting applying the marked changes.
     */
    public Reprinting<ASTNode> toReprinting() {
        return Reprintings.generate(
                node -> Optional.ofNullable(this.marks.get(node)).map(Mark::type),
                node -> this.marks.get(node).extended() ? this.spans.extendedSpan(node) : this.spans.span(node),
                node -> this.marks.get(node).text()
        );
    }

    private record Mark(RefactorType type, String text, boolean extended) {
    }

}
