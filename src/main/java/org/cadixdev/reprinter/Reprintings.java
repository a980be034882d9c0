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

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Building blocks for {@link Reprinting reprintings}.
 */
public final class Reprintings {

    private Reprintings() {
    }

    /**
     * Gets a reprinting that leaves every node unchanged. Passes only
     * interested in some node types fall back to it for all others.
     */
    public static <N> Reprinting<N> catchAll() {
        return node -> Optional.empty();
    }

    /**
     * Creates a reprinting for nodes of type {@code T} that track their own
     * changes. Nodes of any other type are left unchanged, and the renderer
     * is only invoked for nodes that report a change.
     *
     * @param type The node type to handle
     * @param renderer The renderer producing the text of changed nodes
     * @param <N> The node type of the tree
     * @param <T> The handled node type
     * @return The reprinting
     */
    public static <N, T extends Refactorable> Reprinting<N> generate(Class<T> type, Renderer<? super T> renderer) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(renderer, "renderer");
        return node -> {
            if (!type.isInstance(node)) {
                return Optional.empty();
            }
            T refactorable = type.cast(node);
            Optional<RefactorType> refactorType = refactorable.getRefactorType();
            if (refactorType.isEmpty()) {
                return Optional.empty();
            }
            String output = renderer.render(refactorable);
            return Optional.of(new Directive(refactorType.get(), output, refactorable.getSpan()));
        };
    }

    /**
     * Creates a reprinting from separate capabilities, for node types that
     * cannot implement {@link Refactorable} themselves.
     *
     * @param isRefactored Gets the kind of change of a node, if any
     * @param span Gets the span of a node
     * @param renderer The renderer producing the text of changed nodes
     * @param <N> The node type
     * @return The reprinting
     */
    public static <N> Reprinting<N> generate(
            Function<? super N, Optional<RefactorType>> isRefactored,
            Function<? super N, Span> span,
            Renderer<? super N> renderer
    ) {
        Objects.requireNonNull(isRefactored, "isRefactored");
        Objects.requireNonNull(span, "span");
        Objects.requireNonNull(renderer, "renderer");
        return node -> {
            Optional<RefactorType> refactorType = isRefactored.apply(node);
            if (refactorType.isEmpty()) {
                return Optional.empty();
            }
            String output = renderer.render(node);
            return Optional.of(new Directive(refactorType.get(), output, span.apply(node)));
        };
    }

}
