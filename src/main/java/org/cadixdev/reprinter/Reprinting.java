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

import java.util.Objects;
import java.util.Optional;

/**
 * Decides, for one node of a tree, whether and how its source text changes.
 *
 * @param <N> The node type
 */
@FunctionalInterface
public interface Reprinting<N> {

    /**
     * Queries a node for a change.
     *
     * @param node The node
     * @return The directive for the node, or empty if the node is unchanged
     * @throws Exception If the change could not be determined or rendered
     */
    Optional<Directive> query(N node) throws Exception;

    /**
     * Composes this pass with another one. The other pass is only queried for
     * nodes this pass leaves unchanged.
     *
     * @param other The pass to fall back to
     * @return The composed pass
     */
    default Reprinting<N> orElse(Reprinting<? super N> other) {
        Objects.requireNonNull(other, "other");
        return node -> {
            Optional<Directive> directive = this.query(node);
            return directive.isPresent() ? directive : other.query(node);
        };
    }

}
