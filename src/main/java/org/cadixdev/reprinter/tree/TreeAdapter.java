/*
 * Copyright (c) 2018 Cadix Development (https://www.cadixdev.org)
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Public License 2.0 which accompanies this distribution,
 * and is available at https://www.eclipse.org/legal/epl-2.0/
 *
 * SPDX-License-Identifier: EPL-2.0
 */

package org.cadixdev.reprinter.tree;

import java.util.List;

/**
 * Gives access to the ordered children of the nodes of a tree.
 *
 * @param <N> The node type
 */
@FunctionalInterface
public interface TreeAdapter<N> {

    /**
     * Gets the children of a node, in source order.
     *
     * @param node The node
     * @return The children, empty for a leaf
     */
    List<? extends N> children(N node);

}
