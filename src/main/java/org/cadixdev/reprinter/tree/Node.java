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
 * A tree node that exposes its own children.
 *
 * @param <N> The node type of the whole tree
 */
public interface Node<N extends Node<N>> {

    /**
     * Gets the adapter for trees made of nodes.
     */
    static <N extends Node<N>> TreeAdapter<N> adapter() {
        return Node::getChildren;
    }

    List<? extends N> getChildren();

}
