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

/**
 * Produces the new text for a changed node.
 *
 * @param <T> The node type
 */
@FunctionalInterface
public interface Renderer<T> {

    String render(T node) throws Exception;

}
