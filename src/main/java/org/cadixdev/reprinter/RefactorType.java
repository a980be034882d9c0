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
 * How a {@link Directive} alters the text of its node.
 */
public enum RefactorType {

    /**
     * Inserts text immediately before the node's original text.
     */
    BEFORE,

    /**
     * Inserts text immediately after the node's original text.
     */
    AFTER,

    /**
     * Replaces the node's original text.
     */
    REPLACE,

}
