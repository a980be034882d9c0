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
 * Thrown when the directives of a reprint do not fit the source text they were
 * collected for.
 */
public class ReprintException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ReprintException(String message) {
        super(message);
    }

}
