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

import java.util.Optional;

/**
 * A node that knows whether it has been changed, and which text it came from.
 */
public interface Refactorable {

    Optional<RefactorType> getRefactorType();

    Span getSpan();

}
