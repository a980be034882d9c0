/*
 * Copyright (c) 2018 Cadix Development (https://www.cadixdev.org)
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Public License 2.0 which accompanies this distribution,
 * and is available at https://www.eclipse.org/legal/epl-2.0/
 *
 * SPDX-License-Identifier: EPL-2.0
 */

package org.cadixdev.reprinter.text;

/**
 * The result of {@link TextSlicer#slice(Position, Position, SourceText)}.
 *
 * @param text The consumed text
 * @param position The position reached after consuming {@code text}
 * @param remaining The source left after {@code text}
 */
public record Slice(String text, Position position, SourceText remaining) {
}
