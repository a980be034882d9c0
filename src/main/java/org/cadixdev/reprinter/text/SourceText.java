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

import java.util.Objects;

/**
 * The not yet consumed remainder of a source text. Instances are immutable,
 * consuming characters yields a new view over the same string.
 */
public final class SourceText {

    private final String source;
    private final int offset;

    private SourceText(String source, int offset) {
        this.source = source;
        this.offset = offset;
    }

    public static SourceText of(String source) {
        return new SourceText(Objects.requireNonNull(source, "source"), 0);
    }

    public boolean isEmpty() {
        return this.offset >= this.source.length();
    }

    char charAt(int index) {
        return this.source.charAt(this.offset + index);
    }

    /**
     * Gets the offset of the first remaining character within the whole source.
     */
    public int offset() {
        return this.offset;
    }

    public int length() {
        return this.source.length() - this.offset;
    }

    SourceText drop(int count) {
        return new SourceText(this.source, Math.min(this.offset + count, this.source.length()));
    }

    /**
     * Gets the text between this view and a later view of the same source.
     */
    String until(SourceText later) {
        return this.source.substring(this.offset, later.offset);
    }

    @Override
    public String toString() {
        return this.source.substring(this.offset);
    }

}
