/*
 * Copyright (c) 2018 Cadix Development (https://www.cadixdev.org)
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Public License 2.0 which accompanies this distribution,
 * and is available at https://www.eclipse.org/legal/epl-2.0/
 *
 * SPDX-License-Identifier: EPL-2.0
 */

package org.cadixdev.reprinter.jdt.refactor;

import org.cadixdev.reprinter.jdt.RewriteContext;
import org.cadixdev.reprinter.jdt.SourceRewriter;

import java.util.Map;
import java.util.Objects;

/**
 * Renames identifiers by name, without resolving bindings: every simple name
 * matching a key of the renames is replaced by its value.
 */
public final class IdentifierRenamer implements SourceRewriter {

    public static SourceRewriter create(Map<String, String> renames) {
        return new IdentifierRenamer(renames, true);
    }

    public static SourceRewriter create(Map<String, String> renames, boolean javadoc) {
        return new IdentifierRenamer(renames, javadoc);
    }

    private final Map<String, String> renames;
    private final boolean javadoc;

    private IdentifierRenamer(Map<String, String> renames, boolean javadoc) {
        this.renames = Map.copyOf(Objects.requireNonNull(renames, "renames"));
        this.javadoc = javadoc;
    }

    @Override
    public void rewrite(RewriteContext context) {
        context.getCompilationUnit().accept(new RenamerVisitor(context, this.javadoc, this.renames));
    }

}
