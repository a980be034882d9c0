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

import java.util.Objects;

/**
 * Adds Javadoc from a {@link DocumentationTree} to the methods and fields that
 * have none yet.
 */
public class JavadocInserter implements SourceRewriter {

    private final DocumentationTree tree;

    public JavadocInserter(DocumentationTree tree) {
        this.tree = Objects.requireNonNull(tree, "tree");
    }

    @Override
    public void rewrite(RewriteContext context) {
        context.getCompilationUnit().accept(new JavadocVisitor(context, this.tree));
    }

}
