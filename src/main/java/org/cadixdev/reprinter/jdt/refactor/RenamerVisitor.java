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
import org.eclipse.jdt.core.dom.ASTVisitor;
import org.eclipse.jdt.core.dom.SimpleName;

import java.util.Map;

/**
 * Replaces the identifiers of simple names.
 */
class RenamerVisitor extends ASTVisitor {

    final RewriteContext context;
    final Map<String, String> renames;

    RenamerVisitor(RewriteContext context, boolean javadoc, Map<String, String> renames) {
        super(javadoc);
        this.context = context;
        this.renames = renames;
    }

    final void updateIdentifier(SimpleName node, String newName) {
        if (!node.getIdentifier().equals(newName) && !node.isVar()) {
            this.context.getEdits().replace(node, newName);
        }
    }

    @Override
    public final boolean visit(SimpleName node) {
        String newName = this.renames.get(node.getIdentifier());
        if (newName != null) {
            updateIdentifier(node, newName);
        }
        return false;
    }

}
