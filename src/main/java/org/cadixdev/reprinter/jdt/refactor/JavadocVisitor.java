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
import org.eclipse.jdt.core.dom.AbstractTypeDeclaration;
import org.eclipse.jdt.core.dom.BodyDeclaration;
import org.eclipse.jdt.core.dom.FieldDeclaration;
import org.eclipse.jdt.core.dom.MethodDeclaration;
import org.eclipse.jdt.core.dom.SingleVariableDeclaration;
import org.eclipse.jdt.core.dom.VariableDeclarationFragment;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

class JavadocVisitor extends ASTVisitor {

    final RewriteContext context;
    final DocumentationTree tree;

    JavadocVisitor(RewriteContext context, DocumentationTree tree) {
        this.context = context;
        this.tree = tree;
    }

    final void insertJavadoc(BodyDeclaration node, List<String> lines) {
        if (node.getJavadoc() != null || lines.isEmpty()) {
            return;
        }

        String indent = this.context.getIndentation(node);
        StringBuilder text = new StringBuilder("/**\n");
        for (String line : lines) {
            text.append(indent).append(" *");
            if (!line.isEmpty()) {
                text.append(' ').append(line);
            }
            text.append('\n');
        }
        text.append(indent).append(" */\n").append(indent);

        this.context.getEdits().insertBefore(node, text.toString());
    }

    @Override
    public boolean visit(FieldDeclaration node) {
        if (!(node.getParent() instanceof AbstractTypeDeclaration)) {
            return false;
        }

        String owner = this.context.getBinaryName((AbstractTypeDeclaration) node.getParent());

        @SuppressWarnings("unchecked")
        List<VariableDeclarationFragment> fragments = node.fragments();
        for (VariableDeclarationFragment fragment : fragments) {
            DocumentationTree.Field field = this.tree.getField(owner, fragment.getName().getIdentifier());
            if (field != null && field.javadoc().isPresent()) {
                insertJavadoc(node, field.javadoc().get().lines());
                break;
            }
        }
        return false;
    }

    @Override
    public boolean visit(MethodDeclaration node) {
        if (!(node.getParent() instanceof AbstractTypeDeclaration)) {
            // anonymous classes
            return false;
        }

        String owner = this.context.getBinaryName((AbstractTypeDeclaration) node.getParent());
        DocumentationTree.Method method = this.tree.getMethod(owner, node.getName().getIdentifier());
        if (method == null) return false;

        List<String> lines = new ArrayList<>(method.javadoc().map(DocumentationTree.Javadoc::lines).orElseGet(List::of));

        List<String> params = paramTags(node, method.parameters());
        if (!params.isEmpty()) {
            if (!lines.isEmpty()) {
                lines.add("");
            }
            lines.addAll(params);
        }

        insertJavadoc(node, lines);
        return false;
    }

    private static List<String> paramTags(MethodDeclaration node, Map<Integer, DocumentationTree.Parameter> parameters) {
        List<String> tags = new ArrayList<>();

        @SuppressWarnings("unchecked")
        List<SingleVariableDeclaration> declared = node.parameters();
        for (int i = 0; i < declared.size(); i++) {
            DocumentationTree.Parameter parameter = parameters.get(i);
            if (parameter == null || parameter.javadoc().isEmpty()) {
                continue;
            }
            String doc = String.join(" ", parameter.javadoc().get().lines());
            tags.add("@param " + declared.get(i).getName().getIdentifier() + " " + doc);
        }

        return tags;
    }

}
