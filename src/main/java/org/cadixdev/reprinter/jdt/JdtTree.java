/*
 * Copyright (c) 2018 Cadix Development (https://www.cadixdev.org)
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Public License 2.0 which accompanies this distribution,
 * and is available at https://www.eclipse.org/legal/epl-2.0/
 *
 * SPDX-License-Identifier: EPL-2.0
 */

package org.cadixdev.reprinter.jdt;

import org.cadixdev.reprinter.tree.TreeAdapter;
import org.eclipse.jdt.core.dom.ASTNode;
import org.eclipse.jdt.core.dom.StructuralPropertyDescriptor;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Exposes the children of JDT {@link ASTNode nodes}: the values of their child
 * and child list properties, in source order.
 */
public final class JdtTree implements TreeAdapter<ASTNode> {

    public static final JdtTree INSTANCE = new JdtTree();

    private JdtTree() {
    }

    @Override
    public List<ASTNode> children(ASTNode node) {
        List<ASTNode> children = new ArrayList<>();

        @SuppressWarnings("unchecked")
        List<StructuralPropertyDescriptor> properties = node.structuralPropertiesForType();
        for (StructuralPropertyDescriptor property : properties) {
            if (property.isChildProperty()) {
                ASTNode child = (ASTNode) node.getStructuralProperty(property);
                if (child != null) {
                    children.add(child);
                }
            } else if (property.isChildListProperty()) {
                @SuppressWarnings("unchecked")
                List<ASTNode> list = (List<ASTNode>) node.getStructuralProperty(property);
                children.addAll(list);
            }
        }

        // properties are declared in grammar order, which is not always source order
        children.sort(Comparator.comparingInt(ASTNode::getStartPosition));
        return children;
    }

}
