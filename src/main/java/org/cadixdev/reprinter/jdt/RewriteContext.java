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

import org.eclipse.jdt.core.dom.ASTNode;
import org.eclipse.jdt.core.dom.AbstractTypeDeclaration;
import org.eclipse.jdt.core.dom.CompilationUnit;
import org.eclipse.jdt.core.dom.PackageDeclaration;

import java.util.Objects;

/**
 * The state shared by the {@link SourceRewriter rewriters} of one source file.
 */
public final class RewriteContext {

    private final CompilationUnit compilationUnit;
    private final String source;
    private final JdtSpans spans;
    private final JdtEdits edits;

    public RewriteContext(CompilationUnit compilationUnit, String source) {
        this.compilationUnit = Objects.requireNonNull(compilationUnit, "compilationUnit");
        this.source = Objects.requireNonNull(source, "source");
        this.spans = new JdtSpans(compilationUnit, source);
        this.edits = new JdtEdits(this.spans);
    }

    public CompilationUnit getCompilationUnit() {
        return this.compilationUnit;
    }

    public String getSource() {
        return this.source;
    }

    public JdtSpans getSpans() {
        return this.spans;
    }

    public JdtEdits getEdits() {
        return this.edits;
    }

    /**
     * Gets the package of the compilation unit, e.g. {@code com.example}, or an
     * empty string for the default package.
     */
    public String getPackageName() {
        PackageDeclaration declaration = this.compilationUnit.getPackage();
        return declaration == null ? "" : declaration.getName().getFullyQualifiedName();
    }

    /**
     * Gets the binary name of a type declared in this compilation unit, e.g.
     * {@code com.example.Outer$Inner}.
     *
     * @param type The type declaration
     * @return The binary name
     */
    public String getBinaryName(AbstractTypeDeclaration type) {
        StringBuilder name = new StringBuilder(type.getName().getIdentifier());

        ASTNode parent = type.getParent();
        while (parent instanceof AbstractTypeDeclaration) {
            name.insert(0, ((AbstractTypeDeclaration) parent).getName().getIdentifier() + '$');
            parent = parent.getParent();
        }

        String packageName = getPackageName();
        return packageName.isEmpty() ? name.toString() : packageName + '.' + name;
    }

    /**
     * Gets the whitespace preceding the node on its line, or an empty string if
     * there is other text before it.
     */
    public String getIndentation(ASTNode node) {
        int start = node.getStartPosition();
        int lineStart = this.source.lastIndexOf('\n', start - 1) + 1;
        String prefix = this.source.substring(lineStart, start);
        return prefix.isBlank() ? prefix : "";
    }

}
