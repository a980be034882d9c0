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

import org.cadixdev.reprinter.Reprinter;
import org.cadixdev.reprinter.Reprinting;
import org.eclipse.jdt.core.JavaCore;
import org.eclipse.jdt.core.dom.AST;
import org.eclipse.jdt.core.dom.ASTNode;
import org.eclipse.jdt.core.dom.ASTParser;
import org.eclipse.jdt.core.dom.CompilationUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Rewrites Java source files with {@link SourceRewriter rewriters}, keeping the
 * formatting and comments of everything they do not touch.
 */
public class JdtReprinter {

    private static final Logger logger = LoggerFactory.getLogger(JdtReprinter.class);

    private final List<SourceRewriter> rewriters = new ArrayList<>();
    private final Reprinter reprinter = new Reprinter();

    private String sourceCompatibility = JavaCore.VERSION_17;

    public List<SourceRewriter> getRewriters() {
        return this.rewriters;
    }

    public Reprinter getReprinter() {
        return this.reprinter;
    }

    public String getSourceCompatibility() {
        return this.sourceCompatibility;
    }

    public void setSourceCompatibility(String sourceCompatibility) {
        this.sourceCompatibility = Objects.requireNonNull(sourceCompatibility, "sourceCompatibility");
    }

    public CompilationUnit parse(String source) {
        ASTParser parser = ASTParser.newParser(AST.JLS17);
        parser.setKind(ASTParser.K_COMPILATION_UNIT);

        Map<String, String> options = JavaCore.getOptions();
        JavaCore.setComplianceOptions(this.sourceCompatibility, options);
        parser.setCompilerOptions(options);

        parser.setSource(source.toCharArray());
        return (CompilationUnit) parser.createAST(null);
    }

    /**
     * Reprints a compilation unit.
     *
     * @param compilationUnit The compilation unit
     * @param source The source it was parsed from
     * @param query The query deciding which nodes changed
     * @return The new source
     * @throws Exception Anything thrown by the query
     */
    public String reprint(CompilationUnit compilationUnit, String source, Reprinting<? super ASTNode> query) throws Exception {
        return this.reprinter.reprint(query, JdtTree.INSTANCE, compilationUnit, source);
    }

    /**
     * Runs every registered rewriter on the source, in order. Each rewriter
     * works on a fresh parse of the previous rewriter's output, so the nodes
     * one rewriter marks never hide the marks of another.
     *
     * @param source The Java source
     * @return The rewritten source
     * @throws Exception Anything thrown by a rewriter
     */
    public String rewrite(String source) throws Exception {
        String result = source;
        for (SourceRewriter rewriter : this.rewriters) {
            result = rewrite(result, rewriter);
        }
        return result;
    }

    /**
     * Runs one rewriter on the source.
     *
     * @param source The Java source
     * @param rewriter The rewriter
     * @return The rewritten source
     * @throws Exception Anything thrown by the rewriter
     */
    public String rewrite(String source, SourceRewriter rewriter) throws Exception {
        CompilationUnit compilationUnit = parse(source);
        RewriteContext context = new RewriteContext(compilationUnit, source);
        rewriter.rewrite(context);

        logger.debug("{} marked {} nodes", rewriter.getClass().getSimpleName(), context.getEdits().size());
        return reprint(compilationUnit, source, context.getEdits().toReprinting());
    }

}
