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

import org.cadixdev.reprinter.splice.SpanChecker;
import org.cadixdev.reprinter.splice.Splicer;
import org.cadixdev.reprinter.tree.Node;
import org.cadixdev.reprinter.tree.RefactorCollector;
import org.cadixdev.reprinter.tree.TreeAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Reprints a tree into source text, changing only the text of the nodes a
 * {@link Reprinting} reports as changed. Everything else in the original
 * source, whitespace and comments included, is kept as it is.
 *
 * <p>A reprint collects the directives of the tree, orders them by their
 * position in the source and splices them into the source in one pass.</p>
 */
public class Reprinter {

    private static final Logger logger = LoggerFactory.getLogger(Reprinter.class);

    private boolean strictSpans;

    /**
     * Gets whether directives are checked against each other and against the
     * source before they are applied.
     *
     * @return {@code true} if spans are checked
     */
    public boolean isStrictSpans() {
        return this.strictSpans;
    }

    /**
     * Sets whether directives are checked before they are applied. When
     * enabled, overlapping directives and directives reaching past the end of
     * the source fail the reprint with a {@link ReprintException}. When
     * disabled, the output for such directives is unspecified.
     *
     * @param strictSpans {@code true} to check spans
     */
    public void setStrictSpans(boolean strictSpans) {
        this.strictSpans = strictSpans;
    }

    /**
     * Reprints a tree.
     *
     * @param query The query deciding which nodes changed
     * @param tree The adapter giving the children of the tree's nodes
     * @param root The root of the tree
     * @param source The source text the tree was parsed from
     * @param <N> The node type
     * @return The new source text
     * @throws Exception Anything thrown by the query
     */
    public <N> String reprint(Reprinting<? super N> query, TreeAdapter<N> tree, N root, String source) throws Exception {
        Objects.requireNonNull(source, "source");
        if (source.isEmpty()) {
            return "";
        }

        List<Directive> directives = new RefactorCollector<>(tree).collect(query, root);
        return splice(directives, source);
    }

    /**
     * Reprints a tree of {@link Node nodes}.
     *
     * @see #reprint(Reprinting, TreeAdapter, Object, String)
     */
    public <N extends Node<N>> String reprint(Reprinting<? super N> query, N root, String source) throws Exception {
        return reprint(query, Node.<N>adapter(), root, source);
    }

    /**
     * Reprints a tree with a query answering asynchronously. Nodes are still
     * queried one after the other, in the same order as
     * {@link #reprint(Reprinting, TreeAdapter, Object, String)} does.
     *
     * @param query The query deciding which nodes changed
     * @param tree The adapter giving the children of the tree's nodes
     * @param root The root of the tree
     * @param source The source text the tree was parsed from
     * @param <N> The node type
     * @return The new source text, or the failure of the query
     */
    public <N> CompletionStage<String> reprintAsync(AsyncReprinting<? super N> query, TreeAdapter<N> tree, N root, String source) {
        Objects.requireNonNull(source, "source");
        if (source.isEmpty()) {
            return CompletableFuture.completedFuture("");
        }

        return new RefactorCollector<>(tree).collectAsync(query, root)
                .thenApply(directives -> splice(directives, source));
    }

    private String splice(List<Directive> collected, String source) {
        logger.debug("Collected {} directives", collected.size());

        List<Directive> directives = new ArrayList<>(collected);
        directives.sort(Directive.COMPARATOR);

        if (this.strictSpans) {
            SpanChecker.check(directives, source);
        }

        return Splicer.splice(directives, source);
    }

}
