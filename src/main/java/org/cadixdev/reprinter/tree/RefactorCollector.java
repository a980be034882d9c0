/*
 * Copyright (c) 2018 Cadix Development (https://www.cadixdev.org)
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Public License 2.0 which accompanies this distribution,
 * and is available at https://www.eclipse.org/legal/epl-2.0/
 *
 * SPDX-License-Identifier: EPL-2.0
 */

package org.cadixdev.reprinter.tree;

import org.cadixdev.reprinter.AsyncReprinting;
import org.cadixdev.reprinter.Directive;
import org.cadixdev.reprinter.Reprinting;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Walks a tree depth-first in pre-order, querying every node for a
 * {@link Directive}.
 *
 * <p>Once a node yields a directive its children are not visited: the
 * directive owns the whole text of the node. The walk keeps an explicit stack
 * of sibling iterators, so the depth of the tree is not limited by the call
 * stack.</p>
 *
 * @param <N> The node type
 */
public final class RefactorCollector<N> {

    private final TreeAdapter<N> tree;

    public RefactorCollector(TreeAdapter<N> tree) {
        this.tree = Objects.requireNonNull(tree, "tree");
    }

    /**
     * Collects the directives of a tree, in the order they were discovered.
     *
     * @param query The query to run on every visited node
     * @param root The root of the tree
     * @return The directives, in discovery order
     * @throws Exception Anything thrown by the query
     */
    public List<Directive> collect(Reprinting<? super N> query, N root) throws Exception {
        Objects.requireNonNull(query, "query");
        Walk walk = new Walk(root);

        while (walk.hasNext()) {
            N node = walk.next();
            walk.accept(node, query.query(node));
        }

        return walk.directives;
    }

    /**
     * Collects the directives of a tree with a query answering asynchronously.
     * The answer for a node is awaited before the next node is queried, so
     * the query observes the nodes in the same order as with
     * {@link #collect(Reprinting, Object)}.
     *
     * <p>The returned stage fails with the cause of the first failed answer,
     * no further nodes are queried after that.</p>
     *
     * @param query The query to run on every visited node
     * @param root The root of the tree
     * @return The directives, in discovery order
     */
    public CompletionStage<List<Directive>> collectAsync(AsyncReprinting<? super N> query, N root) {
        Objects.requireNonNull(query, "query");
        return new AsyncWalk(query, new Walk(root)).run();
    }

    private final class Walk {

        private final Deque<Iterator<? extends N>> stack = new ArrayDeque<>();
        private final List<Directive> directives = new ArrayList<>();

        Walk(N root) {
            this.stack.push(Collections.singletonList(Objects.requireNonNull(root, "root")).iterator());
        }

        boolean hasNext() {
            while (!this.stack.isEmpty()) {
                if (this.stack.peek().hasNext()) {
                    return true;
                }
                this.stack.pop();
            }
            return false;
        }

        N next() {
            return this.stack.peek().next();
        }

        void accept(N node, Optional<Directive> directive) {
            if (directive.isPresent()) {
                this.directives.add(directive.get());
                return;
            }

            List<? extends N> children = tree.children(node);
            if (!children.isEmpty()) {
                this.stack.push(children.iterator());
            }
        }

    }

    private final class AsyncWalk {

        private final AsyncReprinting<? super N> query;
        private final Walk walk;

        AsyncWalk(AsyncReprinting<? super N> query, Walk walk) {
            this.query = query;
            this.walk = walk;
        }

        CompletableFuture<List<Directive>> run() {
            // Answers that are already there are consumed in place, only
            // pending ones continue the walk in a callback
            while (this.walk.hasNext()) {
                N node = this.walk.next();

                CompletableFuture<Optional<Directive>> answer;
                try {
                    answer = this.query.query(node).toCompletableFuture();
                } catch (RuntimeException e) {
                    return CompletableFuture.failedFuture(e);
                }

                if (!answer.isDone() || answer.isCompletedExceptionally()) {
                    return answer.thenCompose(directive -> {
                        this.walk.accept(node, directive);
                        return run();
                    });
                }
                this.walk.accept(node, answer.join());
            }

            return CompletableFuture.completedFuture(this.walk.directives);
        }

    }

}
