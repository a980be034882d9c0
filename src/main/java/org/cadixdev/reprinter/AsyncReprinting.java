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

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * A {@link Reprinting} whose answers may arrive asynchronously, for queries
 * that have to wait on other work (a renderer backed by a service, for
 * example).
 *
 * @param <N> The node type
 */
@FunctionalInterface
public interface AsyncReprinting<N> {

    CompletionStage<Optional<Directive>> query(N node);

    /**
     * Lifts a synchronous query. Anything it throws completes the returned
     * stage exceptionally.
     */
    static <N> AsyncReprinting<N> of(Reprinting<N> reprinting) {
        Objects.requireNonNull(reprinting, "reprinting");
        return node -> {
            try {
                return CompletableFuture.completedFuture(reprinting.query(node));
            } catch (Exception e) {
                return CompletableFuture.failedFuture(e);
            }
        };
    }

}
