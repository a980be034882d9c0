/*
 * Copyright (c) 2018 Cadix Development (https://www.cadixdev.org)
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Public License 2.0 which accompanies this distribution,
 * and is available at https://www.eclipse.org/legal/epl-2.0/
 *
 * SPDX-License-Identifier: EPL-2.0
 */

package org.cadixdev.reprinter.test;

import org.cadixdev.reprinter.AsyncReprinting;
import org.cadixdev.reprinter.Directive;
import org.cadixdev.reprinter.RefactorType;
import org.cadixdev.reprinter.ReprintException;
import org.cadixdev.reprinter.Reprinter;
import org.cadixdev.reprinter.Reprinting;
import org.cadixdev.reprinter.Reprintings;
import org.cadixdev.reprinter.splice.Splicer;
import org.cadixdev.reprinter.text.LineMap;
import org.cadixdev.reprinter.text.Position;
import org.cadixdev.reprinter.text.Span;
import org.cadixdev.reprinter.tree.Node;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.fail;

class ReprinterTests {

    private static final String SOURCE = "int x = 1;\nint y = 2;\n";

    private static final Reprinting<TestNode> MARKS = Reprintings.generate(TestNode.class, TestNode::getText);

    private final Reprinter reprinter = new Reprinter();

    private TestNode x;
    private TestNode first;
    private TestNode second;
    private TestNode root;

    @BeforeEach
    void setUp() {
        this.x = TestNode.leaf("x", Span.of(1, 5, 1, 6));
        this.first = TestNode.of("first", Span.of(1, 1, 1, 11), this.x, TestNode.leaf("one", Span.of(1, 9, 1, 10)));
        this.second = TestNode.of("second", Span.of(2, 1, 2, 11), TestNode.leaf("y", Span.of(2, 5, 2, 6)));
        this.root = TestNode.of("root", Span.of(1, 1, 3, 1), this.first, this.second);
    }

    private String reprint() throws Exception {
        return this.reprinter.reprint(MARKS, this.root, SOURCE);
    }

    @Test
    void unchangedTreeReprintsIdentically() throws Exception {
        assertEquals(SOURCE, reprint());
        assertEquals(SOURCE, this.reprinter.reprint(Reprintings.catchAll(), this.root, SOURCE));
    }

    @Test
    void replacesStatement() throws Exception {
        this.first.mark(RefactorType.REPLACE, "long x = 1L;");

        assertEquals("long x = 1L;\nint y = 2;\n", reprint());
    }

    @Test
    void insertsBeforeNode() throws Exception {
        this.second.mark(RefactorType.BEFORE, "// y\n");

        assertEquals("int x = 1;\n// y\nint y = 2;\n", reprint());
    }

    @Test
    void insertsAfterNode() throws Exception {
        this.first.mark(RefactorType.AFTER, " // x");

        assertEquals("int x = 1; // x\nint y = 2;\n", reprint());
    }

    @Test
    void appliesSeveralChanges() throws Exception {
        this.x.mark(RefactorType.REPLACE, "count");
        this.second.getChildren().get(0).mark(RefactorType.AFTER, "Prime");
        this.second.mark(RefactorType.BEFORE, "final ");

        // second hides the change of its child y
        assertEquals("int count = 1;\nfinal int y = 2;\n", reprint());
    }

    @Test
    void replacesAcrossLines() throws Exception {
        TestNode node = TestNode.leaf("tail", Span.of(1, 9, 2, 10)).mark(RefactorType.REPLACE, "3");

        assertEquals("int x = 3;\n", this.reprinter.reprint(MARKS, node, SOURCE));
    }

    @ParameterizedTest
    @EnumSource(RefactorType.class)
    void zeroWidthSpansOnlyInsert(RefactorType type) throws Exception {
        TestNode node = TestNode.leaf("gap", Span.at(Position.of(2, 1))).mark(type, "int z = 3;\n");

        assertEquals("int x = 1;\nint z = 3;\nint y = 2;\n", this.reprinter.reprint(MARKS, node, SOURCE));
    }

    @Test
    void emptySourceNeverQueriesTheTree() throws Exception {
        Reprinting<TestNode> query = node -> fail("queried " + node);

        assertEquals("", this.reprinter.reprint(query, this.root, ""));
        assertEquals("", this.reprinter.reprintAsync(AsyncReprinting.of(query), Node.adapter(), this.root, "")
                .toCompletableFuture().get());
    }

    @Test
    void discoveryOrderDoesNotMatter() throws Exception {
        // children listed right to left, so directives are discovered out of source order
        TestNode reversed = TestNode.of("root", Span.of(1, 1, 3, 1), this.second, this.first);
        this.first.mark(RefactorType.REPLACE, "long x = 1L;");
        this.second.mark(RefactorType.AFTER, " // y");

        String expected = "long x = 1L;\nint y = 2; // y\n";
        assertEquals(expected, this.reprinter.reprint(MARKS, reversed, SOURCE));
        assertEquals(expected, Splicer.splice(List.of(
                Directive.replace(this.first.getSpan(), "long x = 1L;"),
                Directive.after(this.second.getSpan(), " // y")
        ), SOURCE));
    }

    @Test
    void truncatesSpansPastTheEndByDefault() throws Exception {
        TestNode node = TestNode.leaf("tail", Span.of(1, 2, 5, 1)).mark(RefactorType.REPLACE, "X");

        assertEquals("aX", this.reprinter.reprint(MARKS, node, "abc"));
    }

    @Test
    void strictSpansRejectSpansPastTheEnd() {
        this.reprinter.setStrictSpans(true);
        TestNode node = TestNode.leaf("tail", Span.of(1, 2, 5, 1)).mark(RefactorType.REPLACE, "X");

        assertThrows(ReprintException.class, () -> this.reprinter.reprint(MARKS, node, "abc"));
    }

    @Test
    void strictSpansAcceptSpansEndingAtTheEnd() throws Exception {
        this.reprinter.setStrictSpans(true);
        TestNode node = TestNode.leaf("tail", Span.of(1, 2, 1, 4)).mark(RefactorType.REPLACE, "X");

        assertEquals("aX", this.reprinter.reprint(MARKS, node, "abc"));
    }

    @Test
    void strictSpansRejectOverlaps() {
        this.reprinter.setStrictSpans(true);
        TestNode left = TestNode.leaf("left", Span.of(1, 1, 1, 7)).mark(RefactorType.REPLACE, "L");
        TestNode inner = TestNode.leaf("inner", Span.of(1, 3, 1, 4)).mark(RefactorType.REPLACE, "I");
        TestNode right = TestNode.leaf("right", Span.of(1, 5, 1, 9)).mark(RefactorType.REPLACE, "R");

        assertThrows(ReprintException.class, () -> this.reprinter.reprint(MARKS,
                TestNode.of("root", Span.of(1, 1, 3, 1), left, right), SOURCE));
        assertThrows(ReprintException.class, () -> this.reprinter.reprint(MARKS,
                TestNode.of("root", Span.of(1, 1, 3, 1), left, inner, TestNode.leaf("end", Span.of(2, 1, 2, 2))
                        .mark(RefactorType.REPLACE, "E")), SOURCE));
    }

    @Test
    void strictSpansRejectColumnsPastTheEndOfTheirLine() {
        this.reprinter.setStrictSpans(true);
        TestNode node = TestNode.leaf("wide", Span.of(1, 5, 2, 2)).mark(RefactorType.REPLACE, "T");

        assertThrows(ReprintException.class, () -> this.reprinter.reprint(MARKS, node, "ab\ncd\nef\n"));
    }

    @Test
    void strictSpansAcceptColumnsJustPastTheLastCharacter() throws Exception {
        this.reprinter.setStrictSpans(true);
        TestNode node = TestNode.leaf("eol", Span.at(Position.of(1, 3))).mark(RefactorType.BEFORE, ";");

        assertEquals("ab;\ncd\n", this.reprinter.reprint(MARKS, node, "ab\ncd\n"));
    }

    @Test
    void countsSurrogatePairsAsOneColumn() throws Exception {
        // U+1F600 takes two chars but a single column
        String source = "\uD83D\uDE00x = 1;\n";
        TestNode node = TestNode.leaf("x", Span.of(1, 2, 1, 3)).mark(RefactorType.REPLACE, "y");

        assertEquals("\uD83D\uDE00y = 1;\n", this.reprinter.reprint(MARKS, node, source));
        assertEquals("\uD83D\uDE00y = 1;\n", Splicer.splice(List.of(Directive.replace(node.getSpan(), "y")), source));

        this.reprinter.setStrictSpans(true);
        TestNode end = TestNode.leaf("end", Span.at(Position.of(1, 8))).mark(RefactorType.BEFORE, " // smile");
        assertEquals("\uD83D\uDE00x = 1; // smile\n", this.reprinter.reprint(MARKS, end, source));
    }

    @Test
    void strictSpansAcceptAdjacentSpans() throws Exception {
        this.reprinter.setStrictSpans(true);
        this.first.mark(RefactorType.REPLACE, "a;");
        TestNode insertion = TestNode.leaf("gap", Span.at(Position.of(1, 11))).mark(RefactorType.BEFORE, " b;");

        assertEquals("a; b;\nint y = 2;\n", this.reprinter.reprint(MARKS,
                TestNode.of("root", Span.of(1, 1, 3, 1), this.first, insertion), SOURCE));
    }

    @Test
    void rendersOnlyChangedNodes() throws Exception {
        AtomicInteger rendered = new AtomicInteger();
        this.x.mark(RefactorType.REPLACE, "z");
        Reprinting<TestNode> query = Reprintings.generate(TestNode.class, node -> {
            rendered.incrementAndGet();
            return node.getText().toUpperCase();
        });

        assertEquals("int Z = 1;\nint y = 2;\n", this.reprinter.reprint(query, this.root, SOURCE));
        assertEquals(1, rendered.get());
    }

    @Test
    void generatesFromCapabilities() throws Exception {
        Reprinting<TestNode> query = Reprintings.generate(
                node -> node.getName().equals("y") ? Optional.of(RefactorType.REPLACE) : Optional.empty(),
                node -> node.getSpan(),
                node -> "why"
        );

        assertEquals("int x = 1;\nint why = 2;\n", this.reprinter.reprint(query, this.root, SOURCE));
    }

    @Test
    void composesIndependentPasses() throws Exception {
        Reprinting<TestNode> renameX = node -> node == this.x
                ? Optional.of(Directive.replace(this.x.getSpan(), "a"))
                : Optional.empty();
        Reprinting<TestNode> renameAll = node -> node.getChildren().isEmpty()
                ? Optional.of(Directive.replace(node.getSpan(), "b"))
                : Optional.empty();

        assertEquals("int a = b;\nint b = 2;\n",
                this.reprinter.reprint(renameX.orElse(renameAll), this.root, SOURCE));
        assertEquals(SOURCE,
                this.reprinter.reprint(Reprintings.<TestNode>catchAll().orElse(Reprintings.catchAll()), this.root, SOURCE));
    }

    @Test
    void propagatesRendererFailures() {
        this.x.mark(RefactorType.REPLACE, "z");
        IllegalStateException failure = new IllegalStateException("no renderer");
        Reprinting<TestNode> query = Reprintings.generate(TestNode.class, node -> {
            throw failure;
        });

        IllegalStateException thrown = assertThrows(IllegalStateException.class,
                () -> this.reprinter.reprint(query, this.root, SOURCE));
        assertSame(failure, thrown);
    }

    @Test
    void reprintsAsynchronously() throws Exception {
        this.first.mark(RefactorType.REPLACE, "long x = 1L;");

        String output = this.reprinter.reprintAsync(AsyncReprinting.of(MARKS), Node.adapter(), this.root, SOURCE)
                .toCompletableFuture()
                .get();

        assertEquals("long x = 1L;\nint y = 2;\n", output);
    }

    @ParameterizedTest
    @CsvSource({
            "1, 1, 1, 1",
            "1, 5, 1, 6",
            "1, 9, 2, 4",
            "2, 1, 3, 1",
            "1, 11, 2, 1",
            "3, 1, 3, 1",
    })
    void followsSpliceLaws(int lowerLine, int lowerColumn, int upperLine, int upperColumn) throws Exception {
        Span span = Span.of(lowerLine, lowerColumn, upperLine, upperColumn);
        LineMap lines = LineMap.of(SOURCE);
        String head = SOURCE.substring(0, lines.offset(span.lower()));
        String node = SOURCE.substring(lines.offset(span.lower()), lines.offset(span.upper()));
        String tail = SOURCE.substring(lines.offset(span.upper()));

        assertEquals(head + "T" + tail, spliceOne(RefactorType.REPLACE, span));
        assertEquals(head + "T" + node + tail, spliceOne(RefactorType.BEFORE, span));
        assertEquals(head + node + "T" + tail, spliceOne(RefactorType.AFTER, span));
    }

    private String spliceOne(RefactorType type, Span span) throws Exception {
        TestNode node = TestNode.leaf("node", span).mark(type, "T");
        return this.reprinter.reprint(MARKS, TestNode.of("root", Span.of(1, 1, 3, 1), node), SOURCE);
    }

}
