package org.pragmatica.flatast;

import org.junit.jupiter.api.Test;
import org.pragmatica.flatast.error.FlatAstException;
import org.pragmatica.flatast.error.TreeError;
import org.pragmatica.flatast.grammar.Variant;
import org.pragmatica.flatast.render.OmissionPolicy;
import org.pragmatica.flatast.tree.Address;
import org.pragmatica.flatast.tree.Category;
import org.pragmatica.flatast.tree.FlatStore;
import org.pragmatica.flatast.tree.NodeTag;
import org.pragmatica.flatast.tree.TreeBuilder;

import java.io.IOException;
import java.io.UncheckedIOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.pragmatica.flatast.TestTrees.expr;
import static org.pragmatica.flatast.TestTrees.leaves;
import static org.pragmatica.flatast.TestTrees.tree;

class FlatAstTest {

    private static FlatStore nestedBrackets(int levels) {
        var builder = TreeBuilder.create();
        var cursor = builder.root(NodeTag.of(Variant.Expression.BRACKETS, 1));
        for (int i = 1; i < levels; i++) {
            cursor = cursor.node(NodeTag.of(Variant.Expression.BRACKETS, 1));
        }
        cursor.leaf("x");
        return builder.build();
    }

    private static FlatStore incompleteSum() {
        return tree(NodeTag.of(Variant.Expression.PLUS, 2), leaves("a"));
    }

    // === Rendering ===

    @Test
    void render_subtreeAtAddress() {
        var store = tree(NodeTag.of(Category.RETURN_STMT), expr(Variant.Expression.CALL, "f", "x"));

        assertEquals("return f(x)", FlatAst.render(store));
        assertEquals("f(x)", FlatAst.render(store, Address.child(Address.ROOT, 0)));
    }

    @Test
    void render_isDeterministic() {
        var store = tree(NodeTag.of(Variant.Expression.COMPOSED, 2),
                         expr(Variant.Expression.KEY_VALUE, "a", "1").andThen(expr(Variant.Expression.KEY_VALUE, "b", "2")));

        assertThat(FlatAst.render(store)).isEqualTo(FlatAst.render(store))
                                         .isEqualTo("{a: 1, b: 2}");
    }

    @Test
    void renderTo_writesIntoSuppliedSink() {
        var store = tree(NodeTag.of(Variant.Expression.INDEX, 2), leaves("a", "0"));
        var out = new StringBuilder("x := ");

        FlatAst.renderer().build().renderTo(store, Address.ROOT, out);

        assertThat(out).hasToString("x := a[0]");
    }

    @Test
    void renderTo_rethrowsSinkFailureUnchecked() {
        var store = tree(NodeTag.of(Variant.Branch.BREAK), cursor -> {});
        var failing = new Appendable() {
            @Override
            public Appendable append(CharSequence csq) throws IOException {
                throw new IOException("closed");
            }

            @Override
            public Appendable append(CharSequence csq, int start, int end) throws IOException {
                throw new IOException("closed");
            }

            @Override
            public Appendable append(char c) throws IOException {
                throw new IOException("closed");
            }
        };

        assertThatThrownBy(() -> FlatAst.renderer().build().renderTo(store, Address.ROOT, failing))
            .isInstanceOf(UncheckedIOException.class)
            .hasRootCauseMessage("closed");
    }

    // === Depth ceiling ===

    @Test
    void nestingWithinLimit_renders() {
        assertThat(FlatAst.render(nestedBrackets(10))).isEqualTo("((((((((((x))))))))))");
    }

    @Test
    void nestingBeyondLimit_failsWithTooDeeplyNested() {
        var renderer = FlatAst.renderer()
                              .maxDepth(5)
                              .build();

        var exception = assertThrows(FlatAstException.class, () -> renderer.render(nestedBrackets(10)));

        assertThat(exception.error()).isInstanceOf(TreeError.TooDeeplyNested.class);
        assertThat(((TreeError.TooDeeplyNested) exception.error()).limit()).isEqualTo(5);
        assertThat(exception).hasMessageContaining("too deeply nested");
    }

    @Test
    void defaultDepthLimit_stopsRunawayNesting() {
        assertThatThrownBy(() -> FlatAst.render(nestedBrackets(1000)))
            .isInstanceOf(FlatAstException.class)
            .hasMessageContaining("limit is 512");
    }

    @Test
    void invalidDepthLimit_isRejected() {
        assertThatThrownBy(() -> FlatAst.renderer().maxDepth(0).build())
            .isInstanceOf(IllegalArgumentException.class);
    }

    // === Omissions ===

    @Test
    void lenientPolicy_rendersNothingForMissingChild() {
        assertThat(FlatAst.render(incompleteSum())).isEqualTo("a + ");
    }

    @Test
    void strictPolicy_failsOnMissingChild() {
        var renderer = FlatAst.renderer()
                              .omissions(OmissionPolicy.STRICT)
                              .build();

        var exception = assertThrows(FlatAstException.class, () -> renderer.render(incompleteSum()));

        assertThat(exception.error()).isEqualTo(new TreeError.MissingChild(Address.ROOT, 1, "operand"));
        assertThat(exception).hasMessageStartingWith("Malformed node at 0x0");
    }

    @Test
    void strictPolicy_doesNotChangeWellFormedOutput() {
        var store = tree(NodeTag.of(Variant.TypeDef.ALIAS),
                         cursor -> cursor.leaf("Handler")
                                         .node(NodeTag.of(Category.ROOT_OF_TYPE),
                                               type -> type.node(NodeTag.of(Variant.Expression.MAP, 2), leaves("string", "func()"))));
        var strict = FlatAst.renderer()
                            .omissions(OmissionPolicy.STRICT)
                            .build();

        assertThat(strict.render(store)).isEqualTo(FlatAst.render(store))
                                        .isEqualTo("type Handler = map[string]func()");
    }

    @Test
    void strictPolicy_reportsMissingFunctionParameter() {
        var store = tree(NodeTag.of(Variant.Func.FUNCTION, 2),
                         cursor -> cursor.leaf("f")
                                         .node(NodeTag.of(Variant.TypedIdent.NORMAL), leaves("a").andThen(TestTrees.type("int")))
                                         .node(NodeTag.of(Variant.Block.PLAIN, 0)));
        var strict = FlatAst.renderer()
                            .omissions(OmissionPolicy.STRICT)
                            .build();

        assertThat(FlatAst.render(store)).isEqualTo("func f(a int) {\n}");
        assertThatThrownBy(() -> strict.render(store))
            .isInstanceOf(FlatAstException.class)
            .hasMessageContaining("parameter");
    }

    @Test
    void strictPolicy_emitsNothingBeforeReportingMissingParameter() {
        var store = tree(NodeTag.of(Variant.Func.FUNCTION, 2),
                         cursor -> cursor.leaf("f")
                                         .node(NodeTag.of(Variant.TypedIdent.NORMAL), leaves("a").andThen(TestTrees.type("int"))));
        var strict = FlatAst.renderer()
                            .omissions(OmissionPolicy.STRICT)
                            .build();
        var out = new StringBuilder();

        assertThatThrownBy(() -> strict.renderTo(store, Address.ROOT, out))
            .isInstanceOf(FlatAstException.class)
            .satisfies(e -> assertThat(((FlatAstException) e).error())
                .isEqualTo(new TreeError.MissingChild(Address.ROOT, 2, "parameter")));
        assertThat(out).isEmpty();
    }

    @Test
    void strictPolicy_emitsNothingBeforeReportingMissingName() {
        var store = tree(NodeTag.of(Variant.Label.GOTO), cursor -> {});
        var strict = FlatAst.renderer()
                            .omissions(OmissionPolicy.STRICT)
                            .build();
        var out = new StringBuilder();

        assertThatThrownBy(() -> strict.renderTo(store, Address.ROOT, out)).isInstanceOf(FlatAstException.class);
        assertThat(out).isEmpty();
    }

    // === Comments and dump ===

    @Test
    void classifyComments_sameTextDifferentPlacement() {
        var placement = FlatAst.classifyComments("x++ // c\n\n// c\n");

        assertThat(placement.commentAt(4)).isEqualTo(Variant.Comment.END_OF_LINE);
        assertThat(placement.commentAt(10)).isEqualTo(Variant.Comment.SEPARATE);
    }

    @Test
    void dump_delegatesToTreeDumper() {
        var store = tree(NodeTag.of(Category.RETURN_STMT), leaves("v"));

        assertThat(FlatAst.dump(store, Address.ROOT, 0)).isEqualTo(" [ReturnStmt 0 0]\n  [string v]\n  [-]\n [-]\n");
    }
}
