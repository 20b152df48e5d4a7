package org.pragmatica.flatast.tree;

import org.junit.jupiter.api.Test;
import org.pragmatica.flatast.error.FlatAstException;
import org.pragmatica.flatast.error.TreeError;
import org.pragmatica.flatast.grammar.Variant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TreeBuilderTest {

    @Test
    void cursor_appendsChildrenAtConsecutiveAddresses() {
        var builder = TreeBuilder.create();
        var root = builder.root(NodeTag.of(Category.FILE_MATTER));
        var pkg = root.node(NodeTag.of(Variant.Package.NORMAL));
        pkg.leaf("main");
        root.empty();

        var store = builder.build();

        assertThat(store.size()).isEqualTo(4);
        assertThat(store.tag(Address.child(Address.ROOT, 0))).isEqualTo(NodeTag.of(Variant.Package.NORMAL));
        assertThat(store.text(Address.child(pkg.address(), 0))).isEqualTo("main");
        assertThat(store.isExplicitEmpty(Address.child(Address.ROOT, 1))).isTrue();
        assertThat(root.childCount()).isEqualTo(2);
        assertThat(store.runLength(Address.ROOT)).isEqualTo(2);
    }

    @Test
    void nodeWithConsumer_returnsParentCursor() {
        var builder = TreeBuilder.create();
        var root = builder.root(NodeTag.of(Category.RETURN_STMT));

        var same = root.node(NodeTag.of(Variant.Expression.IDENTIFIER, 1), id -> id.leaf("a"))
                       .leaf("b");

        assertThat(same).isSameAs(root);
        assertThat(builder.build().runLength(Address.ROOT)).isEqualTo(2);
    }

    @Test
    void put_atOccupiedAddress_failsWithCollision() {
        var builder = TreeBuilder.create();
        builder.putLeaf(5, "a");

        assertThatThrownBy(() -> builder.putLeaf(5, "b"))
            .isInstanceOf(FlatAstException.class)
            .satisfies(e -> assertThat(((FlatAstException) e).error())
                .isEqualTo(new TreeError.AddressCollision(5)));
    }

    @Test
    void build_detectsRecordContinuingARun() {
        var builder = TreeBuilder.create();
        builder.root(NodeTag.of(Category.RETURN_STMT))
               .leaf("a")
               .leaf("b");
        var intruder = Address.child(Address.ROOT, 2);
        builder.putLeaf(intruder, "x");

        assertThatThrownBy(builder::build)
            .isInstanceOf(FlatAstException.class)
            .satisfies(e -> assertThat(((FlatAstException) e).error())
                .isEqualTo(new TreeError.RunOverlap(Address.ROOT, 2, intruder)));
    }

    @Test
    void build_detectsRecordAtBaseOfChildlessNode() {
        var builder = TreeBuilder.create();
        builder.root(NodeTag.of(Category.RETURN_STMT));
        builder.putEmpty(Address.base(Address.ROOT));

        assertThatThrownBy(builder::build)
            .isInstanceOf(FlatAstException.class)
            .hasMessageContaining("Run of 0 children");
    }

    @Test
    void put_rejectsNonStructuralTag() {
        var builder = TreeBuilder.create();

        assertThatThrownBy(() -> builder.put(1, NodeTag.NONE))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void putLeaf_rejectsNullText() {
        var builder = TreeBuilder.create();

        assertThatThrownBy(() -> builder.putLeaf(1, null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void builder_cannotBeReusedAfterBuild() {
        var builder = TreeBuilder.create();
        builder.root(NodeTag.of(Category.ROOT_MATTER));
        builder.build();

        assertThatThrownBy(builder::build).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> builder.putLeaf(7, "x")).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void arena_growsBeyondInitialCapacity() {
        var builder = TreeBuilder.create(2);
        var root = builder.root(NodeTag.of(Category.RETURN_STMT));
        for (int i = 0; i < 100; i++) {
            root.leaf("v" + i);
        }

        var store = builder.build();

        assertThat(store.size()).isEqualTo(101);
        assertThat(store.runLength(Address.ROOT)).isEqualTo(100);
        assertThat(store.text(Address.child(Address.ROOT, 99))).isEqualTo("v99");
    }
}
