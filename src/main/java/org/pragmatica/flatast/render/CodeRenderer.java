package org.pragmatica.flatast.render;

import org.pragmatica.flatast.grammar.Variant;
import org.pragmatica.flatast.tree.Address;
import org.pragmatica.flatast.tree.Category;
import org.pragmatica.flatast.tree.FlatStore;
import org.pragmatica.flatast.tree.NodeTag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Unparsing engine - regenerates Go source text from a flat store.
 *
 * <p>One left-to-right, depth-first walk. Every node emits a prefix chosen from its
 * tag, renders its child run from index zero to the first absent key, and emits
 * separators whose choice depends only on the child index, the parent tag and at
 * most one neighbouring sibling. Nodes never end their own line; the run holding
 * them decides the line break, so an end-of-line comment can follow any statement.
 */
public final class CodeRenderer implements Renderer {
    private static final Logger LOGGER = LoggerFactory.getLogger(CodeRenderer.class);

    private static final Variant.Package[] PACKAGES = Variant.Package.values();
    private static final Variant.TypedIdent[] TYPED_IDENTS = Variant.TypedIdent.values();
    private static final Variant.TypeDef[] TYPE_DEFS = Variant.TypeDef.values();
    private static final Variant.Branch[] BRANCHES = Variant.Branch.values();
    private static final Variant.GoDefer[] GO_DEFERS = Variant.GoDefer.values();
    private static final Variant.IncDec[] INC_DECS = Variant.IncDec.values();
    private static final Variant.VarDef[] VAR_DEFS = Variant.VarDef.values();
    private static final Variant.Label[] LABELS = Variant.Label.values();
    private static final Variant.Comment[] COMMENTS = Variant.Comment.values();
    private static final Variant.Block[] BLOCKS = Variant.Block.values();
    private static final Variant.Expression[] EXPRESSIONS = Variant.Expression.values();
    private static final Variant.Assign[] ASSIGNS = Variant.Assign.values();

    private final RenderConfig config;

    private CodeRenderer(RenderConfig config) {
        this.config = config;
    }

    public static CodeRenderer create(RenderConfig config) {
        return new CodeRenderer(config);
    }

    @Override
    public String render(FlatStore store) {
        return render(store, Address.ROOT);
    }

    @Override
    public String render(FlatStore store, long root) {
        var out = new StringBuilder();
        renderTo(store, root, out);
        return out.toString();
    }

    @Override
    public void renderTo(FlatStore store, long root, Appendable out) {
        LOGGER.debug("Rendering {} records from {}", store.size(), Address.format(root));
        var ctx = RenderContext.create(store, config, out);
        render(ctx, root, root, 0);
        LOGGER.debug("Rendered {}", Address.format(root));
    }

    @Override
    public String dump(FlatStore store, long address, int indent) {
        return TreeDumper.create(config).dump(store, address, indent);
    }

    // === Dispatch ===

    private void render(RenderContext ctx, long address, long parent, int depth) {
        ctx.checkDepth(address, depth);
        var tag = ctx.tag(address);
        if (!NodeTag.isStructural(tag)) {
            // Leaf text verbatim; explicit-empty renders as nothing
            ctx.emit(ctx.store().text(address));
            return;
        }
        switch (NodeTag.category(tag)) {
            case ROOT_MATTER -> children(ctx, address, 0, depth);
            case ROOT_OF_TYPE -> typeRoot(ctx, address, depth);
            case FILE_MATTER -> statements(ctx, address, 0, depth);
            case PACKAGE_DEF -> packageClause(ctx, address, tag, depth);
            case IMPORT_STMT -> importSpec(ctx, address, parent, depth);
            case IMPORTS_DEF -> importGroup(ctx, address, depth);
            case TYPED_IDENT -> typedIdent(ctx, address, tag, depth);
            case TYPE_DEF_STMT -> typeDefinition(ctx, address, tag, depth);
            case STRUCT_TYPE -> members(ctx, address, "struct{", depth);
            case INTERFACE_TYPE -> members(ctx, address, "interface{", depth);
            case BRANCH_STMT -> ctx.emit(BRANCHES[NodeTag.variantOf(tag)].keyword());
            case GO_DEFER_STMT -> goDefer(ctx, address, tag, depth);
            case RETURN_STMT -> returnStatement(ctx, address, depth);
            case INC_DEC_STMT -> incDec(ctx, address, tag, depth);
            case VAR_DEF_STMT -> varDefinition(ctx, address, tag, depth);
            case LABEL_STMT -> label(ctx, address, tag);
            case COMMENT_ROW -> comment(ctx, address, tag);
            case EXPRESSION -> expression(ctx, address, tag, depth);
            case BLOCK -> block(ctx, address, tag, depth);
            case TOPLEVEL_FUNC -> function(ctx, address, tag, depth);
            case ASSIGN_STMT -> assignment(ctx, address, tag, depth);
            case CLOSURE -> closure(ctx, address, tag, depth);
            case INTERFACE_METHOD -> interfaceMethod(ctx, address, tag, depth);
        }
    }

    private void renderChild(RenderContext ctx, long parent, int index, int depth) {
        render(ctx, ctx.child(parent, index), parent, depth + 1);
    }

    private void children(RenderContext ctx, long parent, int from, int depth) {
        for (int i = from; ctx.present(parent, i); i++) {
            renderChild(ctx, parent, i, depth);
        }
    }

    /**
     * Children from {@code from} on, each preceded by a single space.
     */
    private void spaced(RenderContext ctx, long parent, int from, int depth) {
        for (int i = from; ctx.present(parent, i); i++) {
            ctx.space();
            renderChild(ctx, parent, i, depth);
        }
    }

    /**
     * Number of leading children of a run that are present, checking the first {@code count}.
     * The first absent one is reported as missing.
     */
    private static int requireRun(RenderContext ctx, long parent, int count, String expected) {
        for (int i = 0; i < count; i++) {
            if (!ctx.require(parent, i, expected)) {
                return i;
            }
        }
        return count;
    }

    /**
     * Children one per line. A chained else branch stays on the line of its if block,
     * an end-of-line comment stays on the line of the statement it follows, and
     * switch and select clauses end their own lines.
     */
    private void statements(RenderContext ctx, long parent, int from, int depth) {
        for (int i = from; ctx.present(parent, i); i++) {
            renderChild(ctx, parent, i, depth);
            statementBreak(ctx, parent, i);
        }
    }

    private void statementBreak(RenderContext ctx, long parent, int index) {
        var current = ctx.tag(ctx.child(parent, index));
        if (NodeTag.is(current, Variant.Block.IF_ELSE)) {
            ctx.space();
            return;
        }
        if (isClause(current)) {
            return;
        }
        lineBreak(ctx, current, ctx.tag(ctx.child(parent, index + 1)));
    }

    /**
     * End the current line, unless the next node is an end-of-line comment that belongs on it.
     */
    private static void lineBreak(RenderContext ctx, long current, long next) {
        if (NodeTag.is(next, Variant.Comment.END_OF_LINE) && !NodeTag.is(current, Variant.Comment.END_OF_LINE)) {
            ctx.space();
        } else {
            ctx.newline();
        }
    }

    /**
     * Line break after an opening token such as a brace, before child {@code index}.
     */
    private static void openLine(RenderContext ctx, long parent, int index) {
        lineBreak(ctx, NodeTag.NONE, ctx.tag(ctx.child(parent, index)));
    }

    private static boolean isClause(long tag) {
        return NodeTag.is(tag, Category.BLOCK) && BLOCKS[NodeTag.variantOf(tag)].clause();
    }

    /**
     * Text of a positional leaf child; nothing when it is absent.
     */
    private static void leafText(RenderContext ctx, long parent, int index) {
        ctx.emit(ctx.store().text(ctx.child(parent, index)));
    }

    // === Declarations ===

    private void packageClause(RenderContext ctx, long address, long tag, int depth) {
        ctx.require(address, 0, "package name");
        if (PACKAGES[NodeTag.variantOf(tag)] == Variant.Package.SEPARATE) {
            ctx.newline();
        }
        ctx.emit("package ");
        leafText(ctx, address, 0);
        spaced(ctx, address, 1, depth);
    }

    private void importSpec(RenderContext ctx, long address, long parent, int depth) {
        var store = ctx.store();
        ctx.require(address, 0, "import spec");
        if (!NodeTag.is(ctx.tag(parent), Category.IMPORTS_DEF)) {
            ctx.emit("import ");
        }
        leafText(ctx, address, 0);
        var second = ctx.child(address, 1);
        if (store.isStructural(second)) {
            spaced(ctx, address, 1, depth);
            return;
        }
        if (!store.text(second).isEmpty()) {
            ctx.emit(" ");
            ctx.emit(store.text(second));
        }
        spaced(ctx, address, 2, depth);
    }

    private void importGroup(RenderContext ctx, long address, int depth) {
        ctx.emit("import (");
        openLine(ctx, address, 0);
        statements(ctx, address, 0, depth);
        ctx.emit(")");
    }

    private void typeRoot(RenderContext ctx, long address, int depth) {
        if (ctx.require(address, 0, "type")) {
            children(ctx, address, 0, depth);
        }
    }

    private void typeDefinition(RenderContext ctx, long address, long tag, int depth) {
        requireRun(ctx, address, 2, "type name and type");
        ctx.emit("type ");
        leafText(ctx, address, 0);
        ctx.emit(" ");
        if (TYPE_DEFS[NodeTag.variantOf(tag)] == Variant.TypeDef.ALIAS) {
            ctx.emit("= ");
        }
        children(ctx, address, 1, depth);
    }

    private void members(RenderContext ctx, long address, String opener, int depth) {
        ctx.emit(opener);
        if (ctx.present(address, 0)) {
            openLine(ctx, address, 0);
        }
        statements(ctx, address, 0, depth);
        ctx.emit("}");
    }

    /**
     * Names sharing a type: {@code a, b T}, {@code a ...T}, {@code a = T}, {@code a T "tag"}.
     */
    private void typedIdent(RenderContext ctx, long address, long tag, int depth) {
        var store = ctx.store();
        var kind = TYPED_IDENTS[NodeTag.variantOf(tag)];
        if (kind == Variant.TypedIdent.ELLIPSIS && NodeTag.is(ctx.tag(ctx.child(address, 0)), Category.ROOT_OF_TYPE)) {
            ctx.emit("...");
        }
        for (int i = 0; ctx.present(address, i); i++) {
            var current = ctx.child(address, i);
            if (store.isStructural(current)) {
                renderChild(ctx, address, i, depth);
                continue;
            }
            if (store.isExplicitEmpty(current)) {
                continue;
            }
            // A leaf after the type is the struct tag
            if (i > 0 && store.isStructural(ctx.child(address, i - 1))) {
                ctx.emit(" ");
            }
            ctx.emit(store.text(current));
            var next = ctx.child(address, i + 1);
            if (store.isLeaf(next)) {
                ctx.emit(", ");
            } else if (store.isStructural(next)) {
                ctx.emit(typeSeparator(kind));
            }
        }
    }

    private static String typeSeparator(Variant.TypedIdent kind) {
        return switch (kind) {
            case NORMAL, TAGGED -> " ";
            case EQUALS -> " = ";
            case ELLIPSIS -> " ...";
        };
    }

    private void function(RenderContext ctx, long address, long tag, int depth) {
        var method = NodeTag.variantOf(tag) == Variant.Func.METHOD.code();
        var from = method
            ? 2
            : 1;
        var expected = method
            ? "name and receiver"
            : "function name";
        requireRun(ctx, address, from, expected);
        var parameters = availableParameters(ctx, address, from, NodeTag.slotsOf(tag));
        ctx.emit("func ");
        if (method) {
            ctx.emit("(");
            if (ctx.present(address, 1)) {
                renderChild(ctx, address, 1, depth);
            }
            ctx.emit(") ");
        }
        leafText(ctx, address, 0);
        var index = signature(ctx, address, from, parameters, depth);
        spaced(ctx, address, index, depth);
    }

    private void closure(RenderContext ctx, long address, long tag, int depth) {
        var parameters = availableParameters(ctx, address, 0, NodeTag.slotsOf(tag));
        ctx.emit("func");
        var index = signature(ctx, address, 0, parameters, depth);
        spaced(ctx, address, index, depth);
    }

    private void interfaceMethod(RenderContext ctx, long address, long tag, int depth) {
        var named = ctx.require(address, 0, "method name");
        var parameters = availableParameters(ctx, address, 1, NodeTag.slotsOf(tag));
        if (named) {
            renderChild(ctx, address, 0, depth);
        }
        var index = signature(ctx, address, 1, parameters, depth);
        children(ctx, address, index, depth);
    }

    /**
     * Number of the {@code declared} parameters starting at {@code from} that are present
     * and come before the body. The first missing one is reported.
     */
    private static int availableParameters(RenderContext ctx, long address, int from, int declared) {
        for (int p = 0; p < declared; p++) {
            var index = from + p;
            if (!ctx.present(address, index) || isBody(ctx, ctx.child(address, index))) {
                ctx.missing(address, index, "parameter");
                return p;
            }
        }
        return declared;
    }

    /**
     * Parenthesized parameters starting at {@code from}, then the parenthesized results
     * (if any) running up to the body. Returns the index of the first child after the results.
     */
    private int signature(RenderContext ctx, long address, int from, int parameters, int depth) {
        ctx.emit("(");
        var index = from;
        for (int p = 0; p < parameters; p++, index++) {
            if (p > 0) {
                ctx.emit(", ");
            }
            renderChild(ctx, address, index, depth);
        }
        ctx.emit(")");
        var results = index;
        for (; ctx.present(address, index) && !isBody(ctx, ctx.child(address, index)); index++) {
            ctx.emit(index == results
                ? " ("
                : ", ");
            renderChild(ctx, address, index, depth);
        }
        if (index > results) {
            ctx.emit(")");
        }
        return index;
    }

    private static boolean isBody(RenderContext ctx, long address) {
        return ctx.store().isNil(address) || NodeTag.is(ctx.tag(address), Category.BLOCK);
    }

    // === Statements ===

    private void goDefer(RenderContext ctx, long address, long tag, int depth) {
        ctx.require(address, 0, "call");
        ctx.emit(GO_DEFERS[NodeTag.variantOf(tag)].keyword());
        children(ctx, address, 0, depth);
    }

    private void returnStatement(RenderContext ctx, long address, int depth) {
        ctx.emit("return");
        for (int i = 0; ctx.present(address, i); i++) {
            if (i == 0) {
                ctx.emit(" ");
            }
            renderChild(ctx, address, i, depth);
            if (!ctx.store().isNil(ctx.child(address, i + 1))) {
                ctx.emit(", ");
            }
        }
    }

    private void incDec(RenderContext ctx, long address, long tag, int depth) {
        ctx.require(address, 0, "operand");
        children(ctx, address, 0, depth);
        ctx.emit(INC_DECS[NodeTag.variantOf(tag)].token());
    }

    /**
     * Single row {@code var x = 1}, or a parenthesized group when a second row exists.
     */
    private void varDefinition(RenderContext ctx, long address, long tag, int depth) {
        ctx.emit(VAR_DEFS[NodeTag.variantOf(tag)].keyword());
        if (hasContent(ctx, ctx.child(address, 1))) {
            ctx.emit("(");
            openLine(ctx, address, 0);
        } else if (!hasContent(ctx, ctx.child(address, 0))) {
            ctx.emit("()");
        }
        for (int i = 0; ctx.present(address, i); i++) {
            renderChild(ctx, address, i, depth);
            var previous = i > 0 && hasContent(ctx, ctx.child(address, i - 1));
            var current = hasContent(ctx, ctx.child(address, i));
            var next = hasContent(ctx, ctx.child(address, i + 1));
            if (current && next) {
                lineBreak(ctx, ctx.tag(ctx.child(address, i)), ctx.tag(ctx.child(address, i + 1)));
            }
            if (previous && !next) {
                ctx.newline();
                ctx.emit(")");
            }
        }
    }

    private static boolean hasContent(RenderContext ctx, long address) {
        return ctx.store().isStructural(address) || !ctx.store().text(address).isEmpty();
    }

    private void label(RenderContext ctx, long address, long tag) {
        ctx.require(address, 0, "label");
        var kind = LABELS[NodeTag.variantOf(tag)];
        ctx.emit(kind.keyword());
        leafText(ctx, address, 0);
        if (kind == Variant.Label.LABEL) {
            ctx.emit(": ");
        }
    }

    private void comment(RenderContext ctx, long address, long tag) {
        ctx.require(address, 0, "comment text");
        if (COMMENTS[NodeTag.variantOf(tag)] == Variant.Comment.SEPARATE) {
            ctx.newline();
        }
        leafText(ctx, address, 0);
    }

    /**
     * Block statement: introducer, header elements, brace (or colon for clauses), body statements.
     */
    private void block(RenderContext ctx, long address, long tag, int depth) {
        var kind = BLOCKS[NodeTag.variantOf(tag)];
        var header = NodeTag.slotsOf(tag);
        requireRun(ctx, address, header, "header element");
        ctx.emit(kind.introducer());
        if (kind == Variant.Block.DEFAULT || kind == Variant.Block.COMMUNICATE_DEFAULT) {
            openLine(ctx, address, 0);
        }
        if (header == 0 && kind.braced()) {
            ctx.emit("{");
            openLine(ctx, address, 0);
        }
        for (int i = 0; ctx.present(address, i); i++) {
            renderChild(ctx, address, i, depth);
            if (i + 1 == header) {
                closeHeader(ctx, kind, address, header);
            } else if (i + 1 > header) {
                statementBreak(ctx, address, i);
            } else if (kind == Variant.Block.CASE) {
                ctx.emit(", ");
            }
        }
        if (kind.braced()) {
            ctx.emit("}");
        }
        if (kind == Variant.Block.IF_ELSE) {
            ctx.emit(" else");
        }
    }

    private static void closeHeader(RenderContext ctx, Variant.Block kind, long address, int header) {
        if (kind == Variant.Block.CASE || kind == Variant.Block.COMMUNICATE) {
            ctx.emit(":");
            openLine(ctx, address, header);
        } else if (kind.braced()) {
            ctx.space();
            ctx.emit("{");
            openLine(ctx, address, header);
        }
    }

    // === Expressions ===

    /**
     * Operator expression over its declared operand count. The zero-, one- and many-operand
     * shapes differ in the token before the first operand, between operands and after the last.
     */
    private void expression(RenderContext ctx, long address, long tag, int depth) {
        var op = EXPRESSIONS[NodeTag.variantOf(tag)];
        var operands = NodeTag.slotsOf(tag);
        requireRun(ctx, address, operands, "operand");
        ctx.emit(operands == 1
            ? op.prefix()
            : openMulti(op, operands));
        for (int i = 0; ctx.present(address, i); i++) {
            renderChild(ctx, address, i, depth);
            var position = i + 1;
            if (operands > 1 && position != operands) {
                ctx.emit(interior(op, position));
            } else if (position == 1 && operands == 1) {
                ctx.emit(closeSingle(op));
            } else if (position == operands) {
                ctx.emit(closeMulti(op, operands));
            }
        }
    }

    private static String openMulti(Variant.Expression op, int operands) {
        return switch (op) {
            case SLICE_TYPE -> "[]";
            case ARRAY_TYPE -> "[";
            case MAP -> "map[";
            case COMPOSED -> operands == 0
                ? "{}"
                : "{";
            default -> "";
        };
    }

    /**
     * Token after operand {@code position} (1-based) when more operands follow.
     */
    private static String interior(Variant.Expression op, int position) {
        return switch (op) {
            case CALL, CALL_ELLIPSIS -> position == 1
                ? "("
                : ", ";
            case SLICE -> position == 1
                ? "["
                : ":";
            case COMPOSITE -> position == 1
                ? "{"
                : ", ";
            default -> op.infix();
        };
    }

    private static String closeSingle(Variant.Expression op) {
        return switch (op) {
            case BRACKETS -> ")";
            case CALL, CALL_ELLIPSIS -> "()";
            case COMPOSED -> "}";
            case COMPOSITE -> "{}";
            case TYPE_ASSERT -> ".(type)";
            default -> "";
        };
    }

    private static String closeMulti(Variant.Expression op, int operands) {
        return switch (op) {
            case INDEX -> "]";
            case SLICE -> operands == 2
                ? ":]"
                : "]";
            case COMPOSED, COMPOSITE -> "}";
            case CALL_ELLIPSIS -> "...)";
            case CALL, TYPE_ASSERT -> ")";
            default -> "";
        };
    }

    /**
     * Assignment over its element count: left hand side, an optional central type, the
     * operator at the midpoint, right hand side. Multi forms put their operator before the
     * single right hand side expression.
     */
    private void assignment(RenderContext ctx, long address, long tag, int depth) {
        var form = ASSIGNS[NodeTag.variantOf(tag)];
        var elements = NodeTag.slotsOf(tag);
        requireRun(ctx, address, elements, "element");
        for (int i = 0; ctx.present(address, i); i++) {
            renderChild(ctx, address, i, depth);
            ctx.emit(assignSeparator(form, elements, i + 1));
        }
    }

    private static String assignSeparator(Variant.Assign form, int elements, int position) {
        if (position >= elements) {
            return "";
        }
        if (position + 1 == elements && form.multi()) {
            return form.operator();
        }
        if (position == (elements + 1) >> 1 && form != Variant.Assign.TYPE_IS_LAST) {
            return form.multi()
                ? ", "
                : form.operator();
        }
        if (position == elements >> 1 && form.ordinal() < Variant.Assign.TYPE_IS_LAST.ordinal()) {
            return " ";
        }
        if (position + 1 != elements || form != Variant.Assign.TYPE_IS_LAST) {
            return ", ";
        }
        return " ";
    }
}
