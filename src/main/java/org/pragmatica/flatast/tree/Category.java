package org.pragmatica.flatast.tree;

/**
 * Node families of the Go syntax tree.
 *
 * <p>Each category carries the size of its variant enumeration, which is also the
 * baseline subtracted from a tag's capacity to decode its slot count, and the
 * arity policy telling what the slot count means.
 */
public enum Category {
    /** Universe block at address zero; children are {@link #FILE_MATTER} nodes. */
    ROOT_MATTER("RootMatter", 1, Arity.FIXED),
    /** A single source file; children are top level declarations and comments. */
    FILE_MATTER("FileMatter", 1, Arity.FIXED),
    /** Package clause: name leaf, optional import comment. */
    PACKAGE_DEF("PackageDef", 2, Arity.FIXED),
    /** Single import: one or two leaves (optional alias, then path). */
    IMPORT_STMT("ImportStmt", 1, Arity.FIXED),
    /** Parenthesized group of {@link #IMPORT_STMT} nodes. */
    IMPORTS_DEF("ImportsDef", 1, Arity.FIXED),
    /** Name leaves sharing one {@link #ROOT_OF_TYPE}, optionally followed by a struct tag leaf. */
    TYPED_IDENT("TypedIdent", 4, Arity.FIXED),
    /** Root of a type expression; a single leaf or expression child. */
    ROOT_OF_TYPE("RootOfType", 1, Arity.FIXED),
    /** Type definition or alias declaration: name leaf, then the type. */
    TYPE_DEF_STMT("TypeDefStmt", 2, Arity.FIXED),
    /** Struct type; children are fields and comments. */
    STRUCT_TYPE("StructType", 1, Arity.FIXED),
    /** Childless statement: explicit semicolon, break, continue, fallthrough, goto. */
    BRANCH_STMT("BranchStmt", 5, Arity.FIXED),
    /** Go or defer statement wrapping a call expression. */
    GO_DEFER_STMT("GoDeferStmt", 2, Arity.FIXED),
    /** Return statement; children are result expressions. */
    RETURN_STMT("ReturnStmt", 1, Arity.FIXED),
    /** Increment or decrement statement around a single operand. */
    INC_DEC_STMT("IncDecStmt", 2, Arity.FIXED),
    /** Variable or constant declaration; one {@link #ASSIGN_STMT} per row. */
    VAR_DEF_STMT("VarDefStmt", 2, Arity.FIXED),
    /** Labeled statement or a goto, continue or break naming a label leaf. */
    LABEL_STMT("LabelStmt", 4, Arity.FIXED),
    /** Interface type; children are methods, embedded types and comments. */
    INTERFACE_TYPE("InterfaceType", 1, Arity.FIXED),
    /** Comment text leaf, placed according to the comment classifier. */
    COMMENT_ROW("CommentRow", 3, Arity.FIXED),
    /** One of the expression operators; slots hold the declared operand count. */
    EXPRESSION("Expression", 38, Arity.OPEN),
    /** Block statement; slots hold the header element count including semicolons. */
    BLOCK("Block", 13, Arity.HEADER),
    /** Top level function or method; slots hold the proper parameter count. */
    TOPLEVEL_FUNC("ToplevelFunc", 2, Arity.OPEN),
    /** Assignment, short variable declaration or declaration row; slots hold the element count. */
    ASSIGN_STMT("AssignStmt", 19, Arity.OPEN),
    /** Function literal; slots hold the parameter count. */
    CLOSURE("Closure", 1, Arity.OPEN),
    /** Interface method: a name {@link #TYPED_IDENT}, parameters, results; slots hold the parameter count. */
    INTERFACE_METHOD("InterfaceMethod", 1, Arity.OPEN);

    private static final Category[] VALUES = values();

    private final String displayName;
    private final int variantCount;
    private final Arity arity;

    Category(String displayName, int variantCount, Arity arity) {
        this.displayName = displayName;
        this.variantCount = variantCount;
        this.arity = arity;
    }

    public String displayName() {
        return displayName;
    }

    public int variantCount() {
        return variantCount;
    }

    /**
     * Constant subtracted from a tag's capacity to obtain its slot count.
     */
    public int baseline() {
        return variantCount;
    }

    public Arity arity() {
        return arity;
    }

    public boolean hasSlots() {
        return arity != Arity.FIXED;
    }

    int code() {
        return ordinal() + 1;
    }

    static Category fromCode(int code) {
        return VALUES[code - 1];
    }

    static int codeLimit() {
        return VALUES.length;
    }

    /**
     * Meaning of the slot axis of a category.
     */
    public enum Arity {
        /**
         * No slot axis; capacity equals length.
         */
        FIXED,

        /**
         * Bounded header: the leading children form a header, the rest is a body.
         */
        HEADER,

        /**
         * Open operand or parameter count.
         */
        OPEN
    }
}
