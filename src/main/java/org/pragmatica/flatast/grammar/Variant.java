package org.pragmatica.flatast.grammar;

import org.pragmatica.flatast.tree.Category;

/**
 * Sub-kinds of the node categories. The ordinal of a constant is the variant code
 * stored in a node tag, so the declaration order of every enumeration is part of
 * the tree format and must not change.
 */
public sealed interface Variant {
    Category category();

    int ordinal();

    default int code() {
        return ordinal();
    }

    enum Package implements Variant {
        NORMAL,
        /** Package clause following empty line(s). */
        SEPARATE;

        @Override
        public Category category() {
            return Category.PACKAGE_DEF;
        }
    }

    enum TypedIdent implements Variant {
        /** {@code a, b T} */
        NORMAL,
        /** {@code a = T} */
        EQUALS,
        /** {@code a ...T} */
        ELLIPSIS,
        /** {@code a T "tag"} */
        TAGGED;

        @Override
        public Category category() {
            return Category.TYPED_IDENT;
        }
    }

    enum TypeDef implements Variant {
        DEFINITION,
        ALIAS;

        @Override
        public Category category() {
            return Category.TYPE_DEF_STMT;
        }
    }

    enum Branch implements Variant {
        SEMICOLON(";"),
        BREAK("break"),
        CONTINUE("continue"),
        FALLTHROUGH("fallthrough"),
        GOTO("goto");

        private final String keyword;

        Branch(String keyword) {
            this.keyword = keyword;
        }

        public String keyword() {
            return keyword;
        }

        @Override
        public Category category() {
            return Category.BRANCH_STMT;
        }
    }

    enum GoDefer implements Variant {
        GO("go "),
        DEFER("defer ");

        private final String keyword;

        GoDefer(String keyword) {
            this.keyword = keyword;
        }

        public String keyword() {
            return keyword;
        }

        @Override
        public Category category() {
            return Category.GO_DEFER_STMT;
        }
    }

    enum IncDec implements Variant {
        INCREMENT("++"),
        DECREMENT("--");

        private final String token;

        IncDec(String token) {
            this.token = token;
        }

        public String token() {
            return token;
        }

        @Override
        public Category category() {
            return Category.INC_DEC_STMT;
        }
    }

    enum VarDef implements Variant {
        VAR("var "),
        CONST("const ");

        private final String keyword;

        VarDef(String keyword) {
            this.keyword = keyword;
        }

        public String keyword() {
            return keyword;
        }

        @Override
        public Category category() {
            return Category.VAR_DEF_STMT;
        }
    }

    enum Label implements Variant {
        /** Labeled statement, {@code name: } */
        LABEL(""),
        GOTO("goto "),
        CONTINUE("continue "),
        BREAK("break ");

        private final String keyword;

        Label(String keyword) {
            this.keyword = keyword;
        }

        public String keyword() {
            return keyword;
        }

        @Override
        public Category category() {
            return Category.LABEL_STMT;
        }
    }

    enum Comment implements Variant {
        /** Comment starting at the end of a line holding other content. */
        END_OF_LINE,
        /** Comment occupying its own line. */
        OWN_LINE,
        /** Comment following empty line(s). */
        SEPARATE;

        @Override
        public Category category() {
            return Category.COMMENT_ROW;
        }
    }

    enum Func implements Variant {
        FUNCTION,
        /** Function with a receiver; the receiver is the second child. */
        METHOD;

        @Override
        public Category category() {
            return Category.TOPLEVEL_FUNC;
        }
    }

    /**
     * Block statement kinds. Kinds declared before {@link #CASE} are braced.
     */
    enum Block implements Variant {
        PLAIN(""),
        IF("if "),
        /** If block followed by an else branch: the next sibling is a PLAIN or IF block. */
        IF_ELSE("if "),
        SWITCH("switch "),
        FOR("for "),
        FOR_RANGE("for range "),
        TYPE_SWITCH("switch "),
        SELECT("select "),
        CASE("case "),
        DEFAULT("default:"),
        /** Statements without braces. */
        NONE(""),
        COMMUNICATE("case "),
        COMMUNICATE_DEFAULT("default:");

        private final String introducer;

        Block(String introducer) {
            this.introducer = introducer;
        }

        public String introducer() {
            return introducer;
        }

        public boolean braced() {
            return ordinal() < CASE.ordinal();
        }

        /**
         * Clause of a switch or select; renders its own line endings.
         */
        public boolean clause() {
            return this == CASE || this == DEFAULT || this == COMMUNICATE || this == COMMUNICATE_DEFAULT;
        }

        @Override
        public Category category() {
            return Category.BLOCK;
        }
    }

    /**
     * Expression operators. Infix tokens are used between operands, prefix tokens
     * when the expression has exactly one operand.
     */
    enum Expression implements Variant {
        BRACKETS("", "("),
        OR_OR(" || ", ""),
        AND_AND(" && ", ""),
        EQUAL(" == ", ""),
        NOT_EQUAL(" != ", ""),
        LESS_THAN(" < ", ""),
        LESS_EQUAL(" <= ", ""),
        GREATER_EQUAL(" >= ", ""),
        GREATER_THAN(" > ", ""),
        PLUS(" + ", "+"),
        MINUS(" - ", "-"),
        OR(" | ", ""),
        XOR(" ^ ", "^"),
        MUL(" * ", "*"),
        DIV(" / ", ""),
        MOD(" % ", ""),
        AND(" & ", "&"),
        AND_NOT(" &^ ", ""),
        SHIFT_LEFT(" << ", ""),
        SHIFT_RIGHT(" >> ", ""),
        NOT("", "!"),
        /** Selector or qualified identifier. */
        DOT(".", ""),
        /** {@code a[lo:hi:max]}; an explicit-empty bound is omitted. */
        SLICE(":", ""),
        /** Composite literal: type, then elements. */
        COMPOSITE(", ", ""),
        CALL(", ", ""),
        /** Send statement, or a receive operation when unary. */
        ARROW(" <- ", "<-"),
        /** {@code []T} */
        SLICE_TYPE("", ""),
        /** {@code [N]T} */
        ARRAY_TYPE("]", ""),
        KEY_VALUE(": ", ""),
        /** {@code x.(T)}, or {@code x.(type)} when unary. */
        TYPE_ASSERT(".(", ""),
        /** Variadic call, {@code f(a, rest...)}. */
        CALL_ELLIPSIS(", ", ""),
        /** Literal value nested in a composite literal, without a type. */
        COMPOSED(", ", "{"),
        INDEX("[", ""),
        MAP("]", ""),
        /** Wrapper of a single leaf. */
        IDENTIFIER("", ""),
        CHAN("", "chan "),
        /** {@code chan<- T} */
        SEND_CHAN("", "chan<- "),
        /** {@code <-chan T} */
        RECEIVE_CHAN("", "<-chan ");

        private final String infix;
        private final String prefix;

        Expression(String infix, String prefix) {
            this.infix = infix;
            this.prefix = prefix;
        }

        /**
         * Token between two operands.
         */
        public String infix() {
            return infix;
        }

        /**
         * Token before the only operand of a unary expression.
         */
        public String prefix() {
            return prefix;
        }

        @Override
        public Category category() {
            return Category.EXPRESSION;
        }
    }

    /**
     * Assignment forms. Forms after {@link #TYPE_IS_LAST} have several left hand side
     * elements and a single right hand side expression.
     */
    enum Assign implements Variant {
        ASSIGN(" = "),
        DEFINE(" := "),
        AND_NOT(" &^= "),
        ADD(" += "),
        SUB(" -= "),
        MUL(" *= "),
        QUO(" /= "),
        REM(" %= "),
        AND(" &= "),
        OR(" |= "),
        XOR(" ^= "),
        SHL(" <<= "),
        SHR(" >>= "),
        /** Constant declaration row following the iota row. */
        IOTA_IS_LAST(", "),
        /** Variable declaration giving a type but no values. */
        TYPE_IS_LAST(""),
        MULTI_ASSIGN(" = "),
        MULTI_DEFINE(" := "),
        MULTI_ASSIGN_RANGE(" = range "),
        MULTI_DEFINE_RANGE(" := range ");

        private final String operator;

        Assign(String operator) {
            this.operator = operator;
        }

        /**
         * Operator between the left and the right hand side.
         */
        public String operator() {
            return operator;
        }

        public boolean multi() {
            return ordinal() > TYPE_IS_LAST.ordinal();
        }

        @Override
        public Category category() {
            return Category.ASSIGN_STMT;
        }
    }
}
