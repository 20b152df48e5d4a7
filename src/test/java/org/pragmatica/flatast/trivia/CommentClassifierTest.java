package org.pragmatica.flatast.trivia;

import org.junit.jupiter.api.Test;
import org.pragmatica.flatast.grammar.Variant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CommentClassifierTest {

    @Test
    void commentAfterContent_isEndOfLine() {
        var placement = CommentClassifier.classify("x := 1 // note\n");

        assertThat(placement.endOfLine()).containsExactly(7);
        assertThat(placement.commentAt(7)).isEqualTo(Variant.Comment.END_OF_LINE);
    }

    @Test
    void commentOnItsOwnLine_defaultsToOwnLine() {
        var source = "x := 1\n\t// note\n";
        var offset = source.indexOf("//");

        var placement = CommentClassifier.classify(source);

        assertThat(placement.endOfLine()).isEmpty();
        assertThat(placement.separate()).isEmpty();
        assertThat(placement.commentAt(offset)).isEqualTo(Variant.Comment.OWN_LINE);
    }

    @Test
    void commentAfterBlankLine_isSeparate() {
        var source = "x\n\n// note\n";

        var placement = CommentClassifier.classify(source);

        assertThat(placement.separate()).containsExactly(3);
        assertThat(placement.commentAt(3)).isEqualTo(Variant.Comment.SEPARATE);
    }

    @Test
    void sameCommentText_classifiedByPosition() {
        var source = """
            func f() {
            \tx++ // note

            \t// note
            }
            """;
        var first = source.indexOf("// note");
        var second = source.lastIndexOf("// note");

        var placement = CommentClassifier.classify(source);

        assertThat(placement.commentAt(first)).isEqualTo(Variant.Comment.END_OF_LINE);
        assertThat(placement.commentAt(second)).isEqualTo(Variant.Comment.SEPARATE);
    }

    @Test
    void blankLineWithWhitespace_stillCountsAsBlank() {
        var source = "x\n  \t\n  /* block */\n";

        var placement = CommentClassifier.classify(source);

        assertThat(placement.separate()).containsExactly(source.indexOf("/*"));
    }

    @Test
    void onlyFirstMarkerOfLine_isEndOfLine() {
        var source = "a /* x */ // y\n";

        var placement = CommentClassifier.classify(source);

        assertThat(placement.endOfLine()).containsExactly(2);
    }

    @Test
    void packageKeywordWithoutBlankLine_isNormal() {
        var placement = CommentClassifier.classify("// header\npackage main\n");

        assertThat(placement.separate()).isEmpty();
        assertThat(placement.packageAt(10)).isEqualTo(Variant.Package.NORMAL);
    }

    @Test
    void packageKeywordAfterBlankLine_isSeparate() {
        var source = "// header\n\npackage main\n";
        var offset = source.indexOf("package");

        var placement = CommentClassifier.classify(source);

        assertThat(placement.separate()).containsExactly(offset);
        assertThat(placement.packageAt(offset)).isEqualTo(Variant.Package.SEPARATE);
        assertThat(placement.commentAt(0)).isEqualTo(Variant.Comment.OWN_LINE);
    }

    @Test
    void prefixOfPackageKeyword_isNotRecorded() {
        var placement = CommentClassifier.classify("x\n\npack\n");

        assertThat(placement.separate()).isEmpty();
    }

    @Test
    void offsets_areByteOffsetsOfUtf8Source() {
        // "é" takes two bytes
        var placement = CommentClassifier.classify("é // c\n");

        assertThat(placement.endOfLine()).containsExactly(3);
    }

    @Test
    void emptyAndSingleByteInput_classifyNothing() {
        assertThat(CommentClassifier.classify(new byte[0]).endOfLine()).isEmpty();
        assertThat(CommentClassifier.classify("/").endOfLine()).isEmpty();
    }

    @Test
    void resultSets_areUnmodifiable() {
        var placement = CommentClassifier.classify("a // b\n");

        assertThatThrownBy(() -> placement.endOfLine().add(99))
            .isInstanceOf(UnsupportedOperationException.class);
    }
}
