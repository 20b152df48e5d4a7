package org.pragmatica.flatast.trivia;

import it.unimi.dsi.fastutil.ints.IntSet;
import org.pragmatica.flatast.grammar.Variant;

/**
 * Placement information for comments of one source file, keyed by the byte offset
 * of the comment marker ({@code //} or {@code /*}) or of the {@code package} keyword.
 *
 * @param endOfLine offsets of comments preceded by other content on their line
 * @param separate  offsets of comments and package clauses following empty line(s)
 */
public record CommentPlacement(IntSet endOfLine, IntSet separate) {

    /**
     * Variant of the comment node to build for a comment starting at {@code offset}.
     */
    public Variant.Comment commentAt(int offset) {
        if (endOfLine.contains(offset)) {
            return Variant.Comment.END_OF_LINE;
        }
        if (separate.contains(offset)) {
            return Variant.Comment.SEPARATE;
        }
        return Variant.Comment.OWN_LINE;
    }

    /**
     * Variant of the package clause node to build for a {@code package} keyword at {@code offset}.
     */
    public Variant.Package packageAt(int offset) {
        return separate.contains(offset)
            ? Variant.Package.SEPARATE
            : Variant.Package.NORMAL;
    }
}
