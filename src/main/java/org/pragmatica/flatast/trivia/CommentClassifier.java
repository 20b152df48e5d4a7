package org.pragmatica.flatast.trivia;

import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSets;

import java.nio.charset.StandardCharsets;

/**
 * Single forward scan over raw source bytes classifying comment placement.
 *
 * <p>A marker is end-of-line when non-whitespace content precedes it on its line;
 * only the first marker of a line counts. A marker, or the {@code package} keyword,
 * is separate when it is the first content of its line and at least one blank line
 * precedes it. Comment markers inside string literals are recorded too; the tree
 * builder only asks about offsets where it found a comment.
 */
public final class CommentClassifier {
    private static final byte[] PACKAGE = "package".getBytes(StandardCharsets.US_ASCII);

    private final byte[] source;
    private final IntOpenHashSet endOfLine = new IntOpenHashSet();
    private final IntOpenHashSet separate = new IntOpenHashSet();

    // Only whitespace seen since the start of the current line
    private boolean leadingWhitespace = true;
    // The current line follows a blank line and has no content yet
    private boolean afterBlankLine;
    private boolean sawEndOfLineMarker;

    private CommentClassifier(byte[] source) {
        this.source = source;
    }

    public static CommentPlacement classify(byte[] source) {
        return new CommentClassifier(source).scan();
    }

    public static CommentPlacement classify(String source) {
        return classify(source.getBytes(StandardCharsets.UTF_8));
    }

    private CommentPlacement scan() {
        for (int i = 0; i + 1 < source.length; i++) {
            var c = source[i];
            var d = source[i + 1];
            if (c == '\n') {
                if (leadingWhitespace) {
                    afterBlankLine = true;
                }
                leadingWhitespace = true;
                sawEndOfLineMarker = false;
                continue;
            }
            var marker = c == '/' && (d == '/' || d == '*');
            if (marker && !leadingWhitespace && !sawEndOfLineMarker) {
                endOfLine.add(i);
                sawEndOfLineMarker = true;
            }
            if ((marker || isPackageKeyword(i)) && afterBlankLine) {
                separate.add(i);
                afterBlankLine = false;
            }
            if ((c & 0xFF) > ' ') {
                leadingWhitespace = false;
                afterBlankLine = false;
            }
        }
        return new CommentPlacement(IntSets.unmodifiable(endOfLine), IntSets.unmodifiable(separate));
    }

    private boolean isPackageKeyword(int offset) {
        if (offset + PACKAGE.length > source.length) {
            return false;
        }
        for (int i = 0; i < PACKAGE.length; i++) {
            if (source[offset + i] != PACKAGE[i]) {
                return false;
            }
        }
        return true;
    }
}
