// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package sigil.symbol.reader;

import sigil.symbol.SymbolPosition;
import sigil.symbol.SymbolSource;

/**
 * A position within a source text with single-character lookahead, keeping line and column numbers up to date.
 * <p>
 * The whole state of a cursor is its {@link SymbolPosition}, so backtracking is just {@link #reset(SymbolPosition)}
 * to a previously taken {@link #position()}.
 * <p>
 * A line ends at {@code \n}, at {@code \r\n} and at a lone {@code \r}.
 */
final class SourceCursor {
    SourceCursor(final SymbolSource source) {
        text = source.text();
        position = SymbolPosition.start();
    }

    SymbolPosition position() {
        return position;
    }

    void reset(final SymbolPosition position) {
        assert position.index() <= text.length();
        this.position = position;
    }

    String text() {
        return text;
    }

    int index() {
        return position.index();
    }

    /**
     * Returns {@code true} iff there are no characters left.
     * <p>
     * If {@code false} is returned, it's safe to {@link #peek()} at the current character and to {@link #discardPeek()}
     * it.
     */
    boolean reachedEnd() {
        return position.index() >= text.length();
    }

    char peek() {
        assert !reachedEnd();
        return text.charAt(position.index());
    }

    /**
     * Returns {@code true} iff the current character is the given one. Safe to call at the end of the text.
     */
    boolean peekIs(final char c) {
        return !reachedEnd() && peek() == c;
    }

    /**
     * Returns {@code true} iff the text continues with the given string at the current position.
     */
    boolean lookingAt(final String string) {
        return text.startsWith(string, position.index());
    }

    /**
     * Discards the current character, advancing to the next one.
     */
    void discardPeek() {
        final var c = peek();
        final var index = position.index();
        if (c == '\n' || (c == '\r' && (index + 1 >= text.length() || text.charAt(index + 1) != '\n'))) {
            position = position.nextLine(1);
        } else {
            // The '\r' of a "\r\n" pair is just a column, the '\n' that follows ends the line.
            position = position.nextColumn();
        }
    }

    void discard(final int count) {
        for (int i = 0; i < count; i += 1) {
            discardPeek();
        }
    }

    /**
     * Discards characters until the given string is found, leaving the cursor right before it.
     *
     * @return {@code false} if the string doesn't occur in the rest of the text; the cursor is then at the end.
     */
    boolean discardUntil(final String string) {
        final var found = text.indexOf(string, position.index());
        discard(((found >= 0) ? found : text.length()) - position.index());
        return found >= 0;
    }

    private final String text;
    private SymbolPosition position;
}
