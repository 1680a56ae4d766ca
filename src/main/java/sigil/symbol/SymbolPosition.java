// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package sigil.symbol;

/**
 * A position within a {@link SymbolSource}.
 * <p>
 * Positions lie <em>between</em> characters: the position of a character is the one right before it.
 *
 * @param index  The zero-based index of the character following this position.
 * @param line   The one-based line number.
 * @param column The one-based column number; tabs count as one column.
 */
public record SymbolPosition(int index, int line, int column) {
    /**
     * Returns the position at the very start of a text.
     */
    public static SymbolPosition start() {
        return startPosition;
    }

    /**
     * Returns the all-zero position, used by origins that cover a whole input without tracking where within it.
     */
    public static SymbolPosition empty() {
        return emptyPosition;
    }

    /**
     * Returns the position one character further on the same line.
     */
    public SymbolPosition nextColumn() {
        return new SymbolPosition(index + 1, line, column + 1);
    }

    /**
     * Returns the position at the start of the next line, after a line terminator of the given length.
     */
    public SymbolPosition nextLine(final int terminatorLength) {
        return new SymbolPosition(index + terminatorLength, line + 1, 1);
    }

    private static final SymbolPosition startPosition = new SymbolPosition(0, 1, 1);
    private static final SymbolPosition emptyPosition = new SymbolPosition(0, 0, 0);
}
