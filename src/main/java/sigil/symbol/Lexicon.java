// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package sigil.symbol;

/**
 * The lexical rules of the sigil notation: character classes, delimiters and the predicates the reader and the writer
 * agree on.
 */
public final class Lexicon {
    private Lexicon() {
    }

    /**
     * The name of the atom heading the canonical form of the index operator, as in {@code [Index 0 target]}.
     */
    public static final String indexExpansion = "Index";

    public static final char indexChar = '.';
    public static final char hashChar = '#';
    public static final char openListChar = '[';
    public static final char closeListChar = ']';
    public static final char openTextChar = '"';
    public static final char closeTextChar = '"';
    public static final char quoteChar = '`';
    public static final char lineCommentChar = ';';
    public static final String openBlockCommentString = "#|";
    public static final String closeBlockCommentString = "|#";

    static final String newlineChars = "\n\r";
    static final String whitespaceChars = "\t " + newlineChars;
    // Legal in atoms, but reserved for future syntax, so names must not use them.
    static final String reservedChars = "(){}\\$:,";
    static final String structureCharsNoTextNoIndex = "#[]`";
    static final String structureCharsNoText = structureCharsNoTextNoIndex + indexChar;
    static final String structureChars = openTextChar + structureCharsNoText;
    static final String illegalNameChars = reservedChars + structureChars + whitespaceChars;

    /**
     * Returns {@code true} iff the given character is skipped between tokens.
     */
    public static boolean isWhitespaceChar(final char c) {
        return whitespaceChars.indexOf(c) >= 0;
    }

    /**
     * Returns {@code true} iff the given character delimits tokens.
     * <p>
     * The index operator {@code .} is a structure character too, except inside a number literal.
     */
    public static boolean isStructureChar(final char c) {
        return structureChars.indexOf(c) >= 0;
    }

    /**
     * Returns {@code true} iff the given character can't appear in an atom.
     */
    public static boolean isNonAtomChar(final char c) {
        return isWhitespaceChar(c) || isStructureChar(c);
    }

    /**
     * Returns {@code true} iff the given character can't appear in a name.
     * <p>
     * Names are atoms that identify things, and are held to a stricter standard than atoms in general: reserved
     * characters are excluded too.
     */
    public static boolean isIllegalNameChar(final char c) {
        return illegalNameChars.indexOf(c) >= 0;
    }

    /**
     * Returns {@code true} iff the given string is a valid name: non-empty, and free of illegal name characters.
     */
    public static boolean isValidName(final String name) {
        if (name.isEmpty()) {
            return false;
        }
        for (int i = 0; i < name.length(); i += 1) {
            if (isIllegalNameChar(name.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns {@code true} iff the given string is wrapped in explicit text delimiters.
     */
    public static boolean isExplicit(final String string) {
        return string.length() >= 2 && string.charAt(0) == openTextChar
            && string.charAt(string.length() - 1) == closeTextChar;
    }

    /**
     * Strips one pair of explicit text delimiters from the given string, if present.
     */
    public static String distill(final String string) {
        return isExplicit(string) ? string.substring(1, string.length() - 1) : string;
    }

    /**
     * Returns {@code true} iff the whole given string is a single number literal.
     */
    public static boolean isNumber(final String string) {
        return !string.isEmpty() && NumberLiteral.scan(string, 0) == string.length();
    }

    /**
     * Returns {@code true} iff the given string has the form of a color literal: a {@code #} followed by
     * ASCII hexadecimal digits that fit in 64 bits. Signs are not allowed.
     */
    public static boolean isColor(final String string) {
        if (string.length() < 2 || string.charAt(0) != hashChar) {
            return false;
        }
        for (int i = 1; i < string.length(); i += 1) {
            final var c = string.charAt(i);
            if (c >= 0x80 || Character.digit(c, 16) < 0) {
                return false;
            }
        }
        try {
            Long.parseUnsignedLong(string, 1, string.length(), 16);
            return true;
        } catch (final NumberFormatException e) {
            return false;
        }
    }

    /**
     * Returns {@code true} iff the given atom text must be written with explicit text delimiters to be read back as
     * the same text: it isn't a color literal, and contains whitespace or a structure character.
     * <p>
     * The {@code "} character is the exception: delimiters can't protect it, so it doesn't call for them either.
     */
    public static boolean shouldBeExplicit(final String string) {
        if (isColor(string)) {
            return false;
        }
        for (int i = 0; i < string.length(); i += 1) {
            final var c = string.charAt(i);
            if (Character.isWhitespace(c) || structureCharsNoText.indexOf(c) >= 0) {
                return true;
            }
        }
        return false;
    }
}
