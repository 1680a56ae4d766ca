// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package sigil.symbol;

/**
 * The number literal grammar.
 * <p>
 * A number literal is an optional sign followed by either a hexadecimal number
 * ({@code 0x1F}, {@code 0x1.8p3}) or a decimal one ({@code 5}, {@code 0.5}, {@code 1.}, {@code 1e-3}), followed by up
 * to {@value #maxSuffixLength} ASCII letters of type suffix ({@code 0.0f}, {@code 10UL}).
 * <p>
 * The scanner only recognizes the literal; whether it's followed by something that makes it a number token rather than
 * the prefix of an atom is up to the reader.
 */
public final class NumberLiteral {
    private NumberLiteral() {
    }

    /**
     * The maximum number of type suffix characters retained after a literal.
     */
    public static final int maxSuffixLength = 4;

    /**
     * Scans a number literal starting at the given offset of the given text.
     *
     * @return The length of the literal, suffix included, or {@code -1} if there's no number literal at the offset.
     */
    public static int scan(final CharSequence text, final int offset) {
        final var scanner = new Scanner(text, offset);
        return scanner.scanLiteral() ? scanner.position - offset : -1;
    }

    private static final class Scanner {
        private Scanner(final CharSequence text, final int offset) {
            this.text = text;
            position = offset;
        }

        private boolean scanLiteral() {
            skipIf('+', '-');
            final var isHexadecimal = peek() == '0' && (peekAt(1) == 'x' || peekAt(1) == 'X');
            final var scannedNumber = isHexadecimal ? scanHexadecimal() : scanDecimal();
            if (!scannedNumber) {
                return false;
            }
            scanSuffix();
            return true;
        }

        private boolean scanDecimal() {
            // The fractional part needs an integer part in front of it, .5 is not a number.
            if (skipDigits(10) == 0) {
                return false;
            }
            if (peek() == '.') {
                position += 1;
                skipDigits(10);
            }
            return scanExponent('e', 'E');
        }

        private boolean scanHexadecimal() {
            position += 2;
            if (skipDigits(16) == 0) {
                return false;
            }
            if (peek() == '.') {
                position += 1;
                skipDigits(16);
            }
            return scanExponent('p', 'P');
        }

        // An exponent marker not followed by digits makes the whole literal invalid.
        private boolean scanExponent(final char marker, final char upperMarker) {
            if (!skipIf(marker, upperMarker)) {
                return true;
            }
            skipIf('+', '-');
            return skipDigits(10) > 0;
        }

        private void scanSuffix() {
            for (int i = 0; i < maxSuffixLength && isAsciiLetter(peek()); i += 1) {
                position += 1;
            }
        }

        private int skipDigits(final int radix) {
            final var start = position;
            while (isDigit(peek(), radix)) {
                position += 1;
            }
            return position - start;
        }

        private boolean skipIf(final char c1, final char c2) {
            final var c = peek();
            if (c == c1 || c == c2) {
                position += 1;
                return true;
            }
            return false;
        }

        private char peek() {
            return peekAt(0);
        }

        private char peekAt(final int lookahead) {
            final var index = position + lookahead;
            return (index < text.length()) ? text.charAt(index) : endOfText;
        }

        private static boolean isDigit(final char c, final int radix) {
            return c < 0x80 && Character.digit(c, radix) >= 0;
        }

        private static boolean isAsciiLetter(final char c) {
            return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
        }

        private static final char endOfText = '\uFFFF';

        private final CharSequence text;
        private int position;
    }
}
