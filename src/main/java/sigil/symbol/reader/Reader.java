// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package sigil.symbol.reader;

import java.util.ArrayList;
import java.util.List;
import sigil.symbol.Lexicon;
import sigil.symbol.NumberLiteral;
import sigil.symbol.Symbol;
import sigil.symbol.SymbolOrigin;
import sigil.symbol.SymbolPosition;
import sigil.symbol.SymbolSource;
import sigil.symbol.Symbols;
import sigil.util.Trace;
import sigil.util.annotation.Nullable;
import sigil.util.condition.ConditionContext;
import sigil.util.condition.UnhandledErrorError;

/**
 * The symbol reader: the primary means of converting notation text into a {@link Symbol}.
 * <p>
 * Reads the following, and every combination thereof:
 * <pre>
 * None                         ; atoms
 * 0.0f  -5  0x1F               ; numbers
 * "String with quoted spaces." ; texts
 * `[Some 1]                    ; quotes
 * []  [Some 0]  [[0 1] [2 4]]  ; lists
 * #FF000080                    ; colors, read as [1.0 0.0 0.0 0.5019608]
 * target.indexer  target.0     ; index operator, read as [Index indexer target]
 * </pre>
 * Whitespace, {@code ;} line comments and {@code #| |#} block comments are skipped between symbols. Block comments do
 * not nest: the first {@code |#} closes the comment.
 */
public final class Reader {
    private Reader(final SymbolSource source) {
        this.source = source;
        cursor = new SourceCursor(source);
    }

    /**
     * Reads the given text as a single symbol, optionally surrounded by whitespace and comments.
     * <p>
     * Every symbol read, the members of color literals aside, carries its {@link SymbolOrigin} within a
     * {@link SymbolSource} made of {@code text} and {@code sourceId}.
     * <p>
     * If the text is not exactly one symbol, a fatal {@link ReadErrorCondition} is signaled, reporting the furthest
     * position the reader reached.
     *
     * @param text     The notation text to read.
     * @param sourceId The identity of the text for diagnostics, usually a file path, or {@code null} if it has none.
     */
    public static Symbol read(final String text, final @Nullable String sourceId) {
        final var source = new SymbolSource(sourceId, text);
        try (final var trace = new Trace(() -> "Reading a symbol from " + source.describe())) {
            trace.use();
            return new Reader(source).readWhole();
        }
    }

    private Symbol readWhole() {
        skipWhitespace();
        final var symbol = readSymbol();
        if (symbol == null) {
            throw signalReadError();
        }
        if (!cursor.reachedEnd()) {
            expected("end of input");
            throw signalReadError();
        }
        return symbol;
    }

    // Every read* method either returns a symbol and leaves the cursor after its trailing whitespace, or returns null
    // and leaves the cursor where it was.

    private @Nullable Symbol readSymbol() {
        currentDepth += 1;
        try {
            if (currentDepth > maxDepth) {
                furthestPosition = cursor.position();
                furthestExpected.clear();
                throw signalReadError(ReadErrorCondition.Kind.NESTING, "Recursion limit reached, try to limit nesting");
            }
            final var start = cursor.position();
            var target = readOperand();
            if (target == null) {
                return null;
            }
            // The index operator is left-associative: a.b.c is (a.b).c.
            while (cursor.peekIs(Lexicon.indexChar)) {
                final var operatorStart = cursor.position();
                final var targetStop = lastStop;
                cursor.discardPeek();
                final var operatorOrigin = new SymbolOrigin(source, operatorStart, finishToken());
                final var indexer = readOperand();
                if (indexer == null) {
                    cursor.reset(operatorStart);
                    lastStop = targetStop;
                    return target;
                }
                target = expandIndex(target, indexer, operatorOrigin, new SymbolOrigin(source, start, lastStop));
            }
            return target;
        } finally {
            currentDepth -= 1;
        }
    }

    private @Nullable Symbol readOperand() {
        final var start = cursor.position();
        if (cursor.reachedEnd()) {
            expected("symbol");
            return null;
        }
        final var symbol = switch (cursor.peek()) {
            case Lexicon.hashChar -> readColor(start);
            case Lexicon.quoteChar -> readQuote(start);
            case Lexicon.openTextChar -> readText(start);
            case Lexicon.openListChar -> readList(start);
            default -> readNumberOrAtom(start);
        };
        if (symbol == null) {
            cursor.reset(start);
            expected("symbol");
        }
        return symbol;
    }

    private @Nullable Symbol readColor(final SymbolPosition start) {
        cursor.discardPeek();
        final var digitsStart = cursor.index();
        while (!cursor.reachedEnd() && Character.digit(cursor.peek(), 16) >= 0 && cursor.peek() < 0x80) {
            cursor.discardPeek();
        }
        if (cursor.index() == digitsStart) {
            expected("hexadecimal digit");
            return null;
        }
        final var packed = parseColor(cursor.text().substring(digitsStart, cursor.index()));
        final var origin = new SymbolOrigin(source, start, finishToken());
        return new Symbol.List(
            List.of(
                colorComponent(packed >>> 24),
                colorComponent(packed >>> 16),
                colorComponent(packed >>> 8),
                colorComponent(packed)
            ),
            origin
        );
    }

    private @Nullable Symbol readQuote(final SymbolPosition start) {
        cursor.discardPeek();
        final var quoted = readSymbol();
        if (quoted == null) {
            return null;
        }
        // The quoted symbol already skipped the trailing whitespace.
        return new Symbol.Quote(quoted, new SymbolOrigin(source, start, lastStop));
    }

    private @Nullable Symbol readText(final SymbolPosition start) {
        cursor.discardPeek();
        final var contentStart = cursor.index();
        while (!cursor.reachedEnd() && cursor.peek() != Lexicon.closeTextChar) {
            cursor.discardPeek();
        }
        if (cursor.reachedEnd()) {
            expected("closing '" + Lexicon.closeTextChar + "'");
            return null;
        }
        final var content = cursor.text().substring(contentStart, cursor.index());
        cursor.discardPeek();
        return new Symbol.Text(content, new SymbolOrigin(source, start, finishToken()));
    }

    private @Nullable Symbol readList(final SymbolPosition start) {
        cursor.discardPeek();
        skipWhitespace();
        final var items = new ArrayList<Symbol>();
        while (!cursor.peekIs(Lexicon.closeListChar)) {
            final var item = readSymbol();
            if (item == null) {
                expected("closing '" + Lexicon.closeListChar + "'");
                return null;
            }
            items.add(item);
        }
        cursor.discardPeek();
        return new Symbol.List(items, new SymbolOrigin(source, start, finishToken()));
    }

    private @Nullable Symbol readNumberOrAtom(final SymbolPosition start) {
        final var number = readNumber(start);
        return (number != null) ? number : readAtom(start);
    }

    private @Nullable Symbol readNumber(final SymbolPosition start) {
        final var length = NumberLiteral.scan(cursor.text(), cursor.index());
        if (length < 0) {
            return null;
        }
        // A number must be followed by whitespace, a structure character or the end, otherwise it's part of an atom.
        final var end = cursor.index() + length;
        if (end < cursor.text().length() && !Lexicon.isNonAtomChar(cursor.text().charAt(end))) {
            return null;
        }
        final var literal = cursor.text().substring(cursor.index(), end);
        cursor.discard(length);
        return new Symbol.Number(literal, new SymbolOrigin(source, start, finishToken()));
    }

    private @Nullable Symbol readAtom(final SymbolPosition start) {
        final var atomStart = cursor.index();
        while (!cursor.reachedEnd() && !Lexicon.isNonAtomChar(cursor.peek())) {
            cursor.discardPeek();
        }
        if (cursor.index() == atomStart) {
            return null;
        }
        final var atom = cursor.text().substring(atomStart, cursor.index()).stripTrailing();
        return new Symbol.Atom(atom, new SymbolOrigin(source, start, finishToken()));
    }

    private Symbol expandIndex(
        final Symbol target,
        final Symbol indexer,
        final SymbolOrigin operatorOrigin,
        final SymbolOrigin origin
    ) {
        final var indexAtom = new Symbol.Atom(Lexicon.indexExpansion, operatorOrigin);
        final var indexerItems = Symbols.asList(indexer);
        final var effectiveIndexer =
            (indexerItems != null && indexerItems.size() == 1 && indexerItems.get(0) instanceof Symbol.Number number)
                ? number
                : indexer;
        return new Symbol.List(List.of(indexAtom, effectiveIndexer, target), origin);
    }

    /**
     * Records the end of the token just consumed and skips the whitespace following it.
     *
     * @return The position right after the token.
     */
    private SymbolPosition finishToken() {
        final var stop = cursor.position();
        lastStop = stop;
        skipWhitespace();
        return stop;
    }

    private void skipWhitespace() {
        while (!cursor.reachedEnd()) {
            final var c = cursor.peek();
            if (c == Lexicon.lineCommentChar) {
                skipLineComment();
            } else if (cursor.lookingAt(Lexicon.openBlockCommentString)) {
                skipBlockComment();
            } else if (Lexicon.isWhitespaceChar(c)) {
                cursor.discardPeek();
            } else {
                return;
            }
        }
    }

    private void skipLineComment() {
        while (!cursor.reachedEnd() && !cursor.peekIs('\n') && !cursor.peekIs('\r')) {
            cursor.discardPeek();
        }
    }

    private void skipBlockComment() {
        cursor.discard(Lexicon.openBlockCommentString.length());
        // Block comments don't nest, an inner opening is just part of the comment.
        if (!cursor.discardUntil(Lexicon.closeBlockCommentString)) {
            expected("closing '" + Lexicon.closeBlockCommentString + "'");
            throw signalReadError();
        }
        cursor.discard(Lexicon.closeBlockCommentString.length());
    }

    private void expected(final String description) {
        final var index = cursor.index();
        if (index > furthestPosition.index()) {
            furthestPosition = cursor.position();
            furthestExpected.clear();
        }
        if (index == furthestPosition.index() && !furthestExpected.contains(description)) {
            furthestExpected.add(description);
        }
    }

    private UnhandledErrorError signalReadError() {
        final var atEnd = furthestPosition.index() >= cursor.text().length();
        final var unterminated = furthestExpected.stream().anyMatch(e -> e.startsWith("closing "));
        final var kind = (atEnd && unterminated) ? ReadErrorCondition.Kind.STRUCTURAL : ReadErrorCondition.Kind.LEXICAL;
        final var found = atEnd ? "end of input" : ("'" + cursor.text().charAt(furthestPosition.index()) + "'");
        return signalReadError(kind, "Expected " + String.join(" or ", furthestExpected) + " but found " + found);
    }

    private UnhandledErrorError signalReadError(final ReadErrorCondition.Kind kind, final String message) {
        final var atLineEnd = furthestPosition.index() >= cursor.text().length()
            || Lexicon.isWhitespaceChar(cursor.text().charAt(furthestPosition.index()));
        final var stop = atLineEnd ? furthestPosition : furthestPosition.nextColumn();
        final var origin = new SymbolOrigin(source, furthestPosition, stop);
        throw ConditionContext.error(new ReadErrorCondition(message, kind, furthestExpected, origin));
    }

    private static Symbol colorComponent(final int packed) {
        return new Symbol.Number(Float.toString((packed & 0xFF) / 255.0f), null);
    }

    // Hex that doesn't fit in 32 bits reads as transparent black rather than failing.
    private static int parseColor(final String hex) {
        try {
            return Integer.parseUnsignedInt(hex, 16);
        } catch (final NumberFormatException e) {
            return 0;
        }
    }

    private static final int maxDepth = 1000;

    private final SymbolSource source;
    private final SourceCursor cursor;
    private SymbolPosition lastStop = SymbolPosition.start();
    private SymbolPosition furthestPosition = SymbolPosition.start();
    private final List<String> furthestExpected = new ArrayList<>();
    private int currentDepth = 0;
}
