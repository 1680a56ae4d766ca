// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package sigil.symbol.reader;

import java.util.List;
import sigil.symbol.SymbolOrigin;
import sigil.symbol.origin.OriginPrinter;
import sigil.util.condition.Condition;

/**
 * A condition type indicating that notation text could not be read.
 * <p>
 * Always signaled as fatal; a read never produces a partial symbol tree.
 */
public final class ReadErrorCondition extends Condition {
    /**
     * Initializes a new read error with the given user-readable message, reported at the given origin.
     */
    ReadErrorCondition(
        final String rawMessage,
        final Kind kind,
        final List<String> expected,
        final SymbolOrigin origin
    ) {
        super(rawMessage);
        this.kind = kind;
        this.expected = List.copyOf(expected);
        this.origin = origin;
    }

    /**
     * Retrieves the kind of this read error.
     */
    public Kind kind() {
        return kind;
    }

    /**
     * Retrieves the user-readable descriptions of what the reader would have accepted at the failure position.
     */
    public List<String> expected() {
        return expected;
    }

    /**
     * Retrieves the origin of the failure: it starts at the furthest position the reader reached.
     */
    public SymbolOrigin origin() {
        return origin;
    }

    @Override
    public String detailedMessage() {
        return message() + '\n' + OriginPrinter.print(origin);
    }

    private final Kind kind;
    private final List<String> expected;
    private final SymbolOrigin origin;

    /**
     * The kinds of read errors.
     */
    public enum Kind {
        /**
         * Nothing the notation allows matches the text at the failure position.
         */
        LEXICAL,
        /**
         * A list, text or block comment is still open at the end of input.
         */
        STRUCTURAL,
        /**
         * Lists or quotes are nested deeper than the reader is willing to go.
         */
        NESTING,
    }
}
