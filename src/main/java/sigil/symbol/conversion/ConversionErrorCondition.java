// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package sigil.symbol.conversion;

import sigil.symbol.Symbol;
import sigil.symbol.origin.OriginPrinter;
import sigil.util.annotation.Nullable;
import sigil.util.condition.Condition;

/**
 * A condition type indicating that a symbol couldn't be converted into the value its consumer wanted.
 */
public final class ConversionErrorCondition extends Condition {
    /**
     * Initializes a new conversion error with the given user-readable message.
     *
     * @param symbol The symbol that failed to convert, or {@code null} if not available.
     */
    public ConversionErrorCondition(final String message, final @Nullable Symbol symbol) {
        super(message);
        this.symbol = symbol;
    }

    /**
     * Retrieves the symbol that failed to convert, or {@code null} if not available.
     */
    public @Nullable Symbol symbol() {
        return symbol;
    }

    @Override
    public String detailedMessage() {
        return (symbol == null) ? message() : (message() + '\n' + OriginPrinter.tryPrint(symbol.origin()));
    }

    private final @Nullable Symbol symbol;
}
