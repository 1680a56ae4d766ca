// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package sigil.symbol.conversion;

import sigil.symbol.Symbol;
import sigil.symbol.writer.Writer;
import sigil.util.annotation.Nullable;
import sigil.util.condition.ConditionContext;
import sigil.util.condition.UnhandledErrorError;

/**
 * A utility class for code converting symbols into other values.
 */
public final class Conversions {
    private Conversions() {
    }

    /**
     * Signals a fatal {@link ConversionErrorCondition} with the given message, followed by the written form of the
     * given symbol if there is one.
     * <p>
     * Never returns normally; declared to return {@link UnhandledErrorError} so that call sites can write
     * {@code throw Conversions.fail(...)}.
     *
     * @param symbol The symbol that failed to convert, or {@code null} if not available.
     */
    public static UnhandledErrorError fail(final String message, final @Nullable Symbol symbol) {
        final var fullMessage = (symbol != null)
            ? (message + "\nConversion source: " + Writer.write(symbol))
            : (message + "\nConversion source not available.");
        throw ConditionContext.error(new ConversionErrorCondition(fullMessage, symbol));
    }
}
