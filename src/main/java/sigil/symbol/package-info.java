// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Representation of symbols, the values of the sigil notation, as Java objects, together with the lexical rules of
 * the notation.
 * <p>
 * A symbol is one of an atom ({@code None}), a number ({@code -5}, {@code 0.0f}), a text ({@code "with spaces"}),
 * a quote ({@code `[Some 1]}) or a list of symbols ({@code [AnimationData 4 8]}). Symbols read from text remember
 * where they came from, see {@link sigil.symbol.SymbolOrigin}.
 */
@NonNullByDefault
package sigil.symbol;

import sigil.util.annotation.NonNullByDefault;
