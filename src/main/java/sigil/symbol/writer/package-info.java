// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The symbol writer, turning {@link sigil.symbol.Symbol} trees back into canonical notation text.
 */
@NonNullByDefault
package sigil.symbol.writer;

import sigil.util.annotation.NonNullByDefault;
