// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The symbol reader, turning notation text into {@link sigil.symbol.Symbol} trees, and the CSV adapter built on top of
 * it.
 */
@NonNullByDefault
package sigil.symbol.reader;

import sigil.util.annotation.NonNullByDefault;
