// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Rendering of symbol origins as user-readable source excerpts.
 */
@NonNullByDefault
package sigil.symbol.origin;

import sigil.util.annotation.NonNullByDefault;
