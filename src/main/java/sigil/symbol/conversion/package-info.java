// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Failure reporting for code converting symbols into other values.
 */
@NonNullByDefault
package sigil.symbol.conversion;

import sigil.util.annotation.NonNullByDefault;
