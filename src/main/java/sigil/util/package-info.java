// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Small utilities shared by the notation engine: operation traces and control flow helpers.
 */
@NonNullByDefault
package sigil.util;

import sigil.util.annotation.NonNullByDefault;
