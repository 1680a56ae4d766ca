// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package sigil.symbol;

import sigil.util.annotation.Nullable;

/**
 * The text a symbol was read from.
 * <p>
 * One source is shared by every symbol of a single read.
 *
 * @param sourceId The identity of the text, usually a file path, or {@code null} if it has none.
 * @param text     The whole text that was read.
 */
public record SymbolSource(@Nullable String sourceId, String text) {
    /**
     * Returns a short user-readable description of this source, for operation traces.
     */
    public String describe() {
        return (sourceId != null) ? sourceId : "anonymous text";
    }
}
