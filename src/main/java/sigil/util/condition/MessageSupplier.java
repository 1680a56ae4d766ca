// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package sigil.util.condition;

/**
 * A lazily evaluated user-readable message.
 */
@FunctionalInterface
public interface MessageSupplier {
    String get();
}
