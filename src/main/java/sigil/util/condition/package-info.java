// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Common Lisp-inspired condition and restart system.
 * <p>
 * Every failure the notation engine reports, from malformed input to an unconvertible symbol, is a
 * {@link sigil.util.condition.Condition} signaled through {@link sigil.util.condition.ConditionContext}. Callers
 * decide what happens next by installing a {@link sigil.util.condition.Handler}, which runs <em>before</em> the stack
 * is unwound and may transfer control to a {@link sigil.util.condition.Restart}.
 */
@NonNullByDefault
package sigil.util.condition;

import sigil.util.annotation.NonNullByDefault;
