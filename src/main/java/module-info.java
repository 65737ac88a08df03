// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Counting queries over single-pass iterators, and the alternating merge of two iterators.
 */
module exotic {
    requires static org.jetbrains.annotations;
    requires static com.github.spotbugs.annotations;
    exports exotic.util.iterator;
}
