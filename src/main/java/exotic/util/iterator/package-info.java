// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Counting queries over single-pass iterators, and the alternating merge of two iterators.
 */
package exotic.util.iterator;
