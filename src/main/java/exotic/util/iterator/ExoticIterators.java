// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package exotic.util.iterator;

import java.util.Iterator;
import java.util.Objects;
import java.util.function.Predicate;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import org.jetbrains.annotations.NotNull;

/**
 * A utility class containing counting queries over single-pass iterators, and an adapter that alternates between
 * two iterators.
 * <p>
 * Every query consumes the iterator it's given: once a query returns, the iterator is left in an unspecified, but
 * valid, position and shouldn't be used anymore. Queries never pull more elements than are needed to determine the
 * answer, so they are safe to use on unbounded iterators whenever the answer can be known early. Overloads taking an
 * {@link Iterable} obtain exactly one iterator from it.
 * <p>
 * Predicates are applied exactly once per pulled element, in iteration order, so they may be stateful.
 * <p>
 * Exceptions thrown by the given iterators and predicates are passed through to the caller.
 * <p>
 * A negative threshold is never an error: no count can be below it, so such queries are answered without pulling
 * anything. A {@code null} iterator or predicate is reported before pulling anything.
 */
public final class ExoticIterators {
    private ExoticIterators() {
    }

    /**
     * Returns {@code true} iff at least {@code n} elements of the given iterator satisfy the given predicate.
     * <p>
     * Stops pulling as soon as the {@code n}-th matching element is found. If {@code n} is zero or negative, nothing
     * is pulled.
     */
    public static <T> boolean atLeast(
        final @NotNull Iterator<? extends T> source,
        final long n,
        final @NotNull Predicate<? super T> predicate
    ) {
        checkArguments(source, predicate);
        if (n <= 0) {
            return true;
        }
        long matches = 0;
        while (matches < n && source.hasNext()) {
            if (predicate.test(source.next())) {
                matches += 1;
            }
        }
        return matches == n;
    }

    /**
     * Returns {@code true} iff at least {@code n} elements of the given iterable satisfy the given predicate.
     *
     * @see #atLeast(Iterator, long, Predicate)
     */
    public static <T> boolean atLeast(
        final @NotNull Iterable<? extends T> source,
        final long n,
        final @NotNull Predicate<? super T> predicate
    ) {
        return atLeast(iteratorOf(source), n, predicate);
    }

    /**
     * Returns {@code true} iff no more than {@code n} elements of the given iterator satisfy the given predicate.
     * <p>
     * Stops pulling as soon as the {@code (n + 1)}-th matching element is found, otherwise the iterator is drained.
     * If {@code n} is negative, returns {@code false} without pulling anything.
     */
    public static <T> boolean atMost(
        final @NotNull Iterator<? extends T> source,
        final long n,
        final @NotNull Predicate<? super T> predicate
    ) {
        checkArguments(source, predicate);
        if (n < 0) {
            return false;
        }
        long matches = 0;
        while (source.hasNext()) {
            if (predicate.test(source.next())) {
                matches += 1;
                if (matches > n) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * Returns {@code true} iff no more than {@code n} elements of the given iterable satisfy the given predicate.
     *
     * @see #atMost(Iterator, long, Predicate)
     */
    public static <T> boolean atMost(
        final @NotNull Iterable<? extends T> source,
        final long n,
        final @NotNull Predicate<? super T> predicate
    ) {
        return atMost(iteratorOf(source), n, predicate);
    }

    /**
     * Returns {@code true} iff exactly {@code n} elements of the given iterator satisfy the given predicate.
     * <p>
     * Returns {@code false} as soon as the {@code (n + 1)}-th matching element is found. A {@code true} answer always
     * requires draining the iterator. If {@code n} is negative, returns {@code false} without pulling anything.
     */
    public static <T> boolean exactlyN(
        final @NotNull Iterator<? extends T> source,
        final long n,
        final @NotNull Predicate<? super T> predicate
    ) {
        checkArguments(source, predicate);
        if (n < 0) {
            return false;
        }
        long matches = 0;
        while (source.hasNext()) {
            if (predicate.test(source.next())) {
                matches += 1;
                if (matches > n) {
                    return false;
                }
            }
        }
        return matches == n;
    }

    /**
     * Returns {@code true} iff exactly {@code n} elements of the given iterable satisfy the given predicate.
     *
     * @see #exactlyN(Iterator, long, Predicate)
     */
    public static <T> boolean exactlyN(
        final @NotNull Iterable<? extends T> source,
        final long n,
        final @NotNull Predicate<? super T> predicate
    ) {
        return exactlyN(iteratorOf(source), n, predicate);
    }

    /**
     * Returns {@code true} iff exactly {@code m} elements of the given iterator satisfy {@code predicateM} and
     * exactly {@code n} elements satisfy {@code predicateN}.
     * <p>
     * Both predicates are applied to every pulled element, {@code predicateM} first, even if one of them can no
     * longer change the answer. Returns {@code false} as soon as an element pushes either count past its threshold.
     * If either threshold is negative, returns {@code false} without pulling anything.
     */
    public static <T> boolean exactlyMN(
        final @NotNull Iterator<? extends T> source,
        final long m,
        final @NotNull Predicate<? super T> predicateM,
        final long n,
        final @NotNull Predicate<? super T> predicateN
    ) {
        checkArguments(source, predicateM);
        Objects.requireNonNull(predicateN, "predicateN");
        if (m < 0 || n < 0) {
            return false;
        }
        long matchesM = 0;
        long matchesN = 0;
        while (source.hasNext()) {
            final T element = source.next();
            final var passesM = predicateM.test(element);
            final var passesN = predicateN.test(element);
            if (passesM) {
                matchesM += 1;
            }
            if (passesN) {
                matchesN += 1;
            }
            if (matchesM > m || matchesN > n) {
                return false;
            }
        }
        return matchesM == m && matchesN == n;
    }

    /**
     * Returns {@code true} iff exactly {@code m} elements of the given iterable satisfy {@code predicateM} and
     * exactly {@code n} elements satisfy {@code predicateN}.
     *
     * @see #exactlyMN(Iterator, long, Predicate, long, Predicate)
     */
    public static <T> boolean exactlyMN(
        final @NotNull Iterable<? extends T> source,
        final long m,
        final @NotNull Predicate<? super T> predicateM,
        final long n,
        final @NotNull Predicate<? super T> predicateN
    ) {
        return exactlyMN(iteratorOf(source), m, predicateM, n, predicateN);
    }

    /**
     * Returns {@code true} iff either all elements of the given iterator satisfy the given predicate, or none of them
     * do. An empty iterator trivially qualifies.
     * <p>
     * Returns {@code false} as soon as both a passing and a failing element have been seen.
     */
    public static <T> boolean allOrNone(
        final @NotNull Iterator<? extends T> source,
        final @NotNull Predicate<? super T> predicate
    ) {
        checkArguments(source, predicate);
        var seenPass = false;
        var seenFail = false;
        while (source.hasNext()) {
            if (predicate.test(source.next())) {
                seenPass = true;
            } else {
                seenFail = true;
            }
            if (seenPass && seenFail) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns {@code true} iff either all elements of the given iterable satisfy the given predicate, or none of them
     * do.
     *
     * @see #allOrNone(Iterator, Predicate)
     */
    public static <T> boolean allOrNone(
        final @NotNull Iterable<? extends T> source,
        final @NotNull Predicate<? super T> predicate
    ) {
        return allOrNone(iteratorOf(source), predicate);
    }

    /**
     * Returns {@code true} iff the given iterator yields an even number of elements, exactly half of which satisfy
     * the given predicate. An empty iterator trivially qualifies.
     * <p>
     * The answer can't be known before the end, so the iterator is always drained. Never returns if the iterator is
     * unbounded.
     */
    public static <T> boolean perfectlyBalanced(
        final @NotNull Iterator<? extends T> source,
        final @NotNull Predicate<? super T> predicate
    ) {
        checkArguments(source, predicate);
        long total = 0;
        long matches = 0;
        while (source.hasNext()) {
            total += 1;
            if (predicate.test(source.next())) {
                matches += 1;
            }
        }
        return total % 2 == 0 && total / 2 == matches;
    }

    /**
     * Returns {@code true} iff the given iterable yields an even number of elements, exactly half of which satisfy
     * the given predicate.
     *
     * @see #perfectlyBalanced(Iterator, Predicate)
     */
    public static <T> boolean perfectlyBalanced(
        final @NotNull Iterable<? extends T> source,
        final @NotNull Predicate<? super T> predicate
    ) {
        return perfectlyBalanced(iteratorOf(source), predicate);
    }

    /**
     * Returns a lazy iterator that yields elements of the two given iterators in turn, starting with {@code first}.
     * It ends as soon as the iterator whose turn it is runs out, even if the other one still has elements.
     * <p>
     * Both iterators are owned by the returned adapter from now on, and shouldn't be used directly.
     * <p>
     * Complexity: constant time. Nothing is pulled until the adapter is consumed.
     *
     * @see Alternate
     */
    @CheckReturnValue
    public static <T> @NotNull Alternate<T> alternate(
        final @NotNull Iterator<? extends T> first,
        final @NotNull Iterator<? extends T> second
    ) {
        return new Alternate<>(first, second);
    }

    /**
     * Returns a lazy iterator that yields elements of the two given iterables in turn, starting with {@code first}.
     * Exactly one iterator is obtained from each iterable.
     *
     * @see #alternate(Iterator, Iterator)
     */
    @CheckReturnValue
    public static <T> @NotNull Alternate<T> alternate(
        final @NotNull Iterable<? extends T> first,
        final @NotNull Iterable<? extends T> second
    ) {
        return new Alternate<>(iteratorOf(first), iteratorOf(second));
    }

    private static <T> @NotNull Iterator<? extends T> iteratorOf(final @NotNull Iterable<? extends T> iterable) {
        return Objects.requireNonNull(iterable, "source").iterator();
    }

    // Check eagerly, so that bad arguments are reported even when the iterator is empty.
    private static void checkArguments(final @NotNull Iterator<?> source, final @NotNull Predicate<?> predicate) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(predicate, "predicate");
    }
}
