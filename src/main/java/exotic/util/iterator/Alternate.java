// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package exotic.util.iterator;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import org.jetbrains.annotations.NotNull;

/**
 * An iterator that yields elements of two source iterators in strict alternation, starting with the first one.
 * <p>
 * Iteration ends the first time the source whose turn it is runs out, and never resumes afterwards, even if the other
 * source still has elements left. Consequently, if the first source has {@code k} elements and the second {@code j},
 * the alternation yields {@code 2 * k} elements when {@code k <= j}, and {@code 2 * j + 1} elements otherwise.
 * <p>
 * The adapter doesn't buffer: each element is pulled from its source only when {@link #next()} is called. Once
 * exhausted, the sources are never touched again.
 * <p>
 * Instances are obtained from {@link ExoticIterators#alternate(Iterator, Iterator)}. They are not thread-safe.
 */
public final class Alternate<T> implements Iterator<T> {
    Alternate(final @NotNull Iterator<? extends T> first, final @NotNull Iterator<? extends T> second) {
        this.first = Objects.requireNonNull(first, "first");
        this.second = Objects.requireNonNull(second, "second");
    }

    /**
     * Returns {@code true} iff the source whose turn it is has another element.
     * <p>
     * The first time this returns {@code false}, the alternation is finished for good. Calling this method repeatedly
     * without calling {@link #next()} in between doesn't change the state of the alternation.
     */
    @Override
    public boolean hasNext() {
        if (finished) {
            return false;
        }
        if (currentSource().hasNext()) {
            return true;
        }
        finished = true;
        secondsTurn = !secondsTurn; // The end of a source takes up a turn too.
        return false;
    }

    /**
     * Returns the next element of the source whose turn it is, and passes the turn to the other source.
     *
     * @throws NoSuchElementException if the alternation is finished
     */
    @Override
    public T next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Alternation is finished");
        }
        final T element = currentSource().next();
        secondsTurn = !secondsTurn;
        return element;
    }

    @Override
    public @NotNull String toString() {
        return "Alternate[turn=" + (secondsTurn ? "second" : "first") + ", finished=" + finished + "]";
    }

    private @NotNull Iterator<? extends T> currentSource() {
        assert !finished : "Sources are no longer consulted once finished";
        return secondsTurn ? second : first;
    }

    private final Iterator<? extends T> first;
    private final Iterator<? extends T> second;
    private boolean secondsTurn = false;
    private boolean finished = false;
}
