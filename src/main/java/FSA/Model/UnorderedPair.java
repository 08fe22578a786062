package FSA.Model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable pair where {@code (a, b)} equals {@code (b, a)}.
 * Elements are stored in ascending order, so {@link #getFirst()} is never greater than {@link #getSecond()}.
 * @param <T> - element type
 */
public final class UnorderedPair<T extends Comparable<? super T>> {
    private final T first;
    private final T second;

    private UnorderedPair(T a, T b) {
        Objects.requireNonNull(a, "pair element cannot be null");
        Objects.requireNonNull(b, "pair element cannot be null");
        if (a.compareTo(b) <= 0) {
            this.first = a;
            this.second = b;
        } else {
            this.first = b;
            this.second = a;
        }
    }

    public static <T extends Comparable<? super T>> UnorderedPair<T> of(T a, T b) {
        return new UnorderedPair<>(a, b);
    }

    public T getFirst() {
        return first;
    }

    public T getSecond() {
        return second;
    }

    /**
     * Every unordered pair of two distinct positions of the collection, each exactly once.
     * For {@code [1, 2, 3]}: {@code (1, 2), (1, 3), (2, 3)}.
     */
    public static <T extends Comparable<? super T>> List<UnorderedPair<T>> uniquePairs(Iterable<? extends T> elements) {
        final List<T> list = new ArrayList<>();
        elements.forEach(list::add);
        final int n = list.size();
        final List<UnorderedPair<T>> result = new ArrayList<>(n * Math.max(n - 1, 0) / 2);
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                result.add(of(list.get(i), list.get(j)));
            }
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        UnorderedPair<?> that = (UnorderedPair<?>) o;
        return first.equals(that.first) && second.equals(that.second);
    }

    @Override
    public int hashCode() {
        return Objects.hash(first, second);
    }

    @Override
    public String toString() {
        return "(" + first + ", " + second + ")";
    }
}
