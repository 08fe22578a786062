package FSA.Model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Labeled edge, owned by its source state. An empty label set is an unlabeled edge.
 * @param <I> - Input symbol type, e.g., Character
 */
public final class Transition<I> {
    private final Set<I> letters;
    private final int target;

    public Transition(Collection<? extends I> letters, int target) {
        this.letters = Collections.unmodifiableSet(new LinkedHashSet<>(Objects.requireNonNull(letters)));
        this.target = target;
    }

    public Set<I> getLetters() {
        return letters;
    }

    public int getTarget() {
        return target;
    }

    public boolean isEpsilon() {
        return letters.isEmpty();
    }

    public boolean hasLetter(I letter) {
        return letters.contains(letter);
    }

    /**
     * Whether this edge may be taken while reading the letter.
     * Unlabeled edges are taken on every letter.
     */
    public boolean isEnabledBy(I letter) {
        return isEpsilon() || hasLetter(letter);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Transition<?> that = (Transition<?>) o;
        return target == that.target && letters.equals(that.letters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(letters, target);
    }

    @Override
    public String toString() {
        return "-" + (isEpsilon() ? "ε" : letters.toString()) + "-> " + target;
    }
}
