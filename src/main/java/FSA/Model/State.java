package FSA.Model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.IntUnaryOperator;

import it.unimi.dsi.fastutil.ints.Int2ObjectLinkedOpenHashMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;

/**
 * A state record in an automaton's arena. Edges refer to their targets by id.
 * @param <I> - Input symbol type
 */
public final class State<I> {
    private final int id;
    private boolean initial;
    private final boolean accepting;
    private final List<Transition<I>> transitions;

    public State(int id, boolean initial, boolean accepting) {
        this.id = id;
        this.initial = initial;
        this.accepting = accepting;
        this.transitions = new ArrayList<>();
    }

    /**
     * Deep copy. Transitions are immutable, so only the list is copied.
     */
    public State(State<I> other) {
        this.id = other.id;
        this.initial = other.initial;
        this.accepting = other.accepting;
        this.transitions = new ArrayList<>(other.transitions);
    }

    public int getId() {
        return id;
    }

    public boolean isInitial() {
        return initial;
    }

    public void setInitial(boolean initial) {
        this.initial = initial;
    }

    public boolean isAccepting() {
        return accepting;
    }

    public List<Transition<I>> getTransitions() {
        return Collections.unmodifiableList(transitions);
    }

    public void addTransition(Transition<I> transition) {
        transitions.add(transition);
    }

    /**
     * Union of the letter sets of all outgoing transitions.
     */
    public Set<I> outgoingLetters() {
        final Set<I> result = new HashSet<>();
        for (Transition<I> t : transitions) {
            result.addAll(t.getLetters());
        }
        return result;
    }

    /**
     * Letters of the alphabet that no outgoing transition is labeled with.
     */
    public Set<I> missingLetters(Collection<I> alphabet) {
        final Set<I> result = new LinkedHashSet<>(alphabet);
        result.removeAll(outgoingLetters());
        return result;
    }

    /**
     * Retarget every transition through the mapping, then fold transitions that now share a target
     * into one, keeping the first occurrence's position.
     * @param mapping - old target -> new target
     * @return number of transitions removed by folding
     */
    public int redirect(IntUnaryOperator mapping) {
        final Int2ObjectMap<Set<I>> byTarget = new Int2ObjectLinkedOpenHashMap<>();
        for (Transition<I> t : transitions) {
            final int target = mapping.applyAsInt(t.getTarget());
            Set<I> letters = byTarget.get(target);
            if (letters == null) {
                letters = new LinkedHashSet<>();
                byTarget.put(target, letters);
            }
            letters.addAll(t.getLetters());
        }
        final int before = transitions.size();
        transitions.clear();
        for (Int2ObjectMap.Entry<Set<I>> e : byTarget.int2ObjectEntrySet()) {
            transitions.add(new Transition<>(e.getValue(), e.getIntKey()));
        }
        return before - transitions.size();
    }

    @Override
    public String toString() {
        return (initial ? "->" : "") + id + (accepting ? "*" : "") + " " + transitions;
    }
}
