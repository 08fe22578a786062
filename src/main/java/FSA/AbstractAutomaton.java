package FSA;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import FSA.Exceptions.DuplicateStateException;
import FSA.Exceptions.UnknownAlphabetLetterException;
import FSA.Exceptions.UnknownStateException;
import FSA.Model.State;
import FSA.Model.Transition;
import it.unimi.dsi.fastutil.ints.Int2ObjectLinkedOpenHashMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectRBTreeMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectSortedMap;
import it.unimi.dsi.fastutil.ints.IntRBTreeSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;
import it.unimi.dsi.fastutil.ints.IntSortedSets;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;

/**
 * State arena, validation and completion shared by both automaton variants.
 * Variants decide how initial states are recorded and which transitions are allowed.
 * @param <I> - Input symbol type
 */
public abstract class AbstractAutomaton<I> implements FiniteAutomaton<I> {
    protected final Alphabet<I> alphabet;
    protected final Int2ObjectSortedMap<State<I>> states;
    protected final IntSortedSet acceptingStates;
    protected boolean completed;

    protected AbstractAutomaton(Alphabet<I> alphabet) {
        this.alphabet = Alphabets.fromCollection(Objects.requireNonNull(alphabet, "alphabet cannot be null"));
        this.states = new Int2ObjectRBTreeMap<>();
        this.acceptingStates = new IntRBTreeSet();
        this.completed = false;
    }

    /**
     * Deep copy; the copy shares no mutable structure with other.
     */
    protected AbstractAutomaton(AbstractAutomaton<I> other) {
        this.alphabet = other.alphabet; // immutable
        this.states = new Int2ObjectRBTreeMap<>();
        for (State<I> s : other.states.values()) {
            this.states.put(s.getId(), new State<>(s));
        }
        this.acceptingStates = new IntRBTreeSet(other.acceptingStates);
        this.completed = other.completed;
    }

    /**
     * Validate and record an initial state. Called before the state is inserted, so throwing here leaves
     * the automaton unchanged.
     */
    protected abstract void registerInitial(int id);

    /**
     * Validate a transition against the variant's rules, before it is inserted.
     */
    protected abstract void checkTransition(State<I> from, Set<I> letters);

    @Override
    public Alphabet<I> getAlphabet() {
        return alphabet;
    }

    @Override
    public void addState(int id, boolean initial, boolean accepting) {
        if (id < 0) {
            throw new IllegalArgumentException("State ids must be non-negative: " + id);
        }
        if (states.containsKey(id)) {
            throw new DuplicateStateException(id);
        }
        if (initial) {
            registerInitial(id);
        }
        states.put(id, new State<>(id, initial, accepting));
        if (accepting) {
            acceptingStates.add(id);
        }
    }

    @Override
    public void addTransition(Collection<? extends I> letters, int fromId, int toId) {
        Objects.requireNonNull(letters, "letters cannot be null");
        final Set<I> unknown = AlphabetUtils.unknownLetters(letters, alphabet);
        if (!unknown.isEmpty()) {
            throw new UnknownAlphabetLetterException(unknown);
        }
        final State<I> from = getState(fromId);
        getState(toId);

        final Set<I> letterSet = new LinkedHashSet<>(letters);
        checkTransition(from, letterSet);
        from.addTransition(new Transition<>(letterSet, toId));
    }

    @Override
    public boolean complete() {
        // collect first; the hole id depends on the full state set
        final Int2ObjectMap<Set<I>> deficient = new Int2ObjectLinkedOpenHashMap<>();
        for (State<I> s : states.values()) {
            final Set<I> missing = s.missingLetters(alphabet);
            if (!missing.isEmpty()) {
                deficient.put(s.getId(), missing);
            }
        }

        if (!deficient.isEmpty()) {
            final int hole = freshStateId();
            addState(hole);
            addTransition(alphabet, hole, hole);
            for (Int2ObjectMap.Entry<Set<I>> e : deficient.int2ObjectEntrySet()) {
                addTransition(e.getValue(), e.getIntKey(), hole);
            }
        }

        completed = true;
        return deficient.isEmpty();
    }

    @Override
    public boolean isCompleted() {
        return completed;
    }

    /**
     * An id not used by any state: one more than the greatest id, or the greatest unused id on overflow.
     */
    protected int freshStateId() {
        if (states.isEmpty()) {
            return 0;
        }
        final int last = states.lastIntKey();
        if (last < Integer.MAX_VALUE) {
            return last + 1;
        }
        int candidate = Integer.MAX_VALUE;
        while (states.containsKey(candidate)) {
            candidate--;
        }
        return candidate;
    }

    @Override
    public int size() {
        return states.size();
    }

    @Override
    public IntSortedSet getStateIds() {
        return IntSortedSets.unmodifiable(states.keySet());
    }

    @Override
    public boolean isInitial(int id) {
        return getState(id).isInitial();
    }

    @Override
    public boolean isAccepting(int id) {
        return getState(id).isAccepting();
    }

    @Override
    public IntSortedSet getAcceptingStates() {
        return IntSortedSets.unmodifiable(acceptingStates);
    }

    @Override
    public List<Transition<I>> getTransitions(int id) {
        return getState(id).getTransitions();
    }

    protected State<I> getState(int id) {
        final State<I> state = states.get(id);
        if (state == null) {
            throw new UnknownStateException(id);
        }
        return state;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(alphabet=" + alphabet + ", states=" + states.values() + ")";
    }
}
