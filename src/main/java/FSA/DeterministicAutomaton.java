package FSA;

import java.util.Set;

import FSA.Equivalence.PairRefinement;
import FSA.Exceptions.MultipleInitialStatesException;
import FSA.Exceptions.NonDeterministicTransitionException;
import FSA.Model.State;
import FSA.Model.Transition;
import FSA.Model.UnorderedPair;
import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import net.automatalib.alphabet.Alphabet;

/**
 * Deterministic finite automaton: at most one initial state, and at most one transition per state and letter.
 * Missing transitions are allowed until {@link #complete()} is called.
 * @param <I> - Input symbol type
 */
public class DeterministicAutomaton<I> extends AbstractAutomaton<I> {
    public static boolean DEBUG = false;

    /** Returned when there is no initial state or no successor. */
    public static final int NO_STATE = -1;

    private int initialState = NO_STATE;

    public DeterministicAutomaton(Alphabet<I> alphabet) {
        super(alphabet);
    }

    public DeterministicAutomaton(DeterministicAutomaton<I> other) {
        super(other);
        this.initialState = other.initialState;
    }

    @Override
    protected void registerInitial(int id) {
        if (initialState != NO_STATE) {
            throw new MultipleInitialStatesException(initialState, id);
        }
        initialState = id;
    }

    @Override
    protected void checkTransition(State<I> from, Set<I> letters) {
        if (letters.isEmpty()) {
            throw new IllegalArgumentException("DFA transitions need at least one letter");
        }
        for (I letter : letters) {
            for (Transition<I> t : from.getTransitions()) {
                if (t.hasLetter(letter)) {
                    throw new NonDeterministicTransitionException(from.getId(), letter);
                }
            }
        }
    }

    public int getInitialState() {
        return initialState;
    }

    /**
     * The successor of a state by a letter.
     * @return successor id, or NO_STATE if there is no transition on the letter
     */
    public int successor(int stateId, I letter) {
        for (Transition<I> t : getState(stateId).getTransitions()) {
            if (t.hasLetter(letter)) {
                return t.getTarget();
            }
        }
        return NO_STATE;
    }

    @Override
    public boolean accepts(Iterable<? extends I> word) {
        int current = initialState;
        if (current == NO_STATE) {
            return false;
        }
        for (I letter : word) {
            current = successor(current, letter);
            if (current == NO_STATE) {
                return false;
            }
        }
        return getState(current).isAccepting();
    }

    /**
     * Whether every state has a transition on every letter.
     */
    public boolean isTotal() {
        for (State<I> s : states.values()) {
            if (!s.missingLetters(alphabet).isEmpty()) {
                return false;
            }
        }
        return true;
    }

    /**
     * States reachable from the initial state, breadth first.
     */
    public IntSet reachableStates() {
        final IntSet marked = new IntOpenHashSet();
        if (initialState == NO_STATE) {
            return marked;
        }
        final IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
        queue.enqueue(initialState);
        marked.add(initialState);
        while (!queue.isEmpty()) {
            final int stateId = queue.dequeueInt();
            for (Transition<I> t : getState(stateId).getTransitions()) {
                if (marked.add(t.getTarget())) {
                    queue.enqueue(t.getTarget());
                }
            }
        }
        return marked;
    }

    /**
     * A new DFA with only the states reachable from the initial state. This automaton is unchanged.
     */
    public DeterministicAutomaton<I> reachablePart() {
        final IntSet reachable = reachableStates();
        final DeterministicAutomaton<I> result = new DeterministicAutomaton<>(this);
        for (int id : getStateIds()) {
            if (!reachable.contains(id)) {
                result.states.remove(id);
                result.acceptingStates.remove(id);
            }
        }
        // every target of a reachable source is reachable, so no transition dangles
        if (DEBUG) {
            System.out.println("DEBUG: Reachable part: " + size() + " -> " + result.size() + " states");
        }
        return result;
    }

    /**
     * Pairs of distinct states accepting the same language (Myhill-Nerode equivalence).
     * Missing transitions behave as transitions to a non-final sink, so completion is not required.
     */
    public Set<UnorderedPair<Integer>> equivalentStates() {
        return PairRefinement.equivalentPairs(this);
    }

    /**
     * Merge every class of equivalent states into its smallest id. Transitions into merged states are
     * redirected, and transitions of one state that now share a target are folded into one.
     */
    public void mergeEquivalentStates() {
        final Set<UnorderedPair<Integer>> equivalent = equivalentStates();
        if (equivalent.isEmpty()) {
            return;
        }

        // equivalence is transitive, so the smallest partner of a state is its class's smallest id
        final Int2IntMap representative = new Int2IntOpenHashMap();
        for (UnorderedPair<Integer> p : equivalent) {
            final int low = p.getFirst();
            final int high = p.getSecond();
            representative.put(high, Math.min(representative.getOrDefault(high, high), low));
        }

        for (Int2IntMap.Entry e : representative.int2IntEntrySet()) {
            final int merged = e.getIntKey();
            final int primary = e.getIntValue();
            if (merged == initialState) {
                initialState = primary;
                getState(primary).setInitial(true);
            }
            states.remove(merged);
            acceptingStates.remove(merged);
        }

        int folded = 0;
        for (State<I> s : states.values()) {
            folded += s.redirect(t -> representative.getOrDefault(t, t));
        }
        if (DEBUG) {
            System.out.println("DEBUG: Merged " + representative.size() + " states, folded " + folded + " transitions");
        }
    }

    /**
     * The minimal complete DFA accepting the same language. This automaton is unchanged.
     */
    public DeterministicAutomaton<I> minimized() {
        final DeterministicAutomaton<I> result = reachablePart();
        result.complete();
        result.mergeEquivalentStates();
        return result;
    }
}
