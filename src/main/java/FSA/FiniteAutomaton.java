package FSA;

import java.util.Collection;
import java.util.Collections;
import java.util.List;

import FSA.Model.Transition;
import it.unimi.dsi.fastutil.ints.IntSortedSet;
import net.automatalib.alphabet.Alphabet;

/**
 * Operations shared by deterministic and non-deterministic finite automata.
 * States are identified by caller-chosen non-negative ids.
 * @param <I> - Input symbol type, e.g., Character
 */
public interface FiniteAutomaton<I> {

    /**
     * The fixed alphabet, set at construction.
     */
    Alphabet<I> getAlphabet();

    /**
     * Whether this automaton accepts the word. Letters outside the alphabet are not an error;
     * no transition is labeled with them.
     */
    boolean accepts(Iterable<? extends I> word);

    /**
     * Add a state.
     * @param id - non-negative, unused id
     * @param initial - whether the state is initial
     * @param accepting - whether the state is final
     * @throws FSA.Exceptions.DuplicateStateException if id is already used
     * @throws FSA.Exceptions.MultipleInitialStatesException for a second initial state of a DFA
     */
    void addState(int id, boolean initial, boolean accepting);

    default void addState(int id) {
        addState(id, false, false);
    }

    /**
     * Add a transition labeled with letters from one state to another.
     * @throws FSA.Exceptions.UnknownAlphabetLetterException if a letter is not in the alphabet
     * @throws FSA.Exceptions.UnknownStateException if either end does not exist
     * @throws FSA.Exceptions.NonDeterministicTransitionException if a DFA state already has a transition on a letter
     */
    void addTransition(Collection<? extends I> letters, int fromId, int toId);

    default void addTransition(I letter, int fromId, int toId) {
        addTransition(Collections.singleton(letter), fromId, toId);
    }

    /**
     * Complete the automaton with a hole state, so that every state has a transition on every letter.
     * @return whether the automaton was already complete
     */
    boolean complete();

    /**
     * Whether {@link #complete()} has been called.
     */
    boolean isCompleted();

    int size();

    /**
     * State ids in ascending order.
     */
    IntSortedSet getStateIds();

    boolean isInitial(int id);

    boolean isAccepting(int id);

    IntSortedSet getAcceptingStates();

    List<Transition<I>> getTransitions(int id);
}
