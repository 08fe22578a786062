package FSA;

import java.util.BitSet;
import java.util.Set;

import FSA.Model.State;
import it.unimi.dsi.fastutil.ints.IntRBTreeSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;
import it.unimi.dsi.fastutil.ints.IntSortedSets;
import net.automatalib.alphabet.Alphabet;

/**
 * Non-deterministic finite automaton: any number of initial states, any number of transitions per
 * state and letter. A transition with an empty label set is taken on every letter; it still consumes
 * the letter, so this is not an epsilon closure.
 * @param <I> - Input symbol type
 */
public class NondeterministicAutomaton<I> extends AbstractAutomaton<I> {
    private final IntSortedSet initialStates;

    public NondeterministicAutomaton(Alphabet<I> alphabet) {
        super(alphabet);
        this.initialStates = new IntRBTreeSet();
    }

    public NondeterministicAutomaton(NondeterministicAutomaton<I> other) {
        super(other);
        this.initialStates = new IntRBTreeSet(other.initialStates);
    }

    @Override
    protected void registerInitial(int id) {
        initialStates.add(id);
    }

    @Override
    protected void checkTransition(State<I> from, Set<I> letters) {
        // no restriction
    }

    public IntSortedSet getInitialStates() {
        return IntSortedSets.unmodifiable(initialStates);
    }

    @Override
    public boolean accepts(Iterable<? extends I> word) {
        final StatePositions<I> positions = new StatePositions<>(this);
        BitSet current = positions.initial();
        for (I letter : word) {
            current = positions.successors(current, letter);
        }
        return positions.isAccepting(current);
    }

    /**
     * A DFA accepting the same language, by subset construction. This automaton is unchanged.
     */
    public DeterministicAutomaton<I> determinized() {
        return SubsetConstruction.determinize(this);
    }
}
