package FSA;

import java.util.ArrayDeque;
import java.util.BitSet;
import java.util.Deque;

import FSA.Model.DeterminizeRecord;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import net.automatalib.alphabet.Alphabet;

public class SubsetConstruction {
    public static boolean DEBUG = false;
    private static final long STATES_EXPLORED_PERIOD = 10000L;

    /**
     * Subset construction. DFA states are numbered in discovery order; state 0 is the set of initial states.
     * Subsets are processed first-in first-out.
     * @param nfa - Original NFA
     * @return - DFA accepting the same language, with a transition for every state and letter
     * @param <I> - Input symbol type, e.g., Character
     */
    public static <I> DeterministicAutomaton<I> determinize(NondeterministicAutomaton<I> nfa) {
        final Alphabet<I> inputs = nfa.getAlphabet();
        final DeterministicAutomaton<I> out = new DeterministicAutomaton<>(inputs);

        // subsets are compared by value; none is modified once stored
        final Object2IntMap<BitSet> outStateMap = new Object2IntOpenHashMap<>();
        outStateMap.defaultReturnValue(DeterministicAutomaton.NO_STATE);
        final Deque<DeterminizeRecord<BitSet>> queue = new ArrayDeque<>();

        // subsets hold positions, not ids
        final StatePositions<I> positions = new StatePositions<>(nfa);
        final BitSet init = positions.initial();
        out.addState(0, true, positions.isAccepting(init));
        outStateMap.put(init, 0);
        queue.add(new DeterminizeRecord<>(init, 0));

        long statesExplored = 0;
        while (!queue.isEmpty()) {
            final DeterminizeRecord<BitSet> curr = queue.poll();
            for (I sym : inputs) {
                final BitSet succ = positions.successors(curr.subset(), sym);
                int outSucc = outStateMap.getInt(succ);
                if (outSucc == DeterministicAutomaton.NO_STATE) {
                    // add new state to DFA and to queue
                    outSucc = outStateMap.size();
                    out.addState(outSucc, false, positions.isAccepting(succ));
                    outStateMap.put(succ, outSucc);
                    queue.add(new DeterminizeRecord<>(succ, outSucc));
                }
                out.addTransition(sym, curr.dfaState(), outSucc);
            }
            statesExplored++;
            if (DEBUG && statesExplored % STATES_EXPLORED_PERIOD == 0) {
                System.out.println("DEBUG: Explored " + statesExplored + " subsets - "
                    + queue.size() + " subsets left in queue - " + out.size() + " states added");
            }
        }
        if (DEBUG) {
            System.out.println("DEBUG: Subset construction: " + nfa.size() + " -> " + out.size() + " states");
        }
        return out;
    }
}
