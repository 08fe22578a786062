package FSA;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

import FSA.Model.Transition;
import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;

/**
 * Dense numbering of an NFA's states: position p stands for the p-th smallest id.
 * State sets are BitSets over positions, so their size follows the number of states, not the largest id.
 * A snapshot; states or transitions added to the NFA afterwards are not seen.
 * @param <I> - Input symbol type
 */
final class StatePositions<I> {
  private final int[] ids;
  private final boolean[] accepting;
  private final BitSet initial;
  // transitions[p] holds the transitions of the state at position p
  private final List<List<Transition<I>>> transitions;
  // target positions, parallel to transitions
  private final int[][] targets;

  StatePositions(NondeterministicAutomaton<I> nfa) {
    ids = nfa.getStateIds().toIntArray();
    final int nStates = ids.length;
    final Int2IntMap index = new Int2IntOpenHashMap(nStates);
    for (int p = 0; p < nStates; p++) {
      index.put(ids[p], p);
    }

    accepting = new boolean[nStates];
    initial = new BitSet(nStates);
    transitions = new ArrayList<>(nStates);
    targets = new int[nStates][];
    for (int p = 0; p < nStates; p++) {
      accepting[p] = nfa.isAccepting(ids[p]);
      if (nfa.isInitial(ids[p])) {
        initial.set(p);
      }
      final List<Transition<I>> out = new ArrayList<>(nfa.getTransitions(ids[p]));
      transitions.add(out);
      targets[p] = new int[out.size()];
      for (int i = 0; i < out.size(); i++) {
        targets[p][i] = index.get(out.get(i).getTarget());
      }
    }
  }

  /**
   * @return a new set with the positions of the initial states
   */
  BitSet initial() {
    return (BitSet) initial.clone();
  }

  /**
   * Positions reached from any position of the set by a transition enabled by the letter.
   * @return a new set; the argument is not modified
   */
  BitSet successors(BitSet positions, I letter) {
    final BitSet result = new BitSet(ids.length);
    for (int p = positions.nextSetBit(0); p >= 0; p = positions.nextSetBit(p + 1)) {
      final List<Transition<I>> out = transitions.get(p);
      for (int i = 0; i < out.size(); i++) {
        if (out.get(i).isEnabledBy(letter)) {
          result.set(targets[p][i]);
        }
      }
    }
    return result;
  }

  boolean isAccepting(BitSet positions) {
    for (int p = positions.nextSetBit(0); p >= 0; p = positions.nextSetBit(p + 1)) {
      if (accepting[p]) {
        return true;
      }
    }
    return false;
  }
}
