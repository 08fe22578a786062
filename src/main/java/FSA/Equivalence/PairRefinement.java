package FSA.Equivalence;

import java.util.BitSet;
import java.util.HashSet;
import java.util.Set;

import FSA.DeterministicAutomaton;
import FSA.Model.UnorderedPair;
import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import net.automatalib.alphabet.Alphabet;

/**
 * Myhill-Nerode equivalence of DFA states by pairwise refinement (table filling).
 * Every pair starts as a candidate unless exactly one of its states is final; a candidate is dropped once some
 * letter leads it to a dropped pair. The candidates left at the fixpoint are the equivalent pairs.
 */
public final class PairRefinement {
  public static boolean DEBUG = false;

  private PairRefinement() {
  }

  /**
   * Compute the equivalent pairs of a DFA.
   * Missing transitions go to a virtual sink: non-final, looping on every letter. It takes part in the refinement
   * but never appears in the result.
   * @param dfa - DFA, complete or not
   * @return pairs of distinct equivalent state ids
   */
  public static <I> Set<UnorderedPair<Integer>> equivalentPairs(DeterministicAutomaton<I> dfa) {
    final int[] ids = dfa.getStateIds().toIntArray();
    final int nStates = ids.length;
    final int sink = nStates; // index of the virtual sink
    final Int2IntMap index = new Int2IntOpenHashMap();
    for (int p = 0; p < nStates; p++) {
      index.put(ids[p], p);
    }

    final boolean[] isFinal = new boolean[nStates + 1];
    for (int p = 0; p < nStates; p++) {
      isFinal[p] = dfa.isAccepting(ids[p]);
    }

    final int[][] succ = createSuccArr(dfa, ids, index, sink);

    // candidates[p].get(q), p < q: (p,q) not yet known to be inequivalent
    final BitSet[] candidates = initializeCandidates(isFinal);

    int rounds = 0;
    boolean changed = true;
    while (changed) {
      changed = singleRefine(succ, candidates);
      rounds++;
    }
    if (DEBUG) {
      System.out.println("DEBUG: Pair refinement: " + nStates + " states, " + rounds + " rounds");
    }

    return collectPairs(candidates, ids);
  }

  // succ[a][p] is the index of the successor of p on the a-th letter; the sink stands for a missing one
  private static <I> int[][] createSuccArr(DeterministicAutomaton<I> dfa, int[] ids, Int2IntMap index, int sink) {
    final Alphabet<I> alphabet = dfa.getAlphabet();
    final int nSymbols = alphabet.size();
    final int[][] succ = new int[nSymbols][ids.length + 1];
    for (int a = 0; a < nSymbols; a++) {
      final I letter = alphabet.getSymbol(a);
      for (int p = 0; p < ids.length; p++) {
        final int target = dfa.successor(ids[p], letter);
        succ[a][p] = target == DeterministicAutomaton.NO_STATE ? sink : index.get(target);
      }
      succ[a][sink] = sink;
    }
    return succ;
  }

  // a final and a non-final state are never equivalent
  private static BitSet[] initializeCandidates(boolean[] isFinal) {
    final int n = isFinal.length;
    final BitSet[] candidates = new BitSet[n];
    for (int p = 0; p < n; p++) {
      candidates[p] = new BitSet(n);
      for (int q = p + 1; q < n; q++) {
        if (isFinal[p] == isFinal[q]) {
          candidates[p].set(q);
        }
      }
    }
    return candidates;
  }

  // One pass over the remaining candidates. Returns whether any pair was dropped.
  static boolean singleRefine(int[][] succ, BitSet[] candidates) {
    boolean changed = false;
    for (int p = 0; p < candidates.length; p++) {
      final BitSet candidatesP = candidates[p];
      for (int q = candidatesP.nextSetBit(0); q >= 0; q = candidatesP.nextSetBit(q + 1)) {
        if (isDistinguished(p, q, succ, candidates)) {
          candidatesP.clear(q);
          changed = true;
        }
      }
    }
    return changed;
  }

  private static boolean isDistinguished(int p, int q, int[][] succ, BitSet[] candidates) {
    for (int[] succA : succ) {
      final int r = succA[p];
      final int t = succA[q];
      if (r != t && !isCandidate(r, t, candidates)) {
        return true;
      }
    }
    return false;
  }

  private static boolean isCandidate(int r, int t, BitSet[] candidates) {
    return r < t ? candidates[r].get(t) : candidates[t].get(r);
  }

  // The sink has the largest index, so rows and columns below ids.length are real states
  private static Set<UnorderedPair<Integer>> collectPairs(BitSet[] candidates, int[] ids) {
    final Set<UnorderedPair<Integer>> pairs = new HashSet<>();
    for (int p = 0; p < ids.length; p++) {
      final BitSet candidatesP = candidates[p];
      for (int q = candidatesP.nextSetBit(0); q >= 0 && q < ids.length; q = candidatesP.nextSetBit(q + 1)) {
        pairs.add(UnorderedPair.of(ids[p], ids[q]));
      }
    }
    return pairs;
  }
}
