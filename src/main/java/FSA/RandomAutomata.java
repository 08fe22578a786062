package FSA;

import java.util.Random;

import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.common.util.random.RandomUtil;

public class RandomAutomata {
    public static final float TRANSITION_DENSITY = 1.25f;
    public static final float ACCEPTANCE_DENSITY = 0.5f;

    /**
     * Generate random NFA using Tabakov and Vardi's approach, described in the paper
     * <a href="https://doi.org/10.1007/11591191_28">Experimental Evaluation of Classical Automata Constructions</a>
     * by Deian Tabakov and Moshe Y. Vardi.
     *
     * @param r
     *      random instance
     * @param size
     *      number of states, at least 1
     * @param td
     *      transition density, in [0,size]
     * @param ad
     *      acceptance density, in (0,1]. 0.5 is the usual value
     * @param alphabet
     *      alphabet
     * @return
     *      a random NFA with states 0..size-1, not necessarily connected
     */
    public static NondeterministicAutomaton<Integer> generateNFA(
            Random r, int size, float td, float ad, Alphabet<Integer> alphabet) {
        final int edgeNum = Math.round(td * size);
        final int acceptNum = Math.max(1, Math.round(ad * size));
        return generateNFA(r, size, edgeNum, acceptNum, alphabet);
    }

    /**
     * Generate random NFA, with fixed number of accept states and edges (per letter).
     * State 0 is initial and accepting; the other accepting states are drawn from [1,size).
     */
    public static NondeterministicAutomaton<Integer> generateNFA(
            Random r, int size, int edgeNum, int acceptNum, Alphabet<Integer> alphabet) {
        if (size < 1 || acceptNum < 1 || acceptNum > size || edgeNum < 0 || edgeNum > size * size) {
            throw new IllegalArgumentException(
                "Invalid random NFA parameters: size=" + size + ", edges=" + edgeNum + ", accepting=" + acceptNum);
        }

        final boolean[] accepting = new boolean[size];
        accepting[0] = true;
        for (int f : RandomUtil.distinctIntegers(r, acceptNum - 1, 1, size)) {
            accepting[f] = true;
        }

        final NondeterministicAutomaton<Integer> result = new NondeterministicAutomaton<>(alphabet);
        for (int i = 0; i < size; i++) {
            result.addState(i, i == 0, accepting[i]);
        }

        // For each letter, add edgeNum transitions.
        for (int a : alphabet) {
            for (int edgeIndex : RandomUtil.distinctIntegers(r, edgeNum, size * size)) {
                result.addTransition(a, edgeIndex / size, edgeIndex % size);
            }
        }
        return result;
    }

    public static NondeterministicAutomaton<Integer> getRandomAutomaton(int randomSeed, int size) {
        final Random random = new Random(randomSeed);
        final Alphabet<Integer> alphabet = Alphabets.integers(0, 1);
        return generateNFA(random, size, TRANSITION_DENSITY, ACCEPTANCE_DENSITY, alphabet);
    }
}
