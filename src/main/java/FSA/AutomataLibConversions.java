package FSA;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import FSA.Model.Transition;
import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;

/**
 * Conversions to and from AutomataLib's compact automata.
 * Compact automata number their states 0..n-1; ids are mapped in ascending order.
 */
public class AutomataLibConversions {

    public static <I> CompactDFA<I> toCompactDFA(DeterministicAutomaton<I> dfa) {
        final Alphabet<I> alphabet = dfa.getAlphabet();
        final CompactDFA<I> out = new CompactDFA<>(alphabet, dfa.size());
        final Int2IntMap mapping = new Int2IntOpenHashMap();
        for (int id : dfa.getStateIds()) {
            final int s = id == dfa.getInitialState()
                ? out.addInitialState(dfa.isAccepting(id))
                : out.addState(dfa.isAccepting(id));
            mapping.put(id, s);
        }
        for (int id : dfa.getStateIds()) {
            for (Transition<I> t : dfa.getTransitions(id)) {
                for (I letter : t.getLetters()) {
                    out.setTransition(mapping.get(id), alphabet.getSymbolIndex(letter), mapping.get(t.getTarget()));
                }
            }
        }
        return out;
    }

    /**
     * An unlabeled edge becomes one edge per letter, matching how the NFA steps.
     */
    public static <I> CompactNFA<I> toCompactNFA(NondeterministicAutomaton<I> nfa) {
        final Alphabet<I> alphabet = nfa.getAlphabet();
        final CompactNFA<I> out = new CompactNFA<>(alphabet, nfa.size());
        final Int2IntMap mapping = new Int2IntOpenHashMap();
        for (int id : nfa.getStateIds()) {
            final int s = out.addState(nfa.isAccepting(id));
            out.setInitial(s, nfa.isInitial(id));
            mapping.put(id, s);
        }
        for (int id : nfa.getStateIds()) {
            final int src = mapping.get(id);
            for (Transition<I> t : nfa.getTransitions(id)) {
                final int tgt = mapping.get(t.getTarget());
                final Collection<I> letters = t.isEpsilon() ? alphabet : t.getLetters();
                for (I letter : letters) {
                    out.addTransition(src, letter, tgt);
                }
            }
        }
        return out;
    }

    /**
     * State ids are the compact state indices. Letters to the same target are grouped into one transition.
     */
    public static <I> DeterministicAutomaton<I> fromCompactDFA(CompactDFA<I> dfa) {
        final Alphabet<I> alphabet = dfa.getInputAlphabet();
        final DeterministicAutomaton<I> out = new DeterministicAutomaton<>(alphabet);
        final Integer init = dfa.getInitialState();
        for (Integer s : dfa.getStates()) {
            out.addState(s, s.equals(init), dfa.isAccepting(s));
        }
        for (Integer s : dfa.getStates()) {
            final Map<Integer, Set<I>> byTarget = new LinkedHashMap<>();
            for (I letter : alphabet) {
                final Integer succ = dfa.getSuccessor(s, letter);
                if (succ != null) {
                    byTarget.computeIfAbsent(succ, k -> new LinkedHashSet<>()).add(letter);
                }
            }
            byTarget.forEach((target, letters) -> out.addTransition(letters, s, target));
        }
        return out;
    }

    public static <I> NondeterministicAutomaton<I> fromCompactNFA(CompactNFA<I> nfa) {
        final Alphabet<I> alphabet = nfa.getInputAlphabet();
        final NondeterministicAutomaton<I> out = new NondeterministicAutomaton<>(alphabet);
        final Set<Integer> initialStates = nfa.getInitialStates();
        for (Integer s : nfa.getStates()) {
            out.addState(s, initialStates.contains(s), nfa.isAccepting(s));
        }
        for (Integer s : nfa.getStates()) {
            final Map<Integer, Set<I>> byTarget = new LinkedHashMap<>();
            for (I letter : alphabet) {
                for (Integer succ : nfa.getTransitions(s, letter)) {
                    byTarget.computeIfAbsent(succ, k -> new LinkedHashSet<>()).add(letter);
                }
            }
            byTarget.forEach((target, letters) -> out.addTransition(letters, s, target));
        }
        return out;
    }
}
