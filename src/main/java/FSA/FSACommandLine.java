package FSA;

import FSA.Equivalence.PairRefinement;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;
import net.automatalib.util.automaton.Automata;
import net.automatalib.util.automaton.fsa.NFAs;
import net.automatalib.util.automaton.minimizer.HopcroftMinimizer;
import net.automatalib.word.Word;

import java.util.ArrayList;
import java.util.List;

public class FSACommandLine {
  public static void main(String[] args) {
    List<String> positional = new ArrayList<>(3);

    for (String arg : args) {
      if ("--debug".equalsIgnoreCase(arg)) {
        setDebug(true);
      } else if (arg.startsWith("-")) {
        // Unknown flag
        printUsageAndExit();
      } else {
        positional.add(arg);
      }
    }

    if (positional.isEmpty()) {
      printUsageAndExit();
    }

    String example = positional.get(0).toLowerCase();
    switch (example) {
      case "parity" -> parity();
      case "ends-with-a" -> endsWithA();
      case "complete" -> complete();
      case "reachable" -> reachable();
      case "equivalent" -> equivalent();
      case "random" -> {
        if (positional.size() != 3) {
          printUsageAndExit();
        }
        random(parseInt(positional.get(1)), parseInt(positional.get(2)));
      }
      default -> printUsageAndExit();
    }
  }

  static void setDebug(boolean debug) {
    SubsetConstruction.DEBUG = debug;
    DeterministicAutomaton.DEBUG = debug;
    PairRefinement.DEBUG = debug;
  }

  private static int parseInt(String value) {
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      System.err.println("Not a number: " + value);
      printUsageAndExit();
      return -1; // unreachable
    }
  }

  private static void printUsageAndExit() {
    System.out.println("FSA [--debug] <example> [args]");
    System.out.println("[--debug] : Additional debug/progress output");
    System.out.println();
    System.out.println("<example> : one of the choices below:");
    System.out.println("  parity: DFA over {0,1} accepting words ending with 0 (or empty).");
    System.out.println("  ends-with-a: NFA over {a,b} accepting words ending with a, and its determinization.");
    System.out.println("  complete: DFA for (b(a+b))*, completed with a hole state.");
    System.out.println("  reachable: DFA with an unreachable state, and its reachable part.");
    System.out.println("  equivalent: DFA with equivalent states, and its minimization.");
    System.out.println("  random <size> <seed>: Tabakov-Vardi random NFA, determinized and minimized,");
    System.out.println("    cross-checked against AutomataLib.");
    System.exit(0);
  }

  /**
   * DFA where state 0 means "empty or last letter was 0".
   */
  static DeterministicAutomaton<Character> parityDFA() {
    DeterministicAutomaton<Character> dfa = new DeterministicAutomaton<>(Alphabets.characters('0', '1'));
    dfa.addState(0, true, true);
    dfa.addState(1);
    dfa.addTransition('0', 0, 0);
    dfa.addTransition('1', 0, 1);
    dfa.addTransition('1', 1, 1);
    dfa.addTransition('0', 1, 0);
    return dfa;
  }

  static NondeterministicAutomaton<Character> endsWithANFA() {
    NondeterministicAutomaton<Character> nfa = new NondeterministicAutomaton<>(Alphabets.characters('a', 'b'));
    nfa.addState(0, true, false);
    nfa.addState(1, false, true);
    nfa.addState(2);
    nfa.addTransition(AlphabetUtils.characters("ab"), 0, 0);
    nfa.addTransition('a', 0, 1);
    nfa.addTransition(AlphabetUtils.characters("ab"), 1, 2);
    nfa.addTransition(AlphabetUtils.characters("ab"), 2, 2);
    return nfa;
  }

  static DeterministicAutomaton<Character> alternatingDFA() {
    DeterministicAutomaton<Character> dfa = new DeterministicAutomaton<>(Alphabets.characters('a', 'b'));
    dfa.addState(0, true, true);
    dfa.addState(1);
    dfa.addTransition('b', 0, 1);
    dfa.addTransition(AlphabetUtils.characters("ab"), 1, 0);
    return dfa;
  }

  private static void parity() {
    DeterministicAutomaton<Character> dfa = parityDFA();
    for (String w : List.of("01001", "01000", "zizi")) {
      printAccepts(dfa, w);
    }
  }

  private static void endsWithA() {
    NondeterministicAutomaton<Character> nfa = endsWithANFA();
    DeterministicAutomaton<Character> dfa = nfa.determinized();
    System.out.println("Determinized DFA size: " + dfa.size());
    for (String w : List.of("ababba", "ababbababb", "caca")) {
      Word<Character> word = Word.fromCharSequence(w);
      System.out.println("\"" + w + "\": NFA " + nfa.accepts(word) + ", DFA " + dfa.accepts(word));
    }
  }

  private static void complete() {
    DeterministicAutomaton<Character> dfa = alternatingDFA();
    boolean wasComplete = dfa.complete();
    System.out.println("Was complete: " + wasComplete + ", completed: " + dfa.isCompleted());
    System.out.println("Size after completion: " + dfa.size());
    System.out.println("Transitions of 0: " + dfa.getTransitions(0));
    for (String w : List.of("babb", "abbaba")) {
      printAccepts(dfa, w);
    }
  }

  private static void reachable() {
    DeterministicAutomaton<Character> dfa = parityDFA();
    dfa.addState(2);
    dfa.addTransition('0', 2, 1);
    dfa.addTransition('1', 2, 0);
    DeterministicAutomaton<Character> reachable = dfa.reachablePart();
    System.out.println("Original size: " + dfa.size() + ", reachable part size: " + reachable.size());
  }

  private static void equivalent() {
    DeterministicAutomaton<Character> dfa = parityDFA();
    for (int copy = 2; copy <= 3; copy++) {
      dfa.addState(copy);
      dfa.addTransition('0', copy, 0);
      dfa.addTransition('1', copy, 1);
    }
    System.out.println("Equivalent states: " + dfa.equivalentStates());
    DeterministicAutomaton<Character> minimized = dfa.minimized();
    System.out.println("Original size: " + dfa.size() + ", minimized size: " + minimized.size());
  }

  /**
   * Determinize and minimize a random NFA, checking the result against AutomataLib.
   * @return - minimized DFA
   */
  static DeterministicAutomaton<Integer> random(int size, int seed) {
    NondeterministicAutomaton<Integer> nfa = RandomAutomata.getRandomAutomaton(seed, size);
    System.out.println("Original NFA size: " + nfa.size());
    System.out.println("Alphabet size:" + nfa.getAlphabet().size());

    long before = System.currentTimeMillis();
    DeterministicAutomaton<Integer> dfa = nfa.determinized();
    long after = System.currentTimeMillis();
    System.out.println("SC DFA size: " + dfa.size());
    System.out.println("SC duration: " + ((after - before) / 1000f) + "s");

    before = System.currentTimeMillis();
    DeterministicAutomaton<Integer> minimized = dfa.minimized();
    after = System.currentTimeMillis();
    System.out.println("Minimized DFA size: " + minimized.size());
    System.out.println("Minimization duration: " + ((after - before) / 1000f) + "s");

    // Sanity check against AutomataLib's subset construction and Hopcroft minimization
    Alphabet<Integer> alphabet = nfa.getAlphabet();
    CompactNFA<Integer> compactNFA = AutomataLibConversions.toCompactNFA(nfa);
    CompactDFA<Integer> expected = HopcroftMinimizer.minimizeDFA(NFAs.determinize(compactNFA, alphabet), alphabet);
    CompactDFA<Integer> actual = AutomataLibConversions.toCompactDFA(minimized);
    if (!Automata.testEquivalence(expected, actual, alphabet)) {
      throw new IllegalStateException("Minimized DFA is not equivalent to AutomataLib's for seed " + seed);
    }
    System.out.println("AutomataLib minimized DFA size: " + expected.size());
    return minimized;
  }

  private static void printAccepts(FiniteAutomaton<Character> automaton, String w) {
    System.out.println("\"" + w + "\": " + automaton.accepts(Word.fromCharSequence(w)));
  }
}
