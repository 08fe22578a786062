package FSA;

import FSA.Exceptions.AutomatonException;
import FSA.Exceptions.DuplicateStateException;
import FSA.Exceptions.MultipleInitialStatesException;
import FSA.Exceptions.NonDeterministicTransitionException;
import FSA.Exceptions.UnknownAlphabetLetterException;
import FSA.Exceptions.UnknownStateException;
import FSA.Model.Transition;
import FSA.Model.UnorderedPair;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.word.Word;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static FSA.AlphabetUtils.characters;

public class DeterministicAutomatonTest {
  private DeterministicAutomaton<Character> parity;

  @BeforeEach
  void setUp() {
    parity = FSACommandLine.parityDFA();
  }

  private static Word<Character> w(String s) {
    return Word.fromCharSequence(s);
  }

  @Test
  void testAccepts() {
    Assertions.assertFalse(parity.accepts(w("01001")));
    Assertions.assertTrue(parity.accepts(w("01000")));
    Assertions.assertTrue(parity.accepts(w("")));
    Assertions.assertFalse(parity.accepts(w("zizi"))); // letters outside the alphabet reject
    Assertions.assertFalse(parity.accepts(w("0z")));
    Assertions.assertFalse(parity.isCompleted());
  }

  @Test
  void testSuccessor() {
    Assertions.assertEquals(0, parity.successor(0, '0'));
    Assertions.assertEquals(1, parity.successor(0, '1'));
    Assertions.assertEquals(0, parity.successor(1, '0'));
    Assertions.assertEquals(DeterministicAutomaton.NO_STATE, parity.successor(1, 'z'));
    Assertions.assertThrows(UnknownStateException.class, () -> parity.successor(5, '0'));
    Assertions.assertEquals(0, parity.getInitialState());
  }

  @Test
  void testNoInitialState() {
    DeterministicAutomaton<Character> dfa = new DeterministicAutomaton<>(Alphabets.characters('a', 'b'));
    dfa.addState(0, false, true);
    dfa.addTransition(characters("ab"), 0, 0);
    Assertions.assertEquals(DeterministicAutomaton.NO_STATE, dfa.getInitialState());
    Assertions.assertFalse(dfa.accepts(w("")));
    Assertions.assertFalse(dfa.accepts(w("ab")));
    Assertions.assertEquals(0, dfa.reachablePart().size());
    Assertions.assertEquals(0, dfa.minimized().size());
  }

  @Test
  void testConstructionErrors() {
    DuplicateStateException dup = Assertions.assertThrows(DuplicateStateException.class, () -> parity.addState(0));
    Assertions.assertEquals(0, dup.getStateId());

    MultipleInitialStatesException multi =
        Assertions.assertThrows(MultipleInitialStatesException.class, () -> parity.addState(2, true, false));
    Assertions.assertEquals(0, multi.getInitialState());
    Assertions.assertEquals(2, multi.getRequestedState());
    Assertions.assertEquals(2, parity.size()); // not added
    parity.addState(2);
    Assertions.assertFalse(parity.isInitial(2));

    UnknownAlphabetLetterException letter = Assertions.assertThrows(UnknownAlphabetLetterException.class,
        () -> parity.addTransition(characters("0z"), 2, 0));
    Assertions.assertEquals(Set.of('z'), letter.getUnknownLetters());
    Assertions.assertTrue(parity.getTransitions(2).isEmpty());

    UnknownStateException unknown =
        Assertions.assertThrows(UnknownStateException.class, () -> parity.addTransition('0', 2, 9));
    Assertions.assertEquals(9, unknown.getStateId());
    unknown = Assertions.assertThrows(UnknownStateException.class, () -> parity.addTransition('0', 9, 2));
    Assertions.assertEquals(9, unknown.getStateId());

    NonDeterministicTransitionException nd = Assertions.assertThrows(NonDeterministicTransitionException.class,
        () -> parity.addTransition(characters("10"), 0, 1));
    Assertions.assertEquals(0, nd.getStateId());
    Assertions.assertEquals(2, parity.getTransitions(0).size()); // unchanged

    Assertions.assertThrows(IllegalArgumentException.class, () -> parity.addState(-1));
    Assertions.assertThrows(IllegalArgumentException.class, () -> parity.addTransition(Set.of(), 2, 0));
    Assertions.assertTrue(AutomatonException.class.isAssignableFrom(NonDeterministicTransitionException.class));
  }

  @Test
  void testDeterminismOnPartialOverlap() {
    DeterministicAutomaton<Character> dfa = new DeterministicAutomaton<>(Alphabets.characters('a', 'c'));
    dfa.addState(0, true, false);
    dfa.addState(1);
    dfa.addTransition('a', 0, 1);
    Assertions.assertThrows(NonDeterministicTransitionException.class, () -> dfa.addTransition(characters("ba"), 0, 0));
    Assertions.assertEquals(DeterministicAutomaton.NO_STATE, dfa.successor(0, 'b')); // atomic: b not added
    dfa.addTransition(characters("bc"), 0, 0);
    Assertions.assertEquals(0, dfa.successor(0, 'c'));
  }

  @Test
  void testComplete() {
    DeterministicAutomaton<Character> dfa = FSACommandLine.alternatingDFA();
    Assertions.assertFalse(dfa.isCompleted());
    Assertions.assertFalse(dfa.isTotal());

    Assertions.assertFalse(dfa.complete()); // a hole state was needed
    Assertions.assertTrue(dfa.isCompleted());
    Assertions.assertTrue(dfa.isTotal());
    Assertions.assertEquals(3, dfa.size());
    Assertions.assertEquals(List.of(new Transition<>(Set.of('b'), 1), new Transition<>(Set.of('a'), 2)),
        dfa.getTransitions(0));
    Assertions.assertFalse(dfa.isAccepting(2));
    Assertions.assertEquals(2, dfa.successor(2, 'a'));
    Assertions.assertEquals(2, dfa.successor(2, 'b'));

    Assertions.assertTrue(dfa.accepts(w("babb")));
    Assertions.assertFalse(dfa.accepts(w("abbaba")));

    Assertions.assertTrue(dfa.complete()); // no second hole
    Assertions.assertEquals(3, dfa.size());
  }

  @Test
  void testCompleteWhenAlreadyTotal() {
    Assertions.assertTrue(parity.complete());
    Assertions.assertTrue(parity.isCompleted());
    Assertions.assertEquals(2, parity.size());

    DeterministicAutomaton<Character> empty = new DeterministicAutomaton<>(Alphabets.characters('a', 'b'));
    Assertions.assertTrue(empty.complete());
    Assertions.assertEquals(0, empty.size());
  }

  @Test
  void testReachablePart() {
    parity.addState(2);
    parity.addTransition('0', 2, 1);
    parity.addTransition('1', 2, 0);

    DeterministicAutomaton<Character> reachable = parity.reachablePart();
    Assertions.assertEquals(2, reachable.size());
    Assertions.assertArrayEquals(new int[]{0, 1}, reachable.getStateIds().toIntArray());
    Assertions.assertEquals(3, parity.size()); // receiver unchanged
    Words.assertSameLanguage(parity, reachable, 6);

    reachable.addState(7);
    reachable.addTransition('0', 7, 7);
    Assertions.assertThrows(UnknownStateException.class, () -> parity.getTransitions(7));
  }

  @Test
  void testEquivalentStatesAndMerge() {
    for (int copy = 2; copy <= 3; copy++) {
      parity.addState(copy);
      parity.addTransition('0', copy, 0);
      parity.addTransition('1', copy, 1);
    }
    Set<UnorderedPair<Integer>> eq = parity.equivalentStates();
    Assertions.assertEquals(Set.of(UnorderedPair.of(1, 2), UnorderedPair.of(1, 3), UnorderedPair.of(2, 3)), eq);

    parity.mergeEquivalentStates();
    Assertions.assertEquals(2, parity.size());
    Assertions.assertArrayEquals(new int[]{0, 1}, parity.getStateIds().toIntArray());
    List<Transition<Character>> t0 = parity.getTransitions(0);
    List<Transition<Character>> t1 = parity.getTransitions(1);

    parity.mergeEquivalentStates(); // idempotent
    Assertions.assertEquals(2, parity.size());
    Assertions.assertEquals(t0, parity.getTransitions(0));
    Assertions.assertEquals(t1, parity.getTransitions(1));
    Assertions.assertTrue(parity.equivalentStates().isEmpty());
  }

  @Test
  void testMergeFoldsTransitions() {
    DeterministicAutomaton<Character> dfa = new DeterministicAutomaton<>(Alphabets.characters('a', 'b'));
    dfa.addState(0, true, false);
    dfa.addState(1, false, true);
    dfa.addState(2, false, true);
    dfa.addTransition('a', 0, 1);
    dfa.addTransition('b', 0, 2);
    dfa.addTransition(characters("ab"), 1, 1);
    dfa.addTransition(characters("ab"), 2, 2);

    Assertions.assertEquals(Set.of(UnorderedPair.of(1, 2)), dfa.equivalentStates());
    dfa.mergeEquivalentStates();
    Assertions.assertEquals(2, dfa.size());
    Assertions.assertEquals(List.of(new Transition<>(Set.of('a', 'b'), 1)), dfa.getTransitions(0));
    Assertions.assertEquals(Set.of(1), dfa.getAcceptingStates());
    Assertions.assertTrue(dfa.accepts(w("b")));
    Assertions.assertTrue(dfa.accepts(w("abba")));
    Assertions.assertFalse(dfa.accepts(w("")));
  }

  @Test
  void testMergeMovesInitialState() {
    DeterministicAutomaton<Character> dfa = new DeterministicAutomaton<>(Alphabets.characters('a', 'a'));
    dfa.addState(3, true, true);
    dfa.addState(1, false, true);
    dfa.addTransition('a', 3, 1);
    dfa.addTransition('a', 1, 1);

    dfa.mergeEquivalentStates();
    Assertions.assertEquals(1, dfa.size());
    Assertions.assertEquals(1, dfa.getInitialState());
    Assertions.assertTrue(dfa.isInitial(1));
    Assertions.assertTrue(dfa.accepts(w("")));
    Assertions.assertTrue(dfa.accepts(w("aaa")));
  }

  @Test
  void testEquivalenceWithoutCompletion() {
    DeterministicAutomaton<Character> dfa = new DeterministicAutomaton<>(Alphabets.characters('a', 'b'));
    dfa.addState(0, true, false);
    dfa.addState(1, false, true);
    dfa.addState(2, false, true);
    dfa.addState(3);
    dfa.addTransition('a', 0, 1);
    dfa.addTransition('a', 2, 3);
    dfa.addTransition(characters("ab"), 3, 3);
    // 3 is dead, so 2 behaves like 1, which has no transitions at all
    Assertions.assertEquals(Set.of(UnorderedPair.of(1, 2)), dfa.equivalentStates());

    dfa.complete();
    Assertions.assertEquals(Set.of(UnorderedPair.of(1, 2), UnorderedPair.of(3, 4)), dfa.equivalentStates());
  }

  @Test
  void testMinimized() {
    DeterministicAutomaton<Character> dfa = FSACommandLine.alternatingDFA();
    DeterministicAutomaton<Character> minimized = dfa.minimized();
    Assertions.assertEquals(3, minimized.size()); // 0, 1 and the hole
    Assertions.assertTrue(minimized.isTotal());
    Assertions.assertTrue(minimized.isCompleted());
    Words.assertSameLanguage(dfa, minimized, 7);

    // receiver unchanged
    Assertions.assertEquals(2, dfa.size());
    Assertions.assertFalse(dfa.isCompleted());

    Assertions.assertEquals(2, parity.minimized().size());
  }

  @Test
  void testCopyConstructor() {
    DeterministicAutomaton<Character> copy = new DeterministicAutomaton<>(parity);
    copy.complete();
    copy.addState(5);
    Assertions.assertEquals(2, parity.size());
    Assertions.assertEquals(0, copy.getInitialState());
    Words.assertSameLanguage(parity, copy, 5);
  }
}
