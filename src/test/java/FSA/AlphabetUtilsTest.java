package FSA;

import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

public class AlphabetUtilsTest {
  @Test
  void testIsOverAlphabet() {
    Alphabet<Character> alphabet = Alphabets.characters('a', 'c');
    Assertions.assertTrue(AlphabetUtils.isOverAlphabet(Set.of('a', 'c'), alphabet));
    Assertions.assertTrue(AlphabetUtils.isOverAlphabet(Set.of(), alphabet));
    Assertions.assertFalse(AlphabetUtils.isOverAlphabet(Set.of('a', 'd'), alphabet));

    Assertions.assertEquals(Set.of('d', 'z'), AlphabetUtils.unknownLetters(List.of('a', 'd', 'z', 'd'), alphabet));
    Assertions.assertTrue(AlphabetUtils.unknownLetters(List.of('b'), alphabet).isEmpty());
  }

  @Test
  void testCharacters() {
    Assertions.assertEquals(List.of('a', 'b'), List.copyOf(AlphabetUtils.characters("abba")));
    Assertions.assertTrue(AlphabetUtils.characters("").isEmpty());
  }

  @Test
  void testIntegerAlphabet() {
    Alphabet<Integer> alphabet = Alphabets.integers(0, 1);
    Assertions.assertTrue(AlphabetUtils.isOverAlphabet(List.of(0, 1, 1), alphabet));
    Assertions.assertFalse(AlphabetUtils.isOverAlphabet(List.of(2), alphabet));
  }
}
