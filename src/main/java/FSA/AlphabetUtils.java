package FSA;

import net.automatalib.alphabet.Alphabet;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

public class AlphabetUtils {
    /**
     * Determine if every letter is a symbol of the alphabet.
     */
    public static <I> boolean isOverAlphabet(Collection<? extends I> letters, Alphabet<I> alphabet) {
        for (I letter : letters) {
            if (!alphabet.containsSymbol(letter)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Letters that are not symbols of the alphabet, in encounter order.
     */
    public static <I> Set<I> unknownLetters(Collection<? extends I> letters, Alphabet<I> alphabet) {
        final Set<I> result = new LinkedHashSet<>();
        for (I letter : letters) {
            if (!alphabet.containsSymbol(letter)) {
                result.add(letter);
            }
        }
        return result;
    }

    /**
     * Label set made of the characters of the string, e.g. "ab" -> {a, b}.
     */
    public static Set<Character> characters(CharSequence letters) {
        final Set<Character> result = new LinkedHashSet<>();
        for (int i = 0; i < letters.length(); i++) {
            result.add(letters.charAt(i));
        }
        return result;
    }
}
