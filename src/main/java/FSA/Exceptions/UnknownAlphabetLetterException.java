package FSA.Exceptions;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

public class UnknownAlphabetLetterException extends AutomatonException {
    private final Set<?> unknownLetters;

    public UnknownAlphabetLetterException(Set<?> unknownLetters) {
        super("Letters " + unknownLetters + " are not in the automaton's alphabet");
        this.unknownLetters = Collections.unmodifiableSet(new LinkedHashSet<>(unknownLetters));
    }

    public Set<?> getUnknownLetters() {
        return unknownLetters;
    }
}
