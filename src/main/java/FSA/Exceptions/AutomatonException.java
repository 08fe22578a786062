package FSA.Exceptions;

/**
 * Base class of the errors raised while building an automaton.
 * The failing call leaves the automaton unchanged.
 */
public class AutomatonException extends IllegalArgumentException {
    public AutomatonException(String message) {
        super(message);
    }
}
