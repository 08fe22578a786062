package FSA.Exceptions;

/**
 * A letter would label two transitions leaving the same DFA state.
 */
public class NonDeterministicTransitionException extends AutomatonException {
    private final int stateId;
    private final Object letter;

    public NonDeterministicTransitionException(int stateId, Object letter) {
        super("Transition " + letter + " already exists from state " + stateId
            + ". DFAs cannot have two or more transitions with same letters");
        this.stateId = stateId;
        this.letter = letter;
    }

    public int getStateId() {
        return stateId;
    }

    public Object getLetter() {
        return letter;
    }
}
