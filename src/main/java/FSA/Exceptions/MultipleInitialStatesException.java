package FSA.Exceptions;

/**
 * A DFA has at most one initial state.
 */
public class MultipleInitialStatesException extends AutomatonException {
    private final int initialState;
    private final int requestedState;

    public MultipleInitialStatesException(int initialState, int requestedState) {
        super("DFAs must have a single initial state: " + initialState
            + " is already initial, cannot add " + requestedState + " as initial");
        this.initialState = initialState;
        this.requestedState = requestedState;
    }

    public int getInitialState() {
        return initialState;
    }

    public int getRequestedState() {
        return requestedState;
    }
}
