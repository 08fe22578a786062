package FSA.Exceptions;

public class DuplicateStateException extends AutomatonException {
    private final int stateId;

    public DuplicateStateException(int stateId) {
        super("A state with id " + stateId + " already exists");
        this.stateId = stateId;
    }

    public int getStateId() {
        return stateId;
    }
}
