package FSA.Exceptions;

public class UnknownStateException extends AutomatonException {
    private final int stateId;

    public UnknownStateException(int stateId) {
        super("State with id " + stateId + " doesn't exist");
        this.stateId = stateId;
    }

    public int getStateId() {
        return stateId;
    }
}
