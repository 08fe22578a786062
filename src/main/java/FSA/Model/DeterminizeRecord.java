package FSA.Model;

/**
 * Worklist entry of the subset construction: a set of NFA states and the DFA state standing for it.
 */
public record DeterminizeRecord<S>(S subset, int dfaState) {

  @Override
  public String toString() {
    return dfaState + " <- " + subset;
  }
}
