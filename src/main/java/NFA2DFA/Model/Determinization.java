package NFA2DFA.Model;

import java.util.List;

/**
 * Result of a subset construction: the DFA and, for every DFA state k, the NFA subset it stands for.
 */
public record Determinization(FiniteAutomaton dfa, List<StateSet> subsets) {

  public StateSet subsetOf(int dfaState) {
    return subsets.get(dfaState - 1);
  }

  @Override
  public String toString() {
    return dfa.size() + " DFA states: " + subsets;
  }
}
