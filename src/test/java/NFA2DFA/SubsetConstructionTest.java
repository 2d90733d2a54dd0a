package NFA2DFA;

import NFA2DFA.Model.Determinization;
import NFA2DFA.Model.FiniteAutomaton;
import NFA2DFA.Model.StateSet;
import NFA2DFA.Trace.TraceEvent;
import NFA2DFA.Trace.TraceRecorder;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.exception.FormatException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Objects;

public class SubsetConstructionTest {
  private static final String E = FiniteAutomaton.EPSILON;

  static FiniteAutomaton readResource(String name) throws IOException, FormatException {
    try (InputStream is = Objects.requireNonNull(SubsetConstructionTest.class.getClassLoader().getResourceAsStream(name))) {
      return NFAFormat.read(is);
    }
  }

  @Test
  void testEpsilonThenSymbol() {
    // 0 -E-> 1 -a-> 2, final 2
    FiniteAutomaton nfa = new FiniteAutomaton(0, Alphabets.fromList(List.of("a")));
    nfa.addTransition(0, E, 1);
    nfa.addTransition(1, "a", 2);
    nfa.addFinalState(2);

    Determinization result = SubsetConstruction.determinize(nfa);
    FiniteAutomaton dfa = result.dfa();
    Assertions.assertEquals(1, dfa.getInitialState());
    Assertions.assertEquals(2, dfa.size());
    Assertions.assertEquals(StateSet.of(0, 1), result.subsetOf(1));
    Assertions.assertEquals(StateSet.of(2), result.subsetOf(2));
    Assertions.assertEquals(IntList.of(2), dfa.getTransitions(1, "a"));
    Assertions.assertTrue(dfa.getSymbolMap(2).isEmpty());
    Assertions.assertArrayEquals(new int[] {2}, dfa.getFinalStates().toIntArray());
    Assertions.assertEquals(List.of("a"), List.copyOf(dfa.getInputAlphabet()));
  }

  @Test
  void testEmptyAlphabet() {
    FiniteAutomaton nfa = new FiniteAutomaton(0, Alphabets.fromList(List.of()));
    nfa.addTransition(0, E, 1);
    nfa.addTransition(2, E, 3);
    nfa.addFinalState(3);

    Determinization result = SubsetConstruction.determinize(nfa);
    Assertions.assertEquals(1, result.dfa().size());
    Assertions.assertEquals(List.of(StateSet.of(0, 1)), result.subsets());
    Assertions.assertTrue(result.dfa().getSymbolMap(1).isEmpty());
    Assertions.assertTrue(result.dfa().getFinalStates().isEmpty());

    nfa.addFinalState(1);
    result = SubsetConstruction.determinize(nfa);
    Assertions.assertEquals(1, result.dfa().size());
    Assertions.assertTrue(result.dfa().isFinal(1));
  }

  @Test
  void testInitialClosureFinal() {
    FiniteAutomaton nfa = new FiniteAutomaton(0, Alphabets.fromList(List.of("a")));
    nfa.addTransition(0, E, 1);
    nfa.addTransition(0, "a", 2);
    nfa.addFinalState(1);

    Determinization result = SubsetConstruction.determinize(nfa);
    Assertions.assertTrue(result.dfa().isFinal(1));
    Assertions.assertFalse(result.dfa().isFinal(2));
  }

  @Test
  void testSetEqualSubsetsShareOneState() {
    // moves on a and b give {2,1} and {1,2}, discovered in different orders
    FiniteAutomaton nfa = new FiniteAutomaton(0, Alphabets.fromList(List.of("a", "b", "c")));
    nfa.addTransition(0, "a", 2);
    nfa.addTransition(0, "a", 1);
    nfa.addTransition(0, "b", 1);
    nfa.addTransition(0, "b", 2);
    // c reaches {1} whose closure is {1,2} as well
    nfa.addTransition(0, "c", 1);
    nfa.addTransition(1, E, 2);

    Determinization result = SubsetConstruction.determinize(nfa);
    Assertions.assertEquals(2, result.dfa().size());
    Assertions.assertEquals(StateSet.of(1, 2), result.subsetOf(2));
    Assertions.assertEquals(IntList.of(2), result.dfa().getTransitions(1, "a"));
    Assertions.assertEquals(IntList.of(2), result.dfa().getTransitions(1, "b"));
    Assertions.assertEquals(IntList.of(2), result.dfa().getTransitions(1, "c"));
  }

  @Test
  void testMissingTransitionsStayAbsent() {
    FiniteAutomaton nfa = new FiniteAutomaton(0, Alphabets.fromList(List.of("a", "b")));
    nfa.addTransition(0, "a", 0);

    FiniteAutomaton dfa = SubsetConstruction.determinize(nfa).dfa();
    Assertions.assertEquals(1, dfa.size());
    Assertions.assertEquals(IntList.of(1), dfa.getTransitions(1, "a"));
    Assertions.assertFalse(dfa.getSymbolMap(1).containsKey("b"));
  }

  @Test
  void testTextbookExample() throws IOException, FormatException {
    // Thompson NFA for (a|b)*abb
    FiniteAutomaton nfa = readResource("abb.nfa");
    Determinization result = SubsetConstruction.determinize(nfa);
    FiniteAutomaton dfa = result.dfa();

    Assertions.assertEquals(List.of(
        StateSet.of(0, 1, 2, 4, 7),
        StateSet.of(1, 2, 3, 4, 6, 7, 8),
        StateSet.of(1, 2, 4, 5, 6, 7),
        StateSet.of(1, 2, 4, 5, 6, 7, 9),
        StateSet.of(1, 2, 4, 5, 6, 7, 10)), result.subsets());

    int[][] expected = {{2, 3}, {2, 4}, {2, 3}, {2, 5}, {2, 3}};
    for (int s = 1; s <= 5; s++) {
      Assertions.assertEquals(IntList.of(expected[s - 1][0]), dfa.getTransitions(s, "a"), "state " + s);
      Assertions.assertEquals(IntList.of(expected[s - 1][1]), dfa.getTransitions(s, "b"), "state " + s);
    }
    Assertions.assertArrayEquals(new int[] {5}, dfa.getFinalStates().toIntArray());

    Assertions.assertTrue(dfa.toCompactDFA().accepts(List.of("b", "a", "a", "b", "b")));
    Assertions.assertFalse(dfa.toCompactDFA().accepts(List.of("a", "b", "b", "a")));
  }

  @Test
  void testWorklistIsFifo() throws IOException, FormatException {
    TraceRecorder recorder = new TraceRecorder();
    SubsetConstruction.determinize(readResource("abb.nfa"), recorder);

    IntList marked = new IntArrayList();
    for (TraceEvent.StateMarked event : recorder.getEvents(TraceEvent.StateMarked.class)) {
      marked.add(event.state());
    }
    Assertions.assertEquals(IntList.of(1, 2, 3, 4, 5), marked);

    List<TraceEvent> events = recorder.getEvents();
    Assertions.assertEquals(new TraceEvent.ClosureComputed(StateSet.of(0), StateSet.of(0, 1, 2, 4, 7), 1, true), events.get(0));
    Assertions.assertEquals(new TraceEvent.StateMarked(1), events.get(1));
    Assertions.assertEquals(new TraceEvent.RawMove(StateSet.of(0, 1, 2, 4, 7), "a", StateSet.of(3, 8)), events.get(2));
    Assertions.assertEquals(new TraceEvent.FinalStatesSummary(IntList.of(5)), events.get(events.size() - 1));
    Assertions.assertEquals(5, recorder.getEvents(TraceEvent.ExpansionFinished.class).size());
    // one closure per non-empty move, plus the initial one
    Assertions.assertEquals(recorder.getEvents(TraceEvent.RawMove.class).size() + 1,
        recorder.getEvents(TraceEvent.ClosureComputed.class).size());
  }

  @Test
  void testNFAIsNotModified() throws IOException, FormatException {
    FiniteAutomaton nfa = readResource("abb.nfa");
    String before = TableWriter.toTable(nfa);
    SubsetConstruction.determinize(nfa);
    Assertions.assertEquals(before, TableWriter.toTable(nfa));
  }

  @Test
  void testLargeSparseStateIds() throws FormatException {
    final int base = 2_000_000_000;
    StringBuilder text = new StringBuilder("Initial State: {" + base + "}\n"
        + "Final States: {" + (base + 30) + "}\nTotal States: 31\nState a E\n");
    for (int i = 0; i < 30; i++) {
      text.append(base + i).append(" {").append(base + i + 1).append("} {}\n");
    }
    text.append(base + 30).append(" {} {").append(Integer.MAX_VALUE).append("}\n");
    FiniteAutomaton nfa = NFAFormat.read(text.toString());

    Determinization result = SubsetConstruction.determinize(nfa);
    Assertions.assertEquals(31, result.dfa().size());
    Assertions.assertEquals(StateSet.of(base), result.subsetOf(1));
    Assertions.assertEquals(StateSet.of(base + 30, Integer.MAX_VALUE), result.subsetOf(31));
    Assertions.assertArrayEquals(new int[] {31}, result.dfa().getFinalStates().toIntArray());
  }
}
