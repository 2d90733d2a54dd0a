package NFA2DFA.Trace;

import NFA2DFA.Model.StateSet;
import it.unimi.dsi.fastutil.ints.IntList;

/**
 * Steps of a subset construction, in the order they happen.
 */
public sealed interface TraceEvent {

    /**
     * Epsilon-closure of seed resolved to DFA state.
     * For the initial closure, seed is the singleton of the NFA initial state.
     */
    record ClosureComputed(StateSet seed, StateSet closure, int state, boolean initial) implements TraceEvent { }

    /**
     * DFA state taken off the worklist for expansion.
     */
    record StateMarked(int state) implements TraceEvent { }

    /**
     * Non-empty move from a subset on a symbol, before closure.
     */
    record RawMove(StateSet from, String symbol, StateSet to) implements TraceEvent { }

    /**
     * All symbols of a marked state have been processed.
     */
    record ExpansionFinished(int state) implements TraceEvent { }

    /**
     * Final states of the DFA, ascending.
     */
    record FinalStatesSummary(IntList finalStates) implements TraceEvent { }
}
