package NFA2DFA;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import NFA2DFA.Model.Determinization;
import NFA2DFA.Model.FiniteAutomaton;
import NFA2DFA.Model.StateSet;
import NFA2DFA.Registry.SubsetRegistry;
import NFA2DFA.Trace.TraceEvent;
import NFA2DFA.Trace.TraceListener;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntSet;
import net.automatalib.alphabet.Alphabet;

public class SubsetConstruction {
    public static boolean DEBUG = false;
    private static final long STATES_EXPLORED_PERIOD = 1000L;

    public static Determinization determinize(FiniteAutomaton nfa) {
        return determinize(nfa, TraceListener.noop());
    }

    /**
     * Subset construction with a FIFO worklist of NFA subsets.
     * DFA state IDs are handed out in discovery order, starting with 1 for the closure of the
     * NFA initial state; the worklist order is therefore visible in the numbering and the trace.
     * @param nfa - epsilon-NFA, not modified
     * @param listener - receives trace events while the DFA is built
     * @return - the DFA together with the NFA subset of each DFA state
     */
    public static Determinization determinize(FiniteAutomaton nfa, TraceListener listener) {
        final Alphabet<String> alphabet = nfa.getInputAlphabet();
        final ClosureEngine engine = new ClosureEngine(nfa);
        final SubsetRegistry registry = new SubsetRegistry();
        final Deque<StateSet> unmarked = new ArrayDeque<>();

        final StateSet initSeed = StateSet.of(nfa.getInitialState());
        final StateSet init = engine.nullClosure(initSeed);
        final int initOut = registry.register(init);
        final FiniteAutomaton dfa = new FiniteAutomaton(initOut, alphabet);
        unmarked.addLast(init);
        listener.onEvent(new TraceEvent.ClosureComputed(initSeed, init, initOut, true));

        long statesExplored = 0;
        while (!unmarked.isEmpty()) {
            StateSet inState = unmarked.pollFirst();
            int outState = registry.get(inState);
            listener.onEvent(new TraceEvent.StateMarked(outState));

            for (String symbol : alphabet) {
                IntSet move = engine.move(inState, symbol);
                if (move.isEmpty()) {
                    continue;
                }
                StateSet moveSet = StateSet.of(move);
                listener.onEvent(new TraceEvent.RawMove(inState, symbol, moveSet));

                StateSet succ = engine.nullClosure(moveSet);
                int outSucc = registry.get(succ);
                if (outSucc == SubsetRegistry.MISSING_ELEMENT) {
                    // new DFA state, expand later
                    outSucc = registry.register(succ);
                    dfa.addState(outSucc);
                    unmarked.addLast(succ);
                }
                listener.onEvent(new TraceEvent.ClosureComputed(moveSet, succ, outSucc, false));
                dfa.addTransition(outState, symbol, outSucc);
            }
            listener.onEvent(new TraceEvent.ExpansionFinished(outState));

            statesExplored++;
            if (DEBUG && statesExplored % STATES_EXPLORED_PERIOD == 0) {
                System.err.println("DEBUG: Explored " + statesExplored + " states - "
                    + unmarked.size() + " states left in queue - " + registry.size() + " states added");
            }
        }

        final IntArrayList finalStates = new IntArrayList();
        final List<StateSet> subsets = List.copyOf(registry.subsets());
        for (int i = 0; i < subsets.size(); i++) {
            if (subsets.get(i).intersects(nfa.getFinalStates())) {
                dfa.addFinalState(i + 1);
                finalStates.add(i + 1);
            }
        }
        listener.onEvent(new TraceEvent.FinalStatesSummary(finalStates));

        if (DEBUG) {
            System.err.println("DEBUG: NFA states: " + nfa.size() + " - DFA states: " + dfa.size()
                + " - final: " + finalStates.size());
        }
        return new Determinization(dfa, subsets);
    }
}
