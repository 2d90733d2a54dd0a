package NFA2DFA;

import NFA2DFA.Model.FiniteAutomaton;
import NFA2DFA.Model.StateSet;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;

/**
 * Epsilon-closure and move queries over a (read-only) automaton.
 */
public class ClosureEngine {
    private final FiniteAutomaton nfa;

    public ClosureEngine(FiniteAutomaton nfa) {
        this.nfa = nfa;
    }

    /**
     * States reachable in exactly one step on symbol from any of the given states.
     * States without transitions contribute nothing.
     * @param states - source states
     * @param symbol - input symbol, or {@link FiniteAutomaton#EPSILON}
     * @return - unordered set of destinations
     */
    public IntSet move(StateSet states, String symbol) {
        final IntSet destinations = new IntOpenHashSet();
        for (int i = 0; i < states.size(); i++) {
            destinations.addAll(nfa.getTransitions(states.get(i), symbol));
        }
        return destinations;
    }

    /**
     * Smallest superset of states closed under epsilon moves.
     * Each state is pushed on the worklist at most once.
     * @param states - seed states
     * @return - canonical (sorted) closure
     */
    public StateSet nullClosure(StateSet states) {
        final IntSet closure = new IntOpenHashSet(states.size());
        final IntArrayList unchecked = new IntArrayList(states.size());
        for (int i = 0; i < states.size(); i++) {
            closure.add(states.get(i));
            unchecked.add(states.get(i));
        }

        while (!unchecked.isEmpty()) {
            int state = unchecked.popInt();
            for (int succ : nfa.getTransitions(state, FiniteAutomaton.EPSILON)) {
                if (closure.add(succ)) {
                    unchecked.push(succ);
                }
            }
        }
        return StateSet.of(closure);
    }

    public StateSet nullClosure(IntSet states) {
        return nullClosure(StateSet.of(states));
    }
}
