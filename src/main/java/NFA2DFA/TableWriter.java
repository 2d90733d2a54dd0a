package NFA2DFA;

import NFA2DFA.Model.FiniteAutomaton;
import it.unimi.dsi.fastutil.ints.IntCollection;
import it.unimi.dsi.fastutil.ints.IntIterator;

/**
 * Writes an automaton as a tab separated transition table:
 * <pre>
 * Initial State: {1}
 * Final States: {2}
 * State	a
 * 1	{2}
 * 2	{}
 * </pre>
 */
public class TableWriter {

    public static String toTable(FiniteAutomaton automaton) {
        StringBuilder sb = new StringBuilder();
        sb.append("Initial State: {").append(automaton.getInitialState()).append("}\n");
        sb.append("Final States: ");
        appendBraced(sb, automaton.getFinalStates());
        sb.append('\n');

        sb.append("State");
        for (String symbol : automaton.getInputAlphabet()) {
            sb.append('\t').append(symbol);
        }

        for (int state : automaton.getStates()) {
            sb.append('\n').append(state);
            for (String symbol : automaton.getInputAlphabet()) {
                sb.append('\t');
                appendBraced(sb, automaton.getTransitions(state, symbol));
            }
        }
        return sb.toString();
    }

    private static void appendBraced(StringBuilder sb, IntCollection states) {
        sb.append('{');
        IntIterator it = states.iterator();
        while (it.hasNext()) {
            sb.append(it.nextInt());
            if (it.hasNext()) {
                sb.append(',');
            }
        }
        sb.append('}');
    }
}
