package NFA2DFA.Trace;

import java.io.PrintStream;
import java.util.StringJoiner;

import NFA2DFA.Trace.TraceEvent.ClosureComputed;
import NFA2DFA.Trace.TraceEvent.ExpansionFinished;
import NFA2DFA.Trace.TraceEvent.FinalStatesSummary;
import NFA2DFA.Trace.TraceEvent.RawMove;
import NFA2DFA.Trace.TraceEvent.StateMarked;

/**
 * Renders trace events as the human-readable derivation, one event at a time:
 * <pre>
 * E-closure(I0) = {0,1} = 1
 *
 * Mark 1
 * {0,1} --a--> {2}
 * E-closure{2} = {2} = 2
 *
 * Mark 2
 *
 * dfa final states = [2]
 * </pre>
 */
public class TraceWriter implements TraceListener {
    private final PrintStream out;

    public TraceWriter(PrintStream out) {
        this.out = out;
    }

    @Override
    public void onEvent(TraceEvent event) {
        out.println(format(event));
    }

    /**
     * Text for one event; may span several lines (without the trailing line separator).
     */
    public static String format(TraceEvent event) {
        if (event instanceof ClosureComputed closure) {
            if (closure.initial()) {
                // blank line after the initial closure
                return "E-closure(I0) = " + closure.closure() + " = " + closure.state() + System.lineSeparator();
            }
            return "E-closure" + closure.seed() + " = " + closure.closure() + " = " + closure.state();
        } else if (event instanceof StateMarked marked) {
            return "Mark " + marked.state();
        } else if (event instanceof RawMove move) {
            return move.from() + " --" + move.symbol() + "--> " + move.to();
        } else if (event instanceof ExpansionFinished) {
            return "";
        } else if (event instanceof FinalStatesSummary summary) {
            StringJoiner joiner = new StringJoiner(", ", "[", "]");
            for (int state : summary.finalStates()) {
                joiner.add(String.valueOf(state));
            }
            return "dfa final states = " + joiner;
        }
        throw new IllegalStateException("Unexpected trace event: " + event);
    }
}
