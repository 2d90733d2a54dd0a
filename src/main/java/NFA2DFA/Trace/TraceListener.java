package NFA2DFA.Trace;

@FunctionalInterface
public interface TraceListener {

    void onEvent(TraceEvent event);

    static TraceListener noop() {
        return event -> { };
    }
}
