package NFA2DFA.Trace;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Keeps every event in memory, e.g. to inspect a construction after the fact.
 */
public class TraceRecorder implements TraceListener {
    private final List<TraceEvent> events = new ArrayList<>();

    @Override
    public void onEvent(TraceEvent event) {
        events.add(event);
    }

    public List<TraceEvent> getEvents() {
        return Collections.unmodifiableList(events);
    }

    public <T extends TraceEvent> List<T> getEvents(Class<T> type) {
        List<T> result = new ArrayList<>();
        for (TraceEvent event : events) {
            if (type.isInstance(event)) {
                result.add(type.cast(event));
            }
        }
        return result;
    }
}
