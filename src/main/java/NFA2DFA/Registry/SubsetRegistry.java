package NFA2DFA.Registry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import NFA2DFA.Model.StateSet;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

/**
 * Assigns DFA state IDs to NFA subsets in discovery order, starting at 1.
 */
public class SubsetRegistry {
    public static final int MISSING_ELEMENT = -1;

    private final Object2IntMap<StateSet> subset2State;
    private final List<StateSet> state2Subset;

    public SubsetRegistry() {
        this.subset2State = new Object2IntOpenHashMap<>();
        this.subset2State.defaultReturnValue(MISSING_ELEMENT); // if missing, return MISSING_ELEMENT
        this.state2Subset = new ArrayList<>();
    }

    /**
     * Get the DFA state ID of a subset.
     * @param subset canonical NFA subset
     * @return DFA state ID or MISSING_ELEMENT if the subset is not registered.
     */
    public int get(StateSet subset) {
        return subset2State.getInt(subset);
    }

    /**
     * Register a new subset under the next free ID.
     * @param subset canonical NFA subset, not yet registered
     * @return the assigned DFA state ID
     */
    public int register(StateSet subset) {
        if (subset2State.containsKey(subset)) {
            throw new IllegalStateException("Subset already registered: " + subset);
        }
        state2Subset.add(subset);
        int stateID = state2Subset.size();
        subset2State.put(subset, stateID);
        return stateID;
    }

    public int size() {
        return state2Subset.size();
    }

    /**
     * Registered subsets, indexed by DFA state ID - 1.
     */
    public List<StateSet> subsets() {
        return Collections.unmodifiableList(state2Subset);
    }

    @Override
    public String toString() {
        return "SubsetRegistry" + state2Subset;
    }
}
