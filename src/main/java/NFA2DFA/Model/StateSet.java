package NFA2DFA.Model;

import java.util.Arrays;

import it.unimi.dsi.fastutil.ints.IntCollection;

/**
 * Canonical key for a subset of NFA states: a sorted, duplicate-free sequence of state IDs.
 * Two StateSets are equal iff they contain the same states, regardless of the order
 * the states were discovered in.
 */
public final class StateSet {
    public static final StateSet EMPTY = new StateSet(new int[0]);

    private final int[] states;
    private final int hash;

    private StateSet(int[] sortedStates) {
        this.states = sortedStates;
        this.hash = Arrays.hashCode(sortedStates);
    }

    public static StateSet of(int... states) {
        return canonical(states.clone());
    }

    public static StateSet of(IntCollection states) {
        return canonical(states.toIntArray());
    }

    private static StateSet canonical(int[] raw) {
        if (raw.length == 0) {
            return EMPTY;
        }
        Arrays.sort(raw);
        int unique = 1;
        for (int i = 1; i < raw.length; i++) {
            if (raw[i] != raw[unique - 1]) {
                raw[unique++] = raw[i];
            }
        }
        return new StateSet(unique == raw.length ? raw : Arrays.copyOf(raw, unique));
    }

    public int size() {
        return states.length;
    }

    public boolean isEmpty() {
        return states.length == 0;
    }

    public int get(int index) {
        return states[index];
    }

    public boolean contains(int state) {
        return Arrays.binarySearch(states, state) >= 0;
    }

    /**
     * Whether any state of this set is also in the given collection.
     */
    public boolean intersects(IntCollection others) {
        for (int s : states) {
            if (others.contains(s)) {
                return true;
            }
        }
        return false;
    }

    public boolean isSubsetOf(StateSet other) {
        for (int s : states) {
            if (!other.contains(s)) {
                return false;
            }
        }
        return true;
    }

    public int[] toIntArray() {
        return states.clone();
    }

    /**
     * Comma joined states without braces, e.g. "0,1,4".
     */
    public String join() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < states.length; i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(states[i]);
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StateSet)) {
            return false;
        }
        StateSet other = (StateSet) o;
        return hash == other.hash && Arrays.equals(states, other.states);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return "{" + join() + "}";
    }
}
