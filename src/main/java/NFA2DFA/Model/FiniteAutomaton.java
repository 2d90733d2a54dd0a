package NFA2DFA.Model;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectRBTreeMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectSortedMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import it.unimi.dsi.fastutil.ints.IntRBTreeSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;
import it.unimi.dsi.fastutil.ints.IntSortedSets;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.impl.CompactDFA;

/**
 * Finite automaton over String symbols with integer state IDs, used for both the input NFA
 * and the constructed DFA.
 * Transitions are stored as state -> (symbol -> destinations). Every state that appears as a
 * source or destination is a key of the relation, so lookups never miss once construction is done.
 * The epsilon symbol may appear in the relation but is never part of the alphabet.
 */
public class FiniteAutomaton {
    public static final String EPSILON = "E";

    private final int initialState;
    private final Alphabet<String> alphabet;
    private final IntSortedSet finalStates = new IntRBTreeSet();
    private final Int2ObjectSortedMap<Map<String, IntList>> transitions = new Int2ObjectRBTreeMap<>();

    public FiniteAutomaton(int initialState, Alphabet<String> alphabet) {
        this.initialState = initialState;
        this.alphabet = alphabet;
        addState(initialState);
    }

    public int getInitialState() {
        return initialState;
    }

    public Alphabet<String> getInputAlphabet() {
        return alphabet;
    }

    /**
     * Register a state with no outgoing transitions; no-op if already known.
     */
    public void addState(int state) {
        if (!transitions.containsKey(state)) {
            transitions.put(state, new HashMap<>());
        }
    }

    /**
     * Add end to the destinations of (start, symbol). Does not deduplicate.
     */
    public void addTransition(int start, String symbol, int end) {
        addState(start);
        transitions.get(start).computeIfAbsent(symbol, k -> new IntArrayList()).add(end);
        addState(end);
    }

    public void addFinalState(int state) {
        finalStates.add(state);
    }

    public boolean isFinal(int state) {
        return finalStates.contains(state);
    }

    public IntSortedSet getFinalStates() {
        return IntSortedSets.unmodifiable(finalStates);
    }

    /**
     * All known states, ascending.
     */
    public IntSortedSet getStates() {
        return IntSortedSets.unmodifiable(transitions.keySet());
    }

    public int size() {
        return transitions.size();
    }

    /**
     * Destinations of (state, symbol); empty if either is unknown.
     */
    public IntList getTransitions(int state, String symbol) {
        Map<String, IntList> symbolMap = transitions.get(state);
        if (symbolMap == null) {
            return IntLists.emptyList();
        }
        IntList destinations = symbolMap.get(symbol);
        return destinations == null ? IntLists.emptyList() : IntLists.unmodifiable(destinations);
    }

    public Map<String, IntList> getSymbolMap(int state) {
        Map<String, IntList> symbolMap = transitions.get(state);
        return symbolMap == null ? Collections.emptyMap() : Collections.unmodifiableMap(symbolMap);
    }

    /**
     * Copy a deterministic automaton into an AutomataLib {@link CompactDFA}. States are added in
     * ascending ID order, so DFA state k of a constructed DFA becomes compact state k-1.
     * @return - a (possibly partial) CompactDFA over the same alphabet
     * @throws IllegalStateException if the automaton has epsilon edges or several destinations per symbol
     */
    public CompactDFA<String> toCompactDFA() {
        final CompactDFA<String> out = new CompactDFA<>(alphabet, size());
        final Int2IntMap stateMap = new Int2IntOpenHashMap(size());

        for (int state : transitions.keySet()) {
            int outState = (state == initialState) ? out.addInitialState(isFinal(state)) : out.addState(isFinal(state));
            stateMap.put(state, outState);
        }

        for (Int2ObjectMap.Entry<Map<String, IntList>> entry : transitions.int2ObjectEntrySet()) {
            int state = entry.getIntKey();
            for (Map.Entry<String, IntList> trans : entry.getValue().entrySet()) {
                IntList destinations = trans.getValue();
                if (destinations.isEmpty()) {
                    continue;
                }
                if (EPSILON.equals(trans.getKey()) || !alphabet.containsSymbol(trans.getKey())) {
                    throw new IllegalStateException("Not a DFA: state " + state + " has a transition on " + trans.getKey());
                }
                if (destinations.size() > 1) {
                    throw new IllegalStateException("Not a DFA: state " + state + " has "
                        + destinations.size() + " destinations on " + trans.getKey());
                }
                out.setTransition(stateMap.get(state), alphabet.getSymbolIndex(trans.getKey()), stateMap.get(destinations.getInt(0)));
            }
        }
        return out;
    }

    @Override
    public String toString() {
        return "FiniteAutomaton{initial=" + initialState + ", final=" + finalStates
            + ", alphabet=" + alphabet + ", states=" + size() + "}";
    }
}
