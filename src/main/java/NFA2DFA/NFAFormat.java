package NFA2DFA;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import NFA2DFA.Model.FiniteAutomaton;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.exception.FormatException;

/**
 * Reads the textual NFA description:
 * <pre>
 * Initial State: {0}
 * Final States: {2}
 * Total States: 3
 * State a E
 * 0 {} {1}
 * 1 {2} {}
 * 2 {} {}
 * </pre>
 * One column must be the epsilon symbol {@code E}; it is kept in the transitions but not in the alphabet.
 */
public class NFAFormat {
    private static final Pattern INITIAL = Pattern.compile("Initial State:\\s*\\{\\s*(\\d+)\\s*}\\s*");
    private static final Pattern FINAL = Pattern.compile("Final States:\\s*\\{([^}]*)}\\s*");
    private static final Pattern TOTAL = Pattern.compile("Total States:\\s*(\\d+)\\s*");
    private static final Pattern HEADER = Pattern.compile("State\\s+(\\S.*)");
    private static final Pattern SPLIT = Pattern.compile("\\s+");

    public static FiniteAutomaton read(InputStream is) throws IOException, FormatException {
        BufferedReader reader = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8));
        return new LineParser(reader).parse();
    }

    public static FiniteAutomaton read(Path path) throws IOException, FormatException {
        try (InputStream is = Files.newInputStream(path)) {
            return read(is);
        }
    }

    public static FiniteAutomaton read(String text) throws FormatException {
        BufferedReader reader = new BufferedReader(new StringReader(text));
        try {
            return new LineParser(reader).parse();
        } catch (IOException e) {
            // StringReader does not fail
            throw new IllegalStateException(e);
        }
    }

    private static final class LineParser {
        private final BufferedReader reader;
        private int lineNumber;

        LineParser(BufferedReader reader) {
            this.reader = reader;
        }

        FiniteAutomaton parse() throws IOException, FormatException {
            final int initialState = parseState(header(INITIAL, "Initial State: {<state>}").group(1));
            final IntList finalStates = parseStateList(header(FINAL, "Final States: {<state>,...}").group(1));
            final int totalStates = parseState(header(TOTAL, "Total States: <count>").group(1));
            final List<String> columns = List.of(SPLIT.split(header(HEADER, "State <symbol> ...").group(1).trim()));

            final Set<String> seen = new HashSet<>();
            for (String column : columns) {
                if (!seen.add(column)) {
                    throw error("duplicate symbol column '" + column + "'");
                }
            }
            if (!seen.contains(FiniteAutomaton.EPSILON)) {
                throw error("missing epsilon column '" + FiniteAutomaton.EPSILON + "'");
            }
            final List<String> symbols = new ArrayList<>(columns);
            symbols.remove(FiniteAutomaton.EPSILON);

            final FiniteAutomaton nfa = new FiniteAutomaton(initialState, Alphabets.fromList(symbols));
            for (int f : finalStates) {
                nfa.addFinalState(f);
                nfa.addState(f);
            }

            final Pattern row = rowPattern(columns.size());
            final IntSet rows = new IntOpenHashSet();
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                Matcher m = row.matcher(line);
                if (!m.matches()) {
                    throw error("expected a state followed by " + columns.size() + " {...} groups");
                }
                int from = parseState(m.group(1));
                if (!rows.add(from)) {
                    throw error("duplicate row for state " + from);
                }
                nfa.addState(from);
                for (int c = 0; c < columns.size(); c++) {
                    for (int to : parseStateList(m.group(c + 2))) {
                        nfa.addTransition(from, columns.get(c), to);
                    }
                }
            }

            if (SubsetConstruction.DEBUG && nfa.size() != totalStates) {
                System.err.println("DEBUG: Total States says " + totalStates + " but " + nfa.size() + " states are used");
            }
            return nfa;
        }

        private Matcher header(Pattern pattern, String expected) throws IOException, FormatException {
            String line = reader.readLine();
            lineNumber++;
            if (line == null) {
                throw error("unexpected end of input, expected '" + expected + "'");
            }
            Matcher m = pattern.matcher(line.trim());
            if (!m.matches()) {
                throw error("expected '" + expected + "' but found '" + line + "'");
            }
            return m;
        }

        private IntList parseStateList(String list) throws FormatException {
            final IntList states = new IntArrayList();
            if (list.isBlank()) {
                return states;
            }
            for (String state : list.split(",")) {
                states.add(parseState(state.trim()));
            }
            return states;
        }

        private int parseState(String state) throws FormatException {
            try {
                int id = Integer.parseInt(state);
                if (id < 0) {
                    throw error("negative state '" + state + "'");
                }
                return id;
            } catch (NumberFormatException e) {
                throw new FormatException("line " + lineNumber + ": invalid state '" + state + "'", e);
            }
        }

        private FormatException error(String message) {
            return new FormatException("line " + lineNumber + ": " + message);
        }
    }

    private static Pattern rowPattern(int columns) {
        StringBuilder sb = new StringBuilder("\\s*([^\\s{]+)");
        for (int i = 0; i < columns; i++) {
            sb.append("\\s*\\{([^}]*)}");
        }
        sb.append("\\s*");
        return Pattern.compile(sb.toString());
    }
}
