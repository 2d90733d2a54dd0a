package NFA2DFA;

import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import NFA2DFA.Model.Determinization;
import NFA2DFA.Model.FiniteAutomaton;
import NFA2DFA.Trace.TraceWriter;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.exception.FormatException;
import net.automatalib.serialization.ba.BAWriter;

public class NFA2DFACommandLine {
  static final int EXIT_OK = 0;
  static final int EXIT_MALFORMED = 1;
  static final int EXIT_USAGE = 2;

  public static void main(String[] args) {
    int status = run(args, System.in, System.out, System.err);
    if (status != EXIT_OK) {
      System.exit(status);
    }
  }

  /**
   * Parse the NFA, print the derivation trace and then the DFA table.
   * @param args - command-line arguments
   * @param in - NFA source when no file is given
   * @param out - trace and table
   * @param err - error messages
   * @return - process exit status
   */
  static int run(String[] args, InputStream in, PrintStream out, PrintStream err) {
    String filename = null;
    boolean debug = false;
    List<String> positional = new ArrayList<>(1);

    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if ("--debug".equalsIgnoreCase(arg)) {
        debug = true;
      } else if ("--writeBA".equalsIgnoreCase(arg)) {
        // Require a value that isn't another flag
        if (i + 1 >= args.length || args[i + 1].startsWith("-")) {
          err.println("Missing value for --writeBA");
          printUsage(out);
          return EXIT_USAGE;
        }
        filename = args[++i]; // consume the value
      } else if (arg.startsWith("-")) {
        // Unknown flag
        printUsage(out);
        return EXIT_USAGE;
      } else {
        positional.add(arg);
      }
    }

    if (positional.size() > 1) {
      printUsage(out);
      return EXIT_USAGE;
    }

    // DEBUG is process-global; only this invocation sees --debug
    final boolean previousDebug = SubsetConstruction.DEBUG;
    SubsetConstruction.DEBUG = previousDebug || debug;
    try {
      final FiniteAutomaton nfa;
      try {
        nfa = positional.isEmpty() ? NFAFormat.read(in) : NFAFormat.read(Path.of(positional.get(0)));
      } catch (FormatException e) {
        err.println("Malformed NFA: " + e.getMessage());
        return EXIT_MALFORMED;
      } catch (IOException e) {
        err.println("Unable to read NFA: " + e.getMessage());
        return EXIT_MALFORMED;
      }
      if (SubsetConstruction.DEBUG) {
        System.err.println("DEBUG: Original NFA size: " + nfa.size());
        System.err.println("DEBUG: Alphabet size: " + nfa.getInputAlphabet().size());
      }

      long before = System.currentTimeMillis();
      Determinization result = SubsetConstruction.determinize(nfa, new TraceWriter(out));
      long after = System.currentTimeMillis();
      if (SubsetConstruction.DEBUG) {
        System.err.println("DEBUG: subset construction duration: " + ((after - before) / 1000f) + "s");
      }

      out.println(TableWriter.toTable(result.dfa()));
      out.flush();

      if (filename != null) {
        writeBAFile(filename, result.dfa().toCompactDFA());
      }
      return EXIT_OK;
    } finally {
      SubsetConstruction.DEBUG = previousDebug;
    }
  }

  private static void printUsage(PrintStream out) {
    out.println("nfa2dfa [--debug] [--writeBA <BA output file>] [<NFA input file>]");
    out.println("[--debug] : Additional debug/progress output on stderr");
    out.println("[--writeBA <BA output file>] : Also write the DFA to the specified file in BA format");
    out.println();
    out.println("<NFA input file> : NFA description; standard input if omitted.");
    out.println("  Initial State: {0}");
    out.println("  Final States: {2}");
    out.println("  Total States: 3");
    out.println("  State a E");
    out.println("  0 {} {1}");
    out.println("  1 {2} {}");
    out.println("  2 {} {}");
  }

  static void writeBAFile(String filename, CompactDFA<String> dfa) {
    if (SubsetConstruction.DEBUG) {
      System.err.println("DEBUG: Writing to file: " + filename);
    }
    BAWriter<String> baWriter = new BAWriter<>();
    try (OutputStream os = new FileOutputStream(filename)) {
      baWriter.writeModel(os, dfa, dfa.getInputAlphabet());
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}
