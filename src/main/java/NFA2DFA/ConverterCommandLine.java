package NFA2DFA;

import NFA2DFA.Export.GraphDescription;
import NFA2DFA.Model.ConversionException;
import NFA2DFA.Model.ConversionResult;
import NFA2DFA.Model.Nfa;
import NFA2DFA.Protocol.AutomatonTextWriter;
import NFA2DFA.Protocol.ConstructionLogWriter;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.serialization.ba.BAWriter;
import net.automatalib.util.automaton.Automata;
import net.automatalib.util.automaton.fsa.NFAs;

import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public class ConverterCommandLine {
  static final int EXIT_OK = 0;
  static final int EXIT_FAILURE = 1;
  static final int EXIT_USAGE = 2;

  static final String STDIN = "-";
  private static final String LOG_LEVEL_PROPERTY = "org.slf4j.simpleLogger.defaultLogLevel";

  public static void main(String[] args) {
    int status = run(args, System.in, System.out, System.err);
    if (status != EXIT_OK) {
      System.exit(status);
    }
  }

  static int run(String[] args, InputStream in, PrintStream out, PrintStream err) {
    String dotFile = null;
    String baFile = null;
    boolean verify = false;
    boolean debug = false;
    ConverterConfig config = ConverterConfig.defaults();
    List<String> positional = new ArrayList<>(1);

    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if ("--debug".equalsIgnoreCase(arg)) {
        debug = true;
      } else if ("--total".equalsIgnoreCase(arg)) {
        config = config.withIncludeDeadState(true);
      } else if ("--verify".equalsIgnoreCase(arg)) {
        verify = true;
      } else if ("--dot".equalsIgnoreCase(arg) || "--writeBA".equalsIgnoreCase(arg)
          || "--maxStates".equalsIgnoreCase(arg)) {
        // Require a value that isn't another flag
        if (i + 1 >= args.length || (args[i + 1].startsWith("-") && !STDIN.equals(args[i + 1]))) {
          err.println("Missing value for " + arg);
          return printUsage(err);
        }
        String value = args[++i]; // consume the value
        if ("--dot".equalsIgnoreCase(arg)) {
          dotFile = value;
        } else if ("--writeBA".equalsIgnoreCase(arg)) {
          baFile = value;
        } else {
          try {
            config = config.withMaxNfaStates(Integer.parseInt(value));
          } catch (IllegalArgumentException e) {
            err.println("Invalid value for --maxStates: " + value);
            return printUsage(err);
          }
        }
      } else if (arg.startsWith("-") && !STDIN.equals(arg)) {
        err.println("Unknown option: " + arg);
        return printUsage(err);
      } else {
        positional.add(arg);
      }
    }

    if (positional.size() != 1) {
      return printUsage(err);
    }

    String text;
    try {
      text = readInput(positional.get(0), in);
    } catch (IOException e) {
      err.println("Error: cannot read " + positional.get(0) + ": " + e.getMessage());
      return EXIT_FAILURE;
    }

    // slf4j-simple reads the level when the first logger is created; restored after this run
    String previousLevel = System.getProperty(LOG_LEVEL_PROPERTY);
    if (debug) {
      System.setProperty(LOG_LEVEL_PROPERTY, "debug");
    }
    try {
      return convert(text, new Converter(config), verify, dotFile, baFile, out, err);
    } finally {
      if (debug) {
        if (previousLevel == null) {
          System.clearProperty(LOG_LEVEL_PROPERTY);
        } else {
          System.setProperty(LOG_LEVEL_PROPERTY, previousLevel);
        }
      }
    }
  }

  private static int convert(String text, Converter converter, boolean verify, String dotFile, String baFile,
                             PrintStream out, PrintStream err) {
    try {
      Nfa nfa = converter.parse(text);
      out.print(AutomatonTextWriter.describe(nfa));
      out.println();

      ConversionResult result = converter.convert(nfa);
      if (verify) {
        verify(result);
      }
      out.print(ConstructionLogWriter.write(result));
      out.println();
      out.print(AutomatonTextWriter.describe(result.dfa()));
      out.println("DFA size: " + result.dfa().size());

      if (verify) {
        out.println("Equivalence check: passed");
      }

      GraphDescription graph = converter.export(result);
      if (dotFile != null) {
        out.println("Writing graph description to file: " + dotFile);
        Files.writeString(Path.of(dotFile), graph.dot(), StandardCharsets.UTF_8);
      } else {
        out.println();
        out.print(graph.dot());
      }

      if (baFile != null) {
        writeBAFile(baFile, result.dfa().toCompactDFA(), out);
      }
    } catch (ConversionException e) {
      err.println("Error: " + e.getMessage());
      return EXIT_FAILURE;
    } catch (IOException e) {
      err.println("Error: cannot write output: " + e.getMessage());
      return EXIT_FAILURE;
    }
    return EXIT_OK;
  }

  private static int printUsage(PrintStream err) {
    err.println(
        "NFA2DFA [--debug] [--total] [--verify] [--maxStates <n>] [--dot <DOT output file>] [--writeBA <BA output file>] <NFA input file>");
    err.println("[--debug] : Additional debug/progress output (logging level for this run only)");
    err.println("[--total] : Draw the dead state and the transitions into it");
    err.println("[--verify] : Cross-check the DFA against AutomataLib's determinization");
    err.println("[--maxStates <n>] : Reject NFAs with more than n states (default "
        + ConverterConfig.DEFAULT_MAX_NFA_STATES + ")");
    err.println("[--dot <DOT output file>] : Write the graph description to a file instead of stdout");
    err.println("[--writeBA <BA output file>] : Write DFA to specified output file in BA format");
    err.println();
    err.println("<NFA input file> : automaton description, or '-' for stdin. Format:");
    err.println("  Enter number of states: <n>");
    err.println("  Enter states: <n state names>");
    err.println("  Enter number of symbols: <m>");
    err.println("  Enter symbols (separate by space): <m symbols>");
    err.println("  Enter start state: <state>");
    err.println("  Enter number of accepting states: <k>");
    err.println("  Enter accepting states: <k state names>");
    err.println("  Enter number of transitions: <t>");
    err.println("  Enter transition (fromState symbol toState): <from> <symbol> <to>   (t times)");
    return EXIT_USAGE;
  }

  private static String readInput(String source, InputStream in) throws IOException {
    if (STDIN.equals(source)) {
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }
    return Files.readString(Path.of(source), StandardCharsets.UTF_8);
  }

  /**
   * Compare against AutomataLib's own determinization.
   * @throws VerificationException if the languages differ
   */
  static void verify(ConversionResult result) throws VerificationException {
    Alphabet<String> alphabet = result.nfa().getInputAlphabet();
    CompactDFA<String> reference = NFAs.determinize(result.nfa().toCompactNFA(), alphabet, false, false);
    if (!Automata.testEquivalence(result.dfa().toCompactDFA(), reference, alphabet)) {
      throw new VerificationException("Subset construction disagrees with reference determinization");
    }
  }

  private static void writeBAFile(String filename, CompactDFA<String> dfa, PrintStream out) throws IOException {
    out.println("Writing to file: " + filename);
    BAWriter<String> baWriter = new BAWriter<>();
    try (OutputStream os = new FileOutputStream(filename)) {
      baWriter.writeModel(os, dfa, dfa.getInputAlphabet());
    }
  }
}
