package NFA2DFA.Protocol;

import NFA2DFA.Model.ConversionResult;
import NFA2DFA.Model.MalformedAutomatonException;
import NFA2DFA.Model.Nfa;
import NFA2DFA.Model.NfaDefinition;
import NFA2DFA.Model.NfaDefinition.Transition;
import NFA2DFA.SubsetConstruction;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

public class WritersTest {
  // q0 -a-> q1, nothing on 'b': needs a dead state
  static Nfa gapNfa() throws MalformedAutomatonException {
    return Nfa.of(NfaDefinition.of(List.of("q0", "q1"), List.of("a", "b"), "q0", List.of("q1"),
        List.of(new Transition("q0", "a", "q1"))));
  }

  // strings over {a,b} ending in "ab", with non-canonical names
  static Nfa endsWithAb() throws MalformedAutomatonException {
    return Nfa.of(NfaDefinition.of(List.of("A", "B", "C"), List.of("a", "b"), "A", List.of("C"),
        List.of(new Transition("A", "a", "A"), new Transition("A", "b", "A"),
            new Transition("A", "a", "B"), new Transition("B", "b", "C"))));
  }

  @Test
  void testConstructionLog() throws MalformedAutomatonException {
    ConversionResult result = SubsetConstruction.determinize(gapNfa());
    String expected = String.join("\n",
        "Subset construction log:",
        "Start state D0 = {q0}",
        "Processing D0 = {q0}:",
        "    On symbol 'a' -> D1 = {q1} (new)",
        "    On symbol 'b' -> D2 = {} (new)",
        "Processing D1 = {q1}:",
        "    On symbol 'a' -> D2 = {} (known)",
        "    On symbol 'b' -> D2 = {} (known)",
        "Dead state D2 = {}:",
        "    On symbol 'a' -> D2 = {} (known)",
        "    On symbol 'b' -> D2 = {} (known)",
        "Accepting states: D1",
        "");
    Assertions.assertEquals(expected, ConstructionLogWriter.write(result));
  }

  @Test
  void testConstructionLogWithoutAcceptingStates() throws MalformedAutomatonException {
    Nfa nfa = Nfa.of(NfaDefinition.of(List.of("x"), List.of("0"), "x", List.of(),
        List.of(new Transition("x", "0", "x"))));
    String log = ConstructionLogWriter.write(SubsetConstruction.determinize(nfa));
    Assertions.assertTrue(log.endsWith("    On symbol '0' -> D0 = {q0} (known)\nAccepting states: none\n"), log);
  }

  @Test
  void testDescribeNfa() throws MalformedAutomatonException {
    String expected = String.join("\n",
        "********************************************",
        "States: q0 q1 q2",
        "Renamed: A=q0 B=q1 C=q2",
        "Symbols: a b",
        "Start state: q0",
        "Transitions:",
        "From state q0 -> a -> q0 q1",
        "From state q0 -> b -> q0",
        "From state q1 -> b -> q2",
        "Accepting states: q2",
        "********************************************",
        "");
    Assertions.assertEquals(expected, AutomatonTextWriter.describe(endsWithAb()));
    Assertions.assertFalse(AutomatonTextWriter.describe(gapNfa()).contains("Renamed:"));
  }

  @Test
  void testDescribeDfa() throws MalformedAutomatonException {
    ConversionResult result = SubsetConstruction.determinize(endsWithAb());
    String expected = String.join("\n",
        "Converted DFA:",
        "State D0 {q0}:",
        "    On symbol 'a' -> D1 {q0,q1}",
        "    On symbol 'b' -> D0 {q0}",
        "State D1 {q0,q1}:",
        "    On symbol 'a' -> D1 {q0,q1}",
        "    On symbol 'b' -> D2 {q0,q2}",
        "State D2 {q0,q2}:",
        "    On symbol 'a' -> D1 {q0,q1}",
        "    On symbol 'b' -> D0 {q0}",
        "Start state: D0",
        "Accepting states: D2",
        "");
    Assertions.assertEquals(expected, AutomatonTextWriter.describe(result.dfa()));
  }

  @Test
  void testProtocolWriterUsesCanonicalNames() throws Exception {
    Nfa original = endsWithAb();
    String text = ProtocolWriter.write(original);
    Assertions.assertEquals(String.join("\n",
        "Enter number of states: 3",
        "Enter states: q0 q1 q2",
        "Enter number of symbols: 2",
        "Enter symbols (separate by space): a b",
        "Enter start state: q0",
        "Enter number of accepting states: 1",
        "Enter accepting states: q2",
        "Enter number of transitions: 4",
        "Enter transition (fromState symbol toState): q0 a q0",
        "Enter transition (fromState symbol toState): q0 a q1",
        "Enter transition (fromState symbol toState): q0 b q0",
        "Enter transition (fromState symbol toState): q1 b q2",
        ""), text);

    Nfa reparsed = Nfa.of(ProtocolParser.parse(text));
    Assertions.assertFalse(reparsed.isRenamed());
    Assertions.assertEquals(AutomatonTextWriter.describe(SubsetConstruction.determinize(original).dfa()),
        AutomatonTextWriter.describe(SubsetConstruction.determinize(reparsed).dfa()));
  }

  @Test
  void testProtocolWriterWithoutAcceptingStates() throws Exception {
    Nfa nfa = Nfa.of(NfaDefinition.of(List.of("x"), List.of("0"), "x", List.of(), List.of()));
    String text = ProtocolWriter.write(nfa);
    Assertions.assertTrue(text.contains("Enter accepting states:\n"), text);
    Assertions.assertEquals(0, Nfa.of(ProtocolParser.parse(text)).getAcceptingStates().cardinality());
  }
}
