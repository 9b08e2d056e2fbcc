package NFA2DFA.Model;

import NFA2DFA.BitSetUtils;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.BitSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertThrows;

public class SubsetDfaTest {
  private static final Alphabet<String> AB = Alphabets.fromList(List.of("a", "b"));

  // D0 = {q0} -a-> D1 = {q0,q2} (accepting), everything else -> D2 = {}
  private static SubsetDfa sample() {
    List<SubsetState> states = List.of(
        new SubsetState(0, BitSetUtils.convertListToBitSet(List.of(0)), false),
        new SubsetState(1, BitSetUtils.convertListToBitSet(List.of(2, 0)), true),
        new SubsetState(2, new BitSet(), false));
    int[][] transitions = {{1, 2}, {1, 2}, {2, 2}};
    return new SubsetDfa(AB, states, transitions, 2);
  }

  @Test
  void testSubsetState() {
    SubsetState s = sample().getState(1);
    Assertions.assertEquals("D1", s.getName());
    Assertions.assertEquals("{q0,q2}", s.getDisplayName());
    Assertions.assertEquals("D1 = {q0,q2}", s.toString());
    Assertions.assertEquals(BitSetUtils.convertListToBitSet(List.of(0, 2)), s.toBitSet());
    Assertions.assertTrue(s.contains(2));
    Assertions.assertFalse(s.contains(1));
    Assertions.assertFalse(s.isDead());
    assertThrows(UnsupportedOperationException.class, () -> s.getMembers().add(5));
  }

  @Test
  void testWalk() {
    SubsetDfa dfa = sample();
    Assertions.assertEquals(3, dfa.size());
    Assertions.assertEquals(6, dfa.getTransitionCount());
    Assertions.assertTrue(dfa.hasDeadState());
    Assertions.assertTrue(dfa.accepts(List.of("a", "a")));
    Assertions.assertFalse(dfa.accepts(List.of("a", "b")));
    Assertions.assertEquals(2, dfa.getStateReachedBy(List.of("b", "a")));
    assertThrows(IllegalArgumentException.class, () -> dfa.getSuccessor(0, "c"));
  }

  @Test
  void testToCompactDFA() {
    SubsetDfa dfa = sample();
    CompactDFA<String> compact = dfa.toCompactDFA();
    Assertions.assertEquals(3, compact.size());
    Assertions.assertEquals(0, (int) compact.getInitialState());
    Assertions.assertTrue(compact.isAccepting(1));
    Assertions.assertTrue(compact.accepts(List.of("a", "a", "a")));
    Assertions.assertFalse(compact.accepts(List.of("b")));
  }

  @Test
  void testRejectsPartialTables() {
    List<SubsetState> states = List.of(new SubsetState(0, BitSetUtils.convertListToBitSet(List.of(0)), false));
    assertThrows(IllegalArgumentException.class, () -> new SubsetDfa(AB, states, new int[][] {{0}}, -1));
    assertThrows(IllegalArgumentException.class, () -> new SubsetDfa(AB, states, new int[0][], -1));
  }

  @Test
  void testFrozen() {
    int[][] transitions = {{0, 0}};
    List<SubsetState> states = List.of(new SubsetState(0, BitSetUtils.convertListToBitSet(List.of(0)), true));
    SubsetDfa dfa = new SubsetDfa(AB, states, transitions, SubsetDfa.NO_DEAD_STATE);
    transitions[0][0] = 7;
    Assertions.assertEquals(0, dfa.getSuccessor(0, 0));
    assertThrows(UnsupportedOperationException.class, () -> dfa.getStates().add(null));
  }
}
