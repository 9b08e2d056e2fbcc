package NFA2DFA.Registry;

import NFA2DFA.BitSetUtils;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.BitSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertThrows;

public class RegistryTest {
  @Test
  void testHashRegistry() {
    HashRegistry registry = new HashRegistry();
    Assertions.assertEquals(Registry.MISSING_ELEMENT, registry.get(new BitSet()));
    Assertions.assertEquals(0, registry.size());

    BitSet b = BitSetUtils.convertListToBitSet(List.of(1,2,3));
    registry.put(b, 1);
    Assertions.assertEquals(1, registry.get(b));

    b = BitSetUtils.convertListToBitSet(List.of(1));
    registry.put(b, 0);
    Assertions.assertEquals(0, registry.get(b));
    Assertions.assertEquals(2, registry.size());
    Assertions.assertEquals("Hash(2)", registry.toString());
  }

  @Test
  void testLookupIsByValue() {
    HashRegistry registry = new HashRegistry();
    BitSet key = BitSetUtils.convertListToBitSet(List.of(0,4));
    registry.put(key, 7);

    // different allocation, same contents
    BitSet sameContents = new BitSet(1024);
    sameContents.set(4);
    sameContents.set(0);
    Assertions.assertEquals(7, registry.get(sameContents));

    // mutating the caller's key afterwards does not corrupt the registry
    key.set(9);
    Assertions.assertEquals(7, registry.get(sameContents));
    Assertions.assertEquals(Registry.MISSING_ELEMENT, registry.get(key));
  }

  @Test
  void testDoubleRegistrationFails() {
    HashRegistry registry = new HashRegistry();
    registry.put(BitSetUtils.convertListToBitSet(List.of(2)), 0);
    assertThrows(IllegalStateException.class,
        () -> registry.put(BitSetUtils.convertListToBitSet(List.of(2)), 1));
  }
}
