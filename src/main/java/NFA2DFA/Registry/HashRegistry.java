package NFA2DFA.Registry;

import java.util.BitSet;

import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

public class HashRegistry implements Registry {
    private final Object2IntMap<BitSet> key2State;

    public HashRegistry() {
        this.key2State = new Object2IntOpenHashMap<>();
        this.key2State.defaultReturnValue(MISSING_ELEMENT); // if missing, return MISSING_ELEMENT
    }

    @Override
    public int get(BitSet subset) {
        return key2State.getInt(subset);
    }

    @Override
    public void put(BitSet subset, int stateID) {
        if (key2State.containsKey(subset)) {
            throw new IllegalStateException("Subset " + subset + " is already registered");
        }
        key2State.put((BitSet) subset.clone(), stateID);
    }

    @Override
    public int size() {
        return key2State.size();
    }

    @Override
    public String toString() {
        return "Hash(" + key2State.size() + ")";
    }
}
