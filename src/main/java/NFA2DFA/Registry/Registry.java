package NFA2DFA.Registry;

import java.util.BitSet;

/**
 * Maps a set of NFA states to the id of the DFA state that represents it.
 * Lookups compare sets by value.
 */
public interface Registry {
    int MISSING_ELEMENT = -1;

    /**
     * Get the DFA state ID registered for the subset.
     * @param subset set of NFA states
     * @return state ID or MISSING_ELEMENT if the subset has not been registered.
     */
    int get(BitSet subset);

    /**
     * Register a new subset with its (fixed) state ID.
     * @param subset set of NFA states; must not be mutated afterwards
     * @param stateID state ID
     */
    void put(BitSet subset, int stateID);

    /**
     * @return number of registered subsets
     */
    int size();
}
