package NFA2DFA.Model;

/**
 * One entry of the construction log: the transition computed for (source, symbol).
 *
 * @param source     id of the subset state being processed
 * @param symbol     input symbol
 * @param target     id of the successor subset state
 * @param discovered whether the successor was first seen by this step
 */
public record ConstructionStep(int source, String symbol, int target, boolean discovered) {

    @Override
    public String toString() {
        return SubsetState.ID_PREFIX + source + " -" + symbol + "-> " + SubsetState.ID_PREFIX + target
            + (discovered ? " (new)" : " (known)");
    }
}
