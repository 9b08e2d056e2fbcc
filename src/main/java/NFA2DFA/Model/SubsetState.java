package NFA2DFA.Model;

import java.util.BitSet;
import java.util.StringJoiner;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;

/**
 * A DFA state discovered by the subset construction: a set of NFA states plus its discovery id.
 * The empty set is the dead state.
 */
public final class SubsetState {
    public static final String ID_PREFIX = "D";

    private final int id;
    private final IntList members;
    private final boolean accepting;
    private final String displayName;

    public SubsetState(int id, BitSet members, boolean accepting) {
        this.id = id;
        final IntArrayList list = new IntArrayList(members.cardinality());
        for (int i = members.nextSetBit(0); i >= 0; i = members.nextSetBit(i + 1)) {
            list.add(i);
        }
        this.members = IntLists.unmodifiable(list);
        this.accepting = accepting;
        this.displayName = displayName(this.members);
    }

    /**
     * Set notation over canonical NFA names, in index order, e.g. {@code {q0,q2}}.
     */
    public static String displayName(IntList members) {
        final StringJoiner joiner = new StringJoiner(",", "{", "}");
        for (int i = 0; i < members.size(); i++) {
            joiner.add(Nfa.CANONICAL_PREFIX + members.getInt(i));
        }
        return joiner.toString();
    }

    public int getId() {
        return id;
    }

    /**
     * @return {@code D<id>}
     */
    public String getName() {
        return ID_PREFIX + id;
    }

    public IntList getMembers() {
        return members;
    }

    public BitSet toBitSet() {
        final BitSet bits = new BitSet();
        for (int i = 0; i < members.size(); i++) {
            bits.set(members.getInt(i));
        }
        return bits;
    }

    public boolean contains(int nfaState) {
        return members.contains(nfaState);
    }

    public boolean isAccepting() {
        return accepting;
    }

    public boolean isDead() {
        return members.isEmpty();
    }

    public String getDisplayName() {
        return displayName;
    }

    @Override
    public String toString() {
        return getName() + " = " + displayName;
    }
}
