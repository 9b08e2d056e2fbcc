package NFA2DFA.Export;

/**
 * A rendered graph, handed to whatever draws it.
 *
 * @param dot       Graphviz DOT source
 * @param nodeCount number of automaton states drawn (the start marker is not counted)
 * @param edgeCount number of labelled transitions drawn (the start arrow is not counted)
 */
public record GraphDescription(String dot, int nodeCount, int edgeCount) {
    @Override
    public String toString() {
        return dot;
    }
}
