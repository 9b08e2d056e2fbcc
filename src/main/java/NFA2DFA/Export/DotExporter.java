package NFA2DFA.Export;

import java.io.IOException;

import NFA2DFA.Model.SubsetDfa;
import NFA2DFA.Model.SubsetState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes a {@link SubsetDfa} as a Graphviz digraph. Accepting states are double circles, the
 * start state is pointed at by an unlabelled arrow from a point node. The dead state and the
 * edges touching it are left out unless a total diagram is requested.
 */
public final class DotExporter {
    private static final Logger LOG = LoggerFactory.getLogger(DotExporter.class);

    static final String GRAPH_NAME = "DFA";
    static final String START_NODE = "start";
    private static final String INDENT = "    ";

    private final boolean includeDeadState;

    public DotExporter(boolean includeDeadState) {
        this.includeDeadState = includeDeadState;
    }

    public GraphDescription export(SubsetDfa dfa) throws ExportException {
        final StringBuilder sb = new StringBuilder();
        final int[] counts = export(dfa, sb);
        return new GraphDescription(sb.toString(), counts[0], counts[1]);
    }

    /**
     * @return {nodes, edges} written
     */
    public int[] export(SubsetDfa dfa, Appendable out) throws ExportException {
        if (dfa.size() == 0) {
            throw new ExportException("DFA has no states");
        }
        try {
            return write(dfa, out);
        } catch (IOException e) {
            throw new ExportException("Could not write graph description: " + e.getMessage(), e);
        }
    }

    private int[] write(SubsetDfa dfa, Appendable out) throws IOException {
        int nodes = 0;
        int edges = 0;

        out.append("digraph ").append(GRAPH_NAME).append(" {\n");
        out.append(INDENT).append("rankdir=LR;\n");

        for (SubsetState s : dfa.getStates()) {
            if (!drawn(s)) {
                continue;
            }
            out.append(INDENT).append(s.getName())
               .append(" [label=").append(quote(s.getDisplayName()))
               .append(", shape=").append(s.isAccepting() ? "doublecircle" : "circle");
            if (s.isDead()) {
                out.append(", style=dashed");
            }
            out.append("];\n");
            nodes++;
        }

        out.append(INDENT).append(START_NODE).append(" [shape=point];\n");
        out.append(INDENT).append(START_NODE).append(" -> ")
           .append(dfa.getState(dfa.getInitialState()).getName()).append(";\n");

        for (SubsetState s : dfa.getStates()) {
            if (!drawn(s)) {
                continue;
            }
            for (int a = 0; a < dfa.getInputAlphabet().size(); a++) {
                final SubsetState target = dfa.getState(dfa.getSuccessor(s.getId(), a));
                if (!drawn(target)) {
                    continue;
                }
                out.append(INDENT).append(s.getName()).append(" -> ").append(target.getName())
                   .append(" [label=").append(quote(dfa.getInputAlphabet().getSymbol(a))).append("];\n");
                edges++;
            }
        }

        out.append("}\n");
        LOG.debug("Exported {} nodes and {} edges", nodes, edges);
        return new int[] {nodes, edges};
    }

    private boolean drawn(SubsetState s) {
        // a dead initial state cannot happen: the initial subset always holds the NFA start state
        return includeDeadState || !s.isDead();
    }

    /**
     * DOT double-quoted ID, escaping backslashes and quotes.
     */
    static String quote(String str) {
        return "\"" + str.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }
}
