package NFA2DFA.Protocol;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

import NFA2DFA.Model.NfaDefinition;

/**
 * Reads the line-oriented automaton description:
 * <pre>
 * Enter number of states: 2
 * Enter states: q0 q1
 * Enter number of symbols: 1
 * Enter symbols (separate by space): a
 * Enter start state: q0
 * Enter number of accepting states: 1
 * Enter accepting states: q1
 * Enter number of transitions: 2
 * Enter transition (fromState symbol toState): q0 a q0
 * Enter transition (fromState symbol toState): q0 a q1
 * </pre>
 * Blank lines and Markdown code fences are skipped. Everything else is positional.
 * Counts of list fields are only checked against the lists later, in
 * {@link NFA2DFA.Model.Nfa#of(NfaDefinition)}; the transition count decides how many lines are read.
 */
public final class ProtocolParser {
    private static final Pattern LINE_BREAK = Pattern.compile("\\R");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final String FENCE = "```";

    private final List<Line> lines;
    private int pos;

    private ProtocolParser(List<Line> lines) {
        this.lines = lines;
    }

    public static NfaDefinition parse(String text) throws ProtocolException {
        return new ProtocolParser(clean(Arrays.asList(LINE_BREAK.split(text, -1)))).parseDefinition();
    }

    public static NfaDefinition parse(Reader reader) throws IOException, ProtocolException {
        final List<String> raw = new ArrayList<>();
        final BufferedReader br = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
        String line;
        while ((line = br.readLine()) != null) {
            raw.add(line);
        }
        return new ProtocolParser(clean(raw)).parseDefinition();
    }

    private static List<Line> clean(List<String> raw) {
        final List<Line> result = new ArrayList<>(raw.size());
        for (int i = 0; i < raw.size(); i++) {
            final String text = raw.get(i).strip();
            if (text.isEmpty() || text.startsWith(FENCE)) {
                continue;
            }
            result.add(new Line(i + 1, text));
        }
        return result;
    }

    private NfaDefinition parseDefinition() throws ProtocolException {
        final int stateCount = readCount(ProtocolField.STATE_COUNT);
        final List<String> states = readNames(ProtocolField.STATES, stateCount);
        final int symbolCount = readCount(ProtocolField.SYMBOL_COUNT);
        final List<String> symbols = readNames(ProtocolField.SYMBOLS, symbolCount);

        final Line startLine = next(ProtocolField.START_STATE);
        final List<String> start = tokens(startLine, ProtocolField.START_STATE);
        if (start.isEmpty()) {
            throw new ProtocolException(startLine.number, "start state is empty");
        }
        if (start.size() > 1) {
            throw new ProtocolException(startLine.number, "expected a single start state, got " + start);
        }

        final int acceptingCount = readCount(ProtocolField.ACCEPTING_COUNT);
        final List<String> accepting = readNames(ProtocolField.ACCEPTING_STATES, acceptingCount);

        final int transitionCount = readCount(ProtocolField.TRANSITION_COUNT);
        // the count is untrusted until the lines are there
        final List<NfaDefinition.Transition> transitions = new ArrayList<>(Math.min(transitionCount, lines.size() - pos));
        for (int i = 0; i < transitionCount; i++) {
            if (pos >= lines.size()) {
                throw new ProtocolException("declared " + transitionCount + " transitions but found " + i);
            }
            final Line line = next(ProtocolField.TRANSITION);
            final List<String> parts = tokens(line, ProtocolField.TRANSITION);
            if (parts.size() != 3) {
                throw new ProtocolException(line.number,
                    "transition must be 'fromState symbol toState', got '" + String.join(" ", parts) + "'");
            }
            transitions.add(new NfaDefinition.Transition(parts.get(0), parts.get(1), parts.get(2)));
        }

        if (pos < lines.size()) {
            final Line extra = lines.get(pos);
            if (extra.text.startsWith(ProtocolField.TRANSITION.getLabel())) {
                throw new ProtocolException(extra.number,
                    "more transitions than the declared " + transitionCount);
            }
            throw new ProtocolException(extra.number, "unexpected content after the last transition");
        }

        return new NfaDefinition(stateCount, states, symbolCount, symbols, start.get(0),
            acceptingCount, accepting, transitionCount, transitions);
    }

    private Line next(ProtocolField field) throws ProtocolException {
        if (pos >= lines.size()) {
            throw new ProtocolException("missing line '" + field.getLabel() + "'");
        }
        final Line line = lines.get(pos);
        if (!line.text.startsWith(field.getLabel())) {
            throw new ProtocolException(line.number, "expected '" + field.getLabel() + "'");
        }
        pos++;
        return line;
    }

    private int readCount(ProtocolField field) throws ProtocolException {
        final Line line = next(field);
        final String value = value(line, field);
        if (value.isEmpty()) {
            throw new ProtocolException(line.number, "missing count for '" + field.getLabel() + "'");
        }
        final int count;
        try {
            count = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ProtocolException(line.number, "'" + value + "' is not a number");
        }
        if (count < 0) {
            throw new ProtocolException(line.number, "count must not be negative, got " + count);
        }
        return count;
    }

    private List<String> readNames(ProtocolField field, int declared) throws ProtocolException {
        final Line line = next(field);
        final List<String> names = tokens(line, field);
        if (declared > 0 && names.isEmpty()) {
            throw new ProtocolException(line.number, "'" + field.getLabel() + "' is empty");
        }
        return names;
    }

    /**
     * Whitespace separated tokens of the value. There are no escapes: names containing ':' or '"'
     * are rejected instead of guessed at.
     */
    private static List<String> tokens(Line line, ProtocolField field) throws ProtocolException {
        final String value = value(line, field);
        if (value.isEmpty()) {
            return Collections.emptyList();
        }
        final List<String> result = Arrays.asList(WHITESPACE.split(value));
        for (String token : result) {
            if (token.indexOf(':') >= 0 || token.indexOf('"') >= 0) {
                throw new ProtocolException(line.number, "name '" + token + "' contains ':' or '\"'");
            }
        }
        return result;
    }

    private static String value(Line line, ProtocolField field) {
        return line.text.substring(field.getLabel().length()).strip();
    }

    private record Line(int number, String text) { }
}
