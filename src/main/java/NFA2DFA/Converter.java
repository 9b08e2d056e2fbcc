package NFA2DFA;

import NFA2DFA.Export.DotExporter;
import NFA2DFA.Export.ExportException;
import NFA2DFA.Export.GraphDescription;
import NFA2DFA.Model.ConversionResult;
import NFA2DFA.Model.MalformedAutomatonException;
import NFA2DFA.Model.Nfa;
import NFA2DFA.Model.NfaDefinition;
import NFA2DFA.Protocol.ProtocolException;
import NFA2DFA.Protocol.ProtocolParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Text in, DFA and graph out. Parsing and validation finish before the construction starts, so a
 * failed conversion never exposes a partial DFA.
 */
public class Converter {
    private static final Logger LOG = LoggerFactory.getLogger(Converter.class);

    private final ConverterConfig config;

    public Converter() {
        this(ConverterConfig.defaults());
    }

    public Converter(ConverterConfig config) {
        this.config = config;
    }

    public ConverterConfig getConfig() {
        return config;
    }

    public Nfa parse(String text) throws ProtocolException, MalformedAutomatonException {
        final NfaDefinition definition = ProtocolParser.parse(text);
        return validate(Nfa.of(definition));
    }

    public ConversionResult convert(String text) throws ProtocolException, MalformedAutomatonException {
        return convert(parse(text));
    }

    public ConversionResult convert(Nfa nfa) throws MalformedAutomatonException {
        validate(nfa);
        final ConversionResult result = SubsetConstruction.determinize(nfa);
        LOG.info("Converted NFA with {} states and {} symbols into DFA with {} states",
            nfa.size(), nfa.getInputAlphabet().size(), result.dfa().size());
        return result;
    }

    public GraphDescription export(ConversionResult result) throws ExportException {
        return new DotExporter(config.includeDeadState()).export(result.dfa());
    }

    private Nfa validate(Nfa nfa) throws MalformedAutomatonException {
        if (nfa.size() > config.maxNfaStates()) {
            throw new MalformedAutomatonException(
                "NFA has " + nfa.size() + " states, more than the limit of " + config.maxNfaStates());
        }
        return nfa;
    }
}
