package org.tapeshift.converter;

import org.tapeshift.converter.api.ConversionException;
import org.tapeshift.converter.api.ConversionResult;
import org.tapeshift.converter.api.IConverter;
import org.tapeshift.converter.backend.ConversionPipeline;
import org.tapeshift.converter.backend.infinite.SipserToInfinitePipeline;
import org.tapeshift.converter.backend.sipser.InfiniteToSipserPipeline;
import org.tapeshift.converter.frontend.header.HeaderResolver;
import org.tapeshift.converter.frontend.parser.TransitionParser;
import org.tapeshift.converter.frontend.rename.StateRenamer;
import org.tapeshift.converter.model.ConverterSettings;
import org.tapeshift.converter.model.MachineType;
import org.tapeshift.converter.model.Transition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * The main converter implementation. This class orchestrates the pipeline from the lines
 * of an input table to the generated transitions.
 * <p>
 * The whole input is parsed before any transformation starts, so an invalid line aborts
 * the conversion without producing partial output.
 */
public class Converter implements IConverter {

    private static final Logger LOGGER = LoggerFactory.getLogger(Converter.class);

    private final ConverterSettings settings;
    private final HeaderResolver headerResolver = new HeaderResolver();
    private final StateRenamer renamer;
    private final Map<MachineType, ConversionPipeline> pipelines;

    /**
     * Creates a converter using {@link ConverterSettings#defaults()}.
     */
    public Converter() {
        this(ConverterSettings.defaults());
    }

    public Converter(ConverterSettings settings) {
        this.settings = settings;
        this.renamer = new StateRenamer(settings);
        this.pipelines = Map.of(
                MachineType.INFINITE, new InfiniteToSipserPipeline(settings),
                MachineType.SIPSER, new SipserToInfinitePipeline(settings));
    }

    @Override
    public ConversionResult convert(List<String> sourceLines, String sourceName) throws ConversionException {
        // Phase 1: Header
        final MachineType type = headerResolver.resolve(sourceLines.isEmpty() ? null : sourceLines.get(0));

        // Phase 2: Parsing
        final TransitionParser parser = new TransitionParser(settings, sourceName);
        final List<Transition> source = parser.parseLines(sourceLines.subList(1, sourceLines.size()), 2);
        LOGGER.debug("Parsed {} transitions from {}", source.size(), sourceName);

        // Phase 3: Renaming into the simulation namespace
        final List<Transition> renamed = renamer.rename(source);

        // Phase 4: Conversion
        final List<Transition> generated = pipelines.get(type).convert(renamed);

        return new ConversionResult(type, settings.startState(), source.size(), generated);
    }
}
