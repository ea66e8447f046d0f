package com.jsonsource.generator.codegen.compose;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.jsonsource.generator.codegen.emit.CodeEmitter;
import com.jsonsource.generator.codegen.exception.ClassDeclarationNotFoundException;
import com.jsonsource.generator.codegen.exception.GenerationException;
import com.jsonsource.generator.codegen.selection.FieldSelector;
import com.jsonsource.generator.config.ConfigMerger;
import com.jsonsource.generator.config.GenerationOptions;
import com.jsonsource.generator.model.ClassModel;
import com.jsonsource.generator.model.SourceUnit;
import com.jsonsource.generator.model.TypeIndex;

/**
 * Runs the generation passes over one unit and assembles their output.
 *
 * Passes run in order, each over every class in declaration order. The first generation error
 * aborts the unit; a declaration that cannot be located only drops that class's patch and is
 * reported as an error diagnostic. Stateless: one composer serves all units of a run, on any
 * thread.
 */
public class GeneratorComposer {

    private static final Logger log = LoggerFactory.getLogger(GeneratorComposer.class);

    private final ConfigMerger configMerger;
    private final List<GenerationPass> passes;

    public GeneratorComposer() {
        this(new ConfigMerger(), new FieldSelector(), new CodeEmitter());
    }

    public GeneratorComposer(ConfigMerger configMerger, FieldSelector fieldSelector, CodeEmitter codeEmitter) {
        this(configMerger, List.of(
                new SerializableClassPass(fieldSelector, codeEmitter),
                new JsonEnumPass(configMerger),
                new JsonLiteralPass(),
                new SourcePatchPass()));
    }

    public GeneratorComposer(ConfigMerger configMerger, List<GenerationPass> passes) {
        this.configMerger = configMerger;
        this.passes = List.copyOf(passes);
    }

    /**
     * @throws GenerationException the first error raised by a pass, naming the element
     */
    public ComposedUnit compose(SourceUnit unit, TypeIndex typeIndex, GenerationOptions global) {
        UnitContext context = new UnitContext(unit, typeIndex, global, configMerger);
        PassOutput output = new PassOutput();

        for (GenerationPass pass : passes) {
            for (ClassModel model : unit.getClasses()) {
                if (!pass.appliesTo(model, context)) {
                    continue;
                }
                try {
                    pass.generate(model, context, output);
                } catch (ClassDeclarationNotFoundException e) {
                    log.error("{}: {}", pass.getName(), e.getMessage());
                    context.getDiagnostics().error(e.getElement(), e.getMessage());
                }
            }
            pass.complete(context, output);
        }

        log.debug("Composed {}: {} fragments, {} patches", unit.getPath(),
                output.getGenerated().getFragments().size(), output.getPatches().size());
        return new ComposedUnit(unit, output.getGenerated(), output.getPatches(),
                context.getDiagnostics().getDiagnostics());
    }
}
