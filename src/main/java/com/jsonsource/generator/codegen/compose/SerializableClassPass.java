package com.jsonsource.generator.codegen.compose;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.jsonsource.generator.codegen.emit.CodeEmitter;
import com.jsonsource.generator.codegen.emit.EmittedClass;
import com.jsonsource.generator.codegen.exception.ConfigurationException;
import com.jsonsource.generator.codegen.selection.ExcludedField;
import com.jsonsource.generator.codegen.selection.FieldSelection;
import com.jsonsource.generator.codegen.selection.FieldSelector;
import com.jsonsource.generator.config.ResolvedConfig;
import com.jsonsource.generator.model.ClassModel;
import com.jsonsource.generator.model.FieldDescriptor;

/**
 * Generates the companion members of classes annotated {@code @JsonSerializable}.
 */
public class SerializableClassPass implements GenerationPass {

    private static final Logger log = LoggerFactory.getLogger(SerializableClassPass.class);

    private final FieldSelector fieldSelector;
    private final CodeEmitter codeEmitter;

    public SerializableClassPass(FieldSelector fieldSelector, CodeEmitter codeEmitter) {
        this.fieldSelector = fieldSelector;
        this.codeEmitter = codeEmitter;
    }

    @Override
    public String getName() {
        return "serializable-class";
    }

    @Override
    public boolean appliesTo(ClassModel model, UnitContext context) {
        return model.isSerializable();
    }

    @Override
    public void generate(ClassModel model, UnitContext context, PassOutput output) {
        if (model.isEnum()) {
            throw new ConfigurationException(model.getName(),
                    "@JsonSerializable cannot be used on enum " + model.getName() + "; use @JsonEnum instead.");
        }
        if (model.isInnerClass()) {
            throw new ConfigurationException(model.getName(),
                    "@JsonSerializable class " + model.getReferenceName() + " must be static.");
        }

        List<FieldDescriptor> fields = context.fieldsOf(model);
        ResolvedConfig config = context.configFor(model);
        if (config.isGenericArgumentFactories() && !model.isGeneric()) {
            String message = "The class " + model.getName() + " is annotated with genericArgumentFactories = true, "
                    + "which only affects classes with type parameters. The option is ignored.";
            log.warn(message);
            context.getDiagnostics().warning(model.getName(), message);
        }

        FieldSelection selection = fieldSelector.select(model, fields, config);
        context.getDiagnostics().reportAll(selection.getDiagnostics());
        for (ExcludedField excluded : selection.getExcluded()) {
            context.getDiagnostics().info(model.getName() + "." + excluded.getField().getName(), excluded.getReason());
        }

        EmittedClass emitted = codeEmitter.emit(model, selection, config, context.getTypeIndex(), context.getGlobal());
        emitted.getFragments().forEach(output::addFragment);
        log.debug("{}: {} fields encoded, {} excluded", model.getName(), selection.getUsable().size(),
                selection.getExcluded().size());
    }
}
