package com.jsonsource.generator.codegen.emit;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.jsonsource.generator.codegen.convert.ConversionContext;
import com.jsonsource.generator.codegen.convert.ConversionRegistry;
import com.jsonsource.generator.codegen.convert.HelperRequirements;
import com.jsonsource.generator.codegen.selection.FieldSelection;
import com.jsonsource.generator.config.GenerationOptions;
import com.jsonsource.generator.config.ResolvedConfig;
import com.jsonsource.generator.model.ClassModel;
import com.jsonsource.generator.model.FieldDescriptor;
import com.jsonsource.generator.model.TypeIndex;

/**
 * Produces the companion members of one class from its field selection and configuration.
 *
 * Each capability is emitted only when its switch is on, in a fixed order: decode factory,
 * encode function, field map, key constants, per-field encoders. The output depends on nothing
 * but the arguments, so identical inputs give byte-identical text.
 */
public class CodeEmitter {

    private static final Logger log = LoggerFactory.getLogger(CodeEmitter.class);

    private final ConversionRegistry registry;
    private final DecodeFactoryEmitter decodeFactoryEmitter = new DecodeFactoryEmitter();
    private final EncodeFunctionEmitter encodeFunctionEmitter = new EncodeFunctionEmitter();
    private final AuxiliaryEmitter auxiliaryEmitter = new AuxiliaryEmitter();

    public CodeEmitter() {
        this(ConversionRegistry.defaults());
    }

    public CodeEmitter(ConversionRegistry registry) {
        this.registry = registry;
    }

    public EmittedClass emit(ClassModel model, FieldSelection selection, ResolvedConfig config,
                             TypeIndex typeIndex, GenerationOptions global) {
        HelperRequirements helpers = new HelperRequirements();
        ConversionContext context = ConversionContext.builder()
                .model(model)
                .config(config)
                .global(global)
                .typeIndex(typeIndex)
                .registry(registry)
                .helpers(helpers)
                .element(model.getName())
                .build();
        List<FieldDescriptor> usable = selection.getUsable();

        EmittedClass.EmittedClassBuilder emitted = EmittedClass.builder();
        if (config.isCreateFactory()) {
            emitted.member(decodeFactoryEmitter.emit(model, selection, context));
        }
        if (config.isCreateToJson()) {
            emitted.member(encodeFunctionEmitter.emit(model, usable, context));
        }
        if (config.isCreateFieldMap()) {
            emitted.member(auxiliaryEmitter.fieldMap(model, usable, context));
        }
        if (config.isCreateJsonKeys()) {
            emitted.member(auxiliaryEmitter.jsonKeys(model, usable, context));
        }
        if (config.isCreatePerFieldToJson()) {
            emitted.member(auxiliaryEmitter.perFieldToJson(model, usable, context));
        }
        emitted.helpers(helpers.getFragments());

        EmittedClass result = emitted.build();
        log.debug("Emitted {} members and {} helpers for {}", result.getMembers().size(),
                result.getHelpers().size(), model.getName());
        return result;
    }
}
