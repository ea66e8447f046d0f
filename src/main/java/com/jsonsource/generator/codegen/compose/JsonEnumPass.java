package com.jsonsource.generator.codegen.compose;

import com.jsonsource.generator.codegen.convert.EnumConverter;
import com.jsonsource.generator.codegen.exception.ConfigurationException;
import com.jsonsource.generator.config.ConfigMerger;
import com.jsonsource.generator.model.ClassModel;

/**
 * Generates the value map of enums annotated {@code @JsonEnum}. The map is the same fragment
 * the class pass emits for enum-typed fields, so a unit ends up with one copy.
 */
public class JsonEnumPass implements GenerationPass {

    private final ConfigMerger configMerger;

    public JsonEnumPass(ConfigMerger configMerger) {
        this.configMerger = configMerger;
    }

    @Override
    public String getName() {
        return "json-enum";
    }

    @Override
    public boolean appliesTo(ClassModel model, UnitContext context) {
        return model.isJsonEnum();
    }

    @Override
    public void generate(ClassModel model, UnitContext context, PassOutput output) {
        if (!model.isEnum()) {
            throw new ConfigurationException(model.getName(),
                    "@JsonEnum can only be used on enums, not on " + model.getName() + ".");
        }
        output.addFragment(EnumConverter.enumMap(model.getReferenceName(), model.getEnumConstants(),
                configMerger.resolveEnumRename(model)));
    }
}
