package com.jsonsource.generator.codegen.compose;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.jsonsource.generator.codegen.diagnostics.DiagnosticCollector;
import com.jsonsource.generator.codegen.selection.ClassHierarchy;
import com.jsonsource.generator.config.ConfigMerger;
import com.jsonsource.generator.config.GenerationOptions;
import com.jsonsource.generator.config.ResolvedConfig;
import com.jsonsource.generator.model.ClassModel;
import com.jsonsource.generator.model.FieldDescriptor;
import com.jsonsource.generator.model.SourceUnit;
import com.jsonsource.generator.model.TypeIndex;

/**
 * Per-unit state shared by the passes: the snapshot, run defaults and resolved configuration,
 * computed once per class.
 *
 * Confined to the thread composing the unit.
 */
public class UnitContext {

    private final SourceUnit unit;
    private final TypeIndex typeIndex;
    private final GenerationOptions global;
    private final ConfigMerger configMerger;
    private final ClassHierarchy hierarchy;
    private final DiagnosticCollector diagnostics = new DiagnosticCollector();
    private final Map<String, List<FieldDescriptor>> fields = new HashMap<>();
    private final Map<String, ResolvedConfig> configs = new HashMap<>();

    public UnitContext(SourceUnit unit, TypeIndex typeIndex, GenerationOptions global, ConfigMerger configMerger) {
        this.unit = unit;
        this.typeIndex = typeIndex;
        this.global = global;
        this.configMerger = configMerger;
        this.hierarchy = new ClassHierarchy(typeIndex);
    }

    public SourceUnit getUnit() {
        return unit;
    }

    public TypeIndex getTypeIndex() {
        return typeIndex;
    }

    public GenerationOptions getGlobal() {
        return global;
    }

    public DiagnosticCollector getDiagnostics() {
        return diagnostics;
    }

    /**
     * Declared and inherited fields, superclass fields first.
     */
    public List<FieldDescriptor> fieldsOf(ClassModel model) {
        return fields.computeIfAbsent(model.getQualifiedName(), k -> hierarchy.allFields(model));
    }

    public ResolvedConfig configFor(ClassModel model) {
        ResolvedConfig config = configs.get(model.getQualifiedName());
        if (config == null) {
            config = configMerger.resolve(global, model, fieldsOf(model));
            configs.put(model.getQualifiedName(), config);
        }
        return config;
    }
}
