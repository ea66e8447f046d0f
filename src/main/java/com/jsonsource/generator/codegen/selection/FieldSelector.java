package com.jsonsource.generator.codegen.selection;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.jsonsource.generator.codegen.diagnostics.Diagnostic;
import com.jsonsource.generator.codegen.exception.DuplicateKeyException;
import com.jsonsource.generator.codegen.exception.UnavailableFieldException;
import com.jsonsource.generator.config.KeyConfig;
import com.jsonsource.generator.config.ResolvedConfig;
import com.jsonsource.generator.model.ClassModel;
import com.jsonsource.generator.model.FieldDescriptor;

/**
 * Computes which fields take part in decoding and encoding.
 *
 * A field is decodable when it is public (directly or through a getter) or explicitly included
 * in fromJson, has a getter, and is not explicitly excluded from fromJson. With factory
 * generation on, only the fields the factory consumes are encoded, plus the ones explicitly
 * included in toJson. Fields explicitly excluded from toJson are then dropped and the remaining
 * output keys must be unique.
 */
public class FieldSelector {

    private static final Logger log = LoggerFactory.getLogger(FieldSelector.class);

    private final FactoryBinder factoryBinder;

    public FieldSelector() {
        this(new FactoryBinder());
    }

    public FieldSelector(FactoryBinder factoryBinder) {
        this.factoryBinder = factoryBinder;
    }

    public FieldSelection select(ClassModel model, ResolvedConfig config) {
        return select(model, model.getFields(), config);
    }

    /**
     * @param fields the class's fields in declaration order, inherited ones included
     * @throws DuplicateKeyException if two encoded fields share an output key
     * @throws UnavailableFieldException if the factory needs a field that was excluded
     */
    public FieldSelection select(ClassModel model, List<FieldDescriptor> fields, ResolvedConfig config) {
        FieldSelection.FieldSelectionBuilder selection = FieldSelection.builder();
        Map<String, FieldDescriptor> decodable = new LinkedHashMap<>();
        Map<String, String> unavailableReasons = new HashMap<>();

        for (FieldDescriptor field : fields) {
            KeyConfig key = config.keyFor(field.getName());
            String reason = null;
            if (!field.isPublic() && !key.isExplicitYesFromJson()) {
                reason = ExcludedField.PRIVATE_FIELD;
            } else if (!field.hasGetter()) {
                reason = ExcludedField.SETTER_ONLY;
                String element = model.getName() + "." + field.getName();
                log.warn("Setters are ignored: {}", element);
                selection.diagnostic(Diagnostic.warning(element, "Setters are ignored: " + element));
            } else if (key.isExplicitNoFromJson()) {
                reason = ExcludedField.NOT_FROM_JSON;
            }

            if (reason == null) {
                decodable.put(field.getName(), field);
            } else {
                unavailableReasons.put(field.getName(), reason);
                selection.excludedField(new ExcludedField(field, reason));
                log.debug("Excluded {}.{}: {}", model.getName(), field.getName(), reason);
            }
        }
        selection.decodable(decodable.values());

        List<FieldDescriptor> encode;
        if (config.isCreateFactory()) {
            FactoryBinding binding = factoryBinder.bind(model, fields, decodable, unavailableReasons);
            selection.binding(binding);
            Set<String> used = binding.getUsedFields();
            encode = new ArrayList<>();
            for (FieldDescriptor field : fields) {
                if (used.contains(field.getName())) {
                    encode.add(field);
                } else if (decodable.containsKey(field.getName())) {
                    selection.excludedField(new ExcludedField(field, ExcludedField.NOT_ASSIGNED));
                }
            }
        } else {
            encode = new ArrayList<>(decodable.values());
        }

        addForcedToJson(model, fields, config, encode);
        encode.removeIf(f -> config.keyFor(f.getName()).isExplicitNoToJson());
        checkDuplicateKeys(model, encode, config);

        selection.usable(encode);
        FieldSelection result = selection.build();
        log.debug("Selected {} of {} fields for {}", result.getUsable().size(), fields.size(), model.getName());
        return result;
    }

    /**
     * Re-adds fields explicitly included in toJson, keeping declaration order.
     */
    private static void addForcedToJson(ClassModel model, List<FieldDescriptor> fields, ResolvedConfig config,
                                        List<FieldDescriptor> encode) {
        boolean added = false;
        for (FieldDescriptor field : fields) {
            if (!config.keyFor(field.getName()).isExplicitYesToJson() || encode.contains(field)
                    || !field.hasGetter()) {
                continue;
            }
            if (!field.isReadable()) {
                throw new UnavailableFieldException(model.getName() + "." + field.getName(),
                        "Cannot encode " + model.getName() + "." + field.getName()
                                + ": it is included in toJson but generated code cannot read it.");
            }
            encode.add(field);
            added = true;
        }
        if (added) {
            encode.sort((a, b) -> Integer.compare(fields.indexOf(a), fields.indexOf(b)));
        }
    }

    private static void checkDuplicateKeys(ClassModel model, List<FieldDescriptor> encode, ResolvedConfig config) {
        Map<String, String> owners = new HashMap<>();
        for (FieldDescriptor field : encode) {
            String jsonKey = config.keyFor(field.getName()).getJsonKey();
            String previous = owners.putIfAbsent(jsonKey, field.getName());
            if (previous != null) {
                throw new DuplicateKeyException(model.getName(), jsonKey, previous, field.getName());
            }
        }
    }
}
