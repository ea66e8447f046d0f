package com.jsonsource.generator.codegen.selection;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.jsonsource.generator.codegen.exception.ConfigurationException;
import com.jsonsource.generator.codegen.exception.UnavailableFieldException;
import com.jsonsource.generator.model.ClassKind;
import com.jsonsource.generator.model.ClassModel;
import com.jsonsource.generator.model.ConstructorModel;
import com.jsonsource.generator.model.FieldDescriptor;
import com.jsonsource.generator.model.ParameterDescriptor;
import com.jsonsource.generator.model.Visibility;

/**
 * Decides how the decode factory instantiates a class.
 *
 * Constructor choice, first match wins: the one annotated {@code @JsonConstructor}, the only
 * non-private one, the no-arg one, the record's canonical one. Private constructors are never
 * candidates.
 */
public class FactoryBinder {

    private static final Logger log = LoggerFactory.getLogger(FactoryBinder.class);

    /**
     * @param decodable fields the factory may read, by name
     * @param unavailableReasons why each remaining field was excluded, by name
     */
    public FactoryBinding bind(ClassModel model, List<FieldDescriptor> fields, Map<String, FieldDescriptor> decodable,
                               Map<String, String> unavailableReasons) {
        ConstructorModel constructor = chooseConstructor(model, fields);
        FactoryBinding.FactoryBindingBuilder binding = FactoryBinding.builder().constructor(constructor);

        for (ParameterDescriptor parameter : constructor.getParameters()) {
            FieldDescriptor field = decodable.get(parameter.getName());
            if (field == null) {
                String reason = unavailableReasons.getOrDefault(parameter.getName(),
                        "No field matches the parameter name.");
                throw new UnavailableFieldException(model.getName(),
                        "Cannot populate the required constructor argument: " + parameter.getName() + ". " + reason);
            }
            binding.constructorArgument(field);
        }

        for (FieldDescriptor field : fields) {
            if (!decodable.containsKey(field.getName())) {
                continue;
            }
            boolean bound = constructor.getParameters().stream()
                    .anyMatch(p -> p.getName().equals(field.getName()));
            if (!bound && field.isAssignable()) {
                binding.assignedField(field);
            }
        }

        FactoryBinding result = binding.build();
        log.debug("Bound {}: constructor({}) + {} assigned fields", model.getName(),
                result.getConstructorArguments().size(), result.getAssignedFields().size());
        return result;
    }

    ConstructorModel chooseConstructor(ClassModel model, List<FieldDescriptor> fields) {
        List<ConstructorModel> annotated = model.getConstructors().stream()
                .filter(ConstructorModel::isAnnotated)
                .toList();
        if (annotated.size() > 1) {
            throw new ConfigurationException(model.getName(),
                    "More than one constructor of " + model.getName() + " is annotated with @JsonConstructor.");
        }
        if (annotated.size() == 1) {
            if (annotated.get(0).getVisibility() == Visibility.PRIVATE) {
                throw new ConfigurationException(model.getName(),
                        "The @JsonConstructor of " + model.getName() + " must not be private.");
            }
            return annotated.get(0);
        }

        List<ConstructorModel> candidates = model.getConstructors().stream()
                .filter(c -> c.getVisibility() != Visibility.PRIVATE)
                .toList();
        if (candidates.isEmpty()) {
            throw new ConfigurationException(model.getName(),
                    model.getName() + " has no constructor the generated code can call.");
        }
        if (candidates.size() == 1) {
            return candidates.get(0);
        }

        Optional<ConstructorModel> noArg = candidates.stream().filter(ConstructorModel::isNoArg).findFirst();
        if (noArg.isPresent()) {
            return noArg.get();
        }
        if (model.getKind() == ClassKind.RECORD) {
            List<String> components = fields.stream()
                    .filter(f -> f.getDeclaringClass() == null || f.getDeclaringClass().equals(model.getName()))
                    .map(FieldDescriptor::getName)
                    .toList();
            Optional<ConstructorModel> canonical = candidates.stream()
                    .filter(c -> c.getParameters().stream().map(ParameterDescriptor::getName).toList().equals(components))
                    .findFirst();
            if (canonical.isPresent()) {
                return canonical.get();
            }
        }
        throw new ConfigurationException(model.getName(),
                model.getName() + " has " + candidates.size()
                        + " constructors; annotate the one to use with @JsonConstructor.");
    }
}
