package com.jsonsource.generator.parser;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.Modifier;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.PackageDeclaration;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.EnumConstantDeclaration;
import com.github.javaparser.ast.body.EnumDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.RecordDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.nodeTypes.modifiers.NodeWithAccessModifiers;
import com.github.javaparser.ast.type.TypeParameter;
import com.jsonsource.generator.codegen.exception.SourceParseException;
import com.jsonsource.generator.codegen.util.NamingUtil;
import com.jsonsource.generator.model.AccessorKind;
import com.jsonsource.generator.model.AnnotationValues;
import com.jsonsource.generator.model.ClassKind;
import com.jsonsource.generator.model.ClassModel;
import com.jsonsource.generator.model.ConstructorModel;
import com.jsonsource.generator.model.DeclarationSpan;
import com.jsonsource.generator.model.FieldDescriptor;
import com.jsonsource.generator.model.ParameterDescriptor;
import com.jsonsource.generator.model.SourceUnit;
import com.jsonsource.generator.model.TypeRef;
import com.jsonsource.generator.model.Visibility;

/**
 * Reads one Java source file into an immutable {@link SourceUnit}.
 *
 * Only what generation needs is extracted: class, record and enum declarations (nested ones
 * included, local ones skipped), their non-static fields, accessors, constructors and the
 * annotations driving generation. Interfaces and annotation types are ignored.
 */
public class SourceUnitParser {

    private static final Logger log = LoggerFactory.getLogger(SourceUnitParser.class);

    private final AnnotationReader annotationReader;

    public SourceUnitParser() {
        this(new AnnotationReader());
    }

    public SourceUnitParser(AnnotationReader annotationReader) {
        this.annotationReader = annotationReader;
    }

    /**
     * Parses {@code text} as the contents of {@code path}.
     *
     * @throws SourceParseException if the text is not valid Java
     */
    public SourceUnit parse(Path path, String text) {
        // JavaParser instances keep state between calls; one per parse keeps this thread-safe
        JavaParser parser = new JavaParser(new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17)
                .setTabSize(1));
        ParseResult<CompilationUnit> result = parser.parse(text);
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            List<String> problems = result.getProblems().stream()
                    .map(Problem::getVerboseMessage)
                    .toList();
            throw new SourceParseException(path.toString(), problems);
        }

        CompilationUnit cu = result.getResult().get();
        OffsetTable offsets = new OffsetTable(text);
        String packageName = cu.getPackageDeclaration().map(PackageDeclaration::getNameAsString).orElse("");

        SourceUnit.SourceUnitBuilder unit = SourceUnit.builder()
                .path(path)
                .text(text)
                .packageName(packageName);

        for (ImportDeclaration imp : cu.getImports()) {
            unit.importDeclaration((imp.isStatic() ? "static " : "") + imp.getNameAsString()
                    + (imp.isAsterisk() ? ".*" : ""));
        }

        String unitName = unitName(path);
        for (TypeDeclaration<?> type : cu.findAll(TypeDeclaration.class)) {
            if (!type.isTopLevelType() && !type.isNestedType()) {
                continue;
            }
            Optional<ClassModel> model = toClassModel(type, packageName, unitName)
                    .map(m -> m.toBuilder()
                            .enclosingPath(enclosingPath(type))
                            .innerClass(isInnerClass(type))
                            .build());
            if (model.isEmpty()) {
                continue;
            }
            unit.classModel(model.get());
            String referenceName = model.get().getReferenceName();
            if (type.getRange().isPresent()) {
                int[] span = offsets.span(type.getRange().get());
                unit.declaration(referenceName, new DeclarationSpan(referenceName, span[0], span[1]));
            }
        }

        SourceUnit parsed = unit.build();
        log.debug("Parsed {}: {} declarations", path, parsed.getClasses().size());
        return parsed;
    }

    private Optional<ClassModel> toClassModel(TypeDeclaration<?> type, String packageName, String unitName) {
        ClassModel model;
        if (type instanceof ClassOrInterfaceDeclaration declaration && !declaration.isInterface()) {
            model = classModel(declaration, packageName, unitName);
        } else if (type instanceof RecordDeclaration record) {
            model = recordModel(record, packageName, unitName);
        } else if (type instanceof EnumDeclaration enumDeclaration) {
            model = enumModel(enumDeclaration, packageName, unitName);
        } else {
            return Optional.empty();
        }
        return Optional.of(withJsonLiterals(model, type));
    }

    /**
     * Static fields annotated {@code @JsonLiteral}. A path that is not a string literal is kept
     * blank and rejected at generation time.
     */
    private ClassModel withJsonLiterals(ClassModel model, TypeDeclaration<?> type) {
        ClassModel.ClassModelBuilder builder = model.toBuilder();
        for (FieldDeclaration field : type.getFields()) {
            if (!field.isStatic()) {
                continue;
            }
            for (VariableDeclarator variable : field.getVariables()) {
                AnnotationValues literal = annotationReader.read(field, AnnotationReader.JSON_LITERAL,
                        model.getName() + "." + variable.getNameAsString());
                if (literal.isPresent()) {
                    builder.jsonLiteral(variable.getNameAsString(), literal.get("value")
                            .filter(String.class::isInstance)
                            .map(String.class::cast)
                            .orElse(""));
                }
            }
        }
        return builder.build();
    }

    private ClassModel classModel(ClassOrInterfaceDeclaration declaration, String packageName, String unitName) {
        String name = declaration.getNameAsString();
        Set<String> typeVariables = typeVariables(declaration.getTypeParameters());

        ClassModel.ClassModelBuilder builder = ClassModel.builder()
                .name(name)
                .packageName(packageName)
                .unitName(unitName)
                .kind(ClassKind.CLASS)
                .typeParameters(typeVariables)
                .typeParameterBounds(typeParameterBounds(declaration.getTypeParameters(), typeVariables))
                .serializableOverride(annotationReader.read(declaration, AnnotationReader.JSON_SERIALIZABLE, name));

        declaration.getExtendedTypes().getFirst()
                .ifPresent(superType -> builder.superType(TypeRefs.of(superType, typeVariables)));

        addMembers(builder, declaration.getMethods());

        Set<String> fieldNames = new HashSet<>();
        for (FieldDeclaration field : declaration.getFields()) {
            if (field.isStatic() || field.isTransient()) {
                continue;
            }
            for (VariableDeclarator variable : field.getVariables()) {
                fieldNames.add(variable.getNameAsString());
                builder.field(fieldDescriptor(declaration, name, field, variable, typeVariables));
            }
        }
        addSetterOnlyProperties(builder, declaration, name, fieldNames, typeVariables);

        List<ConstructorDeclaration> constructors = declaration.getConstructors();
        for (ConstructorDeclaration constructor : constructors) {
            builder.constructor(constructorModel(constructor, typeVariables));
        }
        if (constructors.isEmpty()) {
            builder.constructor(ConstructorModel.builder()
                    .visibility(visibilityOf(declaration))
                    .implicit(true)
                    .build());
        }
        return builder.build();
    }

    private ClassModel recordModel(RecordDeclaration record, String packageName, String unitName) {
        String name = record.getNameAsString();
        Set<String> typeVariables = typeVariables(record.getTypeParameters());

        ClassModel.ClassModelBuilder builder = ClassModel.builder()
                .name(name)
                .packageName(packageName)
                .unitName(unitName)
                .kind(ClassKind.RECORD)
                .typeParameters(typeVariables)
                .typeParameterBounds(typeParameterBounds(record.getTypeParameters(), typeVariables))
                .serializableOverride(annotationReader.read(record, AnnotationReader.JSON_SERIALIZABLE, name));

        addMembers(builder, record.getMethods());

        ConstructorModel.ConstructorModelBuilder canonical = ConstructorModel.builder()
                .visibility(visibilityOf(record))
                .implicit(true);
        for (Parameter component : record.getParameters()) {
            String componentName = component.getNameAsString();
            TypeRef componentType = TypeRefs.of(component.getType(), typeVariables);
            canonical.parameter(new ParameterDescriptor(componentName, componentType));
            builder.field(FieldDescriptor.builder()
                    .name(componentName)
                    .type(componentType)
                    .visibility(Visibility.PUBLIC)
                    .fieldVisibility(Visibility.PRIVATE)
                    .finalField(true)
                    .accessorKind(AccessorKind.RECORD_COMPONENT)
                    .accessorName(componentName)
                    .keyOverride(annotationReader.read(component, AnnotationReader.JSON_KEY,
                            name + "." + componentName))
                    .declaringClass(name)
                    .build());
        }

        List<String> componentNames = record.getParameters().stream().map(Parameter::getNameAsString).toList();
        boolean canonicalDeclared = false;
        for (ConstructorDeclaration constructor : record.getConstructors()) {
            ConstructorModel model = constructorModel(constructor, typeVariables);
            List<String> parameterNames = model.getParameters().stream().map(ParameterDescriptor::getName).toList();
            canonicalDeclared |= parameterNames.equals(componentNames);
            builder.constructor(model);
        }
        if (!canonicalDeclared) {
            builder.constructor(canonical.build());
        }
        return builder.build();
    }

    private ClassModel enumModel(EnumDeclaration declaration, String packageName, String unitName) {
        String name = declaration.getNameAsString();
        ClassModel.ClassModelBuilder builder = ClassModel.builder()
                .name(name)
                .packageName(packageName)
                .unitName(unitName)
                .kind(ClassKind.ENUM)
                .enumOverride(annotationReader.read(declaration, AnnotationReader.JSON_ENUM, name));
        for (EnumConstantDeclaration constant : declaration.getEntries()) {
            builder.enumConstant(constant.getNameAsString());
        }
        addMembers(builder, declaration.getMethods());
        return builder.build();
    }

    private FieldDescriptor fieldDescriptor(ClassOrInterfaceDeclaration owner, String className,
                                            FieldDeclaration field, VariableDeclarator variable,
                                            Set<String> typeVariables) {
        String fieldName = variable.getNameAsString();
        TypeRef type = TypeRefs.of(variable.getType(), typeVariables);
        Visibility fieldVisibility = visibilityOf(field);
        Optional<MethodDeclaration> getter = findGetter(owner, fieldName, type);
        Optional<MethodDeclaration> setter = findSetter(owner, fieldName);

        FieldDescriptor.FieldDescriptorBuilder builder = FieldDescriptor.builder()
                .name(fieldName)
                .type(type)
                .fieldVisibility(fieldVisibility)
                .finalField(field.isFinal())
                .setterName(setter.map(MethodDeclaration::getNameAsString).orElse(null))
                .keyOverride(annotationReader.read(field, AnnotationReader.JSON_KEY, className + "." + fieldName))
                .declaringClass(className);

        if (fieldVisibility == Visibility.PUBLIC) {
            builder.visibility(Visibility.PUBLIC).accessorKind(AccessorKind.FIELD).accessorName(fieldName);
        } else if (getter.isPresent()) {
            builder.visibility(Visibility.PUBLIC)
                    .accessorKind(AccessorKind.GETTER)
                    .accessorName(getter.get().getNameAsString());
        } else {
            builder.visibility(fieldVisibility).accessorKind(AccessorKind.FIELD).accessorName(fieldName);
        }
        return builder.build();
    }

    /**
     * Public {@code setX(value)} methods with neither a field {@code x} nor a getter become
     * setter-only properties, so that selection can report them.
     */
    private void addSetterOnlyProperties(ClassModel.ClassModelBuilder builder, ClassOrInterfaceDeclaration owner,
                                         String className, Set<String> fieldNames, Set<String> typeVariables) {
        for (MethodDeclaration method : owner.getMethods()) {
            String methodName = method.getNameAsString();
            if (!isPublicInstance(method) || !method.getType().isVoidType() || method.getParameters().size() != 1
                    || methodName.length() <= 3 || !methodName.startsWith("set")
                    || !Character.isUpperCase(methodName.charAt(3))) {
                continue;
            }
            String property = Character.toLowerCase(methodName.charAt(3)) + methodName.substring(4);
            TypeRef type = TypeRefs.of(method.getParameter(0).getType(), typeVariables);
            if (fieldNames.contains(property) || findGetter(owner, property, type).isPresent()) {
                continue;
            }
            fieldNames.add(property);
            builder.field(FieldDescriptor.builder()
                    .name(property)
                    .type(type)
                    .visibility(Visibility.PUBLIC)
                    .accessorKind(AccessorKind.NONE)
                    .setterName(methodName)
                    .keyOverride(annotationReader.read(method, AnnotationReader.JSON_KEY, className + "." + property))
                    .declaringClass(className)
                    .build());
        }
    }

    private Optional<MethodDeclaration> findGetter(ClassOrInterfaceDeclaration owner, String property, TypeRef type) {
        String suffix = NamingUtil.capitalize(property);
        boolean bool = type.getName().equals("boolean") || type.getName().equals("Boolean");
        return owner.getMethods().stream()
                .filter(this::isPublicInstance)
                .filter(m -> m.getParameters().isEmpty() && !m.getType().isVoidType())
                .filter(m -> m.getNameAsString().equals("get" + suffix)
                        || (bool && m.getNameAsString().equals("is" + suffix)))
                .findFirst();
    }

    private Optional<MethodDeclaration> findSetter(ClassOrInterfaceDeclaration owner, String property) {
        String name = "set" + NamingUtil.capitalize(property);
        return owner.getMethods().stream()
                .filter(this::isPublicInstance)
                .filter(m -> m.getParameters().size() == 1 && m.getNameAsString().equals(name))
                .findFirst();
    }

    private boolean isPublicInstance(MethodDeclaration method) {
        return method.isPublic() && !method.isStatic();
    }

    private ConstructorModel constructorModel(ConstructorDeclaration constructor, Set<String> typeVariables) {
        ConstructorModel.ConstructorModelBuilder builder = ConstructorModel.builder()
                .visibility(visibilityOf(constructor))
                .annotated(constructor.getAnnotationByName(AnnotationReader.JSON_CONSTRUCTOR).isPresent());
        for (Parameter parameter : constructor.getParameters()) {
            builder.parameter(new ParameterDescriptor(parameter.getNameAsString(),
                    TypeRefs.of(parameter.getType(), typeVariables)));
        }
        return builder.build();
    }

    private static void addMembers(ClassModel.ClassModelBuilder builder, List<MethodDeclaration> methods) {
        for (MethodDeclaration method : methods) {
            builder.existingMember(ClassModel.memberSignature(method.getNameAsString(), method.getParameters().size()));
        }
    }

    private static String enclosingPath(TypeDeclaration<?> type) {
        Deque<String> names = new ArrayDeque<>();
        Optional<Node> parent = type.getParentNode();
        while (parent.isPresent() && parent.get() instanceof TypeDeclaration<?> enclosing) {
            names.push(enclosing.getNameAsString());
            parent = enclosing.getParentNode();
        }
        return String.join(".", names);
    }

    private static boolean isInnerClass(TypeDeclaration<?> type) {
        if (!type.isNestedType() || !(type instanceof ClassOrInterfaceDeclaration declaration) || declaration.isStatic()) {
            return false;
        }
        return type.getParentNode()
                .filter(p -> !(p instanceof ClassOrInterfaceDeclaration owner && owner.isInterface()))
                .isPresent();
    }

    private static Set<String> typeVariables(NodeList<TypeParameter> parameters) {
        return parameters.stream()
                .map(TypeParameter::getNameAsString)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private static Map<String, List<TypeRef>> typeParameterBounds(NodeList<TypeParameter> parameters,
                                                                  Set<String> typeVariables) {
        Map<String, List<TypeRef>> bounds = new LinkedHashMap<>();
        for (TypeParameter parameter : parameters) {
            if (parameter.getTypeBound().isNonEmpty()) {
                bounds.put(parameter.getNameAsString(), parameter.getTypeBound().stream()
                        .map(bound -> TypeRefs.of(bound, typeVariables))
                        .toList());
            }
        }
        return bounds;
    }

    private static Visibility visibilityOf(NodeWithAccessModifiers<?> node) {
        if (node.hasModifier(Modifier.Keyword.PUBLIC)) {
            return Visibility.PUBLIC;
        }
        if (node.hasModifier(Modifier.Keyword.PROTECTED)) {
            return Visibility.PROTECTED;
        }
        if (node.hasModifier(Modifier.Keyword.PRIVATE)) {
            return Visibility.PRIVATE;
        }
        return Visibility.PACKAGE_PRIVATE;
    }

    private static String unitName(Path path) {
        String file = path.getFileName().toString();
        int dot = file.lastIndexOf('.');
        return dot > 0 ? file.substring(0, dot) : file;
    }
}
