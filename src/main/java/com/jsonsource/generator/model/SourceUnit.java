package com.jsonsource.generator.model;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * One compilation unit read from disk: the text snapshot and everything extracted from it.
 *
 * Offsets in {@link #declarations} refer to {@link #text}; patches computed against this
 * snapshot are only valid for the same text.
 */
@Value
@Builder(toBuilder = true)
public class SourceUnit {

    @NonNull
    Path path;

    @NonNull
    String text;

    @NonNull
    @Builder.Default
    String packageName = "";

    /**
     * Import declarations without the {@code import} keyword and trailing semicolon,
     * e.g. {@code java.util.List} or {@code static java.util.Objects.requireNonNull}.
     */
    @NonNull
    @Singular("importDeclaration")
    List<String> imports;

    /**
     * Class, record and enum declarations in source order, nested ones included.
     */
    @NonNull
    @Singular("classModel")
    List<ClassModel> classes;

    /**
     * Declaration spans by reference name.
     */
    @NonNull
    @Singular("declaration")
    Map<String, DeclarationSpan> declarations;

    /**
     * File name without the {@code .java} extension.
     */
    public String getUnitName() {
        String file = path.getFileName().toString();
        int dot = file.lastIndexOf('.');
        return dot > 0 ? file.substring(0, dot) : file;
    }

    /**
     * @param referenceName name as seen from the package, e.g. {@code Order.Line}
     */
    public Optional<DeclarationSpan> findDeclaration(String referenceName) {
        return Optional.ofNullable(declarations.get(referenceName));
    }

    public boolean hasAnnotatedElements() {
        return classes.stream().anyMatch(c -> c.isSerializable() || c.isJsonEnum() || c.hasJsonLiterals());
    }
}
