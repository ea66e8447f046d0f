package com.jsonsource.generator.codegen.output;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Manages import declarations of a generated companion class.
 */
public class ImportManager {

    private final Set<String> imports = new TreeSet<>();
    private final String currentPackage;

    public ImportManager(String currentPackage) {
        this.currentPackage = currentPackage;
    }

    /**
     * Adds an import declaration, e.g. {@code java.util.List} or {@code static a.B.c}.
     * Skips java.lang types and types of the current package.
     */
    public void addImport(String declaration) {
        if (declaration == null || declaration.isEmpty()) {
            return;
        }
        boolean isStatic = declaration.startsWith("static ");
        String name = isStatic ? declaration.substring("static ".length()) : declaration;

        // Skip java.lang
        if (!isStatic && name.startsWith("java.lang.") && name.indexOf('.', "java.lang.".length()) < 0) {
            return;
        }

        // Skip same package
        if (!isStatic && !name.endsWith(".*") && getPackageName(name).equals(currentPackage)) {
            return;
        }

        imports.add(declaration);
    }

    /**
     * Adds multiple imports.
     */
    public void addImports(Iterable<String> declarations) {
        for (String declaration : declarations) {
            addImport(declaration);
        }
    }

    /**
     * Imports in sorted order, without the {@code import} keyword.
     */
    public List<String> getImports() {
        return new ArrayList<>(imports);
    }

    private String getPackageName(String fullQualifiedName) {
        int lastDot = fullQualifiedName.lastIndexOf('.');
        if (lastDot < 0) {
            return "";
        }
        return fullQualifiedName.substring(0, lastDot);
    }
}
