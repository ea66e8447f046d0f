package com.jsonsource.generator.model;

/**
 * Java access levels, as seen from the generated companion class.
 */
public enum Visibility {
    PUBLIC,
    PROTECTED,
    PACKAGE_PRIVATE,
    PRIVATE;

    /**
     * Whether code in the same package can reach a member with this visibility.
     */
    public boolean isVisibleToPackage() {
        return this != PRIVATE;
    }
}
