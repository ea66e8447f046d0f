package com.jsonsource.generator.model;

public enum ClassKind {
    CLASS,
    RECORD,
    ENUM
}
