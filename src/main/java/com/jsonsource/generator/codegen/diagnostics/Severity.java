package com.jsonsource.generator.codegen.diagnostics;

public enum Severity {
    INFO,
    WARNING,
    ERROR
}
