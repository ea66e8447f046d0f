package com.jsonsource.generator.codegen.convert;

import com.jsonsource.generator.model.TypeRef;

/**
 * Produces the Java expressions converting one family of types from and to JSON values.
 *
 * Decode expressions take an {@code Object} expression and yield the declared type; encode
 * expressions take a value of the declared type and yield a JSON-compatible value. An encode
 * expression equal to its input means the value is stored as is.
 */
public interface TypeConverter {

    boolean supports(TypeRef type, ConversionContext context);

    String decode(TypeRef type, String expression, ConversionContext context);

    String encode(TypeRef type, String expression, ConversionContext context);
}
