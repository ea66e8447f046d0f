package com.jsonsource.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Embeds the contents of a JSON file as a constant of the companion class. Goes on a static
 * field, which is then initialized from that constant:
 *
 * <pre>
 * &#64;JsonLiteral("glossary.json")
 * static final Map&lt;String, Object&gt; GLOSSARY = DataJson.DATA_GLOSSARY_JSON_LITERAL;
 * </pre>
 */
@Documented
@Retention(RetentionPolicy.SOURCE)
@Target(ElementType.FIELD)
public @interface JsonLiteral {

    /**
     * Path of the JSON file, relative to the annotated source file.
     */
    String value();
}
