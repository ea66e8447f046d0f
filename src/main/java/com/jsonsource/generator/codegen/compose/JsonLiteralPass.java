package com.jsonsource.generator.codegen.compose;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.jsonsource.generator.codegen.emit.JsonLiteralEmitter;
import com.jsonsource.generator.codegen.exception.ConfigurationException;
import com.jsonsource.generator.codegen.util.NamingUtil;
import com.jsonsource.generator.model.ClassModel;

/**
 * Embeds the JSON files named by {@code @JsonLiteral} static fields as companion constants.
 *
 * Files are read relative to the unit's own file, when the pass runs.
 */
public class JsonLiteralPass implements GenerationPass {

    private static final Logger log = LoggerFactory.getLogger(JsonLiteralPass.class);

    private final TypeAdapter<JsonElement> jsonReader = new Gson().getAdapter(JsonElement.class);
    private final JsonLiteralEmitter emitter = new JsonLiteralEmitter();

    @Override
    public String getName() {
        return "json-literal";
    }

    @Override
    public boolean appliesTo(ClassModel model, UnitContext context) {
        return model.hasJsonLiterals();
    }

    @Override
    public void generate(ClassModel model, UnitContext context, PassOutput output) {
        for (Map.Entry<String, String> literal : model.getJsonLiterals().entrySet()) {
            String element = model.getName() + "." + literal.getKey();
            if (literal.getValue().isBlank()) {
                throw new ConfigurationException(element,
                        "@JsonLiteral on " + element + " must name a JSON file with a string literal.");
            }
            JsonElement json = read(context.getUnit().getPath().resolveSibling(literal.getValue()), element);
            emitter.emit(constantName(model, literal.getKey()), json).forEach(output::addFragment);
            log.debug("Embedded {} as {}", literal.getValue(), constantName(model, literal.getKey()));
        }
    }

    /**
     * {@code Data.glossary} gives {@code DATA_GLOSSARY_JSON_LITERAL}.
     */
    public static String constantName(ClassModel model, String fieldName) {
        return NamingUtil.toScreamingSnakeCase(model.getReferenceName().replace('.', '_') + "_" + fieldName)
                + "_JSON_LITERAL";
    }

    private JsonElement read(Path file, String element) {
        String text;
        try {
            text = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigurationException(element, "Could not read " + file + " for " + element + ": "
                    + e.getMessage(), e);
        }
        try {
            JsonElement json = jsonReader.fromJson(text);
            if (json == null) {
                throw new ConfigurationException(element, file + " for " + element + " is empty.");
            }
            return json;
        } catch (IOException | JsonParseException e) {
            throw new ConfigurationException(element, file + " for " + element + " is not valid JSON: "
                    + e.getMessage(), e);
        }
    }
}
