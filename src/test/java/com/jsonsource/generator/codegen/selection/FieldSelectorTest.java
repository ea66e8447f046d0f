package com.jsonsource.generator.codegen.selection;

import static org.assertj.core.api.Assertions.*;

import java.nio.file.Path;

import org.junit.jupiter.api.Test;

import com.jsonsource.generator.codegen.diagnostics.Severity;
import com.jsonsource.generator.codegen.exception.DuplicateKeyException;
import com.jsonsource.generator.codegen.exception.UnavailableFieldException;
import com.jsonsource.generator.config.ConfigMerger;
import com.jsonsource.generator.config.GenerationOptions;
import com.jsonsource.generator.config.ResolvedConfig;
import com.jsonsource.generator.model.ClassModel;
import com.jsonsource.generator.model.FieldDescriptor;
import com.jsonsource.generator.parser.SourceUnitParser;

/**
 * Unit tests for FieldSelector.
 */
class FieldSelectorTest {

    private final SourceUnitParser parser = new SourceUnitParser();
    private final ConfigMerger merger = new ConfigMerger();
    private final FieldSelector selector = new FieldSelector();

    @Test
    void testSelectionIsSubsetWithReasons() {
        FieldSelection selection = select("""
                @JsonSerializable
                public class Profile {
                    public String name;
                    private String secret;
                    @JsonKey(includeFromJson = false)
                    public String computed;
                    public void setMode(String mode) { }
                }
                """);

        assertThat(selection.getUsable()).extracting(FieldDescriptor::getName).containsExactly("name");
        assertThat(selection.reasonFor("secret")).contains(ExcludedField.PRIVATE_FIELD);
        assertThat(selection.reasonFor("computed")).contains(ExcludedField.NOT_FROM_JSON);
        assertThat(selection.reasonFor("mode")).contains(ExcludedField.SETTER_ONLY);
        assertThat(selection.reasonFor("name")).isEmpty();
    }

    @Test
    void testSetterOnlyPropertyIsReportedAsWarning() {
        FieldSelection selection = select("""
                @JsonSerializable
                public class Settings {
                    public String name;
                    public void setMode(String mode) { }
                }
                """);

        assertThat(selection.getDiagnostics()).singleElement().satisfies(d -> {
            assertThat(d.getSeverity()).isEqualTo(Severity.WARNING);
            assertThat(d.getMessage()).isEqualTo("Setters are ignored: Settings.mode");
        });
    }

    @Test
    void testExcludedFromDecodeStillEncodedWhenForced() {
        FieldSelection selection = select("""
                @JsonSerializable
                public class Point {
                    public int x;
                    @JsonKey(includeFromJson = false, includeToJson = true)
                    public int y;
                }
                """);

        assertThat(selection.getDecodable()).extracting(FieldDescriptor::getName).containsExactly("x");
        assertThat(selection.getFactoryBinding().orElseThrow().getAssignedFields())
                .extracting(FieldDescriptor::getName).containsExactly("x");
        assertThat(selection.getUsable()).extracting(FieldDescriptor::getName).containsExactly("x", "y");
    }

    @Test
    void testExplicitNoToJsonIsDropped() {
        FieldSelection selection = select("""
                @JsonSerializable
                public class Token {
                    public String value;
                    @JsonKey(includeToJson = false)
                    public String issuer;
                }
                """);

        assertThat(selection.getDecodable()).extracting(FieldDescriptor::getName).containsExactly("value", "issuer");
        assertThat(selection.getUsable()).extracting(FieldDescriptor::getName).containsExactly("value");
    }

    @Test
    void testDuplicateKeyNamesBothFields() {
        assertThatThrownBy(() -> select("""
                @JsonSerializable
                public class Pair {
                    @JsonKey(name = "v")
                    public int a;
                    @JsonKey(name = "v")
                    public int b;
                }
                """))
                .isInstanceOfSatisfying(DuplicateKeyException.class, e -> {
                    assertThat(e.getJsonKey()).isEqualTo("v");
                    assertThat(e.getFirstField()).isEqualTo("a");
                    assertThat(e.getSecondField()).isEqualTo("b");
                    assertThat(e.getElement()).isEqualTo("Pair");
                })
                .hasMessageContaining("a and b");
    }

    @Test
    void testWithoutFactoryAllDecodableFieldsAreEncoded() {
        FieldSelection selection = select("""
                @JsonSerializable(createFactory = false)
                public class Reading {
                    private final double value;
                    public final String unit;
                    private String note;

                    Reading(double value, String unit) {
                        this.value = value;
                        this.unit = unit;
                    }

                    public double getValue() { return value; }
                }
                """);

        assertThat(selection.getFactoryBinding()).isEmpty();
        assertThat(selection.getUsable()).extracting(FieldDescriptor::getName).containsExactly("value", "unit");
    }

    @Test
    void testFieldNotAssignedByFactoryIsNotEncoded() {
        FieldSelection selection = select("""
                @JsonSerializable
                public class Label {
                    public final String text;
                    public final String id = "x";

                    public Label(String text) {
                        this.text = text;
                    }
                }
                """);

        assertThat(selection.getUsable()).extracting(FieldDescriptor::getName).containsExactly("text");
        assertThat(selection.reasonFor("id")).contains(ExcludedField.NOT_ASSIGNED);
    }

    @Test
    void testConstructorNeedingPrivateFieldFails() {
        assertThatThrownBy(() -> select("""
                @JsonSerializable
                public class Secret {
                    private final String value;

                    public Secret(String value) {
                        this.value = value;
                    }
                }
                """))
                .isInstanceOf(UnavailableFieldException.class)
                .hasMessageContaining("Cannot populate the required constructor argument: value.")
                .hasMessageContaining(ExcludedField.PRIVATE_FIELD);
    }

    @Test
    void testForcedToJsonOnUnreadableFieldFails() {
        assertThatThrownBy(() -> select("""
                @JsonSerializable(createFactory = false)
                public class Hidden {
                    public int shown;
                    @JsonKey(includeToJson = true)
                    private int hidden;
                }
                """))
                .isInstanceOf(UnavailableFieldException.class)
                .hasMessageContaining("Hidden.hidden");
    }

    private FieldSelection select(String source) {
        ClassModel model = parser.parse(Path.of("Model.java"), source).getClasses().get(0);
        ResolvedConfig config = merger.resolve(GenerationOptions.defaults(), model, model.getFields());
        return selector.select(model, config);
    }
}
