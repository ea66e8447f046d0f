package com.jsonsource.generator.codegen.compose;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.jsonsource.generator.codegen.convert.TypeVariableConverter;
import com.jsonsource.generator.codegen.exception.ClassDeclarationNotFoundException;
import com.jsonsource.generator.codegen.patch.PatchInstruction;
import com.jsonsource.generator.codegen.util.NamingUtil;
import com.jsonsource.generator.config.ResolvedConfig;
import com.jsonsource.generator.model.ClassModel;
import com.jsonsource.generator.model.DeclarationSpan;
import com.jsonsource.generator.model.SourceUnit;
import com.jsonsource.generator.model.TypeRef;

/**
 * Adds {@code fromJson}/{@code toJson} members delegating to the companion class directly into
 * the declarations of classes with {@code patchSource = true}.
 *
 * Members already declared are skipped, so running twice changes nothing. Nested patched
 * declarations are folded into the patch of their patched enclosing declaration, which keeps
 * every instruction of a unit disjoint.
 */
public class SourcePatchPass implements GenerationPass {

    private static final Logger log = LoggerFactory.getLogger(SourcePatchPass.class);

    private static final String MEMBER_INDENT = "    ";

    @Override
    public String getName() {
        return "source-patch";
    }

    @Override
    public boolean appliesTo(ClassModel model, UnitContext context) {
        return model.isSerializable() && !model.isEnum() && context.configFor(model).isPatchSource();
    }

    @Override
    public void generate(ClassModel model, UnitContext context, PassOutput output) {
        SourceUnit unit = context.getUnit();
        DeclarationSpan span = unit.findDeclaration(model.getReferenceName())
                .orElseThrow(() -> new ClassDeclarationNotFoundException(model.getName(), unit.getPath().toString()));
        String declaration = span.slice(unit.getText());
        int closingBrace = declaration.lastIndexOf('}');
        if (closingBrace < 0) {
            throw new ClassDeclarationNotFoundException(model.getName(), unit.getPath().toString());
        }

        List<String> members = missingMembers(model, context.configFor(model));
        if (members.isEmpty()) {
            log.debug("{} already declares its JSON members", model.getName());
            return;
        }

        int lineStart = declaration.lastIndexOf('\n', closingBrace) + 1;
        String beforeBrace = declaration.substring(lineStart, closingBrace);
        String text;
        int offset;
        if (beforeBrace.isBlank()) {
            String indent = beforeBrace + MEMBER_INDENT;
            text = "\n" + indent(members, indent) + "\n";
            offset = span.getStartOffset() + lineStart;
        } else {
            text = "\n" + indent(members, MEMBER_INDENT) + "\n";
            offset = span.getStartOffset() + closingBrace;
        }
        output.addInsertion(new SourceInsertion(span, offset, text));
    }

    @Override
    public void complete(UnitContext context, PassOutput output) {
        List<SourceInsertion> insertions = output.getInsertions();
        String unitText = context.getUnit().getText();
        for (SourceInsertion outer : insertions) {
            boolean nested = insertions.stream().anyMatch(other -> other.contains(outer));
            if (nested) {
                continue;
            }
            DeclarationSpan span = outer.getDeclaration();
            List<SourceInsertion> inside = new ArrayList<>();
            for (SourceInsertion insertion : insertions) {
                if (insertion == outer || outer.contains(insertion)) {
                    inside.add(insertion);
                }
            }
            inside.sort(Comparator.comparingInt(SourceInsertion::getOffset).reversed());

            StringBuilder replacement = new StringBuilder(span.slice(unitText));
            for (SourceInsertion insertion : inside) {
                replacement.insert(insertion.getOffset() - span.getStartOffset(), insertion.getText());
            }
            output.addPatch(new PatchInstruction(context.getUnit().getPath(), span.getStartOffset(),
                    span.getEndOffset(), replacement.toString()));
            log.debug("Patching {} in {}", span.getName(), context.getUnit().getPath());
        }
    }

    private static List<String> missingMembers(ClassModel model, ResolvedConfig config) {
        boolean factories = config.isGenericArgumentFactories() && model.isGeneric();
        int extraParameters = factories ? model.getTypeParameters().size() : 0;
        String companion = NamingUtil.companionClassName(model.getUnitName());
        String typeParameters = model.typeParameterDeclaration(TypeRef::render);
        List<String> members = new ArrayList<>();

        if (config.isCreateFactory() && !model.hasMember("fromJson", 1 + extraParameters)) {
            StringBuilder parameters = new StringBuilder("java.util.Map<String, ?> json");
            StringBuilder arguments = new StringBuilder("json");
            if (factories) {
                for (String t : model.getTypeParameters()) {
                    String name = TypeVariableConverter.decodeFactoryName(t);
                    parameters.append(", java.util.function.Function<Object, ").append(t).append("> ").append(name);
                    arguments.append(", ").append(name);
                }
            }
            members.add("public static " + typeParameters + model.getTypeReference() + " fromJson(" + parameters
                    + ") {\n" + MEMBER_INDENT + "return " + companion + "."
                    + NamingUtil.decodeFunctionName(model.getReferenceName()) + "(" + arguments + ");\n}");
        }

        if (config.isCreateToJson() && !model.hasMember("toJson", extraParameters)) {
            StringBuilder parameters = new StringBuilder();
            StringBuilder arguments = new StringBuilder("this");
            if (factories) {
                for (String t : model.getTypeParameters()) {
                    String name = TypeVariableConverter.encodeFactoryName(t);
                    if (parameters.length() > 0) {
                        parameters.append(", ");
                    }
                    parameters.append("java.util.function.Function<").append(t).append(", Object> ").append(name);
                    arguments.append(", ").append(name);
                }
            }
            members.add("public java.util.Map<String, Object> toJson(" + parameters + ") {\n" + MEMBER_INDENT
                    + "return " + companion + "." + NamingUtil.encodeFunctionName(model.getReferenceName()) + "(" + arguments
                    + ");\n}");
        }
        return members;
    }

    private static String indent(List<String> members, String indent) {
        List<String> indented = new ArrayList<>();
        for (String member : members) {
            indented.add(indent + member.replace("\n", "\n" + indent));
        }
        return String.join("\n\n", indented);
    }
}
