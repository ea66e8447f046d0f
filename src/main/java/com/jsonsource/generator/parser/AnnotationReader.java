package com.jsonsource.generator.parser;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.expr.BooleanLiteralExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.MemberValuePair;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.NormalAnnotationExpr;
import com.github.javaparser.ast.expr.SingleMemberAnnotationExpr;
import com.github.javaparser.ast.expr.StringLiteralExpr;
import com.github.javaparser.ast.expr.TextBlockLiteralExpr;
import com.github.javaparser.ast.nodeTypes.NodeWithAnnotations;
import com.jsonsource.generator.model.AnnotationValues;

/**
 * Decodes the explicitly written members of an annotation into primitive values.
 *
 * Never fails: a member whose expression is not a literal is kept as
 * {@link AnnotationValues.Unresolved} and rejected later by the config layer, which knows
 * what each member should hold.
 */
public class AnnotationReader {

    public static final String JSON_SERIALIZABLE = "JsonSerializable";
    public static final String JSON_KEY = "JsonKey";
    public static final String JSON_ENUM = "JsonEnum";
    public static final String JSON_CONSTRUCTOR = "JsonConstructor";
    public static final String JSON_LITERAL = "JsonLiteral";

    /**
     * Reads {@code annotationName} from {@code node}, or {@link AnnotationValues#absent()}.
     */
    public AnnotationValues read(NodeWithAnnotations<?> node, String annotationName, String elementName) {
        Optional<AnnotationExpr> annotation = node.getAnnotationByName(annotationName);
        return annotation.map(a -> read(a, elementName)).orElse(AnnotationValues.absent());
    }

    public AnnotationValues read(AnnotationExpr annotation, String elementName) {
        Map<String, Object> values = new LinkedHashMap<>();
        if (annotation instanceof NormalAnnotationExpr normal) {
            for (MemberValuePair pair : normal.getPairs()) {
                values.put(pair.getNameAsString(), decode(pair.getValue()));
            }
        } else if (annotation instanceof SingleMemberAnnotationExpr single) {
            values.put("value", decode(single.getMemberValue()));
        }
        return AnnotationValues.of(annotation.getName().getIdentifier(), elementName, values);
    }

    Object decode(Expression expression) {
        if (expression instanceof BooleanLiteralExpr bool) {
            return bool.getValue();
        }
        if (expression instanceof StringLiteralExpr string) {
            return string.asString();
        }
        if (expression instanceof TextBlockLiteralExpr textBlock) {
            return textBlock.asString();
        }
        if (expression instanceof FieldAccessExpr access) {
            return new AnnotationValues.EnumConstant(access.getScope().toString(), access.getNameAsString());
        }
        if (expression instanceof NameExpr name) {
            return new AnnotationValues.EnumConstant("", name.getNameAsString());
        }
        return new AnnotationValues.Unresolved(expression.toString());
    }
}
