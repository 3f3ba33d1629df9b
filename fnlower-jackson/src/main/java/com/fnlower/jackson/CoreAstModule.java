package com.fnlower.jackson;

import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.jsontype.NamedType;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fnlower.ast.Location;
import com.fnlower.ir.*;

import java.io.IOException;
import java.util.List;

/**
 * Jackson module for the core IR.
 *
 * <ul>
 *   <li>Node families are polymorphic on a {@code kind} property holding the record's name,
 *       e.g. {@code {"kind":"CoreVar","name":"x"}}.</li>
 *   <li>Record fields use {@code "Field"} and {@code "Spread"} as their kinds.</li>
 *   <li>Literal pattern values come back as {@link Long}, {@link Double}, {@link String},
 *       {@link Boolean} or null, not as whatever number type Jackson would pick.</li>
 * </ul>
 */
public class CoreAstModule extends SimpleModule {

    private static final List<Class<? extends CoreNode>> NODE_TYPES = List.of(
        // expressions
        CoreIntLit.class, CoreFloatLit.class, CoreStringLit.class, CoreBoolLit.class, CoreUnitLit.class,
        CoreVar.class, CoreLet.class, CoreLetRecExpr.class, CoreLambda.class, CoreApp.class,
        CoreMatch.class, CoreRecord.class, CoreRecordAccess.class, CoreRecordUpdate.class,
        CoreVariant.class, CoreBinOp.class, CoreUnaryOp.class, CoreTypeAnnotation.class,
        CoreUnsafe.class, CoreTuple.class,
        // patterns
        CoreWildcardPattern.class, CoreVarPattern.class, CoreLiteralPattern.class,
        CoreVariantPattern.class, CoreRecordPattern.class, CoreTuplePattern.class,
        // types
        CoreTypeVar.class, CoreTypeConst.class, CoreTypeApp.class, CoreFunctionType.class,
        CoreRecordType.class, CoreVariantType.class, CoreUnionType.class, CoreTupleType.class,
        CoreAliasType.class, CoreRecordTypeDef.class, CoreVariantTypeDef.class,
        // declarations
        CoreLetDecl.class, CoreLetRecGroup.class, CoreTypeDecl.class,
        CoreExternalDecl.class, CoreExternalTypeDecl.class, CoreImportDecl.class,
        CoreModule.class
    );

    public CoreAstModule() {
        super("CoreAstModule", new Version(1, 0, 0, null, "com.fnlower", "fnlower-jackson"));
        addDeserializer(CoreLiteralPattern.class, new LiteralPatternDeserializer());
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(CoreNode.class, KindMixin.class);
        context.setMixInAnnotations(CoreExpr.class, KindMixin.class);
        context.setMixInAnnotations(CorePattern.class, KindMixin.class);
        context.setMixInAnnotations(CoreTypeExpr.class, KindMixin.class);
        context.setMixInAnnotations(CoreTypeDefinition.class, KindMixin.class);
        context.setMixInAnnotations(CoreDeclaration.class, KindMixin.class);
        context.setMixInAnnotations(CoreRecordField.class, KindMixin.class);

        for (Class<? extends CoreNode> type : NODE_TYPES) {
            context.registerSubtypes(new NamedType(type, type.getSimpleName()));
        }
        context.registerSubtypes(
            new NamedType(CoreRecordField.Field.class, "Field"),
            new NamedType(CoreRecordField.Spread.class, "Spread"));
    }

    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
    private interface KindMixin {
    }

    /**
     * Reads {@code {"kind":"CoreLiteralPattern","literal":1}} with the literal narrowed to the
     * types the desugarer produces. Integral numbers become {@link Long}.
     */
    static class LiteralPatternDeserializer extends StdDeserializer<CoreLiteralPattern> {

        LiteralPatternDeserializer() {
            super(CoreLiteralPattern.class);
        }

        @Override
        public CoreLiteralPattern deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            JsonNode node = ctxt.readTree(p);
            Object literal = literalValue(node.get("literal"), p, ctxt);
            JsonNode locNode = node.get("loc");
            Location loc = locNode == null || locNode.isNull()
                ? null
                : ctxt.readTreeAsValue(locNode, Location.class);
            return new CoreLiteralPattern(literal, loc);
        }

        private static Object literalValue(JsonNode value, JsonParser p, DeserializationContext ctxt)
                throws IOException {
            if (value == null || value.isNull()) {
                return null;
            } else if (value.isIntegralNumber()) {
                return value.longValue();
            } else if (value.isFloatingPointNumber()) {
                return value.doubleValue();
            } else if (value.isTextual()) {
                return value.textValue();
            } else if (value.isBoolean()) {
                return value.booleanValue();
            }
            return ctxt.reportInputMismatch(CoreLiteralPattern.class,
                "Unsupported literal pattern value: %s", value.getNodeType());
        }
    }
}
