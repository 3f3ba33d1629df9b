package com.fnlower.desugar;

import com.fnlower.ast.*;
import com.fnlower.ir.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Type expressions and type definitions. Types carry no sugar, so this is a one-to-one
 * copy into the core node family. Record fields and variant constructors recurse back
 * into {@link #desugarTypeExpr}.
 */
final class TypeDesugarer {

    private TypeDesugarer() {}

    static CoreTypeExpr desugarTypeExpr(TypeExpr typeExpr) {
        Location loc = typeExpr.loc();
        if (typeExpr instanceof TypeVar v) {
            return new CoreTypeVar(v.name(), loc);
        } else if (typeExpr instanceof TypeConst c) {
            return new CoreTypeConst(c.name(), loc);
        } else if (typeExpr instanceof TypeApp app) {
            return new CoreTypeApp(desugarTypeExpr(app.constructor()), desugarTypeExprs(app.args()), loc);
        } else if (typeExpr instanceof FunctionType fn) {
            return new CoreFunctionType(desugarTypeExprs(fn.params()), desugarTypeExpr(fn.returnType()), loc);
        } else if (typeExpr instanceof RecordType record) {
            return new CoreRecordType(desugarRecordTypeFields(record.fields()), loc);
        } else if (typeExpr instanceof VariantType variant) {
            return new CoreVariantType(desugarVariantConstructors(variant.constructors()), loc);
        } else if (typeExpr instanceof UnionType union) {
            return new CoreUnionType(desugarTypeExprs(union.types()), loc);
        } else if (typeExpr instanceof TupleType tuple) {
            return new CoreTupleType(desugarTypeExprs(tuple.elements()), loc);
        }
        throw new DesugarInternalError("Unknown type expression kind: " + typeExpr.kind(), loc);
    }

    static CoreTypeDefinition desugarTypeDefinition(TypeDefinition definition) {
        Location loc = definition.loc();
        if (definition instanceof AliasType alias) {
            return new CoreAliasType(desugarTypeExpr(alias.typeExpr()), loc);
        } else if (definition instanceof RecordTypeDef record) {
            return new CoreRecordTypeDef(desugarRecordTypeFields(record.fields()), loc);
        } else if (definition instanceof VariantTypeDef variant) {
            return new CoreVariantTypeDef(desugarVariantConstructors(variant.constructors()), loc);
        }
        throw new DesugarInternalError("Unknown type definition kind: " + definition.kind(), loc);
    }

    private static List<CoreTypeExpr> desugarTypeExprs(List<TypeExpr> types) {
        List<CoreTypeExpr> result = new ArrayList<>(types.size());
        for (TypeExpr t : types) {
            result.add(desugarTypeExpr(t));
        }
        return result;
    }

    private static List<CoreRecordTypeField> desugarRecordTypeFields(List<RecordTypeField> fields) {
        List<CoreRecordTypeField> result = new ArrayList<>(fields.size());
        for (RecordTypeField field : fields) {
            result.add(new CoreRecordTypeField(field.name(), desugarTypeExpr(field.typeExpr()), field.loc()));
        }
        return result;
    }

    private static List<CoreVariantConstructor> desugarVariantConstructors(List<VariantConstructor> constructors) {
        List<CoreVariantConstructor> result = new ArrayList<>(constructors.size());
        for (VariantConstructor ctor : constructors) {
            result.add(new CoreVariantConstructor(ctor.name(), desugarTypeExprs(ctor.args()), ctor.loc()));
        }
        return result;
    }
}
