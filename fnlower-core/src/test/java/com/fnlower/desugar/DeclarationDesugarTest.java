package com.fnlower.desugar;

import com.fnlower.ast.*;
import com.fnlower.ir.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.fnlower.ast.SurfaceFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

public class DeclarationDesugarTest {

    private final Desugarer desugarer = new Desugarer();

    private static Expr composeFG() {
        return binOp(BinaryOp.FORWARD_COMPOSE, var("f"), var("g"));
    }

    private static String composedParam(CoreDeclaration decl) {
        CoreLambda lambda = (CoreLambda) ((CoreLetDecl) decl).value();
        return ((CoreVarPattern) lambda.param()).name();
    }

    @Test
    void testLetDeclarationKeepsFlags() {
        LetDecl decl = new LetDecl(pVar("counter"), intLit(0), true, false, true, at(2, 1));
        List<CoreDeclaration> result = desugarer.desugarDecl(decl);
        assertEquals(1, result.size());
        CoreLetDecl let = assertInstanceOf(CoreLetDecl.class, result.get(0));
        assertEquals(new CoreVarPattern("counter", LOC), let.pattern());
        assertEquals(new CoreIntLit(0, LOC), let.value());
        assertTrue(let.mutable());
        assertFalse(let.recursive());
        assertTrue(let.exported());
        assertEquals(at(2, 1), let.loc());
    }

    @Test
    void testLetRecGroup() {
        LetRecGroup group = new LetRecGroup(List.of(
            new LetRecBinding(pVar("isEven"), lambda("n", app(var("isOdd"), var("n"))), false, LOC),
            new LetRecBinding(pVar("isOdd"), lambda("n", app(var("isEven"), var("n"))), false, LOC)
        ), false, LOC);

        CoreLetRecGroup result = (CoreLetRecGroup) desugarer.desugarDecl(group).get(0);
        assertEquals(2, result.bindings().size());
        assertEquals(new CoreVarPattern("isEven", LOC), result.bindings().get(0).pattern());
        assertInstanceOf(CoreLambda.class, result.bindings().get(1).value());
        assertFalse(result.exported());
    }

    @Test
    void testTypeDeclarations() {
        TypeDecl alias = new TypeDecl("Pair", List.of("a"),
            new AliasType(new TupleType(List.of(tVar("a"), tVar("a")), LOC), LOC), true, LOC);
        CoreTypeDecl aliasResult = (CoreTypeDecl) desugarer.desugarDecl(alias).get(0);
        assertEquals("Pair", aliasResult.name());
        assertEquals(List.of("a"), aliasResult.params());
        assertTrue(aliasResult.exported());
        CoreAliasType aliased = assertInstanceOf(CoreAliasType.class, aliasResult.definition());
        assertEquals(new CoreTupleType(List.of(new CoreTypeVar("a", LOC), new CoreTypeVar("a", LOC)), LOC),
            aliased.typeExpr());

        TypeDecl option = new TypeDecl("Option", List.of("a"), new VariantTypeDef(List.of(
            new VariantConstructor("None", List.of(), LOC),
            new VariantConstructor("Some", List.of(tVar("a")), LOC)
        ), LOC), false, LOC);
        CoreVariantTypeDef variants = (CoreVariantTypeDef) ((CoreTypeDecl) desugarer.desugarDecl(option).get(0)).definition();
        assertEquals(2, variants.constructors().size());
        assertEquals("Some", variants.constructors().get(1).name());
        assertEquals(List.of(new CoreTypeVar("a", LOC)), variants.constructors().get(1).args());

        TypeDecl point = new TypeDecl("Point", List.of(), new RecordTypeDef(List.of(
            new RecordTypeField("x", tCon("Float"), LOC),
            new RecordTypeField("y", tCon("Float"), LOC)
        ), LOC), false, LOC);
        CoreRecordTypeDef fields = (CoreRecordTypeDef) ((CoreTypeDecl) desugarer.desugarDecl(point).get(0)).definition();
        assertEquals(List.of("x", "y"), fields.fields().stream().map(CoreRecordTypeField::name).toList());
    }

    @Test
    void testFunctionAndApplicationTypes() {
        TypeExpr type = new FunctionType(
            List.of(new TypeApp(tCon("List"), List.of(tVar("a")), LOC)),
            tCon("Int"),
            LOC);
        CoreFunctionType result = (CoreFunctionType) desugarer.desugarTypeExpr(type);
        assertEquals(new CoreTypeConst("Int", LOC), result.returnType());
        CoreTypeApp param = (CoreTypeApp) result.params().get(0);
        assertEquals(new CoreTypeConst("List", LOC), param.constructor());
    }

    @Test
    void testSingleExternals() {
        ExternalDecl value = new ExternalDecl("log", tCon("Unit"), "console.log", null, true, LOC);
        CoreExternalDecl valueResult = (CoreExternalDecl) desugarer.desugarDecl(value).get(0);
        assertEquals("log", valueResult.name());
        assertEquals("console.log", valueResult.jsName());
        assertNull(valueResult.from());
        assertTrue(valueResult.exported());

        ExternalTypeDecl type = new ExternalTypeDecl("Promise", tCon("Any"), false, LOC);
        CoreExternalTypeDecl typeResult = (CoreExternalTypeDecl) desugarer.desugarDecl(type).get(0);
        assertEquals("Promise", typeResult.name());
        assertFalse(typeResult.exported());
    }

    @Test
    void testExternalBlockExpandsPerItem() {
        ExternalBlock block = new ExternalBlock(List.of(
            new ExternalBlock.ExternalValue("readFile", tCon("String"), "readFileSync", at(2, 3)),
            new ExternalBlock.ExternalType("Buffer", tCon("Any"), at(3, 3)),
            new ExternalBlock.ExternalValue("exists", tCon("Bool"), "existsSync", at(4, 3))
        ), "fs", true, at(1, 1));

        List<CoreDeclaration> result = desugarer.desugarDecl(block);
        assertEquals(3, result.size());

        CoreExternalDecl readFile = assertInstanceOf(CoreExternalDecl.class, result.get(0));
        assertEquals("readFile", readFile.name());
        assertEquals("readFileSync", readFile.jsName());
        assertEquals("fs", readFile.from());
        assertTrue(readFile.exported());
        assertEquals(at(2, 3), readFile.loc());

        CoreExternalTypeDecl buffer = assertInstanceOf(CoreExternalTypeDecl.class, result.get(1));
        assertEquals("Buffer", buffer.name());
        assertTrue(buffer.exported());

        CoreExternalDecl exists = assertInstanceOf(CoreExternalDecl.class, result.get(2));
        assertEquals("fs", exists.from());
        assertEquals(at(4, 3), exists.loc());
    }

    @Test
    void testEmptyExternalBlock() {
        assertTrue(desugarer.desugarDecl(new ExternalBlock(List.of(), "fs", false, LOC)).isEmpty());
    }

    @Test
    void testImportDeclaration() {
        ImportDecl imp = new ImportDecl(List.of(
            new ImportItem("map", null, false),
            new ImportItem("Option", "Opt", true)
        ), "./prelude", LOC);
        CoreImportDecl result = (CoreImportDecl) desugarer.desugarDecl(imp).get(0);
        assertEquals("./prelude", result.from());
        assertEquals(List.of(
            new CoreImportItem("map", null, false),
            new CoreImportItem("Option", "Opt", true)
        ), result.items());
    }

    @Test
    void testModuleSplitsImportsFromDeclarations() {
        SourceModule module = new SourceModule(
            List.of(new ImportDecl(List.of(new ImportItem("id", null, false)), "./util", LOC)),
            List.of(
                new LetDecl(pVar("a"), intLit(1), false, false, false, LOC),
                new ExternalBlock(List.of(
                    new ExternalBlock.ExternalValue("now", tCon("Int"), "Date.now", LOC),
                    new ExternalBlock.ExternalType("Date", tCon("Any"), LOC)
                ), "globals", false, LOC),
                new LetDecl(pVar("b"), intLit(2), false, false, true, LOC)
            ),
            LOC);

        CoreModule result = desugarer.desugarModule(module);
        assertEquals(1, result.imports().size());
        assertEquals("./util", result.imports().get(0).from());
        assertEquals(List.of("CoreLetDecl", "CoreExternalDecl", "CoreExternalTypeDecl", "CoreLetDecl"),
            result.declarations().stream().map(CoreNode::kind).toList());
        assertEquals(LOC, result.loc());
    }

    @Test
    void testModuleSharesFreshNamesByDefault() {
        SourceModule module = new SourceModule(List.of(), List.of(
            new LetDecl(pVar("h1"), composeFG(), false, false, false, LOC),
            new LetDecl(pVar("h2"), composeFG(), false, false, false, LOC)
        ), LOC);

        CoreModule result = desugarer.desugarModule(module);
        assertEquals("$composed0", composedParam(result.declarations().get(0)));
        assertEquals("$composed1", composedParam(result.declarations().get(1)));
    }

    @Test
    void testModuleCanRestartFreshNamesPerDeclaration() {
        Desugarer perDecl = new Desugarer(new FreshVarGen(),
            DesugarOptions.defaults().withFreshNamesPerDeclaration(true));
        SourceModule module = new SourceModule(List.of(), List.of(
            new LetDecl(pVar("h1"), composeFG(), false, false, false, LOC),
            new LetDecl(pVar("h2"), composeFG(), false, false, false, LOC)
        ), LOC);

        CoreModule result = perDecl.desugarModule(module);
        assertEquals("$composed0", composedParam(result.declarations().get(0)));
        assertEquals("$composed0", composedParam(result.declarations().get(1)));
    }

    @Test
    void testEmptyModule() {
        CoreModule result = desugarer.desugarModule(new SourceModule(List.of(), List.of(), LOC));
        assertTrue(result.imports().isEmpty());
        assertTrue(result.declarations().isEmpty());
    }
}
