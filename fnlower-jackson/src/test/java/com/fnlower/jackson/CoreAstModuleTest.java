package com.fnlower.jackson;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fnlower.ast.Location;
import com.fnlower.ir.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CoreAstModuleTest {

    private static final Location L = new Location("m.fn", 3, 7, 42);

    private final ObjectMapper mapper = FnLowerJackson.createObjectMapper();

    private Object readLiteral(String literalJson) throws Exception {
        String json = "{\"kind\":\"CoreLiteralPattern\",\"literal\":" + literalJson + "}";
        return mapper.readValue(json, CorePattern.class) instanceof CoreLiteralPattern p ? p.literal() : "not a literal";
    }

    @Test
    void testLiteralPatternValuesAreNarrowed() throws Exception {
        assertEquals(Long.valueOf(7), readLiteral("7"));
        assertEquals(Double.valueOf(1.5), readLiteral("1.5"));
        assertEquals("seven", readLiteral("\"seven\""));
        assertEquals(Boolean.TRUE, readLiteral("true"));
        assertNull(readLiteral("null"));
    }

    @Test
    void testSmallIntegersStillComeBackAsLong() throws Exception {
        CorePattern original = new CoreLiteralPattern(3L, L);
        CorePattern back = mapper.readValue(mapper.writeValueAsString(original), CorePattern.class);
        assertEquals(original, back);
        assertInstanceOf(Long.class, ((CoreLiteralPattern) back).literal());
    }

    @Test
    void testLiteralPatternKeepsLocation() throws Exception {
        CoreLiteralPattern back = mapper.readValue(
            mapper.writeValueAsString(new CoreLiteralPattern("s", L)), CoreLiteralPattern.class);
        assertEquals(L, back.loc());
    }

    @Test
    void testObjectLiteralIsRejected() {
        assertThrows(Exception.class,
            () -> mapper.readValue("{\"kind\":\"CoreLiteralPattern\",\"literal\":{\"a\":1}}", CorePattern.class));
    }

    @Test
    void testNullPropertiesAreOmitted() throws Exception {
        CoreMatch match = new CoreMatch(new CoreVar("v", L), List.of(
            new CoreMatchCase(new CoreWildcardPattern(L), null, new CoreUnitLit(L), L)), L);
        JsonNode tree = mapper.readTree(mapper.writeValueAsString(match));
        JsonNode matchCase = tree.get("cases").get(0);
        assertFalse(matchCase.has("guard"));
        assertEquals("CoreWildcardPattern", matchCase.get("pattern").get("kind").asText());
    }

    @Test
    void testUnknownPropertiesAreIgnored() throws Exception {
        String json = "{\"kind\":\"CoreIntLit\",\"value\":4,\"comment\":\"added by a newer writer\"}";
        CoreExpr expr = mapper.readValue(json, CoreExpr.class);
        assertEquals(new CoreIntLit(4, null), expr);
    }

    @Test
    void testDeclarationFamily() throws Exception {
        CoreDeclaration decl = new CoreExternalDecl("now", new CoreTypeConst("Int", L), "Date.now", null, true, L);
        String json = mapper.writeValueAsString(decl);
        assertFalse(json.contains("\"from\""), json);
        assertEquals(decl, mapper.readValue(json, CoreDeclaration.class));
    }

    @Test
    void testTypeDefinitionFamily() throws Exception {
        CoreTypeDefinition def = new CoreRecordTypeDef(List.of(
            new CoreRecordTypeField("x", new CoreTypeConst("Float", L), L),
            new CoreRecordTypeField("tags", new CoreTypeApp(new CoreTypeConst("List", L),
                List.of(new CoreTypeConst("String", L)), L), L)), L);
        assertEquals(def, mapper.readValue(mapper.writeValueAsString(def), CoreTypeDefinition.class));
    }

    @Test
    void testModuleVersion() {
        CoreAstModule module = new CoreAstModule();
        assertEquals("fnlower-jackson", module.version().getArtifactId());
        assertEquals(1, module.version().getMajorVersion());
    }
}
