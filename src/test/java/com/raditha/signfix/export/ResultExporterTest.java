package com.raditha.signfix.export;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.raditha.signfix.model.Finding;
import com.raditha.signfix.model.FixRequest;
import com.raditha.signfix.model.FixResult;
import com.raditha.signfix.resolve.CastRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ResultExporterTest {

    @TempDir
    Path tempDir;

    private final ResultExporter exporter = new ResultExporter();
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void testSuccessfulFixDocument() throws Exception {
        FixResult result = new FixResult("R-7", 12, true, "    x = a + b;", "    x = a + (int)b;", "Cast applied",
                List.of(new CastRecord(CastRecord.Side.RIGHT, "b", "(int)b", "int", false)));
        Path out = tempDir.resolve("result.json");

        exporter.exportResult(Path.of("src", "calc.c"), result, out);

        JsonNode json = mapper.readTree(out.toFile());
        assertEquals("calc.c", json.get("file_name").asText());
        assertEquals("R-7", json.get("report_id").asText());
        assertEquals(12, json.get("line").asInt());
        assertEquals(13, json.get("column").asInt());
        assertEquals("    x = a + (int)b;", json.get("code_after").asText());
        assertTrue(json.get("success").asBoolean());
        assertEquals("int", json.get("casts").get(0).get("castType").asText());
    }

    @Test
    void testUnchangedLineHasColumnOne() {
        FixResult result = FixResult.unchanged(new FixRequest(null, 3, "+", 1), "x = a + b;", "failed");

        ResultExporter.ResultDocument doc = exporter.document(Path.of("a.c"), result);

        assertEquals(1, doc.column());
        assertFalse(doc.success());
        assertEquals(doc.codeBefore(), doc.codeAfter());
    }

    @Test
    void testNullFieldsAreOmitted() throws Exception {
        FixResult result = FixResult.failure(new FixRequest(null, 3, "+", 1), null, "Line 3 not found");

        JsonNode json = mapper.readTree(exporter.toJson(Path.of("a.c"), result));

        assertFalse(json.has("report_id"));
        assertEquals("", json.get("code_after").asText());
        assertEquals("Line 3 not found", json.get("message").asText());
    }

    @Test
    void testFindingsAsJsonArray() throws Exception {
        List<Finding> findings = List.of(
                new Finding("compute", 9, "+", 1, "a", "int", "b", "unsigned int"),
                new Finding("compute", 14, "<", 1, "a", "int", "b", "unsigned int"));

        JsonNode json = mapper.readTree(exporter.toJson(findings));

        assertTrue(json.isArray());
        assertEquals(2, json.size());
        assertEquals("<", json.get(1).get("operator").asText());
        assertEquals("unsigned int", json.get(0).get("rightType").asText());
    }
}
