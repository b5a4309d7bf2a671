package com.raditha.signfix.export;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.raditha.signfix.model.Finding;
import com.raditha.signfix.model.FixResult;
import com.raditha.signfix.resolve.CastRecord;
import com.raditha.signfix.rewrite.DiffGenerator;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes fix results and scan findings as JSON.
 */
public class ResultExporter {

    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * The {@code result.json} document for one fix.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ResultDocument(
            @JsonProperty("file_name") String fileName,
            @JsonProperty("report_id") String reportId,
            @JsonProperty("line") int line,
            @JsonProperty("column") int column,
            @JsonProperty("code_before") String codeBefore,
            @JsonProperty("code_after") String codeAfter,
            @JsonProperty("success") boolean success,
            @JsonProperty("message") String message,
            @JsonProperty("casts") List<CastRecord> casts) {
    }

    /**
     * Build the document. The column is the first position where the lines differ, 1 when
     * they do not.
     */
    public ResultDocument document(Path sourceFile, FixResult result) {
        String before = result.originalLine() == null ? "" : result.originalLine();
        String after = result.rewrittenLine() == null ? "" : result.rewrittenLine();
        int column = Math.max(1, DiffGenerator.firstDifference(before, after));
        return new ResultDocument(sourceFile.getFileName().toString(), result.reportId(), result.lineNumber(),
                column, before, after, result.success(), result.message(), result.casts());
    }

    public void exportResult(Path sourceFile, FixResult result, Path outputPath) throws IOException {
        mapper.writeValue(outputPath.toFile(), document(sourceFile, result));
    }

    public String toJson(Path sourceFile, FixResult result) throws IOException {
        return mapper.writeValueAsString(document(sourceFile, result));
    }

    public String toJson(List<Finding> findings) throws IOException {
        return mapper.writeValueAsString(findings);
    }
}
