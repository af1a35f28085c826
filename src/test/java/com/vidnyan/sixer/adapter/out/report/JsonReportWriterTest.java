package com.vidnyan.sixer.adapter.out.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.vidnyan.sixer.application.port.in.PatchFilesUseCase.FileResult;
import com.vidnyan.sixer.application.port.in.PatchFilesUseCase.PatchReport;
import com.vidnyan.sixer.domain.rule.Diagnostic;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;

class JsonReportWriterTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper().configure(SerializationFeature.INDENT_OUTPUT, true);

    @Test
    void write_ShouldListChangedFilesAndWarnings() throws IOException {
        // Arrange
        PatchReport report = new PatchReport(2,
                List.of(
                        new FileResult(Path.of("a.py"), true, new TreeSet<>(List.of("xrange", "iteritems"))),
                        new FileResult(Path.of("b.py"), false, new TreeSet<>())),
                List.of(new Diagnostic("next", "b.py", "x = f(g(y)).next()")),
                List.of());
        Path target = tempDir.resolve("report.json");

        // Act
        new JsonReportWriter(objectMapper).write(report, target);

        // Assert
        JsonNode json = objectMapper.readTree(Files.readString(target));
        assertEquals(2, json.get("filesScanned").asInt());
        assertEquals(1, json.get("changedFiles").size());
        assertEquals("a.py", json.get("changedFiles").get(0).get("file").asText());
        assertEquals("iteritems", json.get("changedFiles").get(0).get("rules").get(0).asText());
        assertEquals("xrange", json.get("changedFiles").get(0).get("rules").get(1).asText());
        assertEquals("WARNING: [next] b.py: x = f(g(y)).next()", json.get("warnings").get(0).asText());
    }

    @Test
    void write_ShouldFailOnMissingDirectory() {
        PatchReport report = new PatchReport(0, List.of(), List.of(), List.of());
        Path target = tempDir.resolve("missing/report.json");

        assertThrows(UncheckedIOException.class, () -> new JsonReportWriter(objectMapper).write(report, target));
    }
}
