package com.vidnyan.sixer.adapter.out.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.sixer.application.port.in.PatchFilesUseCase.PatchReport;
import com.vidnyan.sixer.application.port.out.ReportWriter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;

/**
 * Writes the run report as indented JSON.
 */
@Component
@RequiredArgsConstructor
public class JsonReportWriter implements ReportWriter {

    private final ObjectMapper objectMapper;

    @Override
    public void write(PatchReport report, Path target) {
        try {
            objectMapper.writeValue(target.toFile(), RunReport.from(report));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write report " + target, e);
        }
    }
}
