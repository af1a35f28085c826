package com.vidnyan.sixer.application.port.out;

import com.vidnyan.sixer.application.port.in.PatchFilesUseCase.PatchReport;

import java.nio.file.Path;

/**
 * Port for persisting a machine-readable run report.
 */
public interface ReportWriter {

    /**
     * @throws java.io.UncheckedIOException on I/O failure
     */
    void write(PatchReport report, Path target);
}
