package com.vidnyan.sixer.adapter.out.report;

import com.vidnyan.sixer.application.port.in.PatchFilesUseCase.PatchReport;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * JSON shape of a run report.
 */
@Value
@Builder
public class RunReport {
    int filesScanned;
    List<ChangedFile> changedFiles;
    List<String> warnings;

    @Value
    @Builder
    public static class ChangedFile {
        String file;
        List<String> rules;
    }

    public static RunReport from(PatchReport report) {
        List<ChangedFile> changed = report.changedFiles().stream()
                .map(result -> ChangedFile.builder()
                        .file(result.file().toString())
                        .rules(List.copyOf(result.appliedRules()))
                        .build())
                .toList();

        List<String> warnings = report.diagnostics().stream()
                .map(Object::toString)
                .toList();

        return RunReport.builder()
                .filesScanned(report.filesScanned())
                .changedFiles(changed)
                .warnings(warnings)
                .build();
    }
}
