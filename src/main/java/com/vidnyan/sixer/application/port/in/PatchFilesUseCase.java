package com.vidnyan.sixer.application.port.in;

import com.vidnyan.sixer.domain.rule.Diagnostic;
import com.vidnyan.sixer.domain.rule.RewriteSettings;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;

/**
 * Primary use case: rewrite a set of Python files with the selected operations.
 */
public interface PatchFilesUseCase {

    /**
     * Patch every file found under the request paths.
     *
     * @throws com.vidnyan.sixer.domain.rule.UnknownRuleException if an operation is unknown
     * @throws com.vidnyan.sixer.domain.RewriteException if a file cannot be patched safely
     */
    PatchReport patch(PatchRequest request);

    /**
     * Patch request parameters.
     */
    record PatchRequest(
        List<String> operations,
        List<Path> paths,
        RewriteSettings settings,
        boolean quiet,
        boolean toStdout,
        Path reportPath         // null = no JSON report
    ) {
        public PatchRequest {
            operations = List.copyOf(operations);
            paths = List.copyOf(paths);
        }

        public Optional<Path> report() {
            return Optional.ofNullable(reportPath);
        }
    }

    /**
     * Outcome of one file.
     */
    record FileResult(Path file, boolean changed, SortedSet<String> appliedRules) {}

    /**
     * Aggregated run result.
     */
    record PatchReport(
        int filesScanned,
        List<FileResult> files,
        List<Diagnostic> diagnostics,
        List<String> pathProblems
    ) {
        public PatchReport {
            files = List.copyOf(files);
            diagnostics = List.copyOf(diagnostics);
            pathProblems = List.copyOf(pathProblems);
        }

        public static PatchReport invalidPaths(List<String> problems) {
            return new PatchReport(0, List.of(), List.of(), problems);
        }

        public boolean success() {
            return pathProblems.isEmpty();
        }

        public List<FileResult> changedFiles() {
            return files.stream().filter(FileResult::changed).toList();
        }
    }
}
