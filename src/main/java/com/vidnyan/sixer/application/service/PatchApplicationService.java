package com.vidnyan.sixer.application.service;

import com.vidnyan.sixer.application.port.in.PatchFilesUseCase;
import com.vidnyan.sixer.application.port.out.ReportWriter;
import com.vidnyan.sixer.application.port.out.SourceFileScanner;
import com.vidnyan.sixer.application.port.out.SourceFileScanner.ScanResult;
import com.vidnyan.sixer.application.port.out.SourceFileStore;
import com.vidnyan.sixer.application.port.out.SourceFileStore.SourceFile;
import com.vidnyan.sixer.application.port.out.SourceOutput;
import com.vidnyan.sixer.domain.RewriteException;
import com.vidnyan.sixer.domain.rule.Diagnostic;
import com.vidnyan.sixer.domain.rule.PatchOutcome;
import com.vidnyan.sixer.domain.rule.RewriteEngine;
import com.vidnyan.sixer.domain.rule.RewriteRule;
import com.vidnyan.sixer.domain.rule.RuleCatalog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Orchestrates a patch run: resolve operations, discover files, rewrite them one after
 * the other and aggregate the warnings.
 *
 * <p>Operation names and paths are validated before the first file is touched.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PatchApplicationService implements PatchFilesUseCase {

    private final RuleCatalog ruleCatalog;
    private final RewriteEngine rewriteEngine;
    private final SourceFileScanner sourceFileScanner;
    private final SourceFileStore sourceFileStore;
    private final SourceOutput sourceOutput;
    private final ReportWriter reportWriter;

    @Override
    public PatchReport patch(PatchRequest request) {
        List<RewriteRule> rules = ruleCatalog.resolve(request.operations());
        log.debug("Operations: {}", rules.stream().map(RewriteRule::name).toList());

        ScanResult scan = sourceFileScanner.scan(request.paths());
        if (scan.hasProblems()) {
            scan.problems().forEach(problem -> log.warn("WARNING: {}", problem));
            log.info("Scanned 0 files");
            return PatchReport.invalidPaths(scan.problems());
        }

        boolean quiet = request.quiet() || request.toStdout();
        List<FileResult> files = new ArrayList<>();
        List<Diagnostic> diagnostics = new ArrayList<>();

        for (Path path : scan.files()) {
            PatchOutcome outcome = patchFile(path, rules, request);
            files.add(new FileResult(path, outcome.changed(), outcome.appliedRules()));
            diagnostics.addAll(outcome.diagnostics());
            if (quiet) {
                continue;
            }
            if (outcome.changed()) {
                log.info("Patch {} with {}", path, String.join(", ", outcome.appliedRules()));
            } else {
                log.info("{}: unchanged", path);
            }
        }

        PatchReport report = new PatchReport(files.size(), files, diagnostics, List.of());
        if (!quiet) {
            log.info("Scanned {} files", report.filesScanned());
        }
        if (!diagnostics.isEmpty()) {
            log.warn("");
            log.warn("Warnings:");
            diagnostics.forEach(diagnostic -> log.warn("{}", diagnostic));
        }

        request.report().ifPresent(target -> {
            reportWriter.write(report, target);
            log.debug("Report written to {}", target);
        });
        return report;
    }

    private PatchOutcome patchFile(Path path, List<RewriteRule> rules, PatchRequest request) {
        SourceFile source = sourceFileStore.read(path);
        PatchOutcome outcome;
        try {
            outcome = rewriteEngine.patch(path.toString(), source.content(), rules, request.settings());
        } catch (RewriteException e) {
            log.error("ERROR while patching {}", path);
            throw e;
        }

        if (request.toStdout()) {
            sourceOutput.emit(path, outcome.content());
        } else if (outcome.changed()) {
            sourceFileStore.write(source, outcome.content());
        }
        return outcome;
    }
}
