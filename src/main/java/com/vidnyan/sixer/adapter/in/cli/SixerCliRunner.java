package com.vidnyan.sixer.adapter.in.cli;

import com.vidnyan.sixer.SixerProperties;
import com.vidnyan.sixer.application.port.in.PatchFilesUseCase;
import com.vidnyan.sixer.application.port.in.PatchFilesUseCase.PatchReport;
import com.vidnyan.sixer.application.port.in.PatchFilesUseCase.PatchRequest;
import com.vidnyan.sixer.domain.RewriteException;
import com.vidnyan.sixer.domain.imports.ModuleTables;
import com.vidnyan.sixer.domain.rule.RewriteRule;
import com.vidnyan.sixer.domain.rule.RewriteSettings;
import com.vidnyan.sixer.domain.rule.RuleCatalog;
import com.vidnyan.sixer.domain.rule.UnknownRuleException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Command-line entry point:
 * {@code sixer [options] <operation[,operation...]> <path> [<path> ...]}.
 *
 * <p>Exit status is 0 on success and 1 on bad arguments, unknown operation, invalid path
 * or a file that could not be patched.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SixerCliRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final String MAX_RANGE = "max-range";
    private static final String APP = "app";
    private static final String THIRD_PARTY = "third-party";
    private static final String QUIET = "quiet";
    private static final String TO_STDOUT = "to-stdout";
    private static final String REPORT = "report";

    private final PatchFilesUseCase patchFilesUseCase;
    private final RuleCatalog ruleCatalog;
    private final SixerProperties properties;

    private int exitCode;

    @Override
    public void run(ApplicationArguments args) {
        exitCode = execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    int execute(ApplicationArguments args) {
        boolean quiet = properties.isQuiet() || args.containsOption(QUIET);
        boolean toStdout = properties.isToStdout() || args.containsOption(TO_STDOUT);
        List<String> positional = new ArrayList<>();
        for (String arg : args.getNonOptionArgs()) {
            switch (arg) {
                case "-q" -> quiet = true;
                case "-c" -> toStdout = true;
                default -> positional.add(arg);
            }
        }

        if (positional.size() < 2) {
            printUsage();
            return 1;
        }

        PatchRequest request;
        try {
            request = new PatchRequest(
                    Arrays.asList(positional.get(0).split(",")),
                    positional.subList(1, positional.size()).stream().map(Path::of).toList(),
                    settings(args),
                    quiet || toStdout,
                    toStdout,
                    reportPath(args));
        } catch (IllegalArgumentException e) {
            log.error(e.getMessage());
            log.error("");
            printUsage();
            return 1;
        }

        try {
            PatchReport report = patchFilesUseCase.patch(request);
            return report.success() ? 0 : 1;
        } catch (UnknownRuleException e) {
            log.error(e.getMessage());
            log.error("");
            printUsage();
            return 1;
        } catch (RewriteException | UncheckedIOException e) {
            log.error("{}", e.getMessage());
            return 1;
        }
    }

    private RewriteSettings settings(ApplicationArguments args) {
        int maxRange = properties.getMaxRange();
        String maxRangeOption = lastValue(args, MAX_RANGE);
        if (maxRangeOption != null) {
            try {
                maxRange = Integer.parseInt(maxRangeOption.strip());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("invalid --max-range value: " + maxRangeOption, e);
            }
        }
        if (maxRange < 0) {
            throw new IllegalArgumentException("--max-range must not be negative: " + maxRange);
        }

        List<String> applicationModules = new ArrayList<>(properties.getApplicationModules());
        applicationModules.addAll(commaSeparated(args, APP));
        List<String> thirdPartyModules = new ArrayList<>(properties.getThirdPartyModules());
        thirdPartyModules.addAll(commaSeparated(args, THIRD_PARTY));

        ModuleTables tables = ModuleTables.defaults().extendedWith(applicationModules, thirdPartyModules);
        return new RewriteSettings(maxRange, tables);
    }

    private Path reportPath(ApplicationArguments args) {
        String option = lastValue(args, REPORT);
        String value = option != null ? option : properties.getReportPath();
        return value == null || value.isBlank() ? null : Path.of(value.strip());
    }

    private static String lastValue(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        return values.get(values.size() - 1);
    }

    private static List<String> commaSeparated(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null) {
            return List.of();
        }
        return values.stream()
                .flatMap(value -> Arrays.stream(value.split(",")))
                .map(String::strip)
                .filter(value -> !value.isEmpty())
                .toList();
    }

    private void printUsage() {
        log.info("Usage: sixer [options] <operation[,operation...]> <path> [<path> ...]");
        log.info("");
        log.info("sixer adds Python 3 support to a Python 2 project using six.");
        log.info("");
        log.info("Options:");
        log.info("  --max-range=N      don't use six.moves.range for ranges smaller than N items (default: {})",
                RewriteSettings.DEFAULT_MAX_RANGE);
        log.info("  --app=a,b          names of the application modules, used to group imports");
        log.info("  --third-party=x,y  name prefixes of third-party modules, used to group imports");
        log.info("  -q, --quiet        be quiet");
        log.info("  -c, --to-stdout    write output into stdout instead of modifying files (implies --quiet)");
        log.info("  --report=FILE      write a JSON report of the run");
        log.info("");
        log.info("Operations:");
        ruleCatalog.rules().stream()
                .sorted(Comparator.comparing(RewriteRule::name))
                .forEach(rule -> log.info("- {}: {}", rule.name(), rule.description()));
        log.info("- {}: apply all available operations", RuleCatalog.ALL);
        log.info("");
        log.info("If a directory is passed, sixer finds .py files in subdirectories.");
        log.info("<operation> can be a list of operations separated by commas, e.g. six_moves,urllib");
    }
}
