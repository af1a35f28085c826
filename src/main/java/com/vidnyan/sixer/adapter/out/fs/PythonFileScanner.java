package com.vidnyan.sixer.adapter.out.fs;

import com.vidnyan.sixer.application.port.out.SourceFileScanner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Scans files and directories for Python source files.
 * Directories are walked recursively; {@code .tox} environments are skipped.
 */
@Component
public class PythonFileScanner implements SourceFileScanner {

    private static final String PYTHON_SUFFIX = ".py";
    private static final String TOX_DIRECTORY = ".tox";

    @Override
    public ScanResult scan(List<Path> paths) {
        List<Path> files = new ArrayList<>();
        List<String> problems = new ArrayList<>();

        for (Path path : paths) {
            if (Files.isRegularFile(path)) {
                files.add(path);
            } else if (Files.isDirectory(path)) {
                List<Path> found = scanDirectory(path);
                if (found.isEmpty()) {
                    problems.add("Directory " + path + " doesn't contain any .py file");
                }
                files.addAll(found);
            } else {
                problems.add("Path " + path + " doesn't exist");
            }
        }

        return new ScanResult(files, problems);
    }

    /**
     * All Python files below {@code root}, in path order.
     */
    List<Path> scanDirectory(Path root) {
        try (Stream<Path> paths = Files.walk(root)) {
            return paths.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(PYTHON_SUFFIX))
                    .filter(p -> !insideTox(root.relativize(p)))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to scan " + root, e);
        }
    }

    private static boolean insideTox(Path relative) {
        for (Path segment : relative) {
            if (TOX_DIRECTORY.equals(segment.toString())) {
                return true;
            }
        }
        return false;
    }
}
