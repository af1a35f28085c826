package com.vidnyan.sixer.application.port.out;

import java.nio.file.Path;
import java.util.List;

/**
 * Port for discovering the Python files to patch.
 */
public interface SourceFileScanner {

    /**
     * Expand files and directories into the list of {@code .py} files.
     * Problems (missing path, directory without Python files) are reported, not thrown.
     */
    ScanResult scan(List<Path> paths);

    record ScanResult(List<Path> files, List<String> problems) {
        public ScanResult {
            files = List.copyOf(files);
            problems = List.copyOf(problems);
        }

        public boolean hasProblems() {
            return !problems.isEmpty();
        }
    }
}
