package com.vidnyan.sixer.application.port.out;

import java.nio.file.Path;

/**
 * Port receiving patched content when files are not rewritten in place.
 */
public interface SourceOutput {

    void emit(Path file, String content);
}
