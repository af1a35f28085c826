package com.vidnyan.sixer.application.port.out;

import java.nio.charset.Charset;
import java.nio.file.Path;

/**
 * Port for reading and writing source files in their own encoding.
 */
public interface SourceFileStore {

    /**
     * Read a file, decoding it with its declared encoding.
     *
     * @throws java.io.UncheckedIOException on I/O failure
     */
    SourceFile read(Path path);

    /**
     * Replace the content of a file. Either the whole new content is written or the file
     * is left as it was.
     *
     * @throws java.io.UncheckedIOException on I/O failure
     */
    void write(SourceFile file, String newContent);

    /**
     * Decoded file content. {@code byteOrderMark} is true when the file starts with a
     * UTF-8 BOM, which is not part of {@code content}.
     */
    record SourceFile(Path path, String content, Charset charset, boolean byteOrderMark) {}
}
