package com.vidnyan.sixer.adapter.out.fs;

import com.vidnyan.sixer.application.port.out.SourceFileStore.SourceFile;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class EncodingAwareFileStoreTest {

    @TempDir
    Path tempDir;

    private final EncodingAwareFileStore store = new EncodingAwareFileStore();

    @Test
    void read_ShouldDefaultToUtf8() throws IOException {
        // Arrange
        Path file = tempDir.resolve("utf8.py");
        Files.writeString(file, "name = u'café'\n", StandardCharsets.UTF_8);

        // Act
        SourceFile source = store.read(file);

        // Assert
        assertEquals(StandardCharsets.UTF_8, source.charset());
        assertFalse(source.byteOrderMark());
        assertEquals("name = u'café'\n", source.content());
    }

    @Test
    void readAndWrite_ShouldKeepDeclaredEncoding() throws IOException {
        // Arrange
        Path file = tempDir.resolve("latin1.py");
        String code = "#!/usr/bin/env python\n# -*- coding: latin-1 -*-\nname = u'café'\n";
        Files.write(file, code.getBytes(StandardCharsets.ISO_8859_1));

        // Act
        SourceFile source = store.read(file);
        store.write(source, code.replace("u'", "'"));

        // Assert
        assertEquals(StandardCharsets.ISO_8859_1, source.charset());
        assertEquals(code, source.content());
        byte[] written = Files.readAllBytes(file);
        assertEquals("#!/usr/bin/env python\n# -*- coding: latin-1 -*-\nname = 'café'\n",
                new String(written, StandardCharsets.ISO_8859_1));
        try (Stream<Path> files = Files.list(tempDir)) {
            assertEquals(1, files.count(), "temporary file left behind");
        }
    }

    @Test
    void readAndWrite_ShouldKeepByteOrderMark() throws IOException {
        // Arrange
        Path file = tempDir.resolve("bom.py");
        byte[] body = "x = 1\n".getBytes(StandardCharsets.UTF_8);
        byte[] bytes = new byte[body.length + 3];
        bytes[0] = (byte) 0xEF;
        bytes[1] = (byte) 0xBB;
        bytes[2] = (byte) 0xBF;
        System.arraycopy(body, 0, bytes, 3, body.length);
        Files.write(file, bytes);

        // Act
        SourceFile source = store.read(file);
        store.write(source, "x = 2\n");

        // Assert
        assertTrue(source.byteOrderMark());
        assertEquals("x = 1\n", source.content());
        byte[] written = Files.readAllBytes(file);
        assertEquals((byte) 0xEF, written[0]);
        assertEquals("x = 2\n", new String(written, 3, written.length - 3, StandardCharsets.UTF_8));
    }

    @Test
    void detectCharset_ShouldIgnoreCookieAfterSecondLine() {
        byte[] bytes = "x = 1\ny = 2\n# coding: latin-1\n".getBytes(StandardCharsets.US_ASCII);

        assertEquals(StandardCharsets.UTF_8, store.detectCharset(tempDir.resolve("late.py"), bytes));
    }

    @Test
    void detectCharset_ShouldFallBackOnUnknownCodec() {
        byte[] bytes = "# coding: klingon\n".getBytes(StandardCharsets.US_ASCII);

        assertEquals(StandardCharsets.UTF_8, store.detectCharset(tempDir.resolve("odd.py"), bytes));
    }

    @Test
    void read_ShouldFailOnUndecodableContent() throws IOException {
        // Arrange
        Path file = tempDir.resolve("broken.py");
        Files.write(file, new byte[]{'x', '=', (byte) 0xFF, '\n'});

        // Act / Assert
        assertThrows(UncheckedIOException.class, () -> store.read(file));
    }
}
