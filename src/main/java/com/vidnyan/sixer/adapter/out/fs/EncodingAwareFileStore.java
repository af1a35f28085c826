package com.vidnyan.sixer.adapter.out.fs;

import com.vidnyan.sixer.application.port.out.SourceFileStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads Python files in the encoding they declare and writes them back in the same one.
 *
 * <p>A UTF-8 byte order mark or a {@code coding:} cookie on one of the first two lines
 * selects the charset, UTF-8 otherwise. Writes go to a temporary file of the same directory
 * which then replaces the original.
 */
@Slf4j
@Component
public class EncodingAwareFileStore implements SourceFileStore {

    private static final byte[] UTF8_BOM = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};

    private static final Pattern CODING_COOKIE = Pattern.compile("^[ \\t\\f]*#.*?coding[:=][ \\t]*([-\\w.]+)");

    // Python codec names Java does not know under the same spelling
    private static final Map<String, String> CODEC_ALIASES = Map.of(
            "latin-1", "ISO-8859-1",
            "latin1", "ISO-8859-1",
            "iso-latin-1", "ISO-8859-1",
            "utf8", "UTF-8",
            "utf-8-sig", "UTF-8");

    @Override
    public SourceFile read(Path path) {
        try {
            byte[] bytes = Files.readAllBytes(path);
            boolean bom = startsWithBom(bytes);
            int offset = bom ? UTF8_BOM.length : 0;
            Charset charset = bom ? StandardCharsets.UTF_8 : detectCharset(path, bytes);
            String content = decode(ByteBuffer.wrap(bytes, offset, bytes.length - offset), charset);
            return new SourceFile(path, content, charset, bom);
        } catch (CharacterCodingException e) {
            throw new UncheckedIOException("Failed to decode " + path, e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + path, e);
        }
    }

    @Override
    public void write(SourceFile file, String newContent) {
        Path target = file.path().toAbsolutePath();
        Path temp = null;
        try {
            byte[] encoded = encode(newContent, file.charset());
            temp = Files.createTempFile(target.getParent(), ".sixer-", ".tmp");
            try (OutputStream out = Files.newOutputStream(temp)) {
                if (file.byteOrderMark()) {
                    out.write(UTF8_BOM);
                }
                out.write(encoded);
            }
            copyPermissions(target, temp);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move not supported for {}, replacing it", target);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            temp = null;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + target, e);
        } finally {
            deleteQuietly(temp);
        }
    }

    Charset detectCharset(Path path, byte[] bytes) {
        String head = new String(bytes, 0, Math.min(bytes.length, 1024), StandardCharsets.ISO_8859_1);
        String[] lines = head.split("\\r?\\n", 3);
        for (int i = 0; i < Math.min(2, lines.length); i++) {
            Matcher matcher = CODING_COOKIE.matcher(lines[i]);
            if (matcher.find()) {
                return charsetFor(path, matcher.group(1));
            }
        }
        return StandardCharsets.UTF_8;
    }

    private static Charset charsetFor(Path path, String codec) {
        String name = codec.toLowerCase(Locale.ROOT).replace('_', '-');
        name = CODEC_ALIASES.getOrDefault(name, name);
        try {
            return Charset.forName(name);
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            log.warn("WARNING: {} declares unknown encoding '{}', using UTF-8", path, codec);
            return StandardCharsets.UTF_8;
        }
    }

    private static boolean startsWithBom(byte[] bytes) {
        return bytes.length >= UTF8_BOM.length
                && bytes[0] == UTF8_BOM[0] && bytes[1] == UTF8_BOM[1] && bytes[2] == UTF8_BOM[2];
    }

    private static String decode(ByteBuffer bytes, Charset charset) throws CharacterCodingException {
        return charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(bytes)
                .toString();
    }

    private static byte[] encode(String content, Charset charset) throws CharacterCodingException {
        ByteBuffer buffer = charset.newEncoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .encode(CharBuffer.wrap(content));
        byte[] bytes = new byte[buffer.remaining()];
        buffer.get(bytes);
        return bytes;
    }

    private static void copyPermissions(Path from, Path to) throws IOException {
        PosixFileAttributeView source = Files.getFileAttributeView(from, PosixFileAttributeView.class);
        PosixFileAttributeView target = Files.getFileAttributeView(to, PosixFileAttributeView.class);
        if (source != null && target != null) {
            target.setPermissions(source.readAttributes().permissions());
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Failed to delete temporary file {}: {}", temp, e.getMessage());
        }
    }
}
