package io.fleetquery.tools.multiquery;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

/**
 * Reads a SQL script, honouring a byte-order mark when present and defaulting to UTF-8.
 */
public class QueryFileReader {

    private static final Charset UTF_32BE = Charset.forName("UTF-32BE");
    private static final Charset UTF_32LE = Charset.forName("UTF-32LE");

    /**
     * @return the file content, trimmed
     * @throws ValidationException if the file is missing or blank
     */
    public String read(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new ValidationException("Query file not found: " + file);
        }
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Error reading query file '" + file + "': " + e.getMessage(), e);
        }

        String content = decode(bytes);
        if (content.isBlank()) {
            throw new ValidationException("Query file '" + file + "' is empty or contains only whitespace");
        }
        return content.trim();
    }

    static String decode(byte[] bytes) {
        // UTF-32LE must be tested before UTF-16LE, their marks share the first two bytes
        if (startsWith(bytes, 0x00, 0x00, 0xFE, 0xFF)) {
            return new String(bytes, 4, bytes.length - 4, UTF_32BE);
        }
        if (startsWith(bytes, 0xFF, 0xFE, 0x00, 0x00)) {
            return new String(bytes, 4, bytes.length - 4, UTF_32LE);
        }
        if (startsWith(bytes, 0xEF, 0xBB, 0xBF)) {
            return new String(bytes, 3, bytes.length - 3, StandardCharsets.UTF_8);
        }
        if (startsWith(bytes, 0xFE, 0xFF)) {
            return new String(bytes, 2, bytes.length - 2, StandardCharsets.UTF_16BE);
        }
        if (startsWith(bytes, 0xFF, 0xFE)) {
            return new String(bytes, 2, bytes.length - 2, StandardCharsets.UTF_16LE);
        }
        return new String(bytes, StandardCharsets.UTF_8);
    }

    private static boolean startsWith(byte[] bytes, int... mark) {
        if (bytes.length < mark.length) {
            return false;
        }
        byte[] expected = new byte[mark.length];
        for (int i = 0; i < mark.length; i++) {
            expected[i] = (byte) mark[i];
        }
        return Arrays.equals(bytes, 0, mark.length, expected, 0, mark.length);
    }
}
