package io.fleetquery.tools.multiquery;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

@DisplayName("QueryFileReader Tests")
class QueryFileReaderTest {

    private static final String QUERY = "SELECT 'zażółć' AS word";

    @TempDir
    Path tempDir;

    private final QueryFileReader reader = new QueryFileReader();

    private static byte[] withMark(byte[] mark, String text, Charset charset) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.writeBytes(mark);
        out.writeBytes(text.getBytes(charset));
        return out.toByteArray();
    }

    @Test
    @DisplayName("Should read UTF-8 without a byte-order mark and trim it")
    void shouldReadPlainUtf8() throws Exception {
        Path file = Files.writeString(tempDir.resolve("q.sql"), "\n  " + QUERY + ";\n\n", StandardCharsets.UTF_8);

        assertThat(reader.read(file)).isEqualTo(QUERY + ";");
    }

    @Test
    @DisplayName("Should strip a UTF-8 byte-order mark")
    void shouldDecodeUtf8Bom() {
        byte[] bytes = withMark(new byte[] {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF}, QUERY, StandardCharsets.UTF_8);

        assertThat(QueryFileReader.decode(bytes)).isEqualTo(QUERY);
    }

    @Test
    @DisplayName("Should decode UTF-16 with either byte order")
    void shouldDecodeUtf16() {
        byte[] bigEndian = withMark(new byte[] {(byte) 0xFE, (byte) 0xFF}, QUERY, StandardCharsets.UTF_16BE);
        byte[] littleEndian = withMark(new byte[] {(byte) 0xFF, (byte) 0xFE}, QUERY, StandardCharsets.UTF_16LE);

        assertThat(QueryFileReader.decode(bigEndian)).isEqualTo(QUERY);
        assertThat(QueryFileReader.decode(littleEndian)).isEqualTo(QUERY);
    }

    @Test
    @DisplayName("Should decode UTF-32 with either byte order")
    void shouldDecodeUtf32() {
        byte[] bigEndian = withMark(new byte[] {0x00, 0x00, (byte) 0xFE, (byte) 0xFF}, QUERY,
            Charset.forName("UTF-32BE"));
        byte[] littleEndian = withMark(new byte[] {(byte) 0xFF, (byte) 0xFE, 0x00, 0x00}, QUERY,
            Charset.forName("UTF-32LE"));

        assertThat(QueryFileReader.decode(bigEndian)).isEqualTo(QUERY);
        assertThat(QueryFileReader.decode(littleEndian)).isEqualTo(QUERY);
    }

    @Test
    @DisplayName("Should keep comments and line structure of a script")
    void shouldReadScriptFixture() throws Exception {
        Path file = Path.of(getClass().getResource("/fixtures/select-accounts.sql").toURI());

        String query = reader.read(file);

        assertThat(query).startsWith("-- active accounts per client\nSELECT id, name");
        assertThat(query).endsWith("WHERE active = true;");
    }

    @Test
    @DisplayName("Should reject a whitespace-only file")
    void shouldRejectBlankFile() throws Exception {
        Path file = Files.writeString(tempDir.resolve("blank.sql"), " \n\t\n");

        assertThatThrownBy(() -> reader.read(file))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("is empty or contains only whitespace");
    }

    @Test
    @DisplayName("Should reject a missing file")
    void shouldRejectMissingFile() {
        Path file = tempDir.resolve("missing.sql");

        assertThatThrownBy(() -> reader.read(file))
            .isInstanceOf(ValidationException.class)
            .hasMessage("Query file not found: " + file);
    }
}
