package io.github.manjago.v8decomp.parser;

import io.github.manjago.v8decomp.parser.SourceReader.SourceReadException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SourceReader.
 */
class SourceReaderTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Read UTF-8 file into lines")
    void testReadUtf8() throws Exception {
        Path file = tempDir.resolve("dump.txt");
        Files.writeString(file, "Start SharedFunctionInfo\r\nParameter count 1\nEnd SharedFunctionInfo\n");

        List<String> lines = SourceReader.forNames(List.of("UTF-8")).readLines(file);

        assertEquals(List.of("Start SharedFunctionInfo", "Parameter count 1", "End SharedFunctionInfo"), lines);
    }

    @Test
    @DisplayName("Byte order mark is dropped")
    void testBomStripped() throws Exception {
        Path file = tempDir.resolve("bom.txt");
        byte[] body = "Start".getBytes(StandardCharsets.UTF_8);
        byte[] bytes = new byte[body.length + 3];
        bytes[0] = (byte) 0xEF;
        bytes[1] = (byte) 0xBB;
        bytes[2] = (byte) 0xBF;
        System.arraycopy(body, 0, bytes, 3, body.length);
        Files.write(file, bytes);

        assertEquals(List.of("Start"), SourceReader.forNames(List.of("UTF-8")).readLines(file));
    }

    @Test
    @DisplayName("Next charset is tried when UTF-8 fails")
    void testFallbackCharset() {
        byte[] gbk = "中文".getBytes(Charset.forName("GBK"));
        SourceReader reader = SourceReader.forNames(List.of("UTF-8", "GBK"));

        assertEquals("中文", reader.decode(gbk, "test"));
    }

    @Test
    @DisplayName("Undecodable input falls back to UTF-8 with replacement")
    void testReplacementFallback() {
        byte[] bytes = {(byte) 0xFF, 'a'};
        SourceReader reader = SourceReader.forNames(List.of("UTF-8"));

        assertEquals("�a", reader.decode(bytes, "test"));
    }

    @Test
    @DisplayName("Unsupported charset names are ignored")
    void testUnsupportedCharset() {
        SourceReader reader = SourceReader.forNames(List.of("no-such-charset", "UTF-8"));

        assertEquals(List.of(StandardCharsets.UTF_8), reader.getCharsets());
    }

    @Test
    @DisplayName("Missing file is reported")
    void testMissingFile() {
        SourceReader reader = SourceReader.forNames(List.of("UTF-8"));

        assertThrows(SourceReadException.class, () -> reader.readLines(tempDir.resolve("missing.txt")));
    }

    @Test
    @DisplayName("All line terminators split")
    void testSplitLines() {
        assertEquals(List.of("a", "b", "c"), SourceReader.splitLines("a\r\nb\rc\n"));
        assertEquals(List.of("a", "", "b"), SourceReader.splitLines("a\n\nb"));
    }
}
