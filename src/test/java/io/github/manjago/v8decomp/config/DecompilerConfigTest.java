package io.github.manjago.v8decomp.config;

import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import io.github.manjago.v8decomp.output.ExportFormat;
import io.github.manjago.v8decomp.translate.OpcodeTableKind;
import io.github.manjago.v8decomp.translate.V8OpcodeTable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DecompilerConfig.
 */
class DecompilerConfigTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("reference.conf defaults match the builder defaults")
    void testDefaults() {
        DecompilerConfig config = DecompilerConfig.defaults();

        assertEquals(DecompilerConfig.builder().build(), config);
        assertEquals(OpcodeTableKind.V8, config.opcodeTable());
        assertEquals(List.of(ExportFormat.DECOMPILED), config.exportFormats());
        assertEquals(List.of("UTF-8", "GBK", "windows-1252"), config.inputEncodings());
        assertEquals(4, config.continueWindow());
        assertEquals(2, config.contextLines());
    }

    @Test
    @DisplayName("File values override defaults, the rest falls back")
    void testFromFile() throws Exception {
        Path file = tempDir.resolve("decomp.conf");
        Files.writeString(file, """
                decompiler {
                  flow.continue-window = 6
                  export.formats = [bytecode, Decompiled]
                }
                """);

        DecompilerConfig config = DecompilerConfig.fromFile(file);

        assertEquals(6, config.continueWindow());
        assertEquals(List.of(ExportFormat.BYTECODE, ExportFormat.DECOMPILED), config.exportFormats());
        assertEquals(2, config.contextLines());
        assertEquals(List.of("UTF-8", "GBK", "windows-1252"), config.inputEncodings());
    }

    @Test
    @DisplayName("Unknown export format in config is rejected")
    void testBadFormat() {
        var raw = ConfigFactory.parseString("decompiler.export.formats = [listing]")
                .withFallback(ConfigFactory.load());

        assertThrows(IllegalArgumentException.class, () -> DecompilerConfig.fromConfig(raw));
    }

    @Test
    @DisplayName("Missing section is a config error")
    void testMissingSection() {
        assertThrows(ConfigException.Missing.class,
                () -> DecompilerConfig.fromConfig(ConfigFactory.parseString("other = 1")));
    }

    @Test
    @DisplayName("Builder overrides")
    void testBuilder() {
        DecompilerConfig config = DecompilerConfig.builder()
                .continueWindow(8)
                .contextLines(0)
                .inputEncodings(List.of("UTF-8"))
                .exportFormats(List.of(ExportFormat.TRANSLATED))
                .build();

        assertEquals(8, config.continueWindow());
        assertEquals(0, config.contextLines());
        assertEquals(List.of("UTF-8"), config.inputEncodings());
        assertEquals(List.of(ExportFormat.TRANSLATED), config.exportFormats());
    }

    @Test
    @DisplayName("Opcode table is created from its configured name")
    void testCreateOpcodeTable() {
        var raw = ConfigFactory.parseString("decompiler.opcode-table = V8")
                .withFallback(ConfigFactory.load());

        DecompilerConfig config = DecompilerConfig.fromConfig(raw);

        assertEquals(OpcodeTableKind.V8, config.opcodeTable());
        assertInstanceOf(V8OpcodeTable.class, config.createOpcodeTable());
        assertNotSame(config.createOpcodeTable(), config.createOpcodeTable());
    }

    @Test
    @DisplayName("Unknown opcode table name is rejected with the known names")
    void testBadOpcodeTable() {
        var raw = ConfigFactory.parseString("decompiler.opcode-table = \"java.lang.String\"")
                .withFallback(ConfigFactory.load());

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> DecompilerConfig.fromConfig(raw));
        assertTrue(e.getMessage().contains("java.lang.String"), e.getMessage());
        assertTrue(e.getMessage().contains("expected v8"), e.getMessage());
    }

    @Test
    @DisplayName("toString lists every setting")
    void testToString() {
        String text = DecompilerConfig.builder().build().toString();

        assertTrue(text.contains("opcode-table:               v8"), text);
        assertTrue(text.contains("flow.continue-window:       4 offsets"), text);
        assertTrue(text.contains("export.formats:             decompiled"), text);
        assertTrue(text.contains("UTF-8, GBK, windows-1252"), text);
    }
}
