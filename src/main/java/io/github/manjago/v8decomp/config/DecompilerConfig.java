package io.github.manjago.v8decomp.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import io.github.manjago.v8decomp.output.ExportFormat;
import io.github.manjago.v8decomp.translate.OpcodeTable;
import io.github.manjago.v8decomp.translate.OpcodeTableKind;

import java.nio.file.Path;
import java.util.Locale;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Configuration for the decompiler.
 *
 * Loads from HOCON files using typesafe-config.
 * Default values are in reference.conf.
 */
public record DecompilerConfig(
    // Translation
    OpcodeTableKind opcodeTable,

    // Output
    List<ExportFormat> exportFormats,

    // Input
    List<String> inputEncodings,   // tried in order

    // Control flow
    int continueWindow,            // offsets before loop end counted as continue

    // Diagnostics
    int contextLines               // source lines shown around a parse error
) {

    public DecompilerConfig {
        exportFormats = List.copyOf(exportFormats);
        inputEncodings = List.copyOf(inputEncodings);
    }

    /**
     * Load default configuration.
     */
    public static DecompilerConfig defaults() {
        return fromConfig(ConfigFactory.load());
    }

    /**
     * Load configuration from a specific file.
     */
    public static DecompilerConfig fromFile(Path configFile) {
        Config fileConfig = ConfigFactory.parseFile(configFile.toFile());
        Config merged = fileConfig.withFallback(ConfigFactory.load());
        return fromConfig(merged);
    }

    /**
     * Load from Config object.
     */
    public static DecompilerConfig fromConfig(Config config) {
        Config c = config.getConfig("decompiler");

        return new DecompilerConfig(
            OpcodeTableKind.parse(c.getString("opcode-table")),
            c.getStringList("export.formats").stream().map(ExportFormat::parse).toList(),
            c.getStringList("input.encodings"),
            c.getInt("flow.continue-window"),
            c.getInt("diagnostics.context-lines")
        );
    }

    /**
     * Create the configured opcode table.
     */
    public OpcodeTable createOpcodeTable() {
        return opcodeTable.create();
    }

    /**
     * Builder for programmatic configuration.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private OpcodeTableKind opcodeTable = OpcodeTableKind.V8;
        private List<ExportFormat> exportFormats = List.of(ExportFormat.DECOMPILED);
        private List<String> inputEncodings = List.of("UTF-8", "GBK", "windows-1252");
        private int continueWindow = 4;
        private int contextLines = 2;

        public Builder opcodeTable(OpcodeTableKind kind) { this.opcodeTable = kind; return this; }
        public Builder exportFormats(List<ExportFormat> formats) { this.exportFormats = formats; return this; }
        public Builder inputEncodings(List<String> encodings) { this.inputEncodings = encodings; return this; }
        public Builder continueWindow(int window) { this.continueWindow = window; return this; }
        public Builder contextLines(int lines) { this.contextLines = lines; return this; }

        public DecompilerConfig build() {
            return new DecompilerConfig(
                opcodeTable, exportFormats, inputEncodings, continueWindow, contextLines
            );
        }
    }

    @Override
    public String toString() {
        return String.format("""
            DecompilerConfig:
              opcode-table:               %s
              export.formats:             %s
              input.encodings:            %s
              flow.continue-window:       %d offsets
              diagnostics.context-lines:  %d
            """,
            opcodeTable.name().toLowerCase(Locale.ROOT),
            exportFormats.stream().map(f -> f.name().toLowerCase()).collect(Collectors.joining(", ")),
            String.join(", ", inputEncodings),
            continueWindow,
            contextLines
        );
    }
}
