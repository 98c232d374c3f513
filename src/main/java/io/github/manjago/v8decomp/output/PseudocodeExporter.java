package io.github.manjago.v8decomp.output;

import io.github.manjago.v8decomp.core.FunctionRecord;
import io.github.manjago.v8decomp.core.Instruction;
import io.github.manjago.v8decomp.run.DecompilationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Renders decompiled functions as text.
 * <p>
 * Each function starts with a {@code function name(a0, a1)} header followed by
 * one listing per selected format. With more than one format every listing is
 * introduced by a {@code // format} comment.
 */
public class PseudocodeExporter {

    private static final Logger log = LoggerFactory.getLogger(PseudocodeExporter.class);

    private final List<ExportFormat> formats;

    public PseudocodeExporter(List<ExportFormat> formats) {
        if (formats.isEmpty()) {
            throw new IllegalArgumentException("At least one export format is required");
        }
        this.formats = List.copyOf(formats);
    }

    public String export(DecompilationResult result) {
        StringBuilder sb = new StringBuilder();
        for (FunctionRecord function : result.functions()) {
            sb.append(export(function)).append('\n');
        }
        return sb.toString();
    }

    public String export(FunctionRecord function) {
        StringBuilder sb = new StringBuilder();
        sb.append("function ").append(function.getName())
                .append('(').append(String.join(", ", function.parameterNames())).append(")\n");
        for (String failure : function.getFailures()) {
            sb.append("// decompilation failed: ").append(failure).append('\n');
        }

        for (ExportFormat format : formats) {
            if (formats.size() > 1) {
                sb.append("// ").append(format.name().toLowerCase(Locale.ROOT)).append('\n');
            }
            switch (format) {
                case BYTECODE -> appendBytecode(sb, function);
                case TRANSLATED -> appendTranslated(sb, function);
                case DECOMPILED -> appendDecompiled(sb, function);
            }
        }
        return sb.toString();
    }

    /**
     * Write the export as UTF-8.
     */
    public void write(DecompilationResult result, Path output) throws IOException {
        Files.writeString(output, export(result), StandardCharsets.UTF_8);
        log.info("Wrote {} functions to {}", result.functions().size(), output);
    }

    private static void appendBytecode(StringBuilder sb, FunctionRecord function) {
        for (Instruction line : function.getCode()) {
            if (!line.isPlaceholder()) {
                sb.append("@ ").append(line.getOffset()).append(" : ").append(line.getInstruction()).append('\n');
            }
        }
    }

    private static void appendTranslated(StringBuilder sb, FunctionRecord function) {
        for (Instruction line : function.getCode()) {
            if (!line.getTranslated().isEmpty()) {
                sb.append(line.getTranslated()).append('\n');
            }
        }
    }

    private static void appendDecompiled(StringBuilder sb, FunctionRecord function) {
        for (Instruction line : function.getCode()) {
            if (line.isVisible() && !line.getDecompiled().isEmpty()) {
                sb.append(line.getDecompiled()).append('\n');
            }
        }
    }
}
