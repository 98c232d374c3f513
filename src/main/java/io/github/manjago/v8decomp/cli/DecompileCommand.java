package io.github.manjago.v8decomp.cli;

import io.github.manjago.v8decomp.config.DecompilerConfig;
import io.github.manjago.v8decomp.core.FunctionRecord;
import io.github.manjago.v8decomp.output.ExportFormat;
import io.github.manjago.v8decomp.output.PseudocodeExporter;
import io.github.manjago.v8decomp.parser.SourceReader.SourceReadException;
import io.github.manjago.v8decomp.run.DecompilationResult;
import io.github.manjago.v8decomp.run.Decompiler;
import io.github.manjago.v8decomp.run.DecompilerListener;
import io.github.manjago.v8decomp.run.Stage;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: decompile
 * 
 * Decompiles a bytecode dump into pseudocode.
 * 
 * Usage:
 *   v8decomp decompile dump.txt -o dump.js
 *   v8decomp decompile dump.txt -F translated,decompiled
 */
@Command(
    name = "decompile",
    description = "Decompile a V8 bytecode dump to pseudocode",
    mixinStandardHelpOptions = true
)
public class DecompileCommand implements Callable<Integer> {
    
    @Parameters(index = "0", description = "Input bytecode dump")
    private Path inputFile;
    
    @Option(names = {"-o", "--output"}, description = "Output file (default: <input>.js)")
    private Path outputFile;
    
    @Option(names = {"-F", "--formats"}, split = ",",
            description = "Listings to export: ${COMPLETION-CANDIDATES} (default: from config)")
    private List<ExportFormat> formats;
    
    @Option(names = {"-f", "--config"}, description = "Configuration file (HOCON)")
    private Path configFile;
    
    @Option(names = {"-v", "--verbose"}, description = "Verbose output")
    private boolean verbose;
    
    @Override
    public Integer call() {
        try {
            DecompilerConfig config = configFile != null
                    ? DecompilerConfig.fromFile(configFile)
                    : DecompilerConfig.defaults();
            List<ExportFormat> selected = formats != null && !formats.isEmpty() ? formats : config.exportFormats();
            
            if (verbose) {
                System.out.println(config);
            }
            System.out.println("Decompiling: " + inputFile);
            
            Decompiler decompiler = new Decompiler(config);
            if (verbose) {
                decompiler.setListener(new DecompilerListener() {
                    @Override
                    public void onStageFailed(FunctionRecord function, Stage stage, Exception error) {
                        System.out.println("  ! " + stage.label() + " failed for " + function.getName()
                                + ": " + error.getMessage());
                    }
                });
            }
            DecompilationResult result = decompiler.decompileFile(inputFile);
            
            System.out.println("✓ Decompiled " + result.functions().size() + " functions ("
                    + result.failedFunctions() + " with errors)");
            if (verbose) {
                System.out.println(result);
            }
            
            Path output = outputFile != null ? outputFile : inputFile.resolveSibling(inputFile.getFileName() + ".js");
            new PseudocodeExporter(selected).write(result, output);
            System.out.println("✓ Written to: " + output);
            
            return 0;
            
        } catch (SourceReadException e) {
            System.err.println("❌ Cannot read input: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            System.err.println("❌ Cannot write output: " + e.getMessage());
            return 1;
        } catch (Exception e) {
            System.err.println("❌ Error: " + e.getMessage());
            if (verbose) {
                e.printStackTrace();
            }
            return 1;
        }
    }
}
