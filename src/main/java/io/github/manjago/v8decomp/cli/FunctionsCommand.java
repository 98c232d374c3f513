package io.github.manjago.v8decomp.cli;

import io.github.manjago.v8decomp.config.DecompilerConfig;
import io.github.manjago.v8decomp.core.FunctionRecord;
import io.github.manjago.v8decomp.core.RunContext;
import io.github.manjago.v8decomp.parser.DisassemblyParser;
import io.github.manjago.v8decomp.parser.SourceReader;
import io.github.manjago.v8decomp.parser.SourceReader.SourceReadException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: functions
 * 
 * Parses a dump and lists its functions without decompiling them.
 */
@Command(
    name = "functions",
    description = "List the functions of a V8 bytecode dump",
    mixinStandardHelpOptions = true
)
public class FunctionsCommand implements Callable<Integer> {
    
    @Parameters(index = "0", description = "Input bytecode dump")
    private Path inputFile;
    
    @Option(names = {"-f", "--config"}, description = "Configuration file (HOCON)")
    private Path configFile;
    
    @Override
    public Integer call() {
        try {
            DecompilerConfig config = configFile != null
                    ? DecompilerConfig.fromFile(configFile)
                    : DecompilerConfig.defaults();
            List<String> lines = SourceReader.forNames(config.inputEncodings()).readLines(inputFile);
            
            RunContext context = new RunContext(inputFile.getFileName().toString());
            Map<String, FunctionRecord> functions = new DisassemblyParser(context, config.contextLines()).parse(lines);
            
            System.out.printf("%-48s %6s %6s %6s %6s  %-16s %-16s %s%n",
                    "NAME", "PARAMS", "REGS", "POOL", "CODE", "SCOPE", "OUTER", "DECLARER");
            for (FunctionRecord f : functions.values()) {
                System.out.printf("%-48s %6d %6d %6d %6d  %-16s %-16s %s%s%n",
                        f.getName(),
                        f.getParameterCount(),
                        f.getRegisterCount(),
                        f.getConstantPool().size(),
                        f.getCode().size(),
                        dash(f.getScopeInfoAddress()),
                        dash(f.getOuterScopeInfoAddress()),
                        dash(f.getDeclarer()),
                        f.isFailed() ? "  (incomplete)" : "");
            }
            System.out.println();
            System.out.println(functions.size() + " functions");
            return 0;
            
        } catch (SourceReadException e) {
            System.err.println("❌ Cannot read input: " + e.getMessage());
            return 1;
        } catch (Exception e) {
            System.err.println("❌ Error: " + e.getMessage());
            return 1;
        }
    }
    
    private static String dash(String value) {
        return value != null ? value : "-";
    }
}
