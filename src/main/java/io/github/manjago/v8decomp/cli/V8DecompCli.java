package io.github.manjago.v8decomp.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * v8decomp CLI - decompiler for V8 Ignition bytecode dumps.
 * 
 * Usage:
 *   v8decomp decompile <dump> [options]  - Decompile a dump to pseudocode
 *   v8decomp functions <dump>            - List the functions of a dump
 *   v8decomp info                        - Show version and config
 */
@Command(
    name = "v8decomp",
    description = "Decompiler for V8 Ignition bytecode disassembly (--print-bytecode output)",
    mixinStandardHelpOptions = true,
    version = "v8decomp 1.0.0",
    subcommands = {
        DecompileCommand.class,
        FunctionsCommand.class,
        InfoCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class V8DecompCli implements Runnable {
    
    @Override
    public void run() {
        // If no subcommand, show help
        CommandLine.usage(this, System.out);
    }
    
    public static void main(String[] args) {
        System.exit(execute(args));
    }

    static int execute(String... args) {
        return new CommandLine(new V8DecompCli())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
    }
}
