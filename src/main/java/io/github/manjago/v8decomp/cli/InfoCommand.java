package io.github.manjago.v8decomp.cli;

import io.github.manjago.v8decomp.config.DecompilerConfig;
import io.github.manjago.v8decomp.translate.OpcodeTable;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * Show information about v8decomp.
 */
@Command(
    name = "info",
    description = "Show version and configuration info",
    mixinStandardHelpOptions = true
)
public class InfoCommand implements Callable<Integer> {
    
    @Override
    public Integer call() {
        System.out.println();
        System.out.println("╔═══════════════════════════════════════╗");
        System.out.println("║              V8DECOMP                 ║");
        System.out.println("║   Ignition bytecode decompiler        ║");
        System.out.println("║          Version 1.0.0                ║");
        System.out.println("╚═══════════════════════════════════════╝");
        System.out.println();
        
        DecompilerConfig config = DecompilerConfig.defaults();
        System.out.println("Default Configuration:");
        System.out.println(config);
        
        OpcodeTable table = config.createOpcodeTable();
        System.out.println("Opcode table:");
        System.out.println("  " + table.getClass().getSimpleName() + ": " + table.mnemonics().size() + " opcodes");
        
        return 0;
    }
}
