package io.github.manjago.v8decomp.run;

import io.github.manjago.v8decomp.config.DecompilerConfig;
import io.github.manjago.v8decomp.core.DecompileException;
import io.github.manjago.v8decomp.core.FunctionRecord;
import io.github.manjago.v8decomp.core.RunContext;
import io.github.manjago.v8decomp.flow.ControlFlowReconstructor;
import io.github.manjago.v8decomp.flow.EdgeSet;
import io.github.manjago.v8decomp.parser.DisassemblyParser;
import io.github.manjago.v8decomp.parser.SourceReader;
import io.github.manjago.v8decomp.parser.SourceReader.SourceReadException;
import io.github.manjago.v8decomp.simplify.ScopeGraph;
import io.github.manjago.v8decomp.simplify.SimplificationOrder;
import io.github.manjago.v8decomp.simplify.Simplifier;
import io.github.manjago.v8decomp.translate.BytecodeTranslator;
import io.github.manjago.v8decomp.translate.OpcodeTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Drives a dump through parse, translate, reconstruct and simplify.
 *
 * Every run gets a fresh {@link RunContext}, so running twice over the same input
 * gives the same result. A failure in one stage of one function is logged,
 * recorded on the function and reported to the listener; the run goes on with the
 * rest.
 */
public class Decompiler {

    private static final Logger log = LoggerFactory.getLogger(Decompiler.class);

    private final DecompilerConfig config;
    private final OpcodeTable opcodes;

    private DecompilerListener listener = DecompilerListener.NOOP;

    public Decompiler(DecompilerConfig config) {
        this(config, config.createOpcodeTable());
    }

    public Decompiler(DecompilerConfig config, OpcodeTable opcodes) {
        this.config = config;
        this.opcodes = opcodes;
    }

    /**
     * Set event listener for decompilation events.
     */
    public void setListener(DecompilerListener listener) {
        this.listener = listener != null ? listener : DecompilerListener.NOOP;
    }

    /**
     * Read and decompile a dump file using the configured input encodings.
     *
     * @throws SourceReadException if the file cannot be read
     */
    public DecompilationResult decompileFile(Path path) throws SourceReadException {
        List<String> lines = SourceReader.forNames(config.inputEncodings()).readLines(path);
        return decompile(path.getFileName().toString(), lines);
    }

    /**
     * Decompile the lines of a dump.
     *
     * @param sourceName name used in messages
     * @param lines raw dump lines
     */
    public DecompilationResult decompile(String sourceName, List<String> lines) {
        RunContext context = new RunContext(sourceName);
        Map<Stage, Integer> failures = new EnumMap<>(Stage.class);

        Map<String, FunctionRecord> functions = new DisassemblyParser(context, config.contextLines()).parse(lines);
        for (FunctionRecord function : functions.values()) {
            for (String failure : function.getFailures()) {
                failures.merge(Stage.PARSE, 1, Integer::sum);
                listener.onStageFailed(function, Stage.PARSE, new DecompileException(failure, function.getName()));
            }
        }
        listener.onParsed(functions);

        BytecodeTranslator translator = new BytecodeTranslator(opcodes);
        ControlFlowReconstructor reconstructor = new ControlFlowReconstructor(config.continueWindow());
        for (FunctionRecord function : functions.values()) {
            structure(function, translator, reconstructor, failures);
        }

        ScopeGraph graph = ScopeGraph.build(functions.values());
        context.setScopeGraph(graph);
        log.debug("{}: {} scopes", sourceName, graph.size());

        Simplifier simplifier = new Simplifier(context);
        for (FunctionRecord function : SimplificationOrder.of(functions.values(), graph)) {
            try {
                simplifier.simplify(function);
            } catch (DecompileException | RuntimeException e) {
                fail(function, Stage.SIMPLIFY, e, failures);
            }
            listener.onSimplified(function);
        }

        DecompilationResult result = new DecompilationResult(sourceName, new ArrayList<>(functions.values()), failures);
        log.info("Decompiled {} functions from {} ({} stage failures)",
                functions.size(), sourceName, result.totalFailures());
        return result;
    }

    private void structure(FunctionRecord function, BytecodeTranslator translator,
                           ControlFlowReconstructor reconstructor, Map<Stage, Integer> failures) {
        EdgeSet edges;
        try {
            edges = translator.translate(function);
        } catch (DecompileException | RuntimeException e) {
            fail(function, Stage.TRANSLATE, e, failures);
            reconstructor.expand(function);
            return;
        }

        try {
            reconstructor.reconstruct(function, edges);
        } catch (RuntimeException e) {
            fail(function, Stage.RECONSTRUCT, e, failures);
            reconstructor.expand(function);
        }
    }

    private void fail(FunctionRecord function, Stage stage, Exception error, Map<Stage, Integer> failures) {
        log.warn("{} failed for {}: {}", stage.label(), function.getName(), error.getMessage());
        log.debug("{} failure detail", stage.label(), error);
        function.markFailed(stage.label(), String.valueOf(error.getMessage()));
        failures.merge(stage, 1, Integer::sum);
        listener.onStageFailed(function, stage, error);
    }
}
