package io.github.manjago.v8decomp.run;

import io.github.manjago.v8decomp.core.FunctionRecord;

import java.util.List;
import java.util.Map;

/**
 * Outcome of one run.
 *
 * @param sourceName input name used in messages
 * @param functions every parsed function, in registry order
 * @param failures number of stage failures per stage
 */
public record DecompilationResult(
    String sourceName,
    List<FunctionRecord> functions,
    Map<Stage, Integer> failures
) {

    public DecompilationResult {
        functions = List.copyOf(functions);
        failures = Map.copyOf(failures);
    }

    public int failureCount(Stage stage) {
        return failures.getOrDefault(stage, 0);
    }

    public int totalFailures() {
        return failures.values().stream().mapToInt(Integer::intValue).sum();
    }

    /**
     * @return number of functions with at least one failed stage
     */
    public long failedFunctions() {
        return functions.stream().filter(FunctionRecord::isFailed).count();
    }

    @Override
    public String toString() {
        return String.format("""
            === Decompilation of %s ===
            Functions:     %d (%d failed)
            Parse errors:  %d
            Translate:     %d
            Reconstruct:   %d
            Simplify:      %d
            """,
            sourceName,
            functions.size(), failedFunctions(),
            failureCount(Stage.PARSE),
            failureCount(Stage.TRANSLATE),
            failureCount(Stage.RECONSTRUCT),
            failureCount(Stage.SIMPLIFY)
        );
    }
}
