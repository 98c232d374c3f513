package io.github.manjago.v8decomp.run;

import io.github.manjago.v8decomp.core.FunctionRecord;

import java.util.Map;

/**
 * Listener for decompilation events.
 * 
 * Implement this interface to follow a run, for example to report progress
 * or collect failures.
 */
public interface DecompilerListener {

    /**
     * Called once every function of the input is parsed.
     * 
     * @param functions registry in parse order
     */
    default void onParsed(Map<String, FunctionRecord> functions) {}

    /**
     * Called when a stage fails for one function. The run continues with the
     * other functions.
     * 
     * @param function the function being processed
     * @param stage stage that failed
     * @param error the failure
     */
    default void onStageFailed(FunctionRecord function, Stage stage, Exception error) {}

    /**
     * Called after a function went through the simplifier, successfully or not.
     * 
     * @param function the simplified function
     */
    default void onSimplified(FunctionRecord function) {}

    /**
     * No-op listener that does nothing.
     */
    DecompilerListener NOOP = new DecompilerListener() {};
}
