package io.github.manjago.v8decomp.run;

import java.util.Locale;

/**
 * Pipeline stages, in execution order.
 */
public enum Stage {
    PARSE,
    TRANSLATE,
    RECONSTRUCT,
    SIMPLIFY;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
