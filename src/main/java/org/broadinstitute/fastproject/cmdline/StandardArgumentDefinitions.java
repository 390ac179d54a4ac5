package org.broadinstitute.fastproject.cmdline;

/**
 * A set of String constants in which the name of the constant (minus the _SHORT_NAME suffix)
 * is the standard long Option name, and the value of the constant is the standard shortName.
 */
public final class StandardArgumentDefinitions {

    private StandardArgumentDefinitions(){}

    public static final String INPUT_LONG_NAME = "input";
    public static final String VERBOSITY_NAME = "verbosity";
    public static final String QUIET_NAME = "QUIET";
    public static final String SIGNATURES_LONG_NAME = "signatures";
    public static final String PRECOMPUTED_SIGNATURES_LONG_NAME = "precomputed-signatures";
    public static final String HOUSEKEEPING_GENES_LONG_NAME = "housekeeping-genes";
    public static final String INPUT_WEIGHTS_LONG_NAME = "input-weights";
    public static final String INPUT_PROJECTION_LONG_NAME = "input-projection";

    public static final String INPUT_SHORT_NAME = "I";
    public static final String SIGNATURES_SHORT_NAME = "S";
    public static final String PRECOMPUTED_SIGNATURES_SHORT_NAME = "P";
    public static final String HOUSEKEEPING_GENES_SHORT_NAME = "H";
}
