package tripod.mapspec.core;

import java.util.Arrays;

/**
 * A record whose parameter names differ from the chain's columns.
 */
public class ChainSchemaException extends IllegalStateException {
    private static final long serialVersionUID = 0x4b81f06c2e9da317l;

    public ChainSchemaException (String[] expected, String[] actual) {
        super ("Chain columns are "+Arrays.toString(expected)
               +" but record has "+Arrays.toString(actual));
    }
}
