package com.raditha.signfix.functions;

import java.util.List;

/**
 * Signature of a function defined or declared in the analyzed file.
 *
 * @param name       function name
 * @param parameters parameters in declaration order
 * @param returnType return type spelling
 * @param line       original line of the definition or declaration
 */
public record FunctionSignature(String name, List<Parameter> parameters, String returnType, int line) {

    public FunctionSignature {
        parameters = List.copyOf(parameters);
    }

    public int argc() {
        return parameters.size();
    }

    /**
     * A named, typed parameter. The name is empty for unnamed prototype parameters.
     */
    public record Parameter(String name, String type) {
    }
}
