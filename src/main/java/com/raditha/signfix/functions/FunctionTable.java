package com.raditha.signfix.functions;

import java.util.Collection;
import java.util.Optional;

/**
 * Function signatures of one source file, looked up by name.
 */
public interface FunctionTable {

    Optional<FunctionSignature> lookup(String name);

    Collection<FunctionSignature> all();
}
