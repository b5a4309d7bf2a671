package com.raditha.signfix.resolve;

import com.raditha.signfix.alias.AliasResolution;
import com.raditha.signfix.alias.TypeTable;
import com.raditha.signfix.tree.ExprNode;
import com.raditha.signfix.types.TypeSpelling;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves operand types through the Type Table, falling back to the front-end's canonical
 * spelling for names the table cannot turn into an integer type.
 */
public class TypeResolver {

    private static final Logger logger = LoggerFactory.getLogger(TypeResolver.class);

    private final TypeTable types;

    public TypeResolver(TypeTable types) {
        this.types = types;
    }

    /**
     * Resolved type of a node with qualifiers stripped.
     */
    public String resolve(ExprNode node) {
        return resolve(node.type(), node.canonicalType());
    }

    /**
     * Resolved type of a declared spelling, with the front-end's canonical spelling as fallback.
     */
    public String resolve(String declared, String canonicalType) {
        if (declared == null || declared.isBlank()) {
            return TypeSpelling.stripQualifiers(canonicalType);
        }
        String resolved = declared;
        if (types != null) {
            AliasResolution r = types.resolveSpelling(declared);
            if (r.cycleDetected()) {
                logger.debug("Type '{}' resolves through a cycle, using '{}'", declared, r.value());
            }
            resolved = r.value();
        }
        resolved = TypeSpelling.stripQualifiers(resolved);
        if (!TypeSpelling.isInteger(resolved) && canonicalType != null && !canonicalType.isBlank()) {
            String canonical = TypeSpelling.stripQualifiers(canonicalType);
            if (TypeSpelling.isInteger(canonical)) {
                return canonical;
            }
        }
        return resolved;
    }
}
