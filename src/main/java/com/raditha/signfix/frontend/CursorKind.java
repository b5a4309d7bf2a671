package com.raditha.signfix.frontend;

/**
 * Kinds of AST cursors the fixer distinguishes. Anything else is {@link #UNEXPOSED_EXPR} or
 * {@link #UNEXPOSED_STMT}.
 */
public enum CursorKind {
    TRANSLATION_UNIT,

    FUNCTION_DECL,
    VAR_DECL,
    PARM_DECL,
    FIELD_DECL,
    TYPEDEF_DECL,
    STRUCT_DECL,
    ENUM_DECL,
    ENUM_CONSTANT_DECL,

    COMPOUND_STMT,
    DECL_STMT,
    EXPRESSION_STMT,
    IF_STMT,
    WHILE_STMT,
    DO_STMT,
    FOR_STMT,
    SWITCH_STMT,
    CASE_STMT,
    DEFAULT_STMT,
    RETURN_STMT,
    BREAK_STMT,
    CONTINUE_STMT,
    UNEXPOSED_STMT,

    BINARY_OPERATOR,
    COMPOUND_ASSIGNMENT_OPERATOR,
    UNARY_OPERATOR,
    CONDITIONAL_OPERATOR,
    CALL_EXPR,
    INTEGER_LITERAL,
    FLOATING_LITERAL,
    CHARACTER_LITERAL,
    STRING_LITERAL,
    DECL_REF_EXPR,
    MEMBER_REF_EXPR,
    ARRAY_SUBSCRIPT_EXPR,
    CSTYLE_CAST_EXPR,
    PAREN_EXPR,
    SIZEOF_EXPR,
    INIT_LIST_EXPR,
    UNEXPOSED_EXPR;

    public boolean isDeclaration() {
        return this.ordinal() >= FUNCTION_DECL.ordinal() && this.ordinal() <= ENUM_CONSTANT_DECL.ordinal();
    }

    public boolean isExpression() {
        return this.ordinal() >= BINARY_OPERATOR.ordinal();
    }

    /**
     * Binary operators in the sense of the fixer: plain binary operators, simple assignment
     * and compound assignment.
     */
    public boolean isBinary() {
        return this == BINARY_OPERATOR || this == COMPOUND_ASSIGNMENT_OPERATOR;
    }

    public boolean isLiteral() {
        return this == INTEGER_LITERAL || this == FLOATING_LITERAL
                || this == CHARACTER_LITERAL || this == STRING_LITERAL;
    }
}
