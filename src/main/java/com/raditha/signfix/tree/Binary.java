package com.raditha.signfix.tree;

/**
 * A binary operation. Operands are replaced in place while the tree is reduced.
 */
public final class Binary implements ExprNode {

    private final String operator;
    private final String type;
    private final String canonicalType;
    private final boolean parenthesized;
    private final String sourceText;
    private final String infix;
    private ExprNode left;
    private ExprNode right;

    /**
     * @param operator      operator spelling
     * @param left          left operand
     * @param right         right operand
     * @param type          type of the operation
     * @param canonicalType front-end canonical type
     * @param parenthesized true when written inside one pair of parentheses
     * @param sourceText    text of the operation as parsed, without enclosing parentheses
     * @param infix         text between the two written operands, operator and spacing included
     */
    public Binary(String operator, ExprNode left, ExprNode right, String type, String canonicalType,
                  boolean parenthesized, String sourceText, String infix) {
        this.operator = operator;
        this.left = left;
        this.right = right;
        this.type = type;
        this.canonicalType = canonicalType;
        this.parenthesized = parenthesized;
        this.sourceText = sourceText;
        this.infix = infix;
    }

    public String operator() {
        return operator;
    }

    public ExprNode left() {
        return left;
    }

    public ExprNode right() {
        return right;
    }

    public void setLeft(ExprNode left) {
        this.left = left;
    }

    public void setRight(ExprNode right) {
        this.right = right;
    }

    @Override
    public String type() {
        return type;
    }

    @Override
    public String canonicalType() {
        return canonicalType;
    }

    @Override
    public boolean parenthesized() {
        return parenthesized;
    }

    public String sourceText() {
        return sourceText;
    }

    public String infix() {
        return infix;
    }

    @Override
    public String toString() {
        return (parenthesized ? "(" : "") + left + " " + operator + " " + right + (parenthesized ? ")" : "");
    }
}
