package com.raditha.signfix.resolve;

import com.raditha.signfix.tree.Binary;
import com.raditha.signfix.tree.Classification;
import com.raditha.signfix.tree.ExprNode;
import com.raditha.signfix.tree.Leaf;
import com.raditha.signfix.tree.Operators;
import com.raditha.signfix.types.TypeSpelling;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Inserts casts where the operands of a binary operation differ in signedness.
 * <p>
 * The tree is reduced bottom-up: the deepest binary node whose operands are both leaves
 * (leftmost on ties) is resolved and replaced by a leaf holding its rendered text, until a
 * single leaf remains. A cast inserted at one level therefore determines the operand type
 * seen by the next level.
 */
public class ConflictResolver {

    private static final Logger logger = LoggerFactory.getLogger(ConflictResolver.class);

    public static final int MAX_REDUCTIONS = 10_000;

    private static final Set<String> INT_RESULT = Set.of("<", ">", "<=", ">=", "==", "!=", "&&", "||");

    private final TypeResolver typeResolver;
    private final boolean castOnTypeNameMismatch;

    /**
     * @param typeResolver           operand type resolution
     * @param castOnTypeNameMismatch also cast when signedness agrees but the resolved type
     *                               names differ
     */
    public ConflictResolver(TypeResolver typeResolver, boolean castOnTypeNameMismatch) {
        this.typeResolver = typeResolver;
        this.castOnTypeNameMismatch = castOnTypeNameMismatch;
    }

    /**
     * Reduce the tree to a single leaf. The tree is consumed.
     */
    public Resolution resolve(ExprNode root) {
        List<CastRecord> casts = new ArrayList<>();
        ExprNode current = root;
        int reductions = 0;
        while (current instanceof Binary) {
            if (reductions >= MAX_REDUCTIONS) {
                throw new IllegalStateException("Expression did not reduce after " + MAX_REDUCTIONS + " steps");
            }
            Bottom bottom = findBottom((Binary) current);
            Leaf reduced = reduce(bottom.node(), casts);
            reductions++;
            if (bottom.parent() == null) {
                current = reduced;
            } else if (bottom.left()) {
                bottom.parent().setLeft(reduced);
            } else {
                bottom.parent().setRight(reduced);
            }
        }
        Leaf result = (Leaf) current;
        return new Resolution(result.rendered(), result.type(), casts, reductions);
    }

    private Leaf reduce(Binary node, List<CastRecord> casts) {
        Leaf left = (Leaf) node.left();
        Leaf right = (Leaf) node.right();
        String op = node.operator();
        String leftType = typeResolver.resolve(left);
        String rightType = typeResolver.resolve(right);
        String type = left.type();
        String canonical = left.canonicalType();

        if (TypeSpelling.isInteger(leftType) && TypeSpelling.isInteger(rightType)) {
            boolean signedness = TypeSpelling.isUnsigned(leftType) != TypeSpelling.isUnsigned(rightType);
            boolean names = castOnTypeNameMismatch
                    && !TypeSpelling.normalize(leftType).equals(TypeSpelling.normalize(rightType));
            if (signedness || names) {
                CastRecord.Side side = castSide(left, right);
                String castType = side == CastRecord.Side.LEFT ? rightType : leftType;
                Leaf operand = side == CastRecord.Side.LEFT ? left : right;
                Leaf cast = cast(operand, castType);
                if (cast.changed() && !cast.rendered().equals(operand.rendered())) {
                    casts.add(new CastRecord(side, operand.rendered(), cast.rendered(), castType,
                            operand.isIntegerLiteral()));
                    logger.debug("{} '{}' {} '{}': cast {} to {}", leftType, left.text(), op, rightType, side, castType);
                    if (side == CastRecord.Side.LEFT) {
                        left = cast;
                    } else {
                        right = cast;
                    }
                    type = castType;
                    canonical = castType;
                }
            }
        } else {
            logger.debug("Operands of '{}' are not both integers ({}, {}), no cast", op, leftType, rightType);
        }
        if (INT_RESULT.contains(op)) {
            type = "int";
            canonical = "int";
        }

        boolean changed = left.changed() || right.changed();
        String text = changed ? render(op, node.infix(), left, right) : node.sourceText();
        return new Leaf(text, type, canonical, Classification.OTHER, Operators.precedence(op),
                node.parenthesized(), changed);
    }

    /**
     * The literal operand when exactly one operand is an integer literal, otherwise the right operand.
     */
    static CastRecord.Side castSide(Leaf left, Leaf right) {
        if (left.isIntegerLiteral() && !right.isIntegerLiteral()) {
            return CastRecord.Side.LEFT;
        }
        return CastRecord.Side.RIGHT;
    }

    /**
     * Integer literals get their {@code U} suffix rewritten; everything else is wrapped in a
     * C-style cast, compound operands in parentheses first.
     */
    static Leaf cast(Leaf operand, String castType) {
        if (operand.isIntegerLiteral()) {
            String suffixed = TypeSpelling.withUnsignedSuffix(operand.text(), TypeSpelling.isUnsigned(castType));
            if (!suffixed.equals(operand.text())) {
                return operand.withText(suffixed, false);
            }
        }
        String text = operand.isCompound()
                ? "(" + castType + ")(" + operand.rendered() + ")"
                : "(" + castType + ")" + operand.rendered();
        return operand.withText(text, true);
    }

    static String render(String op, String infix, Leaf left, Leaf right) {
        String l = left.rendered();
        if (Operators.needsParentheses(left.effectivePrecedence(), op, false)) {
            l = "(" + l + ")";
        }
        String r = right.rendered();
        if (Operators.needsParentheses(right.effectivePrecedence(), op, true)) {
            r = "(" + r + ")";
        }
        return l + infix + r;
    }

    private static Bottom findBottom(Binary root) {
        Bottom[] best = new Bottom[1];
        int[] bestDepth = {-1};
        visit(root, null, false, 0, best, bestDepth);
        return best[0];
    }

    private static void visit(Binary node, Binary parent, boolean left, int depth, Bottom[] best, int[] bestDepth) {
        if (node.left() instanceof Binary l) {
            visit(l, node, true, depth + 1, best, bestDepth);
        }
        if (node.right() instanceof Binary r) {
            visit(r, node, false, depth + 1, best, bestDepth);
        }
        if (node.left() instanceof Leaf && node.right() instanceof Leaf && depth > bestDepth[0]) {
            best[0] = new Bottom(node, parent, left);
            bestDepth[0] = depth;
        }
    }

    private record Bottom(Binary node, Binary parent, boolean left) {
    }
}
