package com.sentrius.expr.model;

import java.util.Objects;

public final class BinaryOperationNode implements Node {
    private final String operator;
    private final Node left;
    private final Node right;

    public BinaryOperationNode(String operator, Node left, Node right) {
        this.operator = operator;
        this.left = left;
        this.right = right;
    }

    public String getOperator() {
        return operator;
    }

    public Node getLeft() {
        return left;
    }

    public Node getRight() {
        return right;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BinaryOperationNode)) {
            return false;
        }
        BinaryOperationNode other = (BinaryOperationNode) o;
        return Objects.equals(operator, other.operator)
            && Objects.equals(left, other.left)
            && Objects.equals(right, other.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, left, right);
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator + " " + right + ")";
    }
}
