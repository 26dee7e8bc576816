package com.sentrius.expr.model;

import java.util.Objects;

public final class UnaryOperationNode implements Node {
    private final String operator;
    private final Node operand;

    public UnaryOperationNode(String operator, Node operand) {
        this.operator = operator;
        this.operand = operand;
    }

    public String getOperator() {
        return operator;
    }

    public Node getOperand() {
        return operand;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof UnaryOperationNode)) {
            return false;
        }
        UnaryOperationNode other = (UnaryOperationNode) o;
        return Objects.equals(operator, other.operator) && Objects.equals(operand, other.operand);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, operand);
    }

    @Override
    public String toString() {
        return "(" + operator + operand + ")";
    }
}
