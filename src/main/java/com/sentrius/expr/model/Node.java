package com.sentrius.expr.model;

/**
 * A node of the expression syntax tree.
 * The set of node kinds is closed; evaluators dispatch over exactly these five.
 */
public sealed interface Node
    permits NumberNode, BinaryOperationNode, UnaryOperationNode, FunctionCallNode, VariableNode {
}
