package mutant.ast;

import java.util.List;

/**
 * Shorthand constructors for hand-built trees in tests.
 */
public final class TestNodes {

    private TestNodes() {}

    public static SourcePosition at(int line) {
        return SourcePosition.line(line);
    }

    public static Node nil(int line) {
        return Node.of(NodeType.NULL_LITERAL, at(line));
    }

    public static Node bool(boolean value, int line) {
        return Node.of(NodeType.BOOLEAN_LITERAL, at(line), value);
    }

    public static Node integer(long value, int line) {
        return Node.of(NodeType.INTEGER_LITERAL, at(line), value);
    }

    public static Node string(String value, int line) {
        return Node.of(NodeType.STRING_LITERAL, at(line), value);
    }

    public static Node var(String name, int line) {
        return Node.of(NodeType.VARIABLE, at(line), name);
    }

    public static Node not(Node operand, int line) {
        return Node.of(NodeType.NOT, at(line), operand);
    }

    public static Node binary(String operator, Node left, Node right, int line) {
        return Node.of(NodeType.BINARY, at(line), operator, left, right);
    }

    public static Node call(Node receiver, String name, int line) {
        return Node.of(NodeType.CALL, at(line), receiver, name);
    }

    public static Node call(Node receiver, String name, int line, Node... arguments) {
        return Node.of(NodeType.CALL_WITH_ARGUMENTS, at(line), receiver, name, List.of(arguments));
    }

    public static Node ret(Node value, int line) {
        return Node.of(NodeType.RETURN, at(line), value);
    }

    public static Node block(int line, Node... statements) {
        return Node.of(NodeType.BLOCK, at(line), List.of(statements));
    }

    public static Node ifNode(Node condition, Node then, Node otherwise, int line) {
        return Node.of(NodeType.IF, at(line), condition, then, otherwise);
    }

    public static Node whileNode(Node condition, Node body, int line) {
        return Node.of(NodeType.WHILE, at(line), condition, body);
    }

    public static Node method(String returnType, String name, Node body, int line) {
        return Node.of(NodeType.METHOD, at(line), returnType, name, List.of(), body);
    }
}
