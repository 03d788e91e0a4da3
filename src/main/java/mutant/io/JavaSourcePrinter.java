package mutant.io;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import mutant.ast.Node;
import mutant.ast.NodeType;

/**
 * Renders nodes as Java source. Nested binary expressions are parenthesized, so
 * the output keeps the tree's grouping without tracking operator precedence.
 */
public final class JavaSourcePrinter {

    private static final String INDENT = "    ";
    private static final Set<NodeType> COMPOUND_STATEMENTS =
            EnumSet.of(NodeType.BLOCK, NodeType.IF, NodeType.WHILE, NodeType.METHOD);

    public String print(Node node) {
        StringBuilder sb = new StringBuilder();
        appendStatement(sb, node, 0);
        return sb.toString();
    }

    /** Renders {@code node} as an expression, without a trailing semicolon. */
    public String printExpression(Node node) {
        StringBuilder sb = new StringBuilder();
        appendNode(sb, node, 0);
        return sb.toString();
    }

    private void appendStatement(StringBuilder sb, Node node, int depth) {
        appendNode(sb, node, depth);
        if (needsSemicolon(node)) {
            sb.append(';');
        }
    }

    private static boolean needsSemicolon(Node node) {
        if (COMPOUND_STATEMENTS.contains(node.type())) {
            return false;
        }
        if (node.type() == NodeType.OPAQUE) {
            String source = node.string("source").strip();
            return !(source.endsWith(";") || source.endsWith("}"));
        }
        return true;
    }

    private void appendNode(StringBuilder sb, Node node, int depth) {
        switch (node.type()) {
            case NULL_LITERAL:
                sb.append("null");
                break;
            case BOOLEAN_LITERAL:
                sb.append(node.bool("value"));
                break;
            case INTEGER_LITERAL:
                appendInteger(sb, node.number("value"));
                break;
            case STRING_LITERAL:
                appendString(sb, node.string("value"));
                break;
            case ARRAY_LITERAL:
                sb.append("new ").append(node.string("elementType")).append("[]{");
                appendList(sb, node.nodes("elements"), depth);
                sb.append('}');
                break;
            case VARIABLE:
                sb.append(node.string("name"));
                break;
            case NOT:
                sb.append('!');
                appendOperand(sb, node.node("operand"), depth);
                break;
            case BINARY:
                appendOperand(sb, node.node("left"), depth);
                sb.append(' ').append(node.string("operator")).append(' ');
                appendOperand(sb, node.node("right"), depth);
                break;
            case CALL:
                appendReceiver(sb, node.node("receiver"), depth);
                sb.append(node.string("name")).append("()");
                break;
            case CALL_WITH_ARGUMENTS:
                appendReceiver(sb, node.node("receiver"), depth);
                sb.append(node.string("name")).append('(');
                appendList(sb, node.nodes("arguments"), depth);
                sb.append(')');
                break;
            case ASSIGNMENT:
                appendNode(sb, node.node("target"), depth);
                sb.append(" = ");
                appendNode(sb, node.node("value"), depth);
                break;
            case LOCAL_VARIABLE:
                sb.append(node.string("type")).append(' ').append(node.string("name"));
                if (node.node("value") != null) {
                    sb.append(" = ");
                    appendNode(sb, node.node("value"), depth);
                }
                break;
            case RETURN:
                sb.append("return");
                if (node.node("value") != null) {
                    sb.append(' ');
                    appendNode(sb, node.node("value"), depth);
                }
                break;
            case IF:
                sb.append("if (");
                appendNode(sb, node.node("condition"), depth);
                sb.append(") ");
                appendStatement(sb, node.node("then"), depth);
                if (node.node("else") != null) {
                    sb.append(" else ");
                    appendStatement(sb, node.node("else"), depth);
                }
                break;
            case WHILE:
                sb.append("while (");
                appendNode(sb, node.node("condition"), depth);
                sb.append(") ");
                appendStatement(sb, node.node("body"), depth);
                break;
            case BLOCK:
                appendBlock(sb, node.nodes("statements"), depth);
                break;
            case PARAMETER:
                sb.append(node.string("type")).append(' ').append(node.string("name"));
                break;
            case METHOD:
                sb.append(node.string("returnType")).append(' ').append(node.string("name")).append('(');
                appendList(sb, node.nodes("parameters"), depth);
                sb.append(") ");
                appendStatement(sb, node.node("body"), depth);
                break;
            case OPAQUE:
                sb.append(node.string("source"));
                break;
            default:
                throw new IllegalArgumentException("Cannot print node type " + node.type());
        }
    }

    private void appendBlock(StringBuilder sb, List<Node> statements, int depth) {
        if (statements.isEmpty()) {
            sb.append("{}");
            return;
        }
        sb.append("{\n");
        for (Node statement : statements) {
            sb.append(INDENT.repeat(depth + 1));
            appendStatement(sb, statement, depth + 1);
            sb.append('\n');
        }
        sb.append(INDENT.repeat(depth)).append('}');
    }

    private void appendList(StringBuilder sb, List<Node> nodes, int depth) {
        for (int i = 0; i < nodes.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            appendNode(sb, nodes.get(i), depth);
        }
    }

    private void appendReceiver(StringBuilder sb, Node receiver, int depth) {
        if (receiver != null) {
            appendOperand(sb, receiver, depth);
            sb.append('.');
        }
    }

    private void appendOperand(StringBuilder sb, Node operand, int depth) {
        boolean group = operand.type() == NodeType.BINARY || operand.type() == NodeType.ASSIGNMENT;
        if (group) {
            sb.append('(');
        }
        appendNode(sb, operand, depth);
        if (group) {
            sb.append(')');
        }
    }

    private static void appendInteger(StringBuilder sb, long value) {
        sb.append(value);
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            sb.append('L');
        }
    }

    private static void appendString(StringBuilder sb, String value) {
        sb.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"':
                    sb.append("\\\"");
                    break;
                case '\\':
                    sb.append("\\\\");
                    break;
                case '\n':
                    sb.append("\\n");
                    break;
                case '\r':
                    sb.append("\\r");
                    break;
                case '\t':
                    sb.append("\\t");
                    break;
                default:
                    sb.append(c);
            }
        }
        sb.append('"');
    }
}
