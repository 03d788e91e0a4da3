package mutant.analysis;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import mutant.ast.Node;
import mutant.ast.NodeType;
import mutant.ast.SourcePosition;
import mutant.logging.LoggingConfig;
import spoon.reflect.code.BinaryOperatorKind;
import spoon.reflect.code.CtAssignment;
import spoon.reflect.code.CtBinaryOperator;
import spoon.reflect.code.CtBlock;
import spoon.reflect.code.CtExpression;
import spoon.reflect.code.CtFieldAccess;
import spoon.reflect.code.CtIf;
import spoon.reflect.code.CtInvocation;
import spoon.reflect.code.CtLiteral;
import spoon.reflect.code.CtLocalVariable;
import spoon.reflect.code.CtNewArray;
import spoon.reflect.code.CtOperatorAssignment;
import spoon.reflect.code.CtReturn;
import spoon.reflect.code.CtStatement;
import spoon.reflect.code.CtSuperAccess;
import spoon.reflect.code.CtUnaryOperator;
import spoon.reflect.code.CtVariableAccess;
import spoon.reflect.code.CtWhile;
import spoon.reflect.code.UnaryOperatorKind;
import spoon.reflect.declaration.CtElement;
import spoon.reflect.declaration.CtMethod;
import spoon.reflect.declaration.CtParameter;
import spoon.reflect.reference.CtArrayTypeReference;
import spoon.reflect.reference.CtTypeReference;

/*
 * Converts Spoon elements into engine nodes. Constructs outside the supported
 * subset become OPAQUE nodes carrying their printed source.
 */
public class SpoonNodeReader {
    private static final Logger LOGGER = LoggingConfig.getLogger(SpoonNodeReader.class);

    private static final Map<BinaryOperatorKind, String> OPERATORS = new EnumMap<>(BinaryOperatorKind.class);

    static {
        OPERATORS.put(BinaryOperatorKind.OR, "||");
        OPERATORS.put(BinaryOperatorKind.AND, "&&");
        OPERATORS.put(BinaryOperatorKind.BITOR, "|");
        OPERATORS.put(BinaryOperatorKind.BITXOR, "^");
        OPERATORS.put(BinaryOperatorKind.BITAND, "&");
        OPERATORS.put(BinaryOperatorKind.EQ, "==");
        OPERATORS.put(BinaryOperatorKind.NE, "!=");
        OPERATORS.put(BinaryOperatorKind.LT, "<");
        OPERATORS.put(BinaryOperatorKind.GT, ">");
        OPERATORS.put(BinaryOperatorKind.LE, "<=");
        OPERATORS.put(BinaryOperatorKind.GE, ">=");
        OPERATORS.put(BinaryOperatorKind.SL, "<<");
        OPERATORS.put(BinaryOperatorKind.SR, ">>");
        OPERATORS.put(BinaryOperatorKind.USR, ">>>");
        OPERATORS.put(BinaryOperatorKind.PLUS, "+");
        OPERATORS.put(BinaryOperatorKind.MINUS, "-");
        OPERATORS.put(BinaryOperatorKind.MUL, "*");
        OPERATORS.put(BinaryOperatorKind.DIV, "/");
        OPERATORS.put(BinaryOperatorKind.MOD, "%");
    }

    /**
     * Reads a method with a body.
     *
     * @throws IllegalArgumentException for abstract or native methods
     */
    public Node readMethod(CtMethod<?> method) {
        if (method.getBody() == null) {
            throw new IllegalArgumentException("Method " + method.getSimpleName() + " has no body");
        }
        List<Node> parameters = new ArrayList<>();
        for (CtParameter<?> parameter : method.getParameters()) {
            parameters.add(Node.of(NodeType.PARAMETER, positionOf(parameter),
                    typeName(parameter.getType()), parameter.getSimpleName()));
        }
        return Node.of(NodeType.METHOD, positionOf(method),
                typeName(method.getType()),
                method.getSimpleName(),
                parameters,
                read(method.getBody()));
    }

    /**
     * Reads a statement or expression. Returns {@code null} for {@code null}.
     */
    public Node read(CtElement element) {
        if (element == null) {
            return null;
        }
        if (element instanceof CtMethod<?> method) {
            return readMethod(method);
        }
        if (element instanceof CtExpression<?> expression && !expression.getTypeCasts().isEmpty()) {
            return opaque(element);
        }
        SourcePosition position = positionOf(element);

        if (element instanceof CtBlock<?> block) {
            return Node.of(NodeType.BLOCK, position, readAll(block.getStatements()));
        } else if (element instanceof CtIf ctIf) {
            return Node.of(NodeType.IF, position,
                    read(ctIf.getCondition()),
                    readBranch(ctIf.getThenStatement(), position),
                    read(ctIf.getElseStatement()));
        } else if (element instanceof CtWhile ctWhile) {
            return Node.of(NodeType.WHILE, position,
                    read(ctWhile.getLoopingExpression()),
                    readBranch(ctWhile.getBody(), position));
        } else if (element instanceof CtReturn<?> ctReturn) {
            return Node.of(NodeType.RETURN, position, read(ctReturn.getReturnedExpression()));
        } else if (element instanceof CtLocalVariable<?> ctVar) {
            return Node.of(NodeType.LOCAL_VARIABLE, position,
                    typeName(ctVar.getType()),
                    ctVar.getSimpleName(),
                    read(ctVar.getDefaultExpression()));
        } else if (element instanceof CtOperatorAssignment<?, ?>) {
            return opaque(element);
        } else if (element instanceof CtAssignment<?, ?> ctAssignment) {
            return Node.of(NodeType.ASSIGNMENT, position,
                    read(ctAssignment.getAssigned()),
                    read(ctAssignment.getAssignment()));
        } else if (element instanceof CtInvocation<?> ctInvocation) {
            return readInvocation(ctInvocation, position);
        } else if (element instanceof CtUnaryOperator<?> ctUnary) {
            if (ctUnary.getKind() != UnaryOperatorKind.NOT) {
                return opaque(element);
            }
            return Node.of(NodeType.NOT, position, read(ctUnary.getOperand()));
        } else if (element instanceof CtBinaryOperator<?> ctOp) {
            String operator = OPERATORS.get(ctOp.getKind());
            if (operator == null) {
                return opaque(element);
            }
            return Node.of(NodeType.BINARY, position,
                    operator,
                    read(ctOp.getLeftHandOperand()),
                    read(ctOp.getRightHandOperand()));
        } else if (element instanceof CtLiteral<?> ctLiteral) {
            return readLiteral(ctLiteral, position);
        } else if (element instanceof CtNewArray<?> ctNewArray) {
            return readNewArray(ctNewArray, position);
        } else if (element instanceof CtSuperAccess<?>) {
            return opaque(element);
        } else if (element instanceof CtFieldAccess<?> ctField) {
            if (ctField.getTarget() != null && !ctField.getTarget().isImplicit()) {
                return opaque(element);
            }
            return Node.of(NodeType.VARIABLE, position, ctField.getVariable().getSimpleName());
        } else if (element instanceof CtVariableAccess<?> ctAccess) {
            if (ctAccess.getVariable() == null || ctAccess.getVariable().getSimpleName().isEmpty()) {
                return opaque(element);
            }
            return Node.of(NodeType.VARIABLE, position, ctAccess.getVariable().getSimpleName());
        }
        return opaque(element);
    }

    private List<Node> readAll(List<? extends CtElement> elements) {
        List<Node> nodes = new ArrayList<>(elements.size());
        for (CtElement element : elements) {
            nodes.add(read(element));
        }
        return nodes;
    }

    // "if (c);" has no then statement
    private Node readBranch(CtStatement statement, SourcePosition fallback) {
        Node branch = read(statement);
        return branch != null ? branch : Node.of(NodeType.BLOCK, fallback, List.of());
    }

    private Node readInvocation(CtInvocation<?> invocation, SourcePosition position) {
        String name = invocation.getExecutable().getSimpleName();
        if (name.startsWith("<")) {
            // this(...) and super(...)
            return opaque(invocation);
        }
        CtExpression<?> target = invocation.getTarget();
        if (target instanceof CtSuperAccess<?>) {
            // super.m() has no receiver that can stand alone
            return opaque(invocation);
        }
        Node receiver = (target == null || target.isImplicit()) ? null : read(target);
        if (invocation.getArguments().isEmpty()) {
            return Node.of(NodeType.CALL, position, receiver, name);
        }
        return Node.of(NodeType.CALL_WITH_ARGUMENTS, position, receiver, name, readAll(invocation.getArguments()));
    }

    private Node readLiteral(CtLiteral<?> literal, SourcePosition position) {
        Object value = literal.getValue();
        if (value == null) {
            return Node.of(NodeType.NULL_LITERAL, position);
        } else if (value instanceof Boolean bool) {
            return Node.of(NodeType.BOOLEAN_LITERAL, position, bool);
        } else if (value instanceof Integer || value instanceof Long
                || value instanceof Short || value instanceof Byte) {
            return Node.of(NodeType.INTEGER_LITERAL, position, ((Number) value).longValue());
        } else if (value instanceof String string) {
            return Node.of(NodeType.STRING_LITERAL, position, string);
        }
        return opaque(literal);
    }

    private Node readNewArray(CtNewArray<?> newArray, SourcePosition position) {
        if (!newArray.getDimensionExpressions().isEmpty()
                || !(newArray.getType() instanceof CtArrayTypeReference<?> arrayType)) {
            return opaque(newArray);
        }
        return Node.of(NodeType.ARRAY_LITERAL, position,
                typeName(arrayType.getComponentType()),
                readAll(newArray.getElements()));
    }

    private Node opaque(CtElement element) {
        LOGGER.finer(() -> "Carrying unsupported " + element.getClass().getSimpleName() + " verbatim");
        return Node.of(NodeType.OPAQUE, positionOf(element), element.toString());
    }

    private static String typeName(CtTypeReference<?> type) {
        return type == null ? "void" : type.getSimpleName();
    }

    static SourcePosition positionOf(CtElement element) {
        spoon.reflect.cu.SourcePosition position = element.getPosition();
        if (position == null || !position.isValidPosition()) {
            return SourcePosition.UNKNOWN;
        }
        return new SourcePosition(position.getLine(), position.getColumn());
    }
}
