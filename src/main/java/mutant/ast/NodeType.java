package mutant.ast;

import java.util.Arrays;
import java.util.List;

/**
 * Node kinds understood by the mutation engine, each with its ordered slot schema.
 * A type declares at most one {@link Slot.Kind#NODE_LIST} slot.
 */
public enum NodeType {
    NULL_LITERAL,
    BOOLEAN_LITERAL(Slot.scalar("value")),
    INTEGER_LITERAL(Slot.scalar("value")),
    STRING_LITERAL(Slot.scalar("value")),
    ARRAY_LITERAL(Slot.scalar("elementType"), Slot.list("elements")),
    VARIABLE(Slot.scalar("name")),
    NOT(Slot.node("operand")),
    BINARY(Slot.scalar("operator"), Slot.node("left"), Slot.node("right")),
    CALL(Slot.optional("receiver"), Slot.scalar("name")),
    CALL_WITH_ARGUMENTS(Slot.optional("receiver"), Slot.scalar("name"), Slot.list("arguments")),
    ASSIGNMENT(Slot.node("target"), Slot.node("value")),
    LOCAL_VARIABLE(Slot.scalar("type"), Slot.scalar("name"), Slot.optional("value")),
    RETURN(Slot.optional("value")),
    IF(Slot.node("condition"), Slot.node("then"), Slot.optional("else")),
    WHILE(Slot.node("condition"), Slot.node("body")),
    BLOCK(Slot.list("statements")),
    PARAMETER(Slot.scalar("type"), Slot.scalar("name")),
    METHOD(Slot.scalar("returnType"), Slot.scalar("name"), Slot.list("parameters"), Slot.node("body")),
    OPAQUE(Slot.scalar("source"));

    public static final String BODY = "body";

    private final List<Slot> slots;
    private final int listSlot;

    NodeType(Slot... slots) {
        this.slots = List.of(slots);
        this.listSlot = findListSlot(slots);
    }

    private static int findListSlot(Slot[] slots) {
        int found = -1;
        for (int i = 0; i < slots.length; i++) {
            if (slots[i].kind() == Slot.Kind.NODE_LIST) {
                if (found != -1) {
                    throw new IllegalStateException("more than one list slot in " + Arrays.toString(slots));
                }
                found = i;
            }
        }
        return found;
    }

    public List<Slot> slots() {
        return slots;
    }

    public int arity() {
        return slots.size();
    }

    /** Index of the named slot, or -1. */
    public int indexOf(String slotName) {
        for (int i = 0; i < slots.size(); i++) {
            if (slots.get(i).name().equals(slotName)) {
                return i;
            }
        }
        return -1;
    }

    public boolean hasSlot(String slotName) {
        return indexOf(slotName) != -1;
    }

    /** Index of the list slot, or -1 when the type has none. */
    public int listSlotIndex() {
        return listSlot;
    }
}
