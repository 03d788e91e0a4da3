package mutant.ast;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class NodeTypeTest {

    @Test
    void atMostOneListSlotPerType() {
        for (NodeType type : NodeType.values()) {
            long lists = type.slots().stream().filter(slot -> slot.kind() == Slot.Kind.NODE_LIST).count();
            assertTrue(lists <= 1, type + " declares " + lists + " list slots");
            assertEquals(lists == 1, type.listSlotIndex() != -1);
        }
    }

    @Test
    void bodySlotIsDeclaredByLoopsAndMethods() {
        assertTrue(NodeType.WHILE.hasSlot(NodeType.BODY));
        assertTrue(NodeType.METHOD.hasSlot(NodeType.BODY));
        assertFalse(NodeType.IF.hasSlot(NodeType.BODY));
        assertEquals(3, NodeType.METHOD.indexOf(NodeType.BODY));
        assertEquals(-1, NodeType.IF.indexOf(NodeType.BODY));
    }
}
