package mutant.mutators;

import static mutant.mutators.ScriptedMutator.none;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.EnumSet;
import java.util.Random;

import org.junit.jupiter.api.Test;

import mutant.ast.NodeType;

class MutatorRegistryTest {

    @Test
    void lookupReturnsTheRegisteredFactory() {
        MutatorFactory factory = none();
        MutatorRegistry registry = new MutatorRegistry().register(NodeType.IF, factory);

        assertSame(factory, registry.lookup(NodeType.IF));
        assertTrue(registry.isRegistered(NodeType.IF));
        assertFalse(registry.isRegistered(NodeType.WHILE));
    }

    @Test
    void lookupOfUnknownTypeFails() {
        MutatorRegistry registry = new MutatorRegistry().register(NodeType.IF, none());

        MutatorLookupException ex = assertThrows(MutatorLookupException.class,
                () -> registry.lookup(NodeType.WHILE));
        assertEquals(NodeType.WHILE, ex.nodeType());
    }

    @Test
    void registrationIsAppendOnly() {
        MutatorRegistry registry = new MutatorRegistry().register(NodeType.IF, none());

        assertThrows(IllegalStateException.class, () -> registry.register(NodeType.IF, none()));
    }

    @Test
    void sealedRegistryRejectsRegistration() {
        MutatorRegistry registry = new MutatorRegistry().register(NodeType.IF, none()).seal();

        assertTrue(registry.isSealed());
        assertThrows(IllegalStateException.class, () -> registry.register(NodeType.WHILE, none()));
        assertTrue(registry.isRegistered(NodeType.IF));
    }

    @Test
    void engineSealsItsRegistry() {
        MutatorRegistry registry = new MutatorRegistry().register(NodeType.IF, none());

        new MutationEngine(registry, new Random(0));

        assertTrue(registry.isSealed());
    }

    @Test
    void standardRegistryCoversEveryTypeButParameters() {
        MutatorRegistry registry = MutatorRegistry.standard();

        assertTrue(registry.isSealed());
        assertEquals(EnumSet.complementOf(EnumSet.of(NodeType.PARAMETER)), EnumSet.copyOf(registry.registeredTypes()));
    }
}
