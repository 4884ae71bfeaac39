package io.github.eutro.ssabuilder.test;

import io.github.eutro.ssabuilder.ext.*;
import io.github.eutro.ssabuilder.ssa.Block;
import io.github.eutro.ssabuilder.ssa.Function;
import io.github.eutro.ssabuilder.ssa.Operation;
import io.github.eutro.ssabuilder.ssa.Phi;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class ExtTest {
    private static final Ext<String> COMMENT = Ext.create(String.class, "COMMENT");

    @Test
    void testAttachRemove() {
        Operation op = new Operation("const");
        assertNull(op.getNullable(COMMENT));
        assertEquals(Optional.empty(), COMMENT.getIn(op));
        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> op.getExtOrThrow(COMMENT));
        assertTrue(ex.getMessage().contains("COMMENT"));

        op.attachExt(COMMENT, "hello");
        assertEquals("hello", op.getExtOrThrow(COMMENT));
        assertEquals(Optional.of("hello"), op.getExt(COMMENT));
        op.attachExt(COMMENT, "bye");
        assertEquals("bye", op.getNullable(COMMENT));

        op.removeExt(COMMENT);
        assertNull(op.getNullable(COMMENT));
        op.removeExt(COMMENT);
    }

    @Test
    void testOwningFunction() {
        Function func = new Function();
        Block block = func.newBlock();
        assertSame(func, block.getExtOrThrow(CommonExts.OWNING_FUNCTION));
        func.blocks.clear();
        assertNull(block.getNullable(CommonExts.OWNING_FUNCTION));
        func.blocks.add(block);
        assertSame(func, block.getNullable(CommonExts.OWNING_FUNCTION));
        assertSame(block, func.getEntry());
    }

    @Test
    void testOwningBlock() {
        Function func = new Function();
        Block block = func.newBlock();
        Phi phi = new Phi(block);
        assertSame(block, phi.getExtOrThrow(CommonExts.OWNING_BLOCK));
        assertThrows(UnsupportedOperationException.class, () -> phi.attachExt(CommonExts.OWNING_BLOCK, block));
        assertThrows(UnsupportedOperationException.class, () -> phi.removeExt(CommonExts.OWNING_BLOCK));
        phi.attachExt(COMMENT, "loop counter");
        assertEquals("loop counter", phi.getNullable(COMMENT));
        assertNull(new Operation("const").getNullable(CommonExts.OWNING_BLOCK));
    }

    @Test
    void testMetadataState() {
        Function func = new Function();
        assertThrows(IllegalStateException.class, func::getEntry);
        MetadataState ms = func.getExtOrThrow(CommonExts.METADATA_STATE);
        ms.validate(MetadataState.SSA_FORM, MetadataState.VERIFIED);
        assertTrue(ms.isValid(MetadataState.SSA_FORM));
        ms.invalidate(MetadataState.VERIFIED);
        assertFalse(ms.isValid(MetadataState.VERIFIED));
        assertTrue(ms.isValid(MetadataState.SSA_FORM));

        MetadataState fresh = new MetadataState();
        func.attachExt(CommonExts.METADATA_STATE, fresh);
        assertSame(fresh, func.getExtOrThrow(CommonExts.METADATA_STATE));
        assertThrows(UnsupportedOperationException.class, () -> func.removeExt(CommonExts.METADATA_STATE));

        Block entry = func.newBlock();
        Block next = func.newBlock();
        fresh.validate(MetadataState.SSA_FORM);
        next.addPredecessor(entry);
        assertFalse(fresh.isValid(MetadataState.SSA_FORM));
    }

    @Test
    void testTrackedList() {
        List<String> added = new ArrayList<>();
        List<String> removed = new ArrayList<>();
        List<String> list = new TrackedList<String>(new ArrayList<>()) {
            @Override
            protected void onAdded(String elt) {
                added.add(elt);
            }

            @Override
            protected void onRemoved(String elt) {
                removed.add(elt);
            }
        };
        list.addAll(Arrays.asList("a", "b", "c"));
        list.set(1, "d");
        list.remove("a");
        list.add(0, "e");
        list.clear();
        assertTrue(list.isEmpty());
        assertEquals(Arrays.asList("a", "b", "c", "d", "e"), added);
        assertEquals(Arrays.asList("b", "a", "e", "d", "c"), removed);
    }
}
