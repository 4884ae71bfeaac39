package io.github.eutro.ssabuilder.test;

import io.github.eutro.ssabuilder.ssa.*;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

public class ValueTest {
    private static final Variable X = new Variable("x");

    @Test
    void testKinds() {
        Function func = new Function();
        Block block = func.newBlock();
        assertEquals(Value.Kind.UNDEF, new Undef().kind());
        assertEquals(Value.Kind.OPERATION, new Operation("const").kind());
        Phi phi = new Phi(block);
        assertEquals(Value.Kind.PHI, phi.kind());
        assertTrue(phi.isPhi());
        assertFalse(new Operation("const").isPhi());
        assertNotEquals(new Undef(), new Undef());
    }

    @Test
    void testOperandUsers() {
        Function func = new Function();
        Block block = func.newBlock();
        Phi phi = new Phi(block);
        Value c = new Operation("const");
        Operation op = new Operation("add", phi, phi);
        assertEquals(Collections.singleton(op), phi.getUsers());

        op.getOperands().remove(0);
        assertTrue(phi.getUsers().contains(op), "still used by the second operand");
        op.getOperands().set(0, c);
        assertFalse(phi.getUsers().contains(op));

        op.appendOperand(phi);
        op.getOperands().clear();
        assertTrue(phi.getUsers().isEmpty());

        assertThrows(NullPointerException.class, () -> op.appendOperand(null));
        assertTrue(op.getOperands().isEmpty());
    }

    @Test
    void testReplaceBy() {
        SSABuilder ssa = new SSABuilder();
        Block block = ssa.newBlock();
        Phi phi = new Phi(block);
        Phi other = new Phi(block);
        ssa.writeVariable(X, block, phi);
        Value c = new Operation("const");
        Operation op = new Operation("use", phi, c);
        other.appendOperand(phi);
        phi.appendOperand(phi);
        assertEquals(Arrays.asList(phi, other), block.getPhis());

        Value v = new Operation("const");
        phi.replaceBy(v);

        assertTrue(phi.isRemoved());
        assertSame(v, phi.getReplacement());
        assertTrue(phi.getUsers().isEmpty());
        assertTrue(phi.getOperands().isEmpty());
        assertSame(v, block.getDefinition(X));
        assertEquals(Arrays.asList(v, c), op.getOperands());
        assertEquals(Collections.singletonList(v), other.getOperands());
        assertEquals(Collections.singletonList(other), block.getPhis());

        assertThrows(IllegalStateException.class, () -> op.appendOperand(phi));
        assertEquals(2, op.getOperands().size());
        assertThrows(IllegalStateException.class, () -> phi.replaceBy(c));
        assertThrows(IllegalArgumentException.class, () -> other.replaceBy(other));
    }

    @Test
    void testResolve() {
        Function func = new Function();
        Block block = func.newBlock();
        Phi first = new Phi(block);
        Phi second = new Phi(block);
        Value v = new Operation("const");
        first.replaceBy(second);
        assertSame(second, first.resolve());
        second.replaceBy(v);
        assertSame(v, first.resolve());
        assertSame(v, second.resolve());

        Phi live = new Phi(block);
        assertSame(live, live.resolve());
        assertNull(live.getReplacement());
    }

    @Test
    void testOperandByPredecessor() {
        Function func = new Function();
        Block entry = func.newBlock();
        Block left = func.newBlock();
        Block right = func.newBlock();
        Block merge = func.newBlock();
        merge.addPredecessor(left);
        merge.addPredecessor(right);

        Phi phi = new Phi(merge);
        assertThrows(IllegalStateException.class, () -> phi.getOperand(left));
        Value l = new Operation("const");
        Value r = new Operation("const");
        phi.appendOperand(l);
        phi.appendOperand(r);
        assertSame(l, phi.getOperand(left));
        assertSame(r, phi.getOperand(right));
        assertThrows(IllegalArgumentException.class, () -> phi.getOperand(entry));
    }

    @Test
    void testVariables() {
        assertEquals(new Variable("x"), new Variable("x"));
        assertNotEquals(new Variable("x"), new Variable("y"));
        assertEquals("$x", X.toString());
        assertThrows(NullPointerException.class, () -> new Variable(null));
    }
}
