package io.github.eutro.ssabuilder.ssa;

import io.github.eutro.ssabuilder.ext.TrackedList;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.ListIterator;
import java.util.Objects;

/**
 * A named computation over an ordered list of operands.
 * <p>
 * The operand list keeps the {@link Phi#getUsers() users} of any phi operands
 * up to date, whichever way it is mutated.
 */
public class Operation extends Value implements User {
    public final String name;

    private final List<Value> operands = new TrackedList<Value>(new ArrayList<>()) {
        @Override
        protected void onAdded(Value elt) {
            Objects.requireNonNull(elt, "operand");
            if (elt.isPhi()) {
                ((Phi) elt).addUser(Operation.this);
            }
        }

        @Override
        protected void onRemoved(Value elt) {
            if (elt.isPhi() && !uses(elt)) {
                ((Phi) elt).removeUser(Operation.this);
            }
        }
    };

    public Operation(String name, List<Value> operands) {
        this.name = Objects.requireNonNull(name, "name");
        this.operands.addAll(operands);
    }

    public Operation(String name, Value... operands) {
        this(name, Arrays.asList(operands));
    }

    @Override
    public Kind kind() {
        return Kind.OPERATION;
    }

    /**
     * Get the operands of this operation. The list is live and may be mutated.
     *
     * @return The operands.
     */
    public List<Value> getOperands() {
        return operands;
    }

    public void appendOperand(Value operand) {
        operands.add(operand);
    }

    @Override
    public boolean uses(Value value) {
        for (Value operand : operands) {
            if (operand == value) return true;
        }
        return false;
    }

    @Override
    public void replaceUses(Value value, Value replacement) {
        ListIterator<Value> it = operands.listIterator();
        while (it.hasNext()) {
            if (it.next() == value) {
                it.set(replacement);
            }
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(toRefString()).append(" = ").append(name);
        for (Value operand : operands) {
            sb.append(' ').append(operand.toRefString());
        }
        return sb.toString();
    }
}
