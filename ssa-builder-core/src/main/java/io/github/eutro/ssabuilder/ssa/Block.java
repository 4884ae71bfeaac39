package io.github.eutro.ssabuilder.ssa;

import io.github.eutro.ssabuilder.ext.CommonExts;
import io.github.eutro.ssabuilder.ext.Ext;
import io.github.eutro.ssabuilder.ext.ExtHolder;
import io.github.eutro.ssabuilder.ext.MetadataState;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * A vertex of the control flow graph.
 * <p>
 * A block holds the current definition of each variable written or read in it,
 * its predecessors in insertion order, and the live phis it owns.
 * Once {@link #isSealed() sealed}, its predecessors can no longer change.
 * <p>
 * Blocks are created by {@link Function#newBlock()}, and sealed by {@link SSABuilder#sealBlock(Block)}.
 */
public final class Block extends ExtHolder implements User {
    private final List<Block> preds = new ArrayList<>();
    private final Map<Variable, Value> defs = new LinkedHashMap<>();
    private final List<Phi> phis = new ArrayList<>();
    private boolean sealed = false;

    Block() {
    }

    public String toTargetString() {
        return String.format("@%08x", System.identityHashCode(this));
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(toTargetString());
        if (!sealed) sb.append(" (unsealed)");
        sb.append(" <-");
        for (Block pred : preds) {
            sb.append(' ').append(pred.toTargetString());
        }
        sb.append("\n{\n");
        for (Phi phi : phis) {
            sb.append(' ').append(phi).append('\n');
        }
        for (Map.Entry<Variable, Value> entry : defs.entrySet()) {
            sb.append(' ').append(entry.getKey()).append(" -> ").append(entry.getValue().toRefString()).append('\n');
        }
        sb.append("}");
        return sb.toString();
    }

    public List<Block> getPredecessors() {
        return Collections.unmodifiableList(preds);
    }

    /**
     * Add a predecessor edge. Edges may repeat, and each one gets its own phi operand.
     *
     * @param pred The predecessor.
     * @throws IllegalStateException If this block is already sealed.
     */
    public void addPredecessor(Block pred) {
        Objects.requireNonNull(pred, "pred");
        if (sealed) {
            throw new IllegalStateException(String.format(
                    "cannot add predecessor to sealed block\n  predecessor: %s\n  in block: %s",
                    pred.toTargetString(),
                    this));
        }
        preds.add(pred);
        if (owner != null) {
            owner.getExtOrThrow(CommonExts.METADATA_STATE).graphChanged();
        }
    }

    public boolean isSealed() {
        return sealed;
    }

    void markSealed() {
        sealed = true;
    }

    /**
     * Get the value currently defined for {@code variable} in this block.
     *
     * @param variable The variable.
     * @return The value, or null if the variable has not been written or resolved here.
     */
    public @Nullable Value getDefinition(Variable variable) {
        return defs.get(variable);
    }

    public Map<Variable, Value> getDefinitions() {
        return Collections.unmodifiableMap(defs);
    }

    void define(Variable variable, Value value) {
        Value old = defs.put(variable, value);
        if (old == value) return;
        if (old != null && old.isPhi() && !uses(old)) {
            ((Phi) old).removeUser(this);
        }
        if (value.isPhi()) {
            ((Phi) value).addUser(this);
        }
    }

    /**
     * Get the live phis of this block, in creation order.
     *
     * @return An unmodifiable view of the phis.
     */
    public List<Phi> getPhis() {
        return Collections.unmodifiableList(phis);
    }

    void addPhi(Phi phi) {
        phis.add(phi);
    }

    void removePhi(Phi phi) {
        phis.remove(phi);
    }

    @Override
    public boolean uses(Value value) {
        for (Value def : defs.values()) {
            if (def == value) return true;
        }
        return false;
    }

    @Override
    public void replaceUses(Value value, Value replacement) {
        boolean replaced = false;
        for (Map.Entry<Variable, Value> entry : defs.entrySet()) {
            if (entry.getValue() == value) {
                entry.setValue(replacement);
                replaced = true;
            }
        }
        if (!replaced) return;
        if (value.isPhi()) {
            ((Phi) value).removeUser(this);
        }
        if (replacement.isPhi()) {
            ((Phi) replacement).addUser(this);
        }
    }

    // exts
    private Function owner = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_FUNCTION) {
            return (T) owner;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_FUNCTION) {
            owner = (Function) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_FUNCTION) {
            owner = null;
            return;
        }
        super.removeExt(ext);
    }
}
