package io.github.eutro.ssabuilder.ssa;

import io.github.eutro.ssabuilder.ext.CommonExts;
import io.github.eutro.ssabuilder.ext.Ext;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * A phi, merging one value per predecessor of its {@link #getBlock() block}.
 * <p>
 * Operand {@code i} is the value flowing in from predecessor {@code i} of the block.
 * A phi knows all of its {@link #getUsers() users}, so that it can be
 * {@link #replaceBy(Value) replaced} in place while the graph is still being built.
 */
public final class Phi extends Operation {
    public static boolean TRACK_PHI_CREATIONS = System.getenv("SSABUILDER_TRACK_PHI_CREATIONS") != null;

    /**
     * Where this phi was constructed, if {@link #TRACK_PHI_CREATIONS} was set at the time.
     */
    public final @Nullable Throwable created = TRACK_PHI_CREATIONS ? new Throwable("phi constructed") : null;

    private final Block block;
    private final Set<User> users = new LinkedHashSet<>();
    private @Nullable Value replacement = null;

    /**
     * Construct an operandless phi, and add it to the phis of {@code block}.
     *
     * @param block The block the phi belongs to.
     */
    public Phi(Block block) {
        super("phi");
        this.block = Objects.requireNonNull(block, "block");
        block.addPhi(this);
    }

    @Override
    public Kind kind() {
        return Kind.PHI;
    }

    public Block getBlock() {
        return block;
    }

    /**
     * Get the users of this phi: every operation holding it as an operand,
     * and every block with a definition mapped to it.
     *
     * @return An unmodifiable view of the users.
     */
    public Set<User> getUsers() {
        return Collections.unmodifiableSet(users);
    }

    void addUser(User user) {
        if (replacement != null) {
            throw new IllegalStateException(String.format(
                    "use of removed phi\n  phi: %s\n  user: %s",
                    this,
                    user));
        }
        users.add(user);
    }

    void removeUser(User user) {
        users.remove(user);
    }

    /**
     * Get the operand flowing in from {@code pred}.
     *
     * @param pred A predecessor of this phi's block.
     * @return The operand for the first edge from {@code pred}.
     * @throws IllegalArgumentException If {@code pred} is not a predecessor.
     * @throws IllegalStateException    If the phi has not been completed yet.
     */
    public Value getOperand(Block pred) {
        int index = block.getPredecessors().indexOf(pred);
        if (index == -1) {
            throw new IllegalArgumentException(pred.toTargetString() + " is not a predecessor of " + block.toTargetString());
        }
        List<Value> operands = getOperands();
        if (index >= operands.size()) {
            throw new IllegalStateException("phi is not complete: " + this);
        }
        return operands.get(index);
    }

    /**
     * Replace every use of this phi with {@code value}, and remove the phi from its block.
     * <p>
     * The phi's operands are cleared, so it no longer uses anything either.
     *
     * @param value The replacement.
     */
    public void replaceBy(Value value) {
        Objects.requireNonNull(value, "value");
        if (value == this) {
            throw new IllegalArgumentException("phi cannot replace itself");
        }
        if (replacement != null) {
            throw new IllegalStateException("phi already replaced: " + this);
        }
        for (User user : new ArrayList<>(users)) {
            if (user != this) {
                user.replaceUses(this, value);
            }
        }
        users.clear();
        replacement = value;
        getOperands().clear();
        block.removePhi(this);
    }

    public boolean isRemoved() {
        return replacement != null;
    }

    public @Nullable Value getReplacement() {
        return replacement;
    }

    /**
     * Follow the chain of replacements from this phi to a live value.
     *
     * @return This phi if it is live, otherwise what it was ultimately replaced by.
     */
    public Value resolve() {
        Value value = this;
        while (value.isPhi() && ((Phi) value).replacement != null) {
            value = ((Phi) value).replacement;
        }
        return value;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(super.toString());
        sb.append(" @ ").append(block.toTargetString());
        if (replacement != null) {
            sb.append(" (replaced by ").append(replacement.toRefString()).append(')');
        }
        return sb.toString();
    }

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_BLOCK) {
            return (T) block;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_BLOCK) {
            throw new UnsupportedOperationException("the block of a phi cannot change");
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_BLOCK) {
            throw new UnsupportedOperationException("the block of a phi cannot change");
        }
        super.removeExt(ext);
    }
}
