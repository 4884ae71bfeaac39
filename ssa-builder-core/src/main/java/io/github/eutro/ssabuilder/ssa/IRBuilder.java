package io.github.eutro.ssabuilder.ssa;

import java.util.List;

/**
 * An instruction builder for front ends, which encapsulates a position in the function
 * being built. Variable reads and writes go through the underlying {@link SSABuilder}.
 */
public class IRBuilder {
    /**
     * The construction session.
     */
    public final SSABuilder ssa;
    private Block bb;

    /**
     * Construct an instruction builder positioned at a specific block.
     *
     * @param ssa The construction session.
     * @param bb  One of the session's blocks.
     */
    public IRBuilder(SSABuilder ssa, Block bb) {
        this.ssa = ssa;
        this.bb = bb;
    }

    /**
     * Construct an instruction builder positioned at a new entry block.
     *
     * @param ssa The construction session, with no blocks yet.
     */
    public IRBuilder(SSABuilder ssa) {
        this(ssa, ssa.newBlock());
    }

    public Block getBlock() {
        return bb;
    }

    public void setBlock(Block bb) {
        this.bb = bb;
    }

    public Block newBlock() {
        return ssa.newBlock();
    }

    /**
     * Create an operation. It is not placed anywhere; only its operands matter to SSA construction.
     *
     * @param name     The name of the operation.
     * @param operands The operands.
     * @return The operation.
     */
    public Operation op(String name, Value... operands) {
        return new Operation(name, operands);
    }

    public Operation op(String name, List<Value> operands) {
        return new Operation(name, operands);
    }

    /**
     * Assign a value to a variable in the current block.
     *
     * @param var   The variable.
     * @param value The value.
     * @return The same value.
     */
    public Value assign(Variable var, Value value) {
        ssa.writeVariable(var, bb, value);
        return value;
    }

    public Value assign(String name, Value value) {
        return assign(new Variable(name), value);
    }

    /**
     * Read a variable in the current block.
     *
     * @param var The variable.
     * @return Its current value.
     */
    public Value use(Variable var) {
        return ssa.readVariable(var, bb);
    }

    public Value use(String name) {
        return use(new Variable(name));
    }

    /**
     * Add an edge from the current block to {@code target}.
     *
     * @param target The jump target.
     */
    public void jump(Block target) {
        ssa.addPredecessor(target, bb);
    }

    /**
     * Add an edge from the current block to each target, in order.
     *
     * @param targets The jump targets.
     */
    public void branch(Block... targets) {
        for (Block target : targets) {
            jump(target);
        }
    }

    /**
     * Seal the current block.
     */
    public void seal() {
        ssa.sealBlock(bb);
    }

    public void seal(Block block) {
        ssa.sealBlock(block);
    }
}
