package io.github.eutro.ssabuilder.ssa;

import io.github.eutro.ssabuilder.ext.CommonExts;
import io.github.eutro.ssabuilder.ext.MetadataState;
import io.github.eutro.ssabuilder.passes.meta.VerifySSA;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A session of SSA construction over one {@link Function}.
 * <p>
 * The front end creates blocks, adds predecessor edges, writes and reads variables in
 * whatever order it lowers the source, and {@link #sealBlock(Block) seals} each block
 * once all of its predecessors are known. Reads return values directly in SSA form;
 * phis are only created where values actually merge.
 * <p>
 * Once every block is sealed, {@link #finish()} ends the session.
 * A session is not thread-safe, and its function should not be touched by anything else
 * until it is finished.
 */
public class SSABuilder {
    private static final Logger LOGGER = LogManager.getLogger();

    public static boolean VERIFY_ON_FINISH = System.getenv("SSABUILDER_VERIFY") != null;

    private final Function function;
    private final PendingPhis pendingPhis = new PendingPhis();
    private final DefUseResolver resolver = new DefUseResolver(pendingPhis);
    private boolean finished = false;

    /**
     * Start a session on an existing function.
     *
     * @param function The function.
     */
    public SSABuilder(Function function) {
        this.function = Objects.requireNonNull(function, "function");
        LOGGER.debug("started SSA construction with {} existing blocks", function.blocks.size());
    }

    /**
     * Start a session on a new, empty function.
     */
    public SSABuilder() {
        this(new Function());
    }

    public Function getFunction() {
        return function;
    }

    /**
     * Get the pending phi registry of this session. Read-only.
     *
     * @return The registry.
     */
    public PendingPhis getPendingPhis() {
        return pendingPhis;
    }

    public boolean isFinished() {
        return finished;
    }

    /**
     * Create a new, unsealed block with no predecessors and no definitions.
     * The first block created is the entry.
     *
     * @return The block.
     */
    public Block newBlock() {
        checkOpen();
        return function.newBlock();
    }

    /**
     * Add an edge from {@code pred} to {@code block}.
     *
     * @param block The block.
     * @param pred  The predecessor.
     * @throws IllegalStateException If {@code block} is sealed.
     */
    public void addPredecessor(Block block, Block pred) {
        checkOpen();
        checkOwned(block);
        checkOwned(pred);
        block.addPredecessor(pred);
    }

    /**
     * Define {@code variable} as {@code value} at the current end of {@code block}.
     *
     * @param variable The variable.
     * @param block    The block.
     * @param value    The value.
     */
    public void writeVariable(Variable variable, Block block, Value value) {
        checkOpen();
        checkOwned(block);
        Objects.requireNonNull(variable, "variable");
        Objects.requireNonNull(value, "value");
        if (value.isPhi() && ((Phi) value).isRemoved()) {
            throw new IllegalArgumentException("cannot define " + variable + " as removed phi " + value);
        }
        resolver.writeVariable(variable, block, value);
    }

    /**
     * Get the value of {@code variable} at the current end of {@code block}.
     * <p>
     * Repeated reads with no write in between return the same value.
     * A variable that no definition reaches reads as {@link Undef}.
     *
     * @param variable The variable.
     * @param block    The block.
     * @return The value.
     */
    public Value readVariable(Variable variable, Block block) {
        checkOpen();
        checkOwned(block);
        Objects.requireNonNull(variable, "variable");
        return resolver.readVariable(variable, block);
    }

    /**
     * Declare the predecessors of {@code block} final, and complete its pending phis.
     *
     * @param block The block.
     * @throws IllegalStateException If the block is already sealed.
     */
    public void sealBlock(Block block) {
        checkOpen();
        checkOwned(block);
        if (block.isSealed()) {
            throw new IllegalStateException("block already sealed: " + block.toTargetString());
        }
        int flushed = 0;
        // completing one phi may read, and so add, another
        Map.Entry<Variable, Phi> entry;
        while ((entry = pendingPhis.poll(block)) != null) {
            resolver.addPhiOperands(entry.getKey(), entry.getValue());
            flushed++;
        }
        block.markSealed();
        pendingPhis.drop(block);
        if (block.getPredecessors().isEmpty() && block != function.getEntry()) {
            LOGGER.warn("sealed {} with no predecessors, treating it as dead code", block.toTargetString());
        }
        LOGGER.debug("sealed {}, completed {} pending phis", block.toTargetString(), flushed);
    }

    /**
     * End the session.
     *
     * @return The function, now in SSA form.
     * @throws IllegalStateException If any block is unsealed.
     */
    public Function finish() {
        checkOpen();
        List<Block> unsealed = new ArrayList<>();
        for (Block block : function.blocks) {
            if (!block.isSealed()) {
                unsealed.add(block);
            }
        }
        if (!unsealed.isEmpty()) {
            LOGGER.debug("{} blocks unsealed at finish", unsealed.size());
            throw unsealedError(unsealed);
        }
        finished = true;
        pendingPhis.clear();
        function.getExtOrThrow(CommonExts.METADATA_STATE).validate(MetadataState.SSA_FORM);
        if (VERIFY_ON_FINISH) {
            VerifySSA.INSTANCE.run(function);
        }
        LOGGER.debug("finished SSA construction of {} blocks", function.blocks.size());
        return function;
    }

    private IllegalStateException unsealedError(List<Block> unsealed) {
        StringBuilder sb = new StringBuilder("blocks left unsealed");
        for (Block block : unsealed) {
            sb.append("\n  block: ").append(block.toTargetString());
            Map<Variable, Phi> pending = pendingPhis.get(block);
            if (!pending.isEmpty()) {
                sb.append(" pending: ").append(pending.keySet());
            }
        }
        IllegalStateException ex = new IllegalStateException(sb.toString());
        for (Block block : unsealed) {
            for (Phi phi : pendingPhis.get(block).values()) {
                if (phi.created != null) {
                    ex.addSuppressed(phi.created);
                }
            }
        }
        return ex;
    }

    private void checkOpen() {
        if (finished) {
            throw new IllegalStateException("SSA construction already finished");
        }
    }

    private void checkOwned(Block block) {
        Objects.requireNonNull(block, "block");
        if (block.getNullable(CommonExts.OWNING_FUNCTION) != function) {
            throw new IllegalStateException(String.format(
                    "block not in function being built\n  block: %s",
                    block.toTargetString()));
        }
    }
}
