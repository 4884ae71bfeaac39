package io.github.eutro.ssabuilder.ssa;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;

/**
 * Resolves variable reads to values, inserting phis at merge points.
 * <p>
 * This is the on-the-fly construction of Braun et al., "Simple and Efficient Construction
 * of Static Single Assignment Form" (CC 2013): local value numbering within a block,
 * recursive lookup through predecessors otherwise, and removal of trivial phis as soon
 * as they are complete.
 */
final class DefUseResolver {
    private static final Logger LOGGER = LogManager.getLogger();

    private final PendingPhis pendingPhis;
    // phis whose operands are still being collected further up the stack
    private final Set<Phi> completing = Collections.newSetFromMap(new IdentityHashMap<>());

    DefUseResolver(PendingPhis pendingPhis) {
        this.pendingPhis = pendingPhis;
    }

    void writeVariable(Variable variable, Block block, Value value) {
        block.define(variable, value);
    }

    Value readVariable(Variable variable, Block block) {
        Value value = block.getDefinition(variable);
        if (value != null) {
            return value;
        }
        return readVariableRecursive(variable, block);
    }

    private Value readVariableRecursive(Variable variable, Block block) {
        Value value;
        List<Block> preds = block.getPredecessors();
        if (!block.isSealed()) {
            Phi phi = new Phi(block);
            pendingPhis.add(block, variable, phi);
            LOGGER.trace("pending {} for {} in {}", phi.toRefString(), variable, block.toTargetString());
            value = phi;
        } else if (preds.size() == 1) {
            value = readThroughChain(variable, block);
        } else {
            // the operandless phi breaks cycles back into this block
            Phi phi = new Phi(block);
            LOGGER.trace("created {} for {} in {}", phi.toRefString(), variable, block.toTargetString());
            writeVariable(variable, block, phi);
            value = addPhiOperands(variable, phi);
        }
        writeVariable(variable, block, value);
        return value;
    }

    /**
     * Look up {@code variable} through the chain of sealed single-predecessor blocks
     * above {@code block}, memoizing the result in every block of the chain but {@code block} itself.
     */
    private Value readThroughChain(Variable variable, Block block) {
        Set<Block> chain = Collections.newSetFromMap(new IdentityHashMap<>());
        chain.add(block);
        Block pred = block.getPredecessors().get(0);
        Value value;
        while (true) {
            Value def = pred.getDefinition(variable);
            if (def != null) {
                value = def;
                break;
            }
            if (!pred.isSealed() || pred.getPredecessors().size() != 1) {
                value = readVariableRecursive(variable, pred);
                break;
            }
            if (!chain.add(pred)) {
                // a cycle with no way in from the entry
                LOGGER.debug("{} read in unreachable cycle through {}", variable, pred.toTargetString());
                value = new Undef();
                break;
            }
            pred = pred.getPredecessors().get(0);
        }
        for (Block link : chain) {
            if (link != block) {
                writeVariable(variable, link, value);
            }
        }
        return value;
    }

    Value addPhiOperands(Variable variable, Phi phi) {
        completing.add(phi);
        try {
            for (Block pred : phi.getBlock().getPredecessors()) {
                phi.appendOperand(readVariable(variable, pred));
            }
        } finally {
            completing.remove(phi);
        }
        return tryRemoveTrivialPhi(phi);
    }

    Value tryRemoveTrivialPhi(Phi phi) {
        if (phi.isRemoved()) {
            return phi.resolve();
        }
        Value same = null;
        for (Value op : phi.getOperands()) {
            if (op == same || op == phi) {
                continue;
            }
            if (same != null) {
                return phi;
            }
            same = op;
        }
        if (same == null) {
            // unreachable, or in the entry block
            same = new Undef();
        }

        List<Phi> phiUsers = new ArrayList<>();
        for (User user : phi.getUsers()) {
            if (user != phi && user instanceof Phi) {
                phiUsers.add((Phi) user);
            }
        }
        LOGGER.trace("replacing trivial {} in {} with {}", phi.toRefString(), phi.getBlock().toTargetString(), same.toRefString());
        phi.replaceBy(same);

        for (Phi user : phiUsers) {
            if (user.isRemoved() || completing.contains(user)) {
                continue;
            }
            LOGGER.trace("rechecking {}", user.toRefString());
            tryRemoveTrivialPhi(user);
        }
        return same.isPhi() ? ((Phi) same).resolve() : same;
    }
}
