package io.github.eutro.ssabuilder.passes.meta;

import io.github.eutro.ssabuilder.ext.CommonExts;
import io.github.eutro.ssabuilder.ext.MetadataState;
import io.github.eutro.ssabuilder.passes.InPlaceIRPass;
import io.github.eutro.ssabuilder.ssa.*;

import java.util.*;

/**
 * Checks the structural invariants of a function built by an {@link SSABuilder}:
 * block ownership, phi completeness, that nothing refers to a removed phi,
 * and that phi users agree with the operands and definitions that actually refer to them.
 * <p>
 * May be run on a function that is still being built; completeness is only checked for sealed blocks.
 */
public class VerifySSA implements InPlaceIRPass<Function> {
    /**
     * A singleton instance of this pass.
     */
    public static final VerifySSA INSTANCE = new VerifySSA();

    @Override
    public void runInPlace(Function function) {
        Set<Block> blockSet = Collections.newSetFromMap(new IdentityHashMap<>());
        blockSet.addAll(function.blocks);
        if (blockSet.size() != function.blocks.size()) {
            throw new IllegalStateException("function contains duplicate blocks");
        }

        for (Block block : function.blocks) {
            if (block.getNullable(CommonExts.OWNING_FUNCTION) != function) {
                throw new IllegalStateException(String.format(
                        "block not owned by function\n  block: %s",
                        block));
            }
            for (Block pred : block.getPredecessors()) {
                if (!blockSet.contains(pred)) {
                    throwInvalidReference(block, pred);
                }
            }

            for (Phi phi : block.getPhis()) {
                if (phi.getBlock() != block) {
                    throw new IllegalStateException(String.format(
                            "phi not owned by block\n  phi: %s\n  in block: %s",
                            phi,
                            block));
                }
                if (phi.isRemoved()) {
                    throw new IllegalStateException(String.format(
                            "removed phi still listed\n  phi: %s\n  in block: %s",
                            phi,
                            block));
                }
                if (block.isSealed() && phi.getOperands().size() != block.getPredecessors().size()) {
                    throw new IllegalStateException(String.format(
                            "phi has %d operands for %d predecessors\n  phi: %s\n  in block: %s",
                            phi.getOperands().size(),
                            block.getPredecessors().size(),
                            phi,
                            block));
                }
                checkOperands(block, phi);
                checkUsers(block, phi);
            }

            for (Map.Entry<Variable, Value> entry : block.getDefinitions().entrySet()) {
                Value value = entry.getValue();
                if (!value.isPhi()) continue;
                Phi phi = (Phi) value;
                checkLive(block, phi, entry.getKey());
                if (!phi.getUsers().contains(block)) {
                    throw new IllegalStateException(String.format(
                            "definition of %s not recorded as a use\n  phi: %s\n  in block: %s",
                            entry.getKey(),
                            phi,
                            block));
                }
            }
        }

        function.getExtOrThrow(CommonExts.METADATA_STATE).validate(MetadataState.VERIFIED);
    }

    private void checkOperands(Block block, Operation op) {
        for (Value operand : op.getOperands()) {
            if (!operand.isPhi()) continue;
            Phi phi = (Phi) operand;
            checkLive(block, phi, op);
            if (!phi.getUsers().contains(op)) {
                throw new IllegalStateException(String.format(
                        "operand does not record its user\n  operand: %s\n  user: %s\n  in block: %s",
                        phi,
                        op,
                        block));
            }
        }
    }

    private void checkUsers(Block block, Phi phi) {
        for (User user : phi.getUsers()) {
            if (!user.uses(phi)) {
                throw new IllegalStateException(String.format(
                        "recorded user does not use phi\n  phi: %s\n  user: %s\n  in block: %s",
                        phi,
                        user,
                        block));
            }
            if (user instanceof Operation && !(user instanceof Phi)) {
                checkOperands(block, (Operation) user);
            }
        }
    }

    private void checkLive(Block block, Phi phi, Object referrer) {
        if (phi.isRemoved()) {
            throw new IllegalStateException(String.format(
                    "reference to removed phi\n  phi: %s\n  from: %s\n  in block: %s",
                    phi,
                    referrer,
                    block));
        }
    }

    private void throwInvalidReference(Block block, Block referenced) {
        throw new IllegalStateException(String.format(
                "block has predecessor not in function" +
                        "\n  predecessor: %s" +
                        "\n  in block: %s",
                referenced.toTargetString(),
                block));
    }
}
