package io.github.eutro.ssabuilder.ssa;

import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * The phis created for variables read in a block before all its predecessors were known.
 * <p>
 * Only unsealed blocks ever have entries. One registry belongs to one {@link SSABuilder}.
 */
public final class PendingPhis {
    private final Map<Block, Map<Variable, Phi>> table = new LinkedHashMap<>();

    PendingPhis() {
    }

    void add(Block block, Variable variable, Phi phi) {
        if (block.isSealed()) {
            throw new IllegalStateException(String.format(
                    "pending phi registered for sealed block\n  variable: %s\n  in block: %s",
                    variable,
                    block));
        }
        Phi existing = table.computeIfAbsent(block, $ -> new LinkedHashMap<>()).putIfAbsent(variable, phi);
        if (existing != null) {
            throw new IllegalStateException(String.format(
                    "variable already has a pending phi\n  variable: %s\n  phi: %s",
                    variable,
                    existing));
        }
    }

    /**
     * Remove and return the oldest pending entry of {@code block}.
     *
     * @param block The block.
     * @return The entry, or null if the block has none left.
     */
    @Nullable Map.Entry<Variable, Phi> poll(Block block) {
        Map<Variable, Phi> phis = table.get(block);
        if (phis == null || phis.isEmpty()) return null;
        Iterator<Map.Entry<Variable, Phi>> it = phis.entrySet().iterator();
        Map.Entry<Variable, Phi> entry = it.next();
        it.remove();
        return new AbstractMap.SimpleImmutableEntry<>(entry);
    }

    void drop(Block block) {
        Map<Variable, Phi> phis = table.remove(block);
        if (phis != null && !phis.isEmpty()) {
            throw new IllegalStateException("dropped block with pending phis: " + phis.keySet());
        }
    }

    /**
     * Get the pending phis of a block.
     *
     * @param block The block.
     * @return An unmodifiable view of the variables and their pending phis.
     */
    public Map<Variable, Phi> get(Block block) {
        Map<Variable, Phi> phis = table.get(block);
        return phis == null ? Collections.emptyMap() : Collections.unmodifiableMap(phis);
    }

    /**
     * @return The blocks that currently have at least one pending phi.
     */
    public Set<Block> blocks() {
        Set<Block> blocks = new LinkedHashSet<>();
        for (Map.Entry<Block, Map<Variable, Phi>> entry : table.entrySet()) {
            if (!entry.getValue().isEmpty()) {
                blocks.add(entry.getKey());
            }
        }
        return blocks;
    }

    public boolean isEmpty() {
        return blocks().isEmpty();
    }

    void clear() {
        table.clear();
    }
}
