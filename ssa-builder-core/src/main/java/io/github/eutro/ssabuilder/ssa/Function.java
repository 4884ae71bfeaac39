package io.github.eutro.ssabuilder.ssa;

import io.github.eutro.ssabuilder.ext.*;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A control flow graph under construction: a list of blocks, the first of which is the entry.
 */
public final class Function extends ExtHolder {
    public final List<Block> blocks = new TrackedList<Block>(new ArrayList<>()) {
        @Override
        protected void onAdded(Block elt) {
            elt.attachExt(CommonExts.OWNING_FUNCTION, Function.this);
        }

        @Override
        protected void onRemoved(Block elt) {
            elt.removeExt(CommonExts.OWNING_FUNCTION);
        }
    }; // [0] is entry

    public Block newBlock() {
        Block block = new Block();
        blocks.add(block);
        metaState.graphChanged();
        return block;
    }

    /**
     * @return The entry block.
     * @throws IllegalStateException If no block has been created yet.
     */
    public Block getEntry() {
        if (blocks.isEmpty()) {
            throw new IllegalStateException("function has no blocks");
        }
        return blocks.get(0);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("fn() {\n");
        for (Block block : blocks) {
            sb.append(block).append('\n');
        }
        sb.append("}");
        return sb.toString();
    }

    // exts
    private MetadataState metaState = new MetadataState();

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.METADATA_STATE) {
            metaState = Objects.requireNonNull((MetadataState) value);
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.METADATA_STATE) {
            throw new UnsupportedOperationException("functions always have a metadata state");
        }
        super.removeExt(ext);
    }

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.METADATA_STATE) {
            return (T) metaState;
        }
        return super.getNullable(ext);
    }
}
