package io.github.eutro.ssabuilder.ext;

import io.github.eutro.ssabuilder.ssa.Block;
import io.github.eutro.ssabuilder.ssa.Function;

/**
 * Exts shared across the IR. All of these are stored in fields
 * of the classes they are attached to.
 */
public class CommonExts {
    /**
     * The {@link MetadataState} of a {@link Function}.
     */
    public static final Ext<MetadataState> METADATA_STATE = Ext.create(MetadataState.class, "METADATA_STATE");

    /**
     * The function a block was created in.
     */
    public static final Ext<Function> OWNING_FUNCTION = Ext.create(Function.class, "OWNING_FUNCTION");

    /**
     * The block a phi merges values for. Read-only.
     */
    public static final Ext<Block> OWNING_BLOCK = Ext.create(Block.class, "OWNING_BLOCK");
}
