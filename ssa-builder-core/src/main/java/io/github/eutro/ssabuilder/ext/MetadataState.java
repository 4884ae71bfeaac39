package io.github.eutro.ssabuilder.ext;

import java.util.BitSet;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Tracks which facts currently hold for a {@link io.github.eutro.ssabuilder.ssa.Function}.
 */
public class MetadataState {
    public static final class MetaKind {
        private static final AtomicInteger COUNTER = new AtomicInteger();
        public final int id = COUNTER.getAndIncrement();
        public final String name;

        private MetaKind(String name) {
            this.name = name;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /**
     * Every block is sealed and no phi is pending.
     */
    public static final MetaKind SSA_FORM = new MetaKind("SSA_FORM");
    /**
     * The function passed {@link io.github.eutro.ssabuilder.passes.meta.VerifySSA}.
     */
    public static final MetaKind VERIFIED = new MetaKind("VERIFIED");

    private final BitSet validSet = new BitSet();

    public boolean isValid(MetaKind kind) {
        return validSet.get(kind.id);
    }

    public void validate(MetaKind... kinds) {
        for (MetaKind kind : kinds) {
            validSet.set(kind.id, true);
        }
    }

    public void invalidate(MetaKind... kinds) {
        for (MetaKind kind : kinds) {
            validSet.set(kind.id, false);
        }
    }

    public void graphChanged() {
        invalidate(SSA_FORM, VERIFIED);
    }
}
