package scriptdetect;

/**
 * Per-script character counts for one shard of a detection call.
 *
 * <p>Slots follow {@link ScriptPredicates#tableOrder()}. Instances are owned by a
 * single shard (or by the merge loop) and are not thread-safe.</p>
 */
final class ScriptCounts {
    /**
     * Returned by {@link #mergeFrom(ScriptCounts, int)} when no slot exceeds the threshold.
     */
    static final int NO_SLOT = -1;

    private final int[] counts = new int[ScriptPredicates.size()];

    /**
     * Adds one character to a slot.
     *
     * @return the slot's new count
     */
    int increment(int slot) {
        return ++counts[slot];
    }

    int get(int slot) {
        return counts[slot];
    }

    /**
     * Adds {@code other} into this vector slot by slot, stopping at the first slot
     * whose combined count exceeds {@code half}.
     *
     * @return the exceeding slot, or {@link #NO_SLOT}
     */
    int mergeFrom(ScriptCounts other, int half) {
        for (int slot = 0; slot < counts.length; slot++) {
            counts[slot] += other.counts[slot];
            if (counts[slot] > half) {
                return slot;
            }
        }
        return NO_SLOT;
    }

    boolean isEmpty() {
        for (int c : counts) {
            if (c != 0) return false;
        }
        return true;
    }

    /**
     * Slot with the highest count; among equal maxima the last slot wins.
     */
    int lastMaxSlot() {
        int best = 0;
        for (int slot = 1; slot < counts.length; slot++) {
            if (counts[slot] >= counts[best]) {
                best = slot;
            }
        }
        return best;
    }
}
