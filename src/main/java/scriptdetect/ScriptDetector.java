package scriptdetect;

import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.IntStream;

import static scriptdetect.StopChars.isStopChar;

/**
 * Detects the dominant writing system ({@link Script}) of a text.
 *
 * <p>Every code point that is not a stop character is assigned to the first script in
 * {@link ScriptPredicates#tableOrder()} that accepts it. Counting stops as soon as a
 * script holds more than half of the input's code points (stop characters included);
 * that script is the result. Otherwise the script with the highest count wins, and on
 * a tie the one listed later in table order.</p>
 *
 * <p>Large inputs are cut into fixed-size shards that are counted in parallel and
 * merged left to right. Detection is stateless and thread-safe.</p>
 *
 * <pre>{@code
 * Optional<Script> s = ScriptDetector.detectScript("Благодаря Эсперанто вы обрётете друзей!");
 * // s.get() == Script.Cyrillic
 * }</pre>
 */
public final class ScriptDetector {
    /**
     * Internal logger used for diagnostic messages.
     * Logging is disabled by default.
     */
    private static final Logger LOGGER = Logger.getLogger(ScriptDetector.class.getName());

    static {
        // Disable logging by default
        LOGGER.setLevel(Level.OFF);
    }

    /**
     * Inputs longer than this many code points are counted in parallel.
     */
    static final int PARALLEL_THRESHOLD = 10_000;

    /**
     * Code points per shard for parallel counting.
     */
    static final int SHARD_SIZE = 4_096;

    private ScriptDetector() {
    }

    /**
     * Enables or disables verbose logging for script detection.
     *
     * @param enabled {@code true} to log at {@code INFO}, {@code false} to turn logging off
     */
    public static void setVerboseLogging(boolean enabled) {
        LOGGER.setLevel(enabled ? Level.INFO : Level.OFF);
    }

    /**
     * Outcome of counting one shard: either an early winner slot, or the shard's counts.
     */
    static final class ShardResult {
        final int earlyWinner;
        final ScriptCounts counts;

        ShardResult(int earlyWinner, ScriptCounts counts) {
            this.earlyWinner = earlyWinner;
            this.counts = counts;
        }

        boolean hasEarlyWinner() {
            return earlyWinner != ScriptCounts.NO_SLOT;
        }
    }

    /**
     * Detects the script of {@code text}.
     *
     * @param text the text to inspect; may be {@code null}
     * @return the dominant script, or empty if the text is {@code null}, empty, or contains
     * no character belonging to a known script
     */
    public static Optional<Script> detectScript(String text) {
        if (text == null || text.isEmpty()) return Optional.empty();

        int[] codePoints = text.codePoints().toArray();
        int shardSize = codePoints.length > PARALLEL_THRESHOLD ? SHARD_SIZE : codePoints.length;
        return detectScript(codePoints, shardSize);
    }

    /**
     * Detects the script of the given code points using shards of {@code shardSize}.
     * The result does not depend on {@code shardSize}.
     */
    static Optional<Script> detectScript(int[] codePoints, int shardSize) {
        if (codePoints.length == 0) return Optional.empty();

        // Fixed for the whole call, stop characters included
        final int half = codePoints.length / 2;
        final int size = Math.max(1, shardSize);
        final int numShards = codePoints.length / size + (codePoints.length % size == 0 ? 0 : 1);

        ShardResult[] results = new ShardResult[numShards];

        if (numShards == 1) {
            results[0] = countShard(codePoints, 0, codePoints.length, half);
        } else {
            LOGGER.info(() -> "Counting " + codePoints.length + " code points in "
                    + numShards + " shards of " + size);

            IntStream.range(0, numShards).parallel().forEach(i -> {
                int from = i * size;
                int to = Math.min(from + size, codePoints.length);
                results[i] = countShard(codePoints, from, to, half);
            });
        }

        return merge(results, half);
    }

    /**
     * Counts one shard, returning as soon as a slot exceeds {@code half}.
     *
     * @param codePoints the whole input
     * @param from       first index of the shard, inclusive
     * @param to         last index of the shard, exclusive
     * @param half       half of the whole input's code point count
     */
    static ShardResult countShard(int[] codePoints, int from, int to, int half) {
        ScriptCounts counts = new ScriptCounts();
        for (int i = from; i < to; i++) {
            int cp = codePoints[i];
            if (isStopChar(cp)) continue;

            int slot = ScriptPredicates.slotOfCodePoint(cp);
            if (slot < 0) continue;

            if (counts.increment(slot) > half) {
                return new ShardResult(slot, counts);
            }
        }
        return new ShardResult(ScriptCounts.NO_SLOT, counts);
    }

    /**
     * Combines shard results left to right.
     */
    static Optional<Script> merge(ShardResult[] results, int half) {
        ScriptCounts total = null;
        for (ShardResult r : results) {
            if (r.hasEarlyWinner()) {
                return earlyWinner(r.earlyWinner);
            }
            if (total == null) {
                total = r.counts;
                continue;
            }
            int slot = total.mergeFrom(r.counts, half);
            if (slot != ScriptCounts.NO_SLOT) {
                return earlyWinner(slot);
            }
        }

        if (total == null || total.isEmpty()) {
            LOGGER.info("No character belongs to a known script");
            return Optional.empty();
        }
        return Optional.of(ScriptPredicates.scriptAt(total.lastMaxSlot()));
    }

    private static Optional<Script> earlyWinner(int slot) {
        Script script = ScriptPredicates.scriptAt(slot);
        LOGGER.info(() -> "Early winner: " + script);
        return Optional.of(script);
    }
}
