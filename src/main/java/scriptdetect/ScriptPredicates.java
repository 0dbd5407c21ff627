package scriptdetect;

import java.util.*;
import java.util.function.IntPredicate;

/**
 * Immutable table of script membership tests, one per {@link Script}.
 *
 * <p>Every test is a union of inclusive code-point ranges taken from the Unicode
 * block assignments of the script. A character is assigned to the <em>first</em>
 * script in {@link #tableOrder()} whose test accepts it, so the table order decides
 * both ambiguous characters and ties in {@link ScriptDetector}.</p>
 *
 * <p>The table is built once during class initialization and never mutated; it is
 * safe for any number of concurrent readers.</p>
 */
public final class ScriptPredicates {

    private ScriptPredicates() {
    }

    /**
     * A single table entry: a script and its membership test.
     */
    public static final class ScriptChecker implements IntPredicate {
        private final Script script;
        private final int[][] ranges;

        ScriptChecker(Script script, int[][] ranges) {
            this.script = script;
            this.ranges = ranges;
        }

        public Script script() {
            return script;
        }

        @Override
        public boolean test(int codePoint) {
            return inRanges(ranges, codePoint);
        }
    }

    /**
     * Order in which scripts are tested. Load-bearing: first match wins, and on a
     * count tie the script listed later wins.
     */
    private static final Script[] TABLE_ORDER = {
            Script.Latin,
            Script.Cyrillic,
            Script.Arabic,
            Script.Mandarin,
            Script.Devanagari,
            Script.Hebrew,
            Script.Ethiopic,
            Script.Georgian,
            Script.Bengali,
            Script.Hangul,
            Script.Hiragana,
            Script.Katakana,
            Script.Greek,
            Script.Kannada,
            Script.Tamil,
            Script.Thai,
            Script.Gujarati,
            Script.Gurmukhi,
            Script.Telugu,
            Script.Malayalam,
            Script.Oriya,
            Script.Myanmar,
            Script.Sinhala,
            Script.Khmer,
    };

    private static final List<ScriptChecker> CHECKERS;
    private static final List<Script> ORDER;

    /**
     * Slot in {@link #TABLE_ORDER} indexed by {@link Script#code()}.
     */
    private static final int[] SLOT_BY_CODE = new int[Script.values().length];

    static {
        List<ScriptChecker> checkers = new ArrayList<>(TABLE_ORDER.length);
        for (int slot = 0; slot < TABLE_ORDER.length; slot++) {
            Script script = TABLE_ORDER[slot];
            checkers.add(new ScriptChecker(script, rangesOf(script)));
            SLOT_BY_CODE[script.code()] = slot;
        }
        CHECKERS = Collections.unmodifiableList(checkers);
        ORDER = Collections.unmodifiableList(Arrays.asList(TABLE_ORDER.clone()));
    }

    /**
     * Returns the inclusive code-point ranges of a script, as {@code {start, end}} pairs.
     */
    private static int[][] rangesOf(Script script) {
        return switch (script) {
            // https://en.wikipedia.org/wiki/Latin_script_in_Unicode
            case Latin -> new int[][]{
                    {'a', 'z'},
                    {'A', 'Z'},
                    {0x0080, 0x00FF},
                    {0x0100, 0x017F},
                    {0x0180, 0x024F},
                    {0x0250, 0x02AF},
                    {0x1D00, 0x1D7F},
                    {0x1D80, 0x1DBF},
                    {0x1E00, 0x1EFF},
                    {0x2100, 0x214F},
                    {0x2C60, 0x2C7F},
                    {0xA720, 0xA7FF},
                    {0xAB30, 0xAB6F},
            };
            case Cyrillic -> new int[][]{
                    {0x0400, 0x0484},
                    {0x0487, 0x052F},
                    {0x2DE0, 0x2DFF},
                    {0xA640, 0xA69D},
                    {0x1D2B, 0x1D2B},
                    {0x1D78, 0x1D78},
                    {0xA69F, 0xA69F},
            };
            // https://en.wikipedia.org/wiki/Arabic_script_in_Unicode
            case Arabic -> new int[][]{
                    {0x0600, 0x06FF},
                    {0x0750, 0x07FF},
                    {0x08A0, 0x08FF},
                    {0xFB50, 0xFDFF},
                    {0xFE70, 0xFEFF},
                    {0x10E60, 0x10E7F},
                    {0x1EE00, 0x1EEFF},
            };
            case Mandarin -> new int[][]{
                    {0x2E80, 0x2E99},
                    {0x2E9B, 0x2EF3},
                    {0x2F00, 0x2FD5},
                    {0x3005, 0x3005},
                    {0x3007, 0x3007},
                    {0x3021, 0x3029},
                    {0x3038, 0x303B},
                    {0x3400, 0x4DB5},
                    {0x4E00, 0x9FCC},
                    {0xF900, 0xFA6D},
                    {0xFA70, 0xFAD9},
            };
            // https://en.wikipedia.org/wiki/Devanagari#Unicode
            case Devanagari -> new int[][]{
                    {0x0900, 0x097F},
                    {0xA8E0, 0xA8FF},
                    {0x1CD0, 0x1CFF},
            };
            case Hebrew -> new int[][]{
                    {0x0590, 0x05FF},
            };
            case Ethiopic -> new int[][]{
                    {0x1200, 0x139F},
                    {0x2D80, 0x2DDF},
                    {0xAB00, 0xAB2F},
            };
            case Georgian -> new int[][]{
                    {0x10A0, 0x10FF},
            };
            case Bengali -> new int[][]{
                    {0x0980, 0x09FF},
            };
            // https://en.wikipedia.org/wiki/Hangul
            case Hangul -> new int[][]{
                    {0xAC00, 0xD7AF},
                    {0x1100, 0x11FF},
                    {0x3130, 0x318F},
                    {0x3200, 0x32FF},
                    {0xA960, 0xA97F},
                    {0xD7B0, 0xD7FF},
                    {0xFF00, 0xFFEF},
            };
            case Hiragana -> new int[][]{
                    {0x3040, 0x309F},
            };
            case Katakana -> new int[][]{
                    {0x30A0, 0x30FF},
            };
            // Greek and Coptic block
            case Greek -> new int[][]{
                    {0x0370, 0x03FF},
            };
            case Kannada -> new int[][]{
                    {0x0C80, 0x0CFF},
            };
            case Tamil -> new int[][]{
                    {0x0B80, 0x0BFF},
            };
            case Thai -> new int[][]{
                    {0x0E00, 0x0E7F},
            };
            case Gujarati -> new int[][]{
                    {0x0A80, 0x0AFF},
            };
            // Punjabi
            case Gurmukhi -> new int[][]{
                    {0x0A00, 0x0A7F},
            };
            case Telugu -> new int[][]{
                    {0x0C00, 0x0C7F},
            };
            case Malayalam -> new int[][]{
                    {0x0D00, 0x0D7F},
            };
            case Oriya -> new int[][]{
                    {0x0B00, 0x0B7F},
            };
            case Myanmar -> new int[][]{
                    {0x1000, 0x109F},
            };
            case Sinhala -> new int[][]{
                    {0x0D80, 0x0DFF},
            };
            // Khmer and Khmer Symbols
            case Khmer -> new int[][]{
                    {0x1780, 0x17FF},
                    {0x19E0, 0x19FF},
            };
        };
    }

    private static boolean inRanges(int[][] ranges, int cp) {
        for (int[] r : ranges) {
            if (cp >= r[0] && cp <= r[1]) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns the table entries in table order.
     *
     * @return an unmodifiable list of checkers
     */
    public static List<ScriptChecker> checkers() {
        return CHECKERS;
    }

    /**
     * Returns every script in the order it is tested against a character.
     *
     * @return an unmodifiable list of all scripts in table order
     */
    public static List<Script> tableOrder() {
        return ORDER;
    }

    /**
     * Number of entries in the table, which is also the length of a count vector.
     *
     * @return the table size
     */
    public static int size() {
        return TABLE_ORDER.length;
    }

    /**
     * Returns the position of {@code script} in {@link #tableOrder()}.
     *
     * @param script the script
     * @return its table slot
     */
    public static int slotOf(Script script) {
        return SLOT_BY_CODE[script.code()];
    }

    /**
     * Returns the script stored at a table slot.
     *
     * @param slot a slot in {@code [0, size())}
     * @return the script at that slot
     */
    public static Script scriptAt(int slot) {
        return TABLE_ORDER[slot];
    }

    /**
     * Tests whether a code point belongs to a script's Unicode ranges.
     *
     * <p>Membership is tested in isolation; a code point may satisfy more than one
     * script here even though {@link #scriptOf(int)} only ever reports the first.</p>
     *
     * @param script    the script to test
     * @param codePoint any code point
     * @return {@code true} if the code point lies in one of the script's ranges
     */
    public static boolean isMember(Script script, int codePoint) {
        return CHECKERS.get(slotOf(script)).test(codePoint);
    }

    /**
     * Returns the table slot of the first script accepting the code point.
     *
     * @param codePoint any code point
     * @return the matching slot, or {@code -1} if no script accepts it
     */
    static int slotOfCodePoint(int codePoint) {
        for (int slot = 0; slot < TABLE_ORDER.length; slot++) {
            if (CHECKERS.get(slot).test(codePoint)) {
                return slot;
            }
        }
        return -1;
    }

    /**
     * Classifies a single code point.
     *
     * @param codePoint any code point
     * @return the first script in table order accepting it, or {@code null} if none does
     */
    public static Script scriptOf(int codePoint) {
        int slot = slotOfCodePoint(codePoint);
        return slot < 0 ? null : TABLE_ORDER[slot];
    }
}
