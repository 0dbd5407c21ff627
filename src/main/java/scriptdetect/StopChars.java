package scriptdetect;

/**
 * Characters ignored by script detection: ASCII controls, space, digits and
 * ASCII punctuation/symbols.
 *
 * <p>Stop characters count towards the length of the input but never towards
 * any script.</p>
 */
public final class StopChars {

    private StopChars() {
    }

    private static final int TABLE_SIZE = 0x80;

    private static final boolean[] STOP_TABLE = new boolean[TABLE_SIZE];

    static {
        // U+0000..U+0040: controls, space, punctuation, digits, '@'
        for (int cp = 0x0000; cp <= 0x0040; cp++) STOP_TABLE[cp] = true;
        // U+005B..U+0060: [ \ ] ^ _ `
        for (int cp = 0x005B; cp <= 0x0060; cp++) STOP_TABLE[cp] = true;
        // U+007B..U+007E: { | } ~
        for (int cp = 0x007B; cp <= 0x007E; cp++) STOP_TABLE[cp] = true;
    }

    /**
     * Tests whether a code point is excluded from script detection.
     *
     * @param codePoint any code point
     * @return {@code true} for stop characters
     */
    public static boolean isStopChar(int codePoint) {
        return codePoint >= 0 && codePoint < TABLE_SIZE && STOP_TABLE[codePoint];
    }
}
