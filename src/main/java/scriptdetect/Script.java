package scriptdetect;

import java.util.*;

/**
 * Writing systems recognised by {@link ScriptDetector}.
 *
 * <p>Constants are kept in alphabetical order. The declaration position is the
 * stable binding code returned by {@link #code()}, so new scripts must be inserted
 * in alphabetical order and every exhaustive {@code switch} over this enum updated.</p>
 *
 * <p>The order in which scripts are tested against a character is a separate,
 * fixed order defined by {@link ScriptPredicates#tableOrder()}.</p>
 */
public enum Script {
    Arabic,
    Bengali,
    Cyrillic,
    Devanagari,
    Ethiopic,
    Georgian,
    Greek,
    Gujarati,
    Gurmukhi,
    Hangul,
    Hebrew,
    Hiragana,
    Kannada,
    Katakana,
    Khmer,
    Latin,
    Malayalam,
    /**
     * Han ideographs (CJK Unified Ideographs and radicals).
     */
    Mandarin,
    Myanmar,
    /**
     * Odia, named after its Unicode block.
     */
    Oriya,
    Sinhala,
    Tamil,
    Telugu,
    Thai;

    /**
     * Returns the fixed English display name of this script.
     * <p>
     * Example: {@code Cyrillic.getName()} → {@code "Cyrillic"}.
     * </p>
     *
     * @return the display name, never {@code null}
     */
    public String getName() {
        return switch (this) {
            case Arabic -> "Arabic";
            case Bengali -> "Bengali";
            case Cyrillic -> "Cyrillic";
            case Devanagari -> "Devanagari";
            case Ethiopic -> "Ethiopic";
            case Georgian -> "Georgian";
            case Greek -> "Greek";
            case Gujarati -> "Gujarati";
            case Gurmukhi -> "Gurmukhi";
            case Hangul -> "Hangul";
            case Hebrew -> "Hebrew";
            case Hiragana -> "Hiragana";
            case Kannada -> "Kannada";
            case Katakana -> "Katakana";
            case Khmer -> "Khmer";
            case Latin -> "Latin";
            case Malayalam -> "Malayalam";
            case Mandarin -> "Mandarin";
            case Myanmar -> "Myanmar";
            case Oriya -> "Oriya";
            case Sinhala -> "Sinhala";
            case Tamil -> "Tamil";
            case Telugu -> "Telugu";
            case Thai -> "Thai";
        };
    }

    /**
     * Returns the stable binding code of this script.
     *
     * <p>Codes are assigned in alphabetical order starting at {@code 0}
     * ({@link #Arabic}) and are used when scripts are exchanged as small
     * integers with native or foreign callers.</p>
     *
     * @return the binding code
     */
    public int code() {
        return ordinal();
    }

    @Override
    public String toString() {
        return getName();
    }

    private static final Script[] BY_CODE = values();

    /**
     * Normalized display name to script, for case-insensitive parsing.
     */
    private static final Map<String, Script> LOOKUP = buildLookup();

    private static Map<String, Script> buildLookup() {
        Map<String, Script> m = new HashMap<>();
        for (Script s : BY_CODE) {
            m.put(s.getName().toLowerCase(Locale.ROOT), s);
        }
        return Collections.unmodifiableMap(m);
    }

    /**
     * Parses a display name into a {@code Script}, ignoring case and surrounding whitespace.
     *
     * <pre>{@code
     * Script s1 = Script.fromName("cyrillic"); // returns Script.Cyrillic
     * Script s2 = Script.fromName(" THAI ");   // returns Script.Thai
     * }</pre>
     *
     * @param value the display name
     * @return the matching script
     * @throws IllegalArgumentException if {@code value} is {@code null}, empty or unknown
     */
    public static Script fromName(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Script name cannot be null");
        }
        if (value.trim().isEmpty()) {
            throw new IllegalArgumentException("Script name cannot be empty");
        }
        Script s = tryParse(value);
        if (s == null) {
            throw new IllegalArgumentException("Unknown script: " + value);
        }
        return s;
    }

    /**
     * Tolerant variant of {@link #fromName(String)}; never throws.
     *
     * @param value the display name; may be {@code null}
     * @return the matching script, or {@code null} if the input is {@code null},
     * empty, or not a known script name
     */
    public static Script tryParse(String value) {
        if (value == null) return null;
        String trimmed = value.trim();
        if (trimmed.isEmpty()) return null;
        return LOOKUP.get(trimmed.toLowerCase(Locale.ROOT));
    }

    /**
     * Returns the script with the given binding code.
     *
     * @param code a binding code as returned by {@link #code()}
     * @return the matching script
     * @throws IllegalArgumentException if no script has that code
     */
    public static Script fromCode(int code) {
        if (code < 0 || code >= BY_CODE.length) {
            throw new IllegalArgumentException("Unknown script code: " + code);
        }
        return BY_CODE[code];
    }
}
