package scriptdetect;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.BeforeClass;
import org.junit.Test;

import java.io.InputStream;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.Assert.*;

/**
 * Runs detection over one sample sentence per script, loaded from {@code /scripts/samples.json}.
 */
public class ScriptSamplesTest {

    private static Map<String, String> samples;

    @BeforeClass
    public static void loadSamples() throws Exception {
        try (InputStream in = ScriptSamplesTest.class.getResourceAsStream("/scripts/samples.json")) {
            assertNotNull("missing /scripts/samples.json", in);
            samples = new ObjectMapper().readValue(in, new TypeReference<Map<String, String>>() {
            });
        }
    }

    @Test
    public void testEveryScriptHasASample() {
        Set<Script> covered = EnumSet.noneOf(Script.class);
        for (String name : samples.keySet()) {
            covered.add(Script.fromName(name));
        }
        assertEquals(EnumSet.allOf(Script.class), covered);
    }

    @Test
    public void testSamplesAreDetected() {
        for (Map.Entry<String, String> e : samples.entrySet()) {
            Script expected = Script.fromName(e.getKey());
            assertEquals(e.getKey(), Optional.of(expected), ScriptDetector.detectScript(e.getValue()));
        }
    }

    @Test
    public void testSampleLettersBelongToTheirScript() {
        for (Map.Entry<String, String> e : samples.entrySet()) {
            Script expected = Script.fromName(e.getKey());
            e.getValue().codePoints()
                    .filter(cp -> !StopChars.isStopChar(cp))
                    .forEach(cp -> assertSame(e.getKey() + " U+" + Integer.toHexString(cp),
                            expected, ScriptPredicates.scriptOf(cp)));
        }
    }
}
