package scriptdetect;

import org.junit.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.Assert.*;

public class ScriptTest {

    @Test
    public void testScriptName() {
        assertEquals("Cyrillic", Script.Cyrillic.getName());
        assertEquals("Katakana", Script.Katakana.getName());
        assertEquals("Mandarin", Script.Mandarin.toString());
    }

    @Test
    public void testEveryNameMatchesConstant() {
        Set<String> names = new HashSet<>();
        for (Script s : Script.values()) {
            assertEquals(s.name(), s.getName());
            assertTrue("duplicate name " + s, names.add(s.getName()));
        }
        assertEquals(24, names.size());
    }

    @Test
    public void testCodesAreAlphabetical() {
        assertEquals(0, Script.Arabic.code());
        assertEquals(2, Script.Cyrillic.code());
        assertEquals(15, Script.Latin.code());
        assertEquals(23, Script.Thai.code());

        Script[] all = Script.values();
        for (int i = 1; i < all.length; i++) {
            assertTrue(all[i - 1].getName().compareTo(all[i].getName()) < 0);
        }
    }

    @Test
    public void testFromCode() {
        for (Script s : Script.values()) {
            assertSame(s, Script.fromCode(s.code()));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testFromCodeOutOfRange() {
        Script.fromCode(24);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testFromCodeNegative() {
        Script.fromCode(-1);
    }

    @Test
    public void testFromName() {
        assertSame(Script.Cyrillic, Script.fromName("cyrillic"));
        assertSame(Script.Thai, Script.fromName(" THAI "));
        assertSame(Script.Devanagari, Script.fromName("Devanagari"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testFromNameUnknown() {
        Script.fromName("Klingon");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testFromNameNull() {
        Script.fromName(null);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testFromNameEmpty() {
        Script.fromName("   ");
    }

    @Test
    public void testTryParse() {
        assertSame(Script.Hangul, Script.tryParse("hangul"));
        assertNull(Script.tryParse(null));
        assertNull(Script.tryParse(""));
        assertNull(Script.tryParse("Latin1"));
    }
}
