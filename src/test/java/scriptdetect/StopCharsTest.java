package scriptdetect;

import org.junit.Test;

import static org.junit.Assert.*;

public class StopCharsTest {

    @Test
    public void testAsciiPunctuationDigitsAndWhitespace() {
        for (char ch : " \t\n\r0123456789!\"#$%&'()*+,-./:;<=>?@[\\]^_`{|}~".toCharArray()) {
            assertTrue("expected stop char: " + (int) ch, StopChars.isStopChar(ch));
        }
        assertTrue(StopChars.isStopChar(0x0000));
    }

    @Test
    public void testLettersAreNotStopChars() {
        for (char ch = 'a'; ch <= 'z'; ch++) assertFalse(StopChars.isStopChar(ch));
        for (char ch = 'A'; ch <= 'Z'; ch++) assertFalse(StopChars.isStopChar(ch));
        assertFalse(StopChars.isStopChar('ж'));
        assertFalse(StopChars.isStopChar(0x007F));
    }

    @Test
    public void testNonAsciiPunctuationIsNotStopChar() {
        // Only the ASCII set is ignored
        assertFalse(StopChars.isStopChar('。'));
        assertFalse(StopChars.isStopChar(0x00A0));
        assertFalse(StopChars.isStopChar(0x1F600));
    }
}
