package eu.virtualparadox.titanshield.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.text.Normalizer;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

class VietnameseTextTest {

    @Test
    @DisplayName("Decomposed and precomposed diacritics normalize to the same string")
    void testNormalizeComposesDiacritics() {
        String precomposed = "bị nghiêm cấm";
        String decomposed = Normalizer.normalize(precomposed, Normalizer.Form.NFD);

        assertNotEquals(precomposed, decomposed);
        assertEquals(precomposed, VietnameseText.normalize(decomposed));
    }

    @Test
    @DisplayName("Whitespace is collapsed and trimmed; null becomes empty")
    void testNormalizeWhitespace() {
        assertEquals("Điều 5 Luật Đất đai", VietnameseText.normalize("  Điều 5\n\tLuật   Đất đai "));
        assertEquals("", VietnameseText.normalize(null));
    }

    @Test
    @DisplayName("Fold lower-cases Vietnamese capitals")
    void testFold() {
        assertEquals("đáp án đúng", VietnameseText.fold("ĐÁP ÁN ĐÚNG"));
    }

    @Test
    @DisplayName("Phrase pattern matches on syllable boundaries, ignores case, keeps diacritics distinct")
    void testPhrasePattern() {
        Pattern cam = VietnameseText.phrasePattern("cấm");

        assertTrue(cam.matcher(VietnameseText.normalize("Hành vi này bị CẤM.")).find());
        assertFalse(cam.matcher("cấmx").find());
        assertFalse(cam.matcher("cam kết").find());
    }
}
