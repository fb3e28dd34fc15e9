package com.pitchmate.chat.test;

import com.pitchmate.chat.util.JtokkitTokenizer;
import com.pitchmate.chat.util.WhitespaceTokenizer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class JtokkitTokenizerTest {

    @Test
    @DisplayName("cl100k_base 토큰 앞부분 복원")
    public void decodesTokenPrefix() {
        JtokkitTokenizer tokenizer = new JtokkitTokenizer();
        String text = "Hello world, this is a travel pitch.";

        List<Integer> ids = tokenizer.encode(text);

        assertTrue(tokenizer.isExact());
        assertTrue(ids.size() > 2);
        assertTrue(text.startsWith(tokenizer.decode(ids.subList(0, 2))));
        assertTrue(tokenizer.encode("").isEmpty());
    }

    @Test
    @DisplayName("한글 중간에서 끊긴 토큰은 온전한 글자까지만 복원")
    public void decodeDropsPartialCharacters() {
        JtokkitTokenizer tokenizer = new JtokkitTokenizer();
        String text = "예산은 어느 정도로 생각하고 계신가요? 일정도 알려주세요.";

        List<Integer> ids = tokenizer.encode(text);

        for (int k = 0; k <= ids.size(); k++) {
            String prefix = tokenizer.decode(ids.subList(0, k));
            assertFalse(prefix.contains("\uFFFD"), "k=" + k);
            assertTrue(text.startsWith(prefix), "k=" + k);
        }
        assertEquals(text, tokenizer.decode(ids));
    }

    @Test
    @DisplayName("정수가 아닌 단위는 복원 실패")
    public void rejectsNonIdUnits() {
        assertThrows(ClassCastException.class, () -> new JtokkitTokenizer().decode(List.of("word")));
    }

    @Test
    @DisplayName("공백 분할 근사 토크나이저")
    public void whitespaceTokenizer() {
        WhitespaceTokenizer tokenizer = new WhitespaceTokenizer();

        assertEquals(List.of("one", "two", "three"), tokenizer.encode("  one  two\nthree "));
        assertEquals("one two", tokenizer.decode(List.of("one", "two")));
        assertTrue(tokenizer.encode("   ").isEmpty());
        assertFalse(tokenizer.isExact());
    }
}
