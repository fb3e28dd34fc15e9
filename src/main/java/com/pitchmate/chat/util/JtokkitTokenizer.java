package com.pitchmate.chat.util;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingRegistry;
import com.knuddels.jtokkit.api.EncodingType;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * jtokkit 기반 정확한 BPE 토크나이저 (cl100k_base)
 */
public class JtokkitTokenizer implements TextTokenizer {

    // UTF-8 문자 하나는 최대 4바이트
    private static final int MAX_PARTIAL_UNITS = 4;

    private final Encoding encoding;

    public JtokkitTokenizer() {
        this(EncodingType.CL100K_BASE);
    }

    public JtokkitTokenizer(EncodingType type) {
        EncodingRegistry registry = Encodings.newDefaultEncodingRegistry();
        this.encoding = registry.getEncoding(type);
    }

    @Override
    public List<Integer> encode(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        return encoding.encode(text);
    }

    /**
     * 토큰 목록을 텍스트로 복원한다.
     * <p>
     * 끝의 토큰이 다바이트 문자를 반만 담고 있으면 온전한 UTF-8 이 될 때까지 뒤쪽 토큰을 버린다.
     */
    @Override
    public String decode(List<?> units) {
        List<Integer> ids = new ArrayList<>(units.size());
        for (Object u : units) {
            ids.add((Integer) u);
        }
        int floor = Math.max(0, ids.size() - MAX_PARTIAL_UNITS);
        for (int end = ids.size(); end >= floor; end--) {
            byte[] bytes = encoding.decodeBytes(ids.subList(0, end));
            try {
                return StandardCharsets.UTF_8.newDecoder()
                        .onMalformedInput(CodingErrorAction.REPORT)
                        .onUnmappableCharacter(CodingErrorAction.REPORT)
                        .decode(ByteBuffer.wrap(bytes))
                        .toString();
            } catch (CharacterCodingException e) {
                // 한 토큰 더 버리고 재시도
            }
        }
        throw new IllegalStateException("Token sequence does not decode to valid UTF-8: " + ids.size() + " tokens");
    }

    @Override
    public boolean isExact() {
        return true;
    }
}
