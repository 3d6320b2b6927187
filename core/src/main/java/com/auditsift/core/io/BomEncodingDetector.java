package com.auditsift.core.io;

import com.auditsift.core.api.IEncodingDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * 기본 인코딩 감지기.
 *  1) BOM (UTF-8 / UTF-16LE / UTF-16BE)
 *  2) BOM 없는 UTF-16LE (앞부분 홀수 바이트 대부분이 0x00, Windows 수집기 출력)
 *  3) 엄격한 UTF-8 디코딩 성공 시 UTF-8
 *  4) 그 외 windows-1252
 * 빈 파일이나 읽기 실패는 판별 불가(empty).
 */
public final class BomEncodingDetector implements IEncodingDetector {

    private static final Logger LOG = LoggerFactory.getLogger(BomEncodingDetector.class);

    private static final int SNIFF_BYTES = 4096;
    private static final Charset FALLBACK = Charset.isSupported("windows-1252")
            ? Charset.forName("windows-1252")
            : StandardCharsets.ISO_8859_1;

    @Override
    public Optional<Charset> detect(Path file) {
        try {
            byte[] head;
            try (InputStream in = Files.newInputStream(file)) {
                head = in.readNBytes(SNIFF_BYTES);
            }
            if (head.length == 0) {
                LOG.debug("Empty file, no encoding: {}", file);
                return Optional.empty();
            }
            Charset bom = fromBom(head);
            if (bom != null) return Optional.of(bom);
            if (looksLikeUtf16Le(head)) return Optional.of(StandardCharsets.UTF_16LE);
            if (isStrictUtf8(Files.readAllBytes(file))) return Optional.of(StandardCharsets.UTF_8);
            return Optional.of(FALLBACK);
        } catch (IOException e) {
            LOG.warn("Cannot detect encoding of {}: {}", file, e.toString());
            return Optional.empty();
        }
    }

    static Charset fromBom(byte[] b) {
        if (b.length >= 3 && (b[0] & 0xFF) == 0xEF && (b[1] & 0xFF) == 0xBB && (b[2] & 0xFF) == 0xBF) {
            return StandardCharsets.UTF_8;
        }
        if (b.length >= 2 && (b[0] & 0xFF) == 0xFF && (b[1] & 0xFF) == 0xFE) return StandardCharsets.UTF_16LE;
        if (b.length >= 2 && (b[0] & 0xFF) == 0xFE && (b[1] & 0xFF) == 0xFF) return StandardCharsets.UTF_16BE;
        return null;
    }

    static boolean looksLikeUtf16Le(byte[] b) {
        int pairs = b.length / 2;
        if (pairs < 4) return false;
        int zeros = 0;
        for (int i = 1; i < pairs * 2; i += 2) {
            if (b[i] == 0 && b[i - 1] != 0) zeros++;
        }
        return zeros * 10 >= pairs * 9;
    }

    static boolean isStrictUtf8(byte[] all) {
        try {
            StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(all));
            return true;
        } catch (CharacterCodingException e) {
            return false;
        }
    }
}
