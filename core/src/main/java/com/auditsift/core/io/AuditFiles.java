package com.auditsift.core.io;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 감사 덤프 읽기 공통부. 디코딩 오류는 MalformedInputException 으로 올려 보내고
 * 선행 BOM(U+FEFF) 은 제거한다.
 */
public final class AuditFiles {

    private static final char BOM = '\uFEFF';

    private AuditFiles() {}

    /** 줄 단위 읽기용 리더 (첫 BOM 은 건너뜀) */
    public static BufferedReader openReader(Path file, Charset cs) throws IOException {
        CharsetDecoder dec = cs.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        BufferedReader r = new BufferedReader(new InputStreamReader(Files.newInputStream(file), dec));
        try {
            r.mark(1);
            int first = r.read();
            if (first != -1 && first != BOM) r.reset();
        } catch (IOException e) {
            r.close();
            throw e;
        }
        return r;
    }

    /** 파일 전체 (레코드 모드용) */
    public static String readAll(Path file, Charset cs) throws IOException {
        String text = Files.readString(file, cs);
        return (!text.isEmpty() && text.charAt(0) == BOM) ? text.substring(1) : text;
    }
}
