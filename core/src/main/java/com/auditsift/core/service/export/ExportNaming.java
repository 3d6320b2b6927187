package com.auditsift.core.service.export;

import com.auditsift.core.model.OsFamily;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

public final class ExportNaming {

    public static final DateTimeFormatter TS_FMT =
            DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").withZone(ZoneId.systemDefault());

    private ExportNaming() {}

    public static ExportContext context(Path baseDir, Instant startedAt) {
        Path out = (baseDir == null ? Paths.get("results") : baseDir);
        return new ExportContext(out, startedAt == null ? Instant.now() : startedAt);
    }

    public static String timestamp(ExportContext ctx) { return TS_FMT.format(ctx.startedAt()); }
    public static Path familyDir(ExportContext ctx, OsFamily family) { return ctx.baseDir().resolve(family.slug()); }
    public static Path jsonPath(ExportContext ctx, OsFamily family) {
        return familyDir(ctx, family).resolve(filePrefix(ctx, family) + ".json");
    }

    public static String filePrefix(ExportContext ctx, OsFamily family) {
        return "audit-" + family.slug() + "-" + timestamp(ctx);
    }

    /** 시트/파일명으로 쓸 수 없는 문자를 '-' 로 */
    public static String slug(String s) {
        if (s == null || s.isBlank()) return "unnamed";
        String out = s.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9._-]", "-").replaceAll("-{2,}", "-");
        return out.replaceAll("^-+|-+$", "");
    }

    public record ExportContext(Path baseDir, Instant startedAt) {}
}
