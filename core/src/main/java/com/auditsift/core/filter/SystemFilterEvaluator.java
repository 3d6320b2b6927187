package com.auditsift.core.filter;

import com.auditsift.core.model.AuditSystem;
import com.auditsift.core.model.FilterAttribute;
import com.auditsift.core.model.FilterOperator;
import com.auditsift.core.model.SystemFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * sys_filter 평가기.
 *  - 필터가 없으면 통과, 여러 개면 AND
 *  - 시스템 OS 계열에 해당하지 않는 속성(예: Linux 시스템의 ubr)은 통과 처리
 *  - producer_version / current_build / ubr 는 버전 비교, 실패 시 문자열 비교
 */
public final class SystemFilterEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(SystemFilterEvaluator.class);

    private SystemFilterEvaluator() {}

    public static boolean matches(AuditSystem system, List<SystemFilter> filters) {
        Objects.requireNonNull(system, "system");
        if (filters == null || filters.isEmpty()) return true;
        for (SystemFilter f : filters) {
            if (!matchesFilter(system, f)) {
                LOG.debug("System {} excluded by filter [{}]", system.getName(), f);
                return false;
            }
        }
        return true;
    }

    /** 입력 순서를 유지한 부분 수열을 돌려준다. */
    public static List<AuditSystem> filterSystems(List<AuditSystem> systems, List<SystemFilter> filters) {
        if (systems == null || systems.isEmpty()) return List.of();
        if (filters == null || filters.isEmpty()) return List.copyOf(systems);
        List<AuditSystem> out = new ArrayList<>(systems.size());
        for (AuditSystem s : systems) {
            if (matches(s, filters)) out.add(s);
        }
        return out;
    }

    /** 필터 1개. 시스템 값이 없으면 null 멤버를 가진 in 만 통과한다. */
    static boolean matchesFilter(AuditSystem system, SystemFilter filter) {
        FilterAttribute attr = filter.attr();
        if (!attr.isApplicableTo(system.getOsFamily())) return true;

        FilterOperator op = filter.comp();
        String actual = resolve(system, attr);
        if (actual == null) {
            return op == FilterOperator.IN && filter.values().contains(null);
        }

        if (attr.isVersionLike()) {
            return compareVersion(actual, op, filter);
        }
        if (op == FilterOperator.IN) {
            for (Object candidate : filter.values()) {
                if (candidate != null && same(attr, actual, normalize(candidate))) return true;
            }
            return false;
        }
        String expected = normalize(filter.value());
        if (op == FilterOperator.EQ) {
            return same(attr, actual, expected);
        }
        return op.test(compareScalar(actual, expected));
    }

    /** 필터 속성 → 시스템 값(문자열). enum 은 표기 문자열로 정규화. */
    static String resolve(AuditSystem s, FilterAttribute attr) {
        return switch (attr) {
            case OS_FAMILY -> s.getOsFamily().value();
            case DISTRO_FAMILY -> (s.getDistroFamily() == null ? null : s.getDistroFamily().value());
            case PRODUCER -> s.getProducer().value();
            case PRODUCER_VERSION -> s.getProducerVersion();
            default -> s.attribute(attr.value());
        };
    }

    private static boolean compareVersion(String actual, FilterOperator op, SystemFilter filter) {
        if (op == FilterOperator.IN) {
            for (Object candidate : filter.values()) {
                if (candidate == null) continue;
                String expected = normalize(candidate);
                OptionalInt c = VersionComparator.compare(actual, expected);
                if (c.isPresent() ? c.getAsInt() == 0 : actual.equals(expected)) return true;
            }
            return false;
        }
        String expected = normalize(filter.value());
        OptionalInt c = VersionComparator.compare(actual, expected);
        int cmp = c.isPresent() ? c.getAsInt() : actual.compareTo(expected);
        return op.test(cmp);
    }

    private static boolean same(FilterAttribute attr, String actual, String expected) {
        return attr.isEnumBacked() ? actual.equalsIgnoreCase(expected) : actual.equals(expected);
    }

    /** 둘 다 숫자면 수치 비교, 아니면 사전식 비교 */
    private static int compareScalar(String actual, String expected) {
        BigDecimal a = toNumber(actual);
        BigDecimal b = toNumber(expected);
        if (a != null && b != null) return a.compareTo(b);
        return actual.compareTo(expected);
    }

    private static BigDecimal toNumber(String s) {
        try {
            return new BigDecimal(s.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String normalize(Object v) {
        return String.valueOf(v).trim();
    }
}
