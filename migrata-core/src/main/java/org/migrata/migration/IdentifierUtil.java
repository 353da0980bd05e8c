package org.migrata.migration;

import org.migrata.migration.spi.IdentifierPolicy;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;

/**
 * 제약조건/인덱스 이름을 생성하고, DB 식별자 길이를 초과할 때 해시로 축약해 주는 유틸리티.
 * PostgreSQL 관례({@code <table>_<column>_fkey})를 따른다.
 */
public final class IdentifierUtil {

    private static final int HASH_LEN = 10;   // 잘라 붙일 해시 길이

    private IdentifierUtil() { /* static only */ }

    /**
     * @param policy  Dialect별 식별자 정책
     * @param suffix  식별자 접미어 (예: "fkey" "key" "idx" "check")
     * @param parts   이름을 구성하는 문자열 조각들 (테이블, 컬럼 ...)
     * @return        정책을 만족하는 식별자
     */
    public static String constraintName(IdentifierPolicy policy, String suffix, String... parts) {
        String combined = String.join("_", parts);
        String normalized = policy.normalizeCase(combined + "_" + suffix);
        if (normalized.length() <= policy.maxLength() && !policy.isKeyword(normalized)) {
            return normalized;
        }

        String hash = sha256Hex(combined).substring(0, HASH_LEN);
        String tail = "_" + hash + "_" + suffix;
        String head = parts.length > 0 ? parts[0] : "";
        int room = Math.max(0, policy.maxLength() - tail.length());
        if (head.length() > room) {
            head = head.substring(0, room);
        }
        String shortened = policy.normalizeCase(head + tail);

        return shortened.length() > policy.maxLength()
                ? shortened.substring(shortened.length() - policy.maxLength())
                : shortened;
    }

    public static String foreignKeyName(IdentifierPolicy policy, String table, String column) {
        return constraintName(policy, "fkey", table, column);
    }

    public static String uniqueName(IdentifierPolicy policy, String table, List<String> columns) {
        List<String> parts = new ArrayList<>();
        parts.add(table);
        parts.addAll(columns);
        return constraintName(policy, "key", parts.toArray(String[]::new));
    }

    /**
     * @param ordinal 1-based position of the check among the table's declared checks
     */
    public static String checkName(IdentifierPolicy policy, String table, int ordinal) {
        return constraintName(policy, "check", table, String.valueOf(ordinal));
    }

    private static String sha256Hex(String input) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(md.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // every JDK ships SHA-256
            return String.format("%08x%08x", input.hashCode(), input.length());
        }
    }
}
