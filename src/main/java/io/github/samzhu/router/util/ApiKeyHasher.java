package io.github.samzhu.router.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

import org.apache.commons.lang3.StringUtils;

/**
 * API Key 雜湊與遮罩工具
 *
 * <p>持久層只保存 SHA-256 雜湊；日誌與用量紀錄只出現前 8 碼。
 */
public final class ApiKeyHasher {

    private static final int VISIBLE_PREFIX_LENGTH = 8;

    private ApiKeyHasher() {
    }

    /**
     * 計算 SHA-256 十六進位雜湊（小寫）
     */
    public static String sha256Hex(String apiKey) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(apiKey.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * 取得可顯示的前綴（前 8 碼）
     */
    public static String visiblePrefix(String apiKey) {
        return StringUtils.left(apiKey, VISIBLE_PREFIX_LENGTH);
    }

    /**
     * 遮罩後的 Key，例如 {@code sk-demo-****}
     */
    public static String mask(String apiKey) {
        return StringUtils.defaultString(visiblePrefix(apiKey)) + "****";
    }
}
