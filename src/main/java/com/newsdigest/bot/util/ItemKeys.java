package com.newsdigest.bot.util;

import com.newsdigest.bot.service.source.RawItem;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;

/**
 * 아이템 식별 키 계산.
 *
 * 정규화된 URL의 SHA-256 해시를 키로 사용합니다. URL이 없으면 소스 고유 ID, 그것도 없으면 제목을 사용합니다.
 * 쿼리 문자열(utm 등 추적 파라미터)과 fragment, 끝의 '/'는 제거됩니다.
 */
public final class ItemKeys {

    private ItemKeys() {
    }

    public static String keyFor(RawItem item) {
        if (item.url() != null && !item.url().isBlank()) {
            return sha256("url:" + normalizeUrl(item.url()));
        }
        if (item.nativeId() != null && !item.nativeId().isBlank()) {
            return sha256("id:" + item.nativeId().trim());
        }
        String title = item.title() != null ? item.title().trim().toLowerCase(Locale.ROOT) : "";
        return sha256("title:" + title);
    }

    public static String normalizeUrl(String url) {
        String trimmed = url.trim();
        try {
            URI uri = new URI(trimmed);
            if (uri.getScheme() == null || uri.getHost() == null) {
                return stripTrailingSlash(stripQueryAndFragment(trimmed));
            }
            String path = uri.getRawPath() != null ? uri.getRawPath() : "";
            StringBuilder normalized = new StringBuilder()
                    .append(uri.getScheme().toLowerCase(Locale.ROOT))
                    .append("://")
                    .append(uri.getHost().toLowerCase(Locale.ROOT));
            if (uri.getPort() != -1) {
                normalized.append(':').append(uri.getPort());
            }
            normalized.append(path);
            return stripTrailingSlash(normalized.toString());
        } catch (URISyntaxException e) {
            return stripTrailingSlash(stripQueryAndFragment(trimmed));
        }
    }

    private static String stripQueryAndFragment(String url) {
        int cut = url.length();
        int query = url.indexOf('?');
        int fragment = url.indexOf('#');
        if (query >= 0) cut = Math.min(cut, query);
        if (fragment >= 0) cut = Math.min(cut, fragment);
        return url.substring(0, cut);
    }

    private static String stripTrailingSlash(String url) {
        String result = url;
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }

    static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            StringBuilder hexString = new StringBuilder();
            for (byte b : hash) {
                String hex = Integer.toHexString(0xff & b);
                if (hex.length() == 1) hexString.append('0');
                hexString.append(hex);
            }
            return hexString.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }
}
