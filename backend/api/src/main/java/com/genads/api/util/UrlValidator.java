package com.genads.api.util;

import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Set;

/**
 * URL checks for client-supplied asset links.
 */
@Slf4j
public class UrlValidator {

    private static final Set<String> ALLOWED_SCHEMES = Set.of("http", "https");

    /**
     * Absolute http(s) URL with a host, e.g. {@code https://cdn.example.com/logo.png}.
     */
    public static boolean isAbsoluteHttpUrl(String url) {
        if (url == null || url.isBlank()) {
            return false;
        }

        String trimmed = url.trim();
        if (!trimmed.equals(url) || containsWhitespace(trimmed)) {
            return false;
        }

        try {
            URI uri = new URI(trimmed);
            if (!uri.isAbsolute() || uri.getScheme() == null) {
                return false;
            }
            if (!ALLOWED_SCHEMES.contains(uri.getScheme().toLowerCase(Locale.ROOT))) {
                return false;
            }
            String host = uri.getHost();
            return host != null && !host.isBlank();
        } catch (URISyntaxException e) {
            log.debug("[UrlValidator] Unparseable URL: {}", truncate(url, 100));
            return false;
        }
    }

    private static boolean containsWhitespace(String value) {
        return value.chars().anyMatch(Character::isWhitespace);
    }

    /**
     * Shortens values for log lines.
     */
    static String truncate(String str, int maxLength) {
        if (str == null) return "null";
        if (str.length() <= maxLength) return str;
        return str.substring(0, maxLength) + "...";
    }
}
