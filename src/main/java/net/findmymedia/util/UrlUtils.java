package net.findmymedia.util;

import jakarta.annotation.Nullable;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;

/**
 * URL helpers for upstream endpoints and Wikipedia article links.
 */
public final class UrlUtils {

    public static final String DEFAULT_AI_BASE_URL = "https://generativelanguage.googleapis.com/v1beta/openai";

    private UrlUtils() {
    }

    /**
     * Normalizes an OpenAI-compatible base URL: trailing slashes and a pasted
     * {@code /chat/completions} suffix are removed.
     */
    public static String normalizeAiBaseUrl(@Nullable String rawUrl) {
        if (rawUrl == null || rawUrl.isBlank()) {
            return DEFAULT_AI_BASE_URL;
        }
        String normalized = rawUrl.trim();
        while (normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        if (normalized.endsWith("/chat/completions")) {
            normalized = normalized.substring(0, normalized.length() - "/chat/completions".length());
        }
        return normalized;
    }

    /**
     * Title of a Wikipedia article from its URL, e.g.
     * {@code https://en.wikipedia.org/wiki/The_Matrix} gives {@code The Matrix}.
     *
     * @return decoded title, or {@code null} when the URL has no usable last segment
     */
    @Nullable
    public static String wikipediaArticleTitle(@Nullable String articleUrl) {
        if (articleUrl == null || articleUrl.isBlank()) {
            return null;
        }
        String trimmed = articleUrl.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        int slash = trimmed.lastIndexOf('/');
        String segment = slash >= 0 ? trimmed.substring(slash + 1) : trimmed;
        if (segment.isBlank()) {
            return null;
        }
        try {
            String decoded = URLDecoder.decode(segment.replace("+", "%2B"), StandardCharsets.UTF_8);
            String title = decoded.replace('_', ' ').trim();
            return title.isEmpty() ? null : title;
        } catch (IllegalArgumentException ex) {
            return segment.replace('_', ' ');
        }
    }
}
