package com.phillippitts.voicenotes.util;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Utility for privacy-safe logging and user-facing error text.
 *
 * <p>Redacts credential-shaped substrings (bearer tokens, {@code sk-} keys, authorization
 * headers, key/token assignments) and personal data (email addresses, home-directory paths).
 * Applied to every error message before it reaches a log sink or a response body.
 */
public final class ErrorSanitizer {

    public static final String REDACTED_API_KEY = "[REDACTED_API_KEY]";
    public static final String REDACTED = "[REDACTED]";
    public static final String REDACTED_EMAIL = "[EMAIL_REDACTED]";
    public static final String REDACTED_PATH = "[PATH_REDACTED]";

    private static final String UNKNOWN_ERROR = "Unknown error";

    // Order matters: bearer tokens first so "Bearer sk-..." collapses into a single marker.
    private static final List<Rule> RULES = List.of(
            new Rule(Pattern.compile("(?i)bearer\\s+[A-Za-z0-9_\\-.~+/]+=*"), "Bearer " + REDACTED_API_KEY),
            new Rule(Pattern.compile("sk-[A-Za-z0-9_\\-]{20,}"), REDACTED_API_KEY),
            new Rule(Pattern.compile("(?i)\"authorization\"\\s*:\\s*\"[^\"]*\""), "\"Authorization\": \"" + REDACTED + "\""),
            new Rule(Pattern.compile("(?i)authorization['\":=\\s]+(?!Bearer \\[)[^,}\\s]+"), "authorization: " + REDACTED),
            new Rule(Pattern.compile("(?i)(api[_-]?key|apikey|api[_-]?secret)([\"'\\s:=]+)[A-Za-z0-9_\\-]{16,}"),
                    "$1$2" + REDACTED),
            new Rule(Pattern.compile("(?i)(token)([\"'\\s:=]+)[A-Za-z0-9_\\-]{16,}"), "$1$2" + REDACTED),
            new Rule(Pattern.compile("[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}"), REDACTED_EMAIL),
            new Rule(Pattern.compile("/(?:home|Users|root|tmp|var|private)(?:/[A-Za-z0-9._-]+)+"), REDACTED_PATH),
            new Rule(Pattern.compile("[A-Za-z]:\\\\(?:[A-Za-z0-9._-]+\\\\)*[A-Za-z0-9._-]*"), REDACTED_PATH)
    );

    private ErrorSanitizer() {}

    /**
     * Redacts secrets and personal data from the given text; returns "" for null.
     */
    public static String sanitize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String result = text;
        for (Rule rule : RULES) {
            result = rule.apply(result);
        }
        return result;
    }

    /**
     * Describes a throwable for logs: {@code SimpleName: message}, followed by the root cause
     * when it differs, all sanitized. Stack traces are never included.
     */
    public static String describe(Throwable error) {
        if (error == null) {
            return UNKNOWN_ERROR;
        }
        StringBuilder sb = new StringBuilder(error.getClass().getSimpleName());
        String message = error.getMessage();
        if (message != null && !message.isBlank()) {
            sb.append(": ").append(message);
        }
        Throwable root = rootCause(error);
        if (root != error) {
            sb.append(" (caused by ").append(root.getClass().getSimpleName());
            if (root.getMessage() != null && !root.getMessage().isBlank()) {
                sb.append(": ").append(root.getMessage());
            }
            sb.append(')');
        }
        return sanitize(sb.toString());
    }

    /**
     * Message suitable for showing to the user: the sanitized exception message, or a generic
     * fallback when the throwable carries none.
     */
    public static String userMessage(Throwable error) {
        if (error == null || error.getMessage() == null || error.getMessage().isBlank()) {
            return UNKNOWN_ERROR;
        }
        return sanitize(error.getMessage());
    }

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null) {
            return "";
        }
        if (max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    private static Throwable rootCause(Throwable error) {
        Throwable current = error;
        // bounded walk: guards against self-referencing cause chains
        for (int depth = 0; depth < 16 && current.getCause() != null && current.getCause() != current; depth++) {
            current = current.getCause();
        }
        return current;
    }

    private record Rule(Pattern pattern, String replacement) {
        String apply(String input) {
            Matcher m = pattern.matcher(input);
            return m.find() ? m.replaceAll(replacement) : input;
        }
    }
}
