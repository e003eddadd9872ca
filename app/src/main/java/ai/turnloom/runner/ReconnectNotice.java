package ai.turnloom.runner;

import java.util.Locale;

/** Recognizes the "reconnecting N/M" notices vendors emit while retrying a dropped connection. */
final class ReconnectNotice {
    private ReconnectNotice() {}

    static boolean isTransient(String message) {
        var trimmed = message.trim();
        if (trimmed.isEmpty()) {
            return false;
        }
        return trimmed.toLowerCase(Locale.ROOT).contains("reconnecting") && containsAttemptFraction(trimmed);
    }

    /** True if the text contains digits, a slash, then another digit. */
    private static boolean containsAttemptFraction(String text) {
        int i = 0;
        while (i < text.length()) {
            if (!isAsciiDigit(text.charAt(i))) {
                i++;
                continue;
            }
            while (i < text.length() && isAsciiDigit(text.charAt(i))) {
                i++;
            }
            if (i + 1 < text.length() && text.charAt(i) == '/' && isAsciiDigit(text.charAt(i + 1))) {
                return true;
            }
        }
        return false;
    }

    private static boolean isAsciiDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
