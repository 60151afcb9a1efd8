package corridorlabs.settlement.util;

import java.util.regex.Pattern;

/**
 * Keeps caller supplied values (corridor ids, addresses, URLs) safe for log lines.
 */
public final class LogSanitizer {

    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\r\\n\\t]+");

    private LogSanitizer() {
    }

    public static String sanitize(String value) {
        if (value == null) {
            return "";
        }
        return CONTROL_CHARS.matcher(value).replaceAll("_");
    }

    /**
     * Shortens an address to its first six and last four characters, e.g. {@code 0x1234...abcd}.
     */
    public static String maskAddress(String address) {
        String sanitized = sanitize(address);
        if (sanitized.length() <= 10) {
            return sanitized.isEmpty() ? "" : sanitized.charAt(0) + "***";
        }
        return sanitized.substring(0, 6) + "..." + sanitized.substring(sanitized.length() - 4);
    }
}
