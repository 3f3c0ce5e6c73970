package com.livedesk.relay.common.text;

import org.springframework.web.util.HtmlUtils;

import java.util.regex.Pattern;

/**
 * Normalizes untrusted text so it can be rendered verbatim by a browser.
 */
public final class InputSanitizer {

    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\p{Cntrl}&&[^\\n\\t]]");
    private static final Pattern ROOM_ID = Pattern.compile("[A-Za-z0-9_-]{1,64}");

    private InputSanitizer() {
    }

    /**
     * Trims, truncates to {@code maxLength}, strips control characters and HTML-escapes.
     *
     * @return the safe text, or {@code null} when nothing is left
     */
    public static String sanitize(String text, int maxLength) {
        if (text == null) return null;
        var trimmed = text.strip();
        if (trimmed.length() > maxLength) {
            int end = maxLength;
            // keep surrogate pairs whole
            if (end > 0 && Character.isHighSurrogate(trimmed.charAt(end - 1))) {
                end--;
            }
            trimmed = trimmed.substring(0, end);
        }
        var cleaned = CONTROL_CHARS.matcher(trimmed).replaceAll("").strip();
        if (cleaned.isEmpty()) return null;
        return HtmlUtils.htmlEscape(cleaned);
    }

    public static boolean isValidRoomId(String roomId) {
        return roomId != null && ROOM_ID.matcher(roomId).matches();
    }

    public static String oneLine(String s, int maxLength) {
        if (s == null) return "";
        var x = s.replaceAll("[\\r\\n\\t]", " ");
        return x.length() > maxLength ? x.substring(0, maxLength) + "..." : x;
    }
}
