package com.visitsync.util;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Canonicalizes text, dates and times read from both systems into comparable forms.
 *
 * None of these methods throw on malformed input: unparseable dates pass through
 * unchanged and unparseable times become "00:00".
 */
public final class TextNormalizer {

    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\u00A0]+");
    private static final Pattern NON_ASCII = Pattern.compile("[^\\x00-\\x7F]");
    private static final Pattern TIME_12H = Pattern.compile("(\\d+)(?::(\\d+))?\\s*(AM|PM)", Pattern.CASE_INSENSITIVE);
    private static final Pattern DIGITS = Pattern.compile("\\d+");

    private TextNormalizer() {
    }

    /**
     * Collapses whitespace (including non-breaking space), trims, lower-cases
     * and strips non-ASCII characters. Null becomes the empty string.
     */
    public static String normalizeText(String s) {
        return normalizeText(s, true);
    }

    public static String normalizeText(String s, boolean stripNonAscii) {
        if (s == null) {
            return "";
        }
        String text = s.replace('\u00A0', ' ');
        if (stripNonAscii) {
            text = NON_ASCII.matcher(text).replaceAll("");
        }
        text = text.toLowerCase(Locale.ROOT);
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    /**
     * Whitespace collapse only, case preserved. Used for labels that are
     * echoed back to an adapter or written to the change log.
     */
    public static String collapseWhitespace(String s) {
        if (s == null) {
            return "";
        }
        return WHITESPACE.matcher(s).replaceAll(" ").trim();
    }

    /**
     * M/D/YYYY or MM/DD/YYYY to YYYY-MM-DD. Input that is not exactly three
     * numeric slash-separated parts is returned unchanged, so callers compare
     * it literally.
     */
    public static String normalizeDateToIso(String date) {
        if (date == null) {
            return "";
        }
        String[] parts = splitDate(date);
        if (parts == null) {
            return date;
        }
        return String.format("%s-%02d-%02d",
            parts[2], Integer.parseInt(parts[0]), Integer.parseInt(parts[1]));
    }

    /**
     * Strips leading zeros from month and day, year preserved: "02/03/2026" to "2/3/2026".
     */
    public static String normalizeDateMdy(String date) {
        if (date == null) {
            return "";
        }
        String[] parts = splitDate(date);
        if (parts == null) {
            return date;
        }
        return Integer.parseInt(parts[0]) + "/" + Integer.parseInt(parts[1]) + "/" + parts[2];
    }

    /**
     * "2/3/2026" to "2-3-2026"; used in document identifiers.
     */
    public static String dateWithDashes(String date) {
        return date == null ? "" : date.trim().replace('/', '-');
    }

    /**
     * Parses "H[:MM] AM|PM" into zero-padded 24-hour "HH:MM". Unparseable or out-of-range
     * input gives "00:00". Never throws.
     */
    public static String convertTo24h(String time) {
        if (time == null) {
            return "00:00";
        }
        Matcher m = TIME_12H.matcher(time);
        if (!m.find()) {
            return "00:00";
        }
        int hour;
        int minute;
        try {
            hour = Integer.parseInt(m.group(1));
            minute = m.group(2) != null ? Integer.parseInt(m.group(2)) : 0;
        } catch (NumberFormatException e) {
            return "00:00";
        }
        if (hour > 12 || minute > 59) {
            return "00:00";
        }
        boolean pm = m.group(3).equalsIgnoreCase("PM");
        if (pm && hour < 12) {
            hour += 12;
        }
        if (!pm && hour == 12) {
            hour = 0;
        }
        return String.format("%02d:%02d", hour, minute);
    }

    private static String[] splitDate(String date) {
        String[] parts = date.trim().split("/", -1);
        if (parts.length != 3) {
            return null;
        }
        for (int i = 0; i < parts.length; i++) {
            parts[i] = parts[i].trim();
            if (!DIGITS.matcher(parts[i]).matches() || parts[i].length() > 9) {
                return null;
            }
        }
        return parts;
    }
}
