package com.phillippitts.acedaw.util;

/** Utility for log-safe rendering of user-supplied strings (project names, archive keys). */
public final class LogSanitizer {

    private static final int DEFAULT_MAX = 80;

    private LogSanitizer() {}

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

    /**
     * Replaces control characters (CR, LF, tabs and the like) with '?' and truncates to
     * {@value #DEFAULT_MAX} characters so untrusted input cannot forge log lines.
     */
    public static String forLog(String s) {
        String t = truncate(s, DEFAULT_MAX);
        StringBuilder sb = new StringBuilder(t.length());
        for (int i = 0; i < t.length(); i++) {
            char c = t.charAt(i);
            sb.append(Character.isISOControl(c) ? '?' : c);
        }
        return sb.toString();
    }
}
