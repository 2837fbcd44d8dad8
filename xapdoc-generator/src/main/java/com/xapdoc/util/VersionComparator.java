package com.xapdoc.util;

import java.util.Comparator;

/**
 * Orders dotted version strings such as {@code 0.2.0} and {@code 0.10.0} part by part.
 *
 * <p>Parts that are both numeric compare as numbers, other parts compare as strings. Missing parts count
 * as {@code 0}. Versions equal by parts fall back to plain string order, so the ordering is total.
 */
public final class VersionComparator implements Comparator<String> {

    public static final VersionComparator INSTANCE = new VersionComparator();

    private VersionComparator() {
    }

    @Override
    public int compare(String v1, String v2) {
        String[] parts1 = v1.split("\\.");
        String[] parts2 = v2.split("\\.");
        int maxLength = Math.max(parts1.length, parts2.length);
        for (int i = 0; i < maxLength; i++) {
            String p1 = i < parts1.length ? parts1[i] : "0";
            String p2 = i < parts2.length ? parts2[i] : "0";
            int cmp = comparePart(p1, p2);
            if (cmp != 0) {
                return cmp;
            }
        }
        return v1.compareTo(v2);
    }

    private static int comparePart(String p1, String p2) {
        if (isNumeric(p1) && isNumeric(p2)) {
            // compare by magnitude without parsing, parts may exceed int range
            String n1 = stripLeadingZeros(p1);
            String n2 = stripLeadingZeros(p2);
            if (n1.length() != n2.length()) {
                return Integer.compare(n1.length(), n2.length());
            }
            return n1.compareTo(n2);
        }
        return p1.compareTo(p2);
    }

    private static boolean isNumeric(String part) {
        if (part.isEmpty()) {
            return false;
        }
        for (int i = 0; i < part.length(); i++) {
            if (!Character.isDigit(part.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static String stripLeadingZeros(String digits) {
        int i = 0;
        while (i < digits.length() - 1 && digits.charAt(i) == '0') {
            i++;
        }
        return digits.substring(i);
    }
}
