package com.essaycoach.corpus;

import java.util.Comparator;

/**
 * Ordering of prompt identifiers used for deterministic tie-breaks.
 * Numeric ids compare by value and sort before non-numeric ids, which compare as strings.
 */
public final class PromptIds {

    public static final Comparator<String> ORDER = PromptIds::compare;

    private PromptIds() {
    }

    public static int compare(String left, String right) {
        Long leftNumber = asNumber(left);
        Long rightNumber = asNumber(right);
        if (leftNumber != null && rightNumber != null) {
            int byValue = Long.compare(leftNumber, rightNumber);
            return byValue != 0 ? byValue : left.compareTo(right);
        }
        if (leftNumber != null) return -1;
        if (rightNumber != null) return 1;
        return left.compareTo(right);
    }

    private static Long asNumber(String id) {
        if (id == null || id.isEmpty() || id.length() > 18) {
            return null;
        }
        for (int i = 0; i < id.length(); i++) {
            if (!Character.isDigit(id.charAt(i))) {
                return null;
            }
        }
        return Long.parseLong(id);
    }
}
