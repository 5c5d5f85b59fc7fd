package com.supplyplanner.domain;

import java.util.Comparator;

/**
 * Orders period labels with embedded numbers compared by value, so that
 * {@code "2024-2"} sorts before {@code "2024-10"} and {@code "week 9"} before {@code "week 10"}.
 */
public final class PeriodOrder implements Comparator<String> {

    public static final PeriodOrder INSTANCE = new PeriodOrder();

    private PeriodOrder() {
    }

    @Override
    public int compare(String a, String b) {
        int i = 0;
        int j = 0;
        while (i < a.length() && j < b.length()) {
            char ca = a.charAt(i);
            char cb = b.charAt(j);
            if (Character.isDigit(ca) && Character.isDigit(cb)) {
                int startA = i;
                int startB = j;
                while (i < a.length() && Character.isDigit(a.charAt(i))) i++;
                while (j < b.length() && Character.isDigit(b.charAt(j))) j++;
                String numA = stripZeros(a.substring(startA, i));
                String numB = stripZeros(b.substring(startB, j));
                if (numA.length() != numB.length()) {
                    return Integer.compare(numA.length(), numB.length());
                }
                int cmp = numA.compareTo(numB);
                if (cmp != 0) return cmp;
            } else {
                if (ca != cb) return Character.compare(ca, cb);
                i++;
                j++;
            }
        }
        int remaining = Integer.compare(a.length() - i, b.length() - j);
        // "01" and "1" must stay distinct keys
        return remaining != 0 ? remaining : a.compareTo(b);
    }

    private static String stripZeros(String digits) {
        int k = 0;
        while (k < digits.length() - 1 && digits.charAt(k) == '0') k++;
        return digits.substring(k);
    }
}
