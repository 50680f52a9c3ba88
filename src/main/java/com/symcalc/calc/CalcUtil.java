package com.symcalc.calc;

class CalcUtil {
    static boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
            (c >= 'A' && c <= 'Z') ||
            c == '_';
    }

    static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    static boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    static boolean isInteger(double d) {
        return !Double.isInfinite(d) && d == Math.floor(d);
    }

    // Work around Java adding ".0" to integer-valued doubles.
    static String formatNumber(double d) {
        String text = String.valueOf(d);
        if (text.endsWith(".0")) {
            text = text.substring(0, text.length() - 2);
        }
        return text;
    }

    static boolean isDebugEnabled(String key) {
        return Calc.debugKeys.get(key) == (Boolean)true;
    }

    static void debug(String key, String msg) {
        if (isDebugEnabled(key)) {
            System.err.println("[DEBUG] (" + key + "): " + msg);
        }
    }
}
