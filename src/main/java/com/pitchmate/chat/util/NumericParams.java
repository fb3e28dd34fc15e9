package com.pitchmate.chat.util;

/**
 * 호출자가 보낸 숫자 파라미터의 안전 변환
 * <p>
 * null, 공백, 숫자가 아닌 문자열, boolean, 0 이하 값은 모두 null 로 취급한다.
 */
public final class NumericParams {

    private NumericParams() {
    }

    public static Integer positiveIntOrNull(Object o) {
        Integer v = asInt(o);
        return v != null && v > 0 ? v : null;
    }

    public static int positiveIntOrDefault(Object o, int defaultValue) {
        Integer v = positiveIntOrNull(o);
        return v != null ? v : defaultValue;
    }

    private static Integer asInt(Object o) {
        if (o == null || o instanceof Boolean) {
            return null;
        }
        if (o instanceof Number n) {
            double d = n.doubleValue();
            return Double.isFinite(d) ? (int) d : null;
        }
        String s = String.valueOf(o).strip();
        if (s.isEmpty()) {
            return null;
        }
        try {
            double d = Double.parseDouble(s);
            return Double.isFinite(d) ? (int) d : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
