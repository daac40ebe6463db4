package com.unlistedjobs.archetype;

/**
 * Census County Business Patterns employment size classes (EMPSZES codes).
 */
public enum SizeClass {
    UNDER_5("210", "<5 employees", 1, 4),
    FROM_5_TO_9("220", "5-9 employees", 5, 9),
    FROM_10_TO_19("230", "10-19 employees", 10, 19),
    FROM_20_TO_49("241", "20-49 employees", 20, 49),
    FROM_50_TO_99("242", "50-99 employees", 50, 99),
    FROM_100_TO_249("251", "100-249 employees", 100, 249),
    FROM_250_TO_499("252", "250-499 employees", 250, 499),
    FROM_500_TO_999("254", "500-999 employees", 500, 999),
    OVER_1000("260", "1000+ employees", 1000, 5000);

    private final String code;
    private final String label;
    private final int min;
    private final int max;

    SizeClass(String code, String label, int min, int max) {
        this.code = code;
        this.label = label;
        this.min = min;
        this.max = max;
    }

    public String code() { return code; }
    public String label() { return label; }
    public int min() { return min; }
    public int max() { return max; }

    public static SizeClass fromCode(String code) {
        if (code != null) {
            for (SizeClass s : values()) {
                if (s.code.equals(code.trim())) return s;
            }
        }
        throw new EstimationException(ErrorKind.INVALID_INPUT, "Unknown CBP size class: " + code);
    }
}
