package com.unlistedjobs.archetype;

import java.util.Locale;

/**
 * Closed set of evidence source types as they appear in the evidence feed.
 * <p>
 * Every source belongs to exactly one {@link EvidenceKind} for headcount purposes, and has its own
 * salary observation weight in {@link EstimationConfig}. Ground-truth sources (payroll, visa filings,
 * negotiated wage tables) are weighted 4.0-5.0; posting ranges 1.5-2.0.
 */
public enum SalarySource {
    POSTING("posting"),
    ATS_GREENHOUSE("ats_greenhouse"),
    ATS_LEVER("ats_lever"),
    ATS_SMARTRECRUITERS("ats_smartrecruiters"),
    ATS_WORKDAY("ats_workday"),
    H1B_VISA("h1b_visa"),
    PERM_VISA("perm_visa"),
    PAYROLL("payroll"),
    STATE_PAYROLL("state_payroll"),
    CBA_PAY_TABLE("cba_pay_table");

    private final String code;

    SalarySource(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /**
     * @return the headcount evidence category this source contributes to
     */
    public EvidenceKind kind() {
        return switch (this) {
            case POSTING, ATS_GREENHOUSE, ATS_LEVER, ATS_SMARTRECRUITERS, ATS_WORKDAY -> EvidenceKind.POSTING;
            case H1B_VISA, PERM_VISA -> EvidenceKind.VISA;
            case PAYROLL, STATE_PAYROLL, CBA_PAY_TABLE -> EvidenceKind.PAYROLL;
        };
    }

    /**
     * Parses a feed code such as {@code "h1b_visa"}. Matching is case-insensitive.
     * @param code source type code
     * @return matching source
     * @throws EstimationException with {@link ErrorKind#INVALID_INPUT} for unknown codes
     */
    public static SalarySource fromCode(String code) {
        if (code != null) {
            String normalized = code.trim().toLowerCase(Locale.ROOT);
            for (SalarySource s : values()) {
                if (s.code.equals(normalized)) return s;
            }
        }
        throw new EstimationException(ErrorKind.INVALID_INPUT, "Unknown evidence source type: " + code);
    }
}
