package com.unlistedjobs.archetype;

import java.util.Objects;

/**
 * One County Business Patterns establishment class: establishments of one industry and size class in one metro.
 */
public record CbpEstablishment(
    String metroAreaId,
    String naicsCode,
    String naicsLabel,
    String industry,
    SizeClass sizeClass,
    int establishments,
    int employment
) {
    public CbpEstablishment {
        Objects.requireNonNull(metroAreaId, "metroAreaId");
        Objects.requireNonNull(naicsCode, "naicsCode");
        Objects.requireNonNull(sizeClass, "sizeClass");
        industry = industry == null || industry.isBlank() ? EvidenceRow.UNKNOWN_INDUSTRY : industry.trim();
        naicsLabel = naicsLabel == null ? naicsCode : naicsLabel;
        if (establishments < 0 || employment < 0) {
            throw new EstimationException(ErrorKind.INVALID_INPUT,
                "Negative establishment or employment count", metroAreaId + "/" + naicsCode);
        }
    }

    /**
     * Identity of the unnamed establishment group, used as the synthetic archetype's company id.
     */
    public String syntheticCompanyId() {
        return "cbp:" + naicsCode + ":" + sizeClass.code();
    }

    /**
     * Sums the counts of another row of the same metro, NAICS code and size class (e.g. a second county).
     */
    public CbpEstablishment combine(CbpEstablishment other) {
        if (!metroAreaId.equals(other.metroAreaId) || !naicsCode.equals(other.naicsCode)
                || sizeClass != other.sizeClass) {
            throw new EstimationException(ErrorKind.INVALID_INPUT, "Cannot combine establishment classes "
                + syntheticCompanyId() + " and " + other.syntheticCompanyId(), metroAreaId);
        }
        return new CbpEstablishment(metroAreaId, naicsCode, naicsLabel, industry, sizeClass,
            establishments + other.establishments, employment + other.employment);
    }
}
