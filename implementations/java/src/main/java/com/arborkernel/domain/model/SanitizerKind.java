package com.arborkernel.domain.model;

/**
 * Closed set of sanitizers, each owning one bit of the taint mask.
 *
 * <p>Bit 0x80 is reserved.
 */
public enum SanitizerKind {

    XSS(0x01, Confidence.VERIFIED),
    SQL(0x02, Confidence.VERIFIED),
    PATH_TRAVERSAL(0x04, Confidence.VERIFIED),
    PROMPT_INJECTION(0x08, Confidence.PLAUSIBLE),
    SSRF(0x10, Confidence.VERIFIED),
    LOG_INJECTION(0x20, Confidence.VERIFIED),
    DESERIALIZATION(0x40, Confidence.VERIFIED);

    private final int bit;
    private final Confidence certifies;

    SanitizerKind(int bit, Confidence certifies) {
        this.bit = bit;
        this.certifies = certifies;
    }

    public int bit() {
        return bit;
    }

    /**
     * Strongest confidence a successful run of this sanitizer can claim.
     */
    public Confidence certifies() {
        return certifies;
    }
}
