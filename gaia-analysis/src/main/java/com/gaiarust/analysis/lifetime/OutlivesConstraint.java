package com.gaiarust.analysis.lifetime;

/**
 * 'longer: 'shorter，附带产生该约束的原因（便于报告）。
 * 相等性只看两端，原因不参与比较。
 */
public final class OutlivesConstraint {

    private final Lifetime longer;
    private final Lifetime shorter;
    private final String reason;

    public OutlivesConstraint(Lifetime longer, Lifetime shorter, String reason) {
        if (longer == null || shorter == null) throw new IllegalArgumentException("lifetimes are required");
        this.longer = longer;
        this.shorter = shorter;
        this.reason = reason != null ? reason : "";
    }

    public Lifetime getLonger() {
        return longer;
    }

    public Lifetime getShorter() {
        return shorter;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OutlivesConstraint)) return false;
        OutlivesConstraint that = (OutlivesConstraint) o;
        return longer.equals(that.longer) && shorter.equals(that.shorter);
    }

    @Override
    public int hashCode() {
        return 31 * longer.hashCode() + shorter.hashCode();
    }

    @Override
    public String toString() {
        return longer + ": " + shorter + (reason.isEmpty() ? "" : " (" + reason + ")");
    }
}
