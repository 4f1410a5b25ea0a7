package com.pathway.distribution;

/** Outcome of a capacity-checked admission: whether it was granted and the count seen before deciding. */
public final class Admission {

    private final boolean admitted;
    private final long observed;

    public Admission(boolean admitted, long observed) {
        this.admitted = admitted;
        this.observed = observed;
    }

    public boolean isAdmitted() {
        return admitted;
    }

    public long getObserved() {
        return observed;
    }

    @Override
    public String toString() {
        return (admitted ? "admitted" : "rejected") + "@" + observed;
    }
}
