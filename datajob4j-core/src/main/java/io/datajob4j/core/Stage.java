package io.datajob4j.core;

/**
 * Pipeline stage of one job run. The label is what operators see in failure notices.
 */
public enum Stage {

    FETCH("Fetch"),
    TRANSFORM("Transform"),
    FORMAT("Format"),
    DELIVERY("Delivery");

    private final String label;

    Stage(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
