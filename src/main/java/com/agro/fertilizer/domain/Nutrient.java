package com.agro.fertilizer.domain;

/**
 * The three nutrient axes a blend must cover.
 * Column names follow the input CSV headers used in the field office.
 */
public enum Nutrient {
    N("N", "N_pct", "N_req_kg_ha"),
    P2O5("P2O5", "P2O5_pct", "P2O5_req_kg_ha"),
    K2O("K2O", "K2O_pct", "K2O_req_kg_ha");

    private final String label;
    private final String contentColumn;
    private final String requirementColumn;

    Nutrient(String label, String contentColumn, String requirementColumn) {
        this.label = label;
        this.contentColumn = contentColumn;
        this.requirementColumn = requirementColumn;
    }

    public String label() {
        return label;
    }

    public String contentColumn() {
        return contentColumn;
    }

    public String requirementColumn() {
        return requirementColumn;
    }
}
