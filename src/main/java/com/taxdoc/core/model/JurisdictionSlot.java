package com.taxdoc.core.model;

import java.util.Objects;

/**
 * One configured jurisdiction. Slot indices are 1-based and follow the user's entry order.
 */
public record JurisdictionSlot(int slotIndex, String prefecture, String municipality) {

    public JurisdictionSlot {
        if (slotIndex < 1) {
            throw new IllegalArgumentException("slotIndex must be >= 1: " + slotIndex);
        }
        Objects.requireNonNull(prefecture, "prefecture");
        prefecture = prefecture.strip();
        if (prefecture.isEmpty()) {
            throw new IllegalArgumentException("prefecture must not be blank (slot " + slotIndex + ")");
        }
        municipality = municipality == null ? "" : municipality.strip();
    }

    public boolean hasMunicipality() {
        return !municipality.isEmpty();
    }

    @Override
    public String toString() {
        return hasMunicipality()
            ? "slot%d[%s/%s]".formatted(slotIndex, prefecture, municipality)
            : "slot%d[%s]".formatted(slotIndex, prefecture);
    }
}
