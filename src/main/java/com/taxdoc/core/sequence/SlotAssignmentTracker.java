package com.taxdoc.core.sequence;

import com.taxdoc.core.model.JurisdictionSlot;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Remembers which slots already received a number in the current run so that ambiguous matches
 * spread over distinct slots. Repeated lookups for the same unit return the same slot.
 */
public final class SlotAssignmentTracker {

    private final Object lock = new Object();
    private final Map<String, Assignment> assignments = new LinkedHashMap<>();

    private record Assignment(String family, int slotIndex, String owner) {
    }

    /**
     * Picks one of {@code candidates} for {@code unitKey}, preferring a slot not yet assigned in
     * {@code family}.
     *
     * @param family  numbering family, usually the catalog code being resolved
     * @param owner   source file the unit belongs to; see {@link #release(String)}
     */
    public JurisdictionSlot choose(String family, List<JurisdictionSlot> candidates, String unitKey, String owner) {
        Objects.requireNonNull(family, "family");
        if (candidates == null || candidates.isEmpty()) {
            throw new IllegalArgumentException("No candidate slots for " + unitKey);
        }
        synchronized (lock) {
            String key = key(family, unitKey);
            if (unitKey != null) {
                Assignment cached = assignments.get(key);
                if (cached != null) {
                    for (JurisdictionSlot candidate : candidates) {
                        if (candidate.slotIndex() == cached.slotIndex()) {
                            return candidate;
                        }
                    }
                }
            }
            Set<Integer> taken = assignedSlots(family);
            JurisdictionSlot chosen = candidates.get(0);
            for (JurisdictionSlot candidate : candidates) {
                if (!taken.contains(candidate.slotIndex())) {
                    chosen = candidate;
                    break;
                }
            }
            if (unitKey != null) {
                assignments.put(key, new Assignment(family, chosen.slotIndex(), owner));
            }
            return chosen;
        }
    }

    /**
     * Forgets every assignment made for {@code owner}, e.g. after its file was aborted.
     */
    public int release(String owner) {
        synchronized (lock) {
            List<String> keys = new ArrayList<>();
            for (Map.Entry<String, Assignment> entry : assignments.entrySet()) {
                if (Objects.equals(entry.getValue().owner(), owner)) {
                    keys.add(entry.getKey());
                }
            }
            keys.forEach(assignments::remove);
            return keys.size();
        }
    }

    public Set<Integer> assignedSlots(String family) {
        synchronized (lock) {
            Set<Integer> slots = new HashSet<>();
            for (Assignment assignment : assignments.values()) {
                if (assignment.family().equals(family)) {
                    slots.add(assignment.slotIndex());
                }
            }
            return slots;
        }
    }

    private static String key(String family, String unitKey) {
        return family + "|" + unitKey;
    }
}
