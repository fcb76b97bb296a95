package com.coparent.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which parent an item is assigned to. Slots are positional: family member ids
 * sorted ascending, the first is {@code parent1}.
 */
public enum ParentSlot {
    PARENT1("parent1"),
    PARENT2("parent2"),
    BOTH("both");

    private final String value;

    ParentSlot(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Slot for a position in the sorted member ids; null past the second member.
     */
    public static ParentSlot ofPosition(int index) {
        if (index == 0) {
            return PARENT1;
        }
        return index == 1 ? PARENT2 : null;
    }

    @JsonCreator
    public static ParentSlot fromValue(String value) {
        for (ParentSlot slot : values()) {
            if (slot.value.equalsIgnoreCase(value) || slot.name().equalsIgnoreCase(value)) {
                return slot;
            }
        }
        throw new IllegalArgumentException("Unknown parent slot: " + value);
    }
}
