package com.nightshade.sequence.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Symmetric camera binning. Serialized as the label ({@code "2x2"}); integers 1..4 are accepted on read.
 */
public enum Binning {
    ONE(1),
    TWO(2),
    THREE(3),
    FOUR(4);

    private final int factor;

    Binning(int factor) {
        this.factor = factor;
    }

    public int getFactor() {
        return factor;
    }

    @JsonValue
    public String getLabel() {
        return factor + "x" + factor;
    }

    @JsonCreator
    public static Binning fromValue(Object value) {
        if (value instanceof Number n) {
            return ofFactor(n.intValue());
        }
        if (value == null) return ONE;
        String s = value.toString().trim();
        for (Binning b : values()) {
            if (b.getLabel().equalsIgnoreCase(s) || b.name().equalsIgnoreCase(s)) return b;
        }
        try {
            return ofFactor(Integer.parseInt(s));
        } catch (NumberFormatException e) {
            return ONE;
        }
    }

    /** Factor outside 1..4 clamps to the nearest supported value. */
    public static Binning ofFactor(int factor) {
        if (factor <= 1) return ONE;
        if (factor >= 4) return FOUR;
        return values()[factor - 1];
    }
}
