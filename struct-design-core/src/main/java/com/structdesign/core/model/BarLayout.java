package com.structdesign.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Drawing hint for a bar group, derived from the bar count alone.
 */
public enum BarLayout {
    SINGLE_ROW("single_row"),
    DOUBLE_ROW("double_row"),
    MULTI_ROW("multi_row");

    private final String id;

    BarLayout(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    /**
     * Up to four bars fit one row, up to eight two rows, anything beyond is multi-row.
     *
     * @param count number of bars
     * @return layout classification
     */
    public static BarLayout forCount(int count) {
        if (count <= 4) {
            return SINGLE_ROW;
        }
        if (count <= 8) {
            return DOUBLE_ROW;
        }
        return MULTI_ROW;
    }
}
