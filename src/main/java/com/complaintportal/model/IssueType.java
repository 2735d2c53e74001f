package com.complaintportal.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum IssueType {
    ROAD("Road"),
    STREET_LIGHT("Street Light"),
    WATER("Water"),
    GARBAGE("Garbage"),
    OTHER("Other");

    // Used by request validation; keep in sync with the labels above
    public static final String LABEL_PATTERN = "Road|Street Light|Water|Garbage|Other";

    private final String label;

    IssueType(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static IssueType fromLabel(String label) {
        for (IssueType type : values()) {
            if (type.label.equals(label)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown issue type: " + label);
    }
}
