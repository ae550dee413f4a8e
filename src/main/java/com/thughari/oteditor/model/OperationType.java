package com.thughari.oteditor.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum OperationType {
    INSERT("insert"),
    DELETE("delete"),
    RETAIN("retain"),
    CURSOR("cursor"),
    SELECTION("selection");

    private final String wireName;

    OperationType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Insert and delete are the only kinds that change text; everything else is an identity
     * under transform.
     */
    public boolean editsText() {
        return this == INSERT || this == DELETE;
    }
}
