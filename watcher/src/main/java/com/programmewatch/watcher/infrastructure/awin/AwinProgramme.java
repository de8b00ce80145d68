package com.programmewatch.watcher.infrastructure.awin;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Fields of one entry of the AWIN publisher programmes response that the watcher
 * relies on. {@code id} is mandatory; a missing id is a schema mismatch.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AwinProgramme(String id, String name, String status) {

    static final String ACTIVE = "active";

    public boolean isActive() {
        return status == null || status.isBlank() || ACTIVE.equalsIgnoreCase(status.strip());
    }
}
