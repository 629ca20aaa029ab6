package com.landingzone.orchestrator.storage.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Response of GET /storage/v1/b/{bucket}/o. Only the fields we read.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ObjectListResponse(List<Item> items, String nextPageToken) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Item(String name) {}

    public List<Item> itemsOrEmpty() {
        return items == null ? List.of() : items;
    }
}
