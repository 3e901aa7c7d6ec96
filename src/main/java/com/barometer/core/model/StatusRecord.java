package com.barometer.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * One line of output for the status-bar host.
 *
 * @param text    the text shown in the bar
 * @param status  the styling class, serialized as {@code class}
 * @param tooltip hover text; omitted from the JSON when null
 */
@JsonPropertyOrder({"text", "class", "tooltip"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StatusRecord(
    @JsonProperty("text") String text,
    @JsonProperty("class") StatusClass status,
    @JsonProperty("tooltip") String tooltip
) {
    public StatusRecord {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(status, "status");
    }

    public static StatusRecord of(String text, StatusClass status) {
        return new StatusRecord(text, status, null);
    }

    public StatusRecord withStatus(StatusClass newStatus) {
        return new StatusRecord(text, newStatus, tooltip);
    }
}
