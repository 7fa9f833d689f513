package de.bsommerfeld.sysml.sql.api.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** A reference as the API embeds it: {@code {"@id": "..."}}. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Identified(@JsonProperty("@id") String id) {
}
