package de.bsommerfeld.sysml.sql.api.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Project(@JsonProperty("@id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("defaultBranch") Identified defaultBranch) {
}
