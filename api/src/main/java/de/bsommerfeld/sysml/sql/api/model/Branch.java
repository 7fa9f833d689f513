package de.bsommerfeld.sysml.sql.api.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A branch of a project.
 *
 * @param head the commit the branch currently points at, {@code null} for a
 *             branch without commits
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Branch(@JsonProperty("@id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("head") Identified head) {
}
