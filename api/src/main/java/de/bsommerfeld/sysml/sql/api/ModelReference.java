package de.bsommerfeld.sysml.sql.api;

/** A resolved project and commit. */
public record ModelReference(String projectId, String commitId) {
}
