package de.bsommerfeld.sysml.sql.importer;

/**
 * A reference whose target is not part of the imported collection. The
 * relation row is skipped, the import carries on.
 *
 * @param relationId identifier the relation row would have had
 * @param originId   element holding the reference
 * @param name       attribute (or relation type) the reference was found in
 * @param targetId   the identifier that could not be found
 */
public record DanglingReference(String relationId, String originId, String name, String targetId) {

    @Override
    public String toString() {
        return originId + "." + name + " -> " + targetId;
    }
}
