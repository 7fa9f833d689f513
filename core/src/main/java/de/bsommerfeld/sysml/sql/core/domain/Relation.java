package de.bsommerfeld.sysml.sql.core.domain;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * A directed, named edge between two elements, one row of the
 * {@code relations} table.
 *
 * @param id       unique relation identifier
 * @param type     type tag, the target's type for references lowered out of
 *                 an element attribute
 * @param name     the role, i.e. the attribute name the reference was found in
 * @param originId identifier of the referencing element
 * @param targetId identifier of the referenced element
 */
public record Relation(String id, String type, String name, String originId, String targetId) {

    /**
     * Builds the relation for a reference held in an element attribute. The
     * identifier is derived from origin, name and target, so importing the
     * same reference twice addresses the same row.
     */
    public static Relation lowered(String originId, String name, String targetId, String targetType) {
        return new Relation(loweredId(originId, name, targetId), targetType, name, originId, targetId);
    }

    public static String loweredId(String originId, String name, String targetId) {
        String key = originId + '\u0000' + name + '\u0000' + targetId;
        return UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8)).toString();
    }
}
