/**
 * Loads element records into the {@code elements} and {@code relations}
 * tables.
 *
 * <h2>Two passes, one transaction</h2>
 *
 * <pre>
 * ElementSource ──pass 1──▶ elements   (upsert per @id, references left out)
 *               ──pass 2──▶ relations  (one row per origin, property, target)
 * </pre>
 *
 * <p>
 * Pass 2 needs every element id of the document, so a reference to an
 * element later in the file resolves. A target outside the document is
 * looked up in the {@code elements} table; targets missing from both
 * become {@link de.bsommerfeld.sysml.sql.importer.DanglingReference}s
 * in the {@link de.bsommerfeld.sysml.sql.importer.ImportReport} instead of
 * rows. Any other failure rolls the whole import back.
 */
package de.bsommerfeld.sysml.sql.importer;
