/**
 * Conversion between {@link works.folio.PdfDocument} and its JSON form.
 * <p>
 * {@link works.folio.jackson.JsonExporter} writes a document as JSON
 * and {@link works.folio.jackson.JsonImporter} reads it back,
 * either as a new document or as an update to an existing one.
 * Both move stream data in chunks, so documents with large streams
 * never need their data in memory all at once.
 */
package works.folio.jackson;
