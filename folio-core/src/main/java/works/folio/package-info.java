/**
 * The object graph of a PDF document.
 * <p>
 * A {@link works.folio.PdfDocument} owns every indirect object through its
 * {@link works.folio.ObjectTable}; containers point at indirect objects with
 * {@link works.folio.PdfReference}. Stream payloads are supplied lazily by
 * {@link works.folio.StreamDataProvider}s and decoded on the way out by the
 * {@link works.folio.filters.FilterPipeline}.
 */
package works.folio;
