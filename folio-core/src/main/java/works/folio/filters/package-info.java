/**
 * Push-style decoders for the standard PDF stream filters,
 * chained together by {@link works.folio.filters.FilterPipeline}.
 */
package works.folio.filters;
