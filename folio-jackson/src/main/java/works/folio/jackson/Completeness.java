package works.folio.jackson;

/**
 * Whether an import describes a whole document or only changes to one.
 */
public enum Completeness {
	/**
	 * The input must carry a PDF version and a trailer,
	 * and every stream must carry its data.
	 */
	FULL,

	/**
	 * Anything may be left out. A stream without data keeps the data it already had.
	 */
	PARTIAL,
}
