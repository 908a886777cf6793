package works.folio;

import org.jetbrains.annotations.Nullable;

/**
 * Storage for indirect objects, keyed by {@link ObjGen}.
 * <p>
 * The table is the sole owner of every indirect object. Everyone else
 * refers to them with {@link PdfReference}, so {@link #replace} is visible to all holders at once.
 */
public interface ObjectTable {
	/**
	 * @return the object stored under {@code og}, or null if there is none
	 */
	@Nullable PdfObject get(ObjGen og);

	/**
	 * If nothing is stored under {@code og}, stores a {@link PdfReserved} placeholder there.
	 *
	 * @return a reference to {@code og}
	 */
	PdfReference reserveIfAbsent(ObjGen og);

	/**
	 * Stores a new stream with an empty dictionary and no data under {@code og},
	 * replacing whatever was there.
	 */
	PdfStream createStream(ObjGen og);

	/**
	 * Stores {@code replacement} under {@code og}, replacing whatever was there.
	 *
	 * @throws IllegalArgumentException if {@code replacement} is a stream stored under some other id
	 */
	void replace(ObjGen og, PdfObject replacement);

	default boolean isReserved(ObjGen og) {
		return get(og) instanceof PdfReserved;
	}
}
