package works.folio;

import org.jetbrains.annotations.Nullable;

/**
 * A node in the object graph of a {@link PdfDocument}.
 * <p>
 * Containers ({@link PdfArray}, {@link PdfDictionary}) hold their direct members;
 * indirect objects are held only by the {@link ObjectTable} and are
 * pointed to with {@link PdfReference}, never shared by value.
 */
public abstract sealed class PdfObject permits
	PdfNull,
	PdfBoolean,
	PdfInteger,
	PdfReal,
	PdfString,
	PdfName,
	PdfArray,
	PdfDictionary,
	PdfStream,
	PdfReference,
	PdfReserved
{
	private String description;

	/**
	 * @return human-readable text saying where this object came from, for diagnostics;
	 * null if nobody said.
	 */
	public @Nullable String description() {
		return description;
	}

	public void setDescription(@Nullable String description) {
		this.description = description;
	}

	/**
	 * @return the PDF type name used in messages, such as "dictionary" or "name"
	 */
	public abstract String typeName();
}
