package works.folio;

/**
 * Placeholder stored in an {@link ObjectTable} for an object that has been
 * referenced but not yet defined. Carries no data.
 */
public final class PdfReserved extends PdfObject {
	@Override
	public String typeName() {
		return "reserved";
	}

	@Override
	public String toString() {
		return "reserved";
	}
}
