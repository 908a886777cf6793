package works.folio;

public final class PdfNull extends PdfObject {
	@Override
	public String typeName() {
		return "null";
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof PdfNull;
	}

	@Override
	public int hashCode() {
		return 0;
	}

	@Override
	public String toString() {
		return "null";
	}
}
