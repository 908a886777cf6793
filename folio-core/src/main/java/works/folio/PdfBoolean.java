package works.folio;

public final class PdfBoolean extends PdfObject {
	private final boolean value;

	public PdfBoolean(boolean value) {
		this.value = value;
	}

	public boolean value() {
		return value;
	}

	@Override
	public String typeName() {
		return "boolean";
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof PdfBoolean other && other.value == value;
	}

	@Override
	public int hashCode() {
		return Boolean.hashCode(value);
	}

	@Override
	public String toString() {
		return Boolean.toString(value);
	}
}
