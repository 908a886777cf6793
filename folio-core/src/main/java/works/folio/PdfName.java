package works.folio;

import static java.util.Objects.requireNonNull;

/**
 * A PDF name. The {@link #value() value} includes the leading solidus,
 * so the name {@code Type} has the value {@code "/Type"}.
 */
public final class PdfName extends PdfObject {
	private final String value;

	public PdfName(String value) {
		if (!requireNonNull(value).startsWith("/")) {
			throw new IllegalArgumentException("Name must start with '/': " + value);
		}
		this.value = value;
	}

	public String value() {
		return value;
	}

	@Override
	public String typeName() {
		return "name";
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof PdfName other && other.value.equals(value);
	}

	@Override
	public int hashCode() {
		return value.hashCode();
	}

	@Override
	public String toString() {
		return value;
	}
}
