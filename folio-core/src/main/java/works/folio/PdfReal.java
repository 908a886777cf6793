package works.folio;

import java.math.BigDecimal;

import static java.util.Objects.requireNonNull;

/**
 * A real number, kept in the textual form it arrived in so that no precision
 * is lost to binary floating point.
 */
public final class PdfReal extends PdfObject {
	private final String text;

	public PdfReal(String text) {
		this.text = requireNonNull(text);
	}

	public String text() {
		return text;
	}

	/**
	 * @throws NumberFormatException if the text is not a number
	 */
	public BigDecimal decimalValue() {
		return new BigDecimal(text);
	}

	@Override
	public String typeName() {
		return "real";
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof PdfReal other && other.text.equals(text);
	}

	@Override
	public int hashCode() {
		return text.hashCode();
	}

	@Override
	public String toString() {
		return text;
	}
}
