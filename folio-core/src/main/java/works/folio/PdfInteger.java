package works.folio;

import java.math.BigInteger;

import static java.util.Objects.requireNonNull;

public final class PdfInteger extends PdfObject {
	private final BigInteger value;

	public PdfInteger(BigInteger value) {
		this.value = requireNonNull(value);
	}

	public PdfInteger(long value) {
		this(BigInteger.valueOf(value));
	}

	public BigInteger value() {
		return value;
	}

	/**
	 * @throws ArithmeticException if the value doesn't fit in an int
	 */
	public int intValue() {
		return value.intValueExact();
	}

	@Override
	public String typeName() {
		return "integer";
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof PdfInteger other && other.value.equals(value);
	}

	@Override
	public int hashCode() {
		return value.hashCode();
	}

	@Override
	public String toString() {
		return value.toString();
	}
}
