package works.folio;

import java.util.Comparator;

/**
 * Identifies one indirect object: an object number paired with a generation number.
 * <p>
 * Ordered by object number, then generation, which is the order in which
 * a {@link PdfDocument} lists its objects.
 */
public record ObjGen(int objectId, int generation) implements Comparable<ObjGen> {
	public ObjGen {
		if (objectId < 0) {
			throw new IllegalArgumentException("Object number must be non-negative: " + objectId);
		}
		if (generation < 0) {
			throw new IllegalArgumentException("Generation number must be non-negative: " + generation);
		}
	}

	public static ObjGen of(int objectId, int generation) {
		return new ObjGen(objectId, generation);
	}

	/**
	 * @throws IllegalArgumentException if either argument is not a non-negative decimal integer that fits in an int
	 */
	public static ObjGen parse(String objectId, String generation) {
		try {
			return new ObjGen(Integer.parseInt(objectId), Integer.parseInt(generation));
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid object id \"" + objectId + " " + generation + "\"", e);
		}
	}

	@Override
	public int compareTo(ObjGen other) {
		return ORDER.compare(this, other);
	}

	/**
	 * @return the reference in PDF syntax, {@code "n g R"}
	 */
	@Override
	public String toString() {
		return objectId + " " + generation + " R";
	}

	private static final Comparator<ObjGen> ORDER = Comparator
		.comparingInt(ObjGen::objectId)
		.thenComparingInt(ObjGen::generation);
}
