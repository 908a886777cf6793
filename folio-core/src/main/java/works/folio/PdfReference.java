package works.folio;

import static java.util.Objects.requireNonNull;

/**
 * Points to the indirect object stored under {@link #objGen()} in an {@link ObjectTable}.
 * <p>
 * Holders see whatever the table currently stores under that id,
 * so replacing a {@link PdfReserved} placeholder never requires revisiting them.
 */
public final class PdfReference extends PdfObject {
	private final ObjGen objGen;

	public PdfReference(ObjGen objGen) {
		this.objGen = requireNonNull(objGen);
	}

	public ObjGen objGen() {
		return objGen;
	}

	@Override
	public String typeName() {
		return "reference";
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof PdfReference other && other.objGen.equals(objGen);
	}

	@Override
	public int hashCode() {
		return objGen.hashCode();
	}

	@Override
	public String toString() {
		return objGen.toString();
	}
}
