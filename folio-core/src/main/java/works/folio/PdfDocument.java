package works.folio;

import java.util.ArrayList;
import java.util.List;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.regex.Pattern;
import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * An in-memory PDF document: its version, its trailer,
 * and the {@link ObjectTable} of indirect objects.
 */
public class PdfDocument implements ObjectTable {
	public static final String DEFAULT_PDF_VERSION = "1.3";
	private static final Pattern PDF_VERSION = Pattern.compile("\\d+\\.\\d+");

	private final NavigableMap<ObjGen, PdfObject> objects = new TreeMap<>();
	private String pdfVersion = DEFAULT_PDF_VERSION;
	private PdfDictionary trailer = new PdfDictionary();

	/**
	 * @return the minimal document: version {@value #DEFAULT_PDF_VERSION},
	 * no objects, and a trailer of {@code << /Size 1 >>}
	 */
	public static PdfDocument empty() {
		PdfDocument result = new PdfDocument();
		result.trailer.replaceKey("/Size", new PdfInteger(1));
		return result;
	}

	public String pdfVersion() {
		return pdfVersion;
	}

	/**
	 * @param pdfVersion of the form {@code major.minor}
	 */
	public void setPdfVersion(String pdfVersion) {
		if (!PDF_VERSION.matcher(pdfVersion).matches()) {
			throw new IllegalArgumentException("Invalid PDF version \"" + pdfVersion + "\"");
		}
		this.pdfVersion = pdfVersion;
	}

	public PdfDictionary trailer() {
		return trailer;
	}

	public void setTrailer(PdfDictionary trailer) {
		this.trailer = requireNonNull(trailer);
	}

	@Override
	public @Nullable PdfObject get(ObjGen og) {
		return objects.get(og);
	}

	@Override
	public PdfReference reserveIfAbsent(ObjGen og) {
		objects.computeIfAbsent(og, k -> new PdfReserved());
		return new PdfReference(og);
	}

	@Override
	public PdfStream createStream(ObjGen og) {
		PdfStream result = new PdfStream(og);
		objects.put(og, result);
		return result;
	}

	@Override
	public void replace(ObjGen og, PdfObject replacement) {
		if (replacement instanceof PdfStream s && !s.objGen().equals(og)) {
			throw new IllegalArgumentException("Stream " + s.objGen() + " can't be stored as " + og);
		}
		objects.put(og, requireNonNull(replacement));
	}

	/**
	 * @return the ids of all stored objects, ascending by object number and then generation
	 */
	public List<ObjGen> objectIds() {
		return new ArrayList<>(objects.keySet());
	}

	/**
	 * @return the highest object number in use, or zero if there are no objects
	 */
	public int maxObjectId() {
		return objects.isEmpty() ? 0 : objects.lastKey().objectId();
	}

	/**
	 * Follows {@code object} if it's a reference.
	 *
	 * @return the referenced object, or {@code object} itself if it's not a reference.
	 * A reference to an id with nothing stored resolves to {@link PdfNull}.
	 */
	public PdfObject resolve(PdfObject object) {
		if (object instanceof PdfReference ref) {
			PdfObject result = objects.get(ref.objGen());
			return (result == null) ? new PdfNull() : result;
		} else {
			return object;
		}
	}

	@Override
	public String toString() {
		return "PdfDocument(" + pdfVersion + ", " + objects.size() + " objects)";
	}
}
