package works.folio;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * An ordered mapping from keys to values.
 * Keys are names written with their leading solidus, like {@code "/Type"}.
 */
public final class PdfDictionary extends PdfObject {
	private final Map<String, PdfObject> entries = new LinkedHashMap<>();

	public @Nullable PdfObject get(String key) {
		return entries.get(key);
	}

	public boolean containsKey(String key) {
		return entries.containsKey(key);
	}

	public void replaceKey(String key, PdfObject value) {
		if (requireNonNull(value) instanceof PdfStream) {
			throw new IllegalArgumentException("A stream can only be held by reference");
		}
		entries.put(requireNonNull(key), value);
	}

	public void removeKey(String key) {
		entries.remove(key);
	}

	public Map<String, PdfObject> entries() {
		return Collections.unmodifiableMap(entries);
	}

	public int size() {
		return entries.size();
	}

	/**
	 * @return a shallow copy: a new dictionary holding the same values
	 */
	public PdfDictionary copy() {
		PdfDictionary result = new PdfDictionary();
		result.entries.putAll(entries);
		result.setDescription(description());
		return result;
	}

	@Override
	public String typeName() {
		return "dictionary";
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof PdfDictionary other && other.entries.equals(entries);
	}

	@Override
	public int hashCode() {
		return entries.hashCode();
	}

	@Override
	public String toString() {
		return entries.toString();
	}
}
