package works.folio;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static java.util.Objects.requireNonNull;

public final class PdfArray extends PdfObject {
	private final List<PdfObject> items = new ArrayList<>();

	public PdfArray() {
	}

	public PdfArray(List<? extends PdfObject> items) {
		items.forEach(this::appendItem);
	}

	public void appendItem(PdfObject item) {
		if (requireNonNull(item) instanceof PdfStream) {
			throw new IllegalArgumentException("A stream can only be held by reference");
		}
		items.add(item);
	}

	public PdfObject get(int index) {
		return items.get(index);
	}

	public int size() {
		return items.size();
	}

	public List<PdfObject> items() {
		return Collections.unmodifiableList(items);
	}

	@Override
	public String typeName() {
		return "array";
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof PdfArray other && other.items.equals(items);
	}

	@Override
	public int hashCode() {
		return items.hashCode();
	}

	@Override
	public String toString() {
		return items.toString();
	}
}
