package works.folio.jackson;

/**
 * Receives the structure of a JSON document as it is parsed, in document order.
 * <p>
 * For a member whose value is a container, the item callback comes first,
 * carrying the still-empty container; then {@link #containerStart},
 * the container's own members, and finally {@link #containerEnd}.
 * The root container gets only {@link #containerStart} and {@link #containerEnd}.
 */
public interface JsonEventHandler {
	void containerStart(Value container);

	/**
	 * @param container the container that just ended, with its {@link Value#end() end} offset
	 */
	void containerEnd(Value container);

	void dictionaryItem(String key, Value value);

	void arrayItem(Value value);

	/**
	 * Called if the whole document is a single scalar.
	 */
	void topLevelScalar();
}
