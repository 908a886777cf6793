package works.folio.jackson;

/**
 * One place where the input didn't match the document schema.
 *
 * @param object the entry being imported when the problem was found,
 *               like {@code "obj:3 0 R"} or {@code "trailer"}; empty outside any entry
 * @param offset byte offset into the input
 */
public record ImportProblem(String object, long offset, String message) {
	/**
	 * @return the problem as a diagnostic line prefixed by {@code inputName}
	 */
	public String describe(String inputName) {
		if (object.isEmpty()) {
			return inputName + " (offset " + offset + "): " + message;
		} else {
			return inputName + " (" + object + ", offset " + offset + "): " + message;
		}
	}
}
