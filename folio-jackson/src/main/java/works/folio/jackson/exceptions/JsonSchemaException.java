package works.folio.jackson.exceptions;

import java.util.List;
import works.folio.jackson.ImportProblem;

/**
 * The input was valid JSON but didn't match the document schema in one or more places.
 * <p>
 * Thrown only after the whole input has been read, so {@link #problems()}
 * lists every problem found, in input order.
 */
public final class JsonSchemaException extends FolioJsonException {
	private final List<ImportProblem> problems;

	public JsonSchemaException(String message, List<ImportProblem> problems) {
		super(message);
		this.problems = List.copyOf(problems);
	}

	public List<ImportProblem> problems() {
		return problems;
	}
}
