package works.folio.jackson.exceptions;

/**
 * The input can't be imported at all: it isn't valid JSON,
 * its root isn't a dictionary, or it couldn't be read.
 * <p>
 * Thrown as soon as the problem is found; nothing after that point is imported.
 */
public final class JsonStructureException extends FolioJsonException {
	public JsonStructureException(String message) {
		super(message);
	}

	public JsonStructureException(String message, Throwable cause) {
		super(message, cause);
	}
}
