package works.folio.jackson.exceptions;

/**
 * An unexpected error has occurred while importing or exporting.
 * <p>
 * This does not necessarily indicate a problem with the input,
 * but rather that some internal assumption has been violated,
 * or that stream data couldn't be moved where it was going.
 */
public final class JsonProcessingException extends FolioJsonException {
	public JsonProcessingException(String message) {
		super(message);
	}

	public JsonProcessingException(String message, Throwable cause) {
		super(message, cause);
	}
}
