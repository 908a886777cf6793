package works.folio.jackson.exceptions;

public sealed abstract class FolioJsonException extends RuntimeException permits
	JsonStructureException,
	JsonSchemaException,
	JsonProcessingException
{
	protected FolioJsonException(String message) {
		super(message);
	}

	protected FolioJsonException(String message, Throwable cause) {
		super(message, cause);
	}
}
