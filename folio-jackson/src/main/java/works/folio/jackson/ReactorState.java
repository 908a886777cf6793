package works.folio.jackson;

/**
 * Where the importer is within the document schema.
 */
enum ReactorState {
	/** Before the root container */
	INITIAL,
	/** The root dictionary */
	TOP,
	/** The "document" dictionary */
	DOCUMENT,
	/** The "objects" dictionary */
	OBJECTS,
	/** The dictionary describing one object: its "value" or "stream" */
	OBJECT_TOP,
	/** Inside a PDF value being built */
	OBJECT,
	/** The dictionary of the "trailer" entry */
	TRAILER,
	/** The "stream" dictionary of an object */
	STREAM,
	/** Inside something the schema doesn't use */
	IGNORE,
}
