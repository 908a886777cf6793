package works.folio.jackson;

/**
 * Where exported stream data goes.
 */
public enum StreamDataMode {
	/** Only each stream's dictionary is exported */
	NONE,
	/** Base64 text in the stream's "data" member */
	INLINE,
	/** A separate file per stream, named in the stream's "datafile" member */
	FILE,
}
