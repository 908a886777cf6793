package works.folio;

/**
 * How much filtering is undone before a stream's bytes are handed out.
 * Each level decodes everything the previous one does.
 */
public enum DecodeLevel {
	/**
	 * Raw bytes, exactly as stored.
	 */
	NONE,

	/**
	 * Lossless general-purpose filters:
	 * {@code /FlateDecode}, {@code /LZWDecode}, {@code /ASCII85Decode} and {@code /ASCIIHexDecode},
	 * including PNG and TIFF predictors.
	 */
	GENERALIZED,

	/**
	 * Adds lossless special-purpose filters: {@code /RunLengthDecode}.
	 */
	SPECIALIZED,

	/**
	 * Adds lossy image filters. None are supported,
	 * so streams using them are left encoded.
	 */
	ALL;

	public boolean includes(DecodeLevel other) {
		return this.compareTo(other) >= 0;
	}
}
