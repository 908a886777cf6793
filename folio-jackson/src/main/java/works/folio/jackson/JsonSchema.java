package works.folio.jackson;

import java.util.regex.Pattern;
import tools.jackson.core.StreamReadConstraints;
import tools.jackson.core.StreamWriteFeature;
import tools.jackson.core.json.JsonFactory;
import tools.jackson.databind.json.JsonMapper;
import works.folio.ObjGen;

/**
 * Keys and string encodings of the document-exchange schema, shared by import and export.
 */
final class JsonSchema {
	static final int VERSION = 2;

	static final String DOCUMENT = "document";
	static final String PDF_VERSION = "pdfversion";
	static final String MAX_OBJECT_ID = "maxobjectid";
	static final String OBJECTS = "objects";
	static final String TRAILER = "trailer";
	static final String VALUE = "value";
	static final String STREAM = "stream";
	static final String DICT = "dict";
	static final String DATA = "data";
	static final String DATAFILE = "datafile";

	static final Pattern PDF_VERSION_PATTERN = Pattern.compile("^\\d+\\.\\d+$");
	static final Pattern OBJECT_KEY_PATTERN = Pattern.compile("^obj:(\\d+) (\\d+) R$");
	static final Pattern INDIRECT_OBJECT_PATTERN = Pattern.compile("^(\\d+) (\\d+) R$");
	static final Pattern UNICODE_PATTERN = Pattern.compile("^u:(.*)$", Pattern.DOTALL);
	static final Pattern BINARY_PATTERN = Pattern.compile("^b:((?:[0-9a-fA-F]{2})*)$");
	static final Pattern NAME_PATTERN = Pattern.compile("^/.*$", Pattern.DOTALL);
	static final Pattern INTEGER_PATTERN = Pattern.compile("^-?\\d+$");

	static final String UNICODE_PREFIX = "u:";
	static final String BINARY_PREFIX = "b:";
	static final String OBJECT_KEY_PREFIX = "obj:";

	private JsonSchema() { }

	static String objectKey(ObjGen og) {
		return OBJECT_KEY_PREFIX + og;
	}

	/**
	 * Stream data travels as one JSON string, so strings may be as long as the input.
	 * The mapper never closes the streams it's given.
	 */
	static JsonMapper newMapper() {
		return JsonMapper.builder(JsonFactory.builder()
				.streamReadConstraints(StreamReadConstraints.builder()
					.maxStringLength(Integer.MAX_VALUE)
					.build())
				.disable(StreamWriteFeature.AUTO_CLOSE_TARGET)
				.build())
			.build();
	}
}
