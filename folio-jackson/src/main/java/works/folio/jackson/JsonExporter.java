package works.folio.jackson;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JsonGenerator;
import tools.jackson.core.exc.JacksonIOException;
import tools.jackson.databind.ObjectWriter;
import tools.jackson.databind.SerializationFeature;
import tools.jackson.databind.json.JsonMapper;
import works.folio.ObjGen;
import works.folio.PdfArray;
import works.folio.PdfBoolean;
import works.folio.PdfDictionary;
import works.folio.PdfDocument;
import works.folio.PdfInteger;
import works.folio.PdfName;
import works.folio.PdfNull;
import works.folio.PdfObject;
import works.folio.PdfReal;
import works.folio.PdfReference;
import works.folio.PdfReserved;
import works.folio.PdfStream;
import works.folio.PdfString;
import works.folio.jackson.exceptions.JsonProcessingException;

import static java.nio.file.StandardOpenOption.CREATE;
import static java.nio.file.StandardOpenOption.TRUNCATE_EXISTING;
import static java.nio.file.StandardOpenOption.WRITE;
import static java.util.Objects.requireNonNull;
import static works.folio.jackson.JsonSchema.BINARY_PREFIX;
import static works.folio.jackson.JsonSchema.DATA;
import static works.folio.jackson.JsonSchema.DATAFILE;
import static works.folio.jackson.JsonSchema.DICT;
import static works.folio.jackson.JsonSchema.DOCUMENT;
import static works.folio.jackson.JsonSchema.MAX_OBJECT_ID;
import static works.folio.jackson.JsonSchema.OBJECTS;
import static works.folio.jackson.JsonSchema.PDF_VERSION;
import static works.folio.jackson.JsonSchema.STREAM;
import static works.folio.jackson.JsonSchema.TRAILER;
import static works.folio.jackson.JsonSchema.UNICODE_PREFIX;
import static works.folio.jackson.JsonSchema.VALUE;
import static works.folio.jackson.JsonSchema.objectKey;

/**
 * Writes documents in the JSON form that {@link JsonImporter} reads.
 * <p>
 * Objects are written in ascending id order, followed by the trailer.
 * Stream data is moved a chunk at a time, never held whole in memory.
 */
public final class JsonExporter {
	private final ObjectWriter writer;

	public JsonExporter() {
		this(JsonSchema.newMapper());
	}

	public JsonExporter(JsonMapper mapper) {
		this.writer = requireNonNull(mapper).writer().with(SerializationFeature.INDENT_OUTPUT);
	}

	/**
	 * Writes {@code document} to the file at {@code path}, replacing it.
	 *
	 * @see #writeJson(PdfDocument, OutputStream, JsonExportSettings)
	 */
	public void writeJson(PdfDocument document, Path path, JsonExportSettings settings) throws IOException {
		try (OutputStream out = Files.newOutputStream(path)) {
			writeJson(document, out, settings);
		}
	}

	/**
	 * Writes {@code document} to {@code out}, which is flushed but not closed.
	 *
	 * @throws IllegalArgumentException if {@code settings} ask for an unsupported version,
	 * or for data files without a file prefix
	 */
	public void writeJson(PdfDocument document, OutputStream out, JsonExportSettings settings) throws IOException {
		validate(settings);
		LOGGER.debug("Exporting {} with {}", document, settings);
		Set<String> wanted = settings.getWantedObjects();
		try (JsonGenerator gen = writer.createGenerator(out)) {
			gen.writeStartObject();
			gen.writeName(DOCUMENT);
			gen.writeStartObject();
			gen.writeName(PDF_VERSION);
			gen.writeString(document.pdfVersion());
			gen.writeName(MAX_OBJECT_ID);
			gen.writeNumber(document.maxObjectId());
			gen.writeName(OBJECTS);
			gen.writeStartObject();
			for (ObjGen og : document.objectIds()) {
				String key = objectKey(og);
				if (wanted.isEmpty() || wanted.contains(key)) {
					PdfObject object = requireNonNull(document.get(og));
					gen.writeName(key);
					if (object instanceof PdfStream stream) {
						writeStream(gen, stream, settings);
					} else {
						writeEntry(gen, object);
					}
				}
			}
			if (wanted.isEmpty() || wanted.contains(TRAILER)) {
				gen.writeName(TRAILER);
				writeEntry(gen, document.trailer());
			}
			gen.writeEndObject();
			gen.writeEndObject();
			gen.writeEndObject();
			gen.writeRaw('\n');
		} catch (JacksonIOException e) {
			throw (e.getCause() != null) ? e.getCause() : new IOException(e.getMessage(), e);
		}
	}

	private static void validate(JsonExportSettings settings) {
		if (settings.getVersion() != JsonSchema.VERSION) {
			throw new IllegalArgumentException("Unsupported JSON version " + settings.getVersion()
				+ "; only version " + JsonSchema.VERSION + " is supported");
		}
		if (settings.getStreamData() == StreamDataMode.FILE && settings.getFilePrefix() == null) {
			throw new IllegalArgumentException("Writing stream data to files requires a file prefix");
		}
	}

	private static void writeEntry(JsonGenerator gen, PdfObject object) {
		gen.writeStartObject();
		gen.writeName(VALUE);
		writeValue(gen, object);
		gen.writeEndObject();
	}

	private static void writeStream(JsonGenerator gen, PdfStream stream, JsonExportSettings settings) throws IOException {
		StreamDataMode mode = settings.getStreamData();
		boolean decode = mode != StreamDataMode.NONE && stream.isDecodable(settings.getDecodeLevel());
		PdfDictionary dict = stream.dict();
		if (decode && dict.containsKey("/Filter")) {
			// The data will no longer be encoded, so the filters no longer apply
			dict = dict.copy();
			dict.removeKey("/Filter");
			dict.removeKey("/DecodeParms");
		}
		gen.writeStartObject();
		gen.writeName(STREAM);
		gen.writeStartObject();
		gen.writeName(DICT);
		writeValue(gen, dict);
		switch (mode) {
			case NONE -> { }
			case INLINE -> {
				gen.writeName(DATA);
				stream.pipeStreamData(new Base64StringSink(gen), settings.getDecodeLevel());
			}
			case FILE -> {
				String filename = settings.getFilePrefix() + "-" + stream.objGen().objectId();
				try (FileChannel out = FileChannel.open(Path.of(filename), CREATE, TRUNCATE_EXISTING, WRITE)) {
					stream.pipeStreamData(out, settings.getDecodeLevel());
				}
				LOGGER.trace("Wrote data of {} to {}", stream.objGen(), filename);
				gen.writeName(DATAFILE);
				gen.writeString(filename);
			}
		}
		gen.writeEndObject();
		gen.writeEndObject();
	}

	static void writeValue(JsonGenerator gen, PdfObject object) {
		if (object instanceof PdfNull || object instanceof PdfReserved) {
			gen.writeNull();
		} else if (object instanceof PdfBoolean b) {
			gen.writeBoolean(b.value());
		} else if (object instanceof PdfInteger i) {
			gen.writeNumber(i.value());
		} else if (object instanceof PdfReal r) {
			gen.writeNumber(normalizeReal(r.text()));
		} else if (object instanceof PdfName n) {
			gen.writeString(n.value());
		} else if (object instanceof PdfString s) {
			gen.writeString(s.textValue()
				.map(text -> UNICODE_PREFIX + text)
				.orElseGet(() -> BINARY_PREFIX + s.hexValue()));
		} else if (object instanceof PdfReference ref) {
			gen.writeString(ref.objGen().toString());
		} else if (object instanceof PdfArray array) {
			gen.writeStartArray();
			for (PdfObject item : array.items()) {
				writeValue(gen, item);
			}
			gen.writeEndArray();
		} else if (object instanceof PdfDictionary dict) {
			gen.writeStartObject();
			for (Map.Entry<String, PdfObject> entry : dict.entries().entrySet()) {
				gen.writeName(entry.getKey());
				writeValue(gen, entry.getValue());
			}
			gen.writeEndObject();
		} else {
			throw new JsonProcessingException("Can't write " + object.typeName() + " as a direct value");
		}
	}

	/**
	 * PDF allows reals like {@code .5}, {@code -.5}, {@code +1} and {@code 5.} that JSON doesn't.
	 */
	static String normalizeReal(String text) {
		String result = text;
		if (result.startsWith("+")) {
			result = result.substring(1);
		}
		if (result.startsWith("-.")) {
			result = "-0" + result.substring(1);
		} else if (result.startsWith(".")) {
			result = "0" + result;
		}
		if (result.endsWith(".")) {
			result = result.substring(0, result.length() - 1);
		}
		return result;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(JsonExporter.class);
}
