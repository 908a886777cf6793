package works.folio.jackson;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;
import java.util.List;
import java.util.Set;
import java.util.zip.Deflater;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.json.JsonMapper;
import works.folio.DecodeLevel;
import works.folio.ObjGen;
import works.folio.PdfArray;
import works.folio.PdfBoolean;
import works.folio.PdfDictionary;
import works.folio.PdfDocument;
import works.folio.PdfInteger;
import works.folio.PdfName;
import works.folio.PdfNull;
import works.folio.PdfReal;
import works.folio.PdfReference;
import works.folio.PdfStream;
import works.folio.PdfString;
import works.folio.StreamDataProvider;

import static java.nio.charset.StandardCharsets.US_ASCII;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.endsWith;
import static org.hamcrest.Matchers.lessThan;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonExporterTest {
	static final JsonMapper MAPPER = JsonMapper.builder().build();

	final JsonExporter exporter = new JsonExporter();
	PdfDocument document;

	@TempDir
	Path tempDir;

	@BeforeEach
	void setupDocument() {
		document = PdfDocument.empty();
		document.setPdfVersion("1.7");
		PdfDictionary catalog = new PdfDictionary();
		catalog.replaceKey("/Type", new PdfName("/Catalog"));
		catalog.replaceKey("/Pages", new PdfReference(ObjGen.of(2, 0)));
		document.replace(ObjGen.of(1, 0), catalog);
		document.replace(ObjGen.of(2, 0), new PdfArray(List.of(new PdfInteger(1), new PdfReal(".5"), new PdfBoolean(false), new PdfNull())));
		document.trailer().replaceKey("/Root", new PdfReference(ObjGen.of(1, 0)));
	}

	@Test
	void objects_areWrittenInSchema() throws IOException {
		assertEquals(MAPPER.readTree("""
			{"document": {
				"pdfversion": "1.7",
				"maxobjectid": 2,
				"objects": {
					"obj:1 0 R": {"value": {"/Type": "/Catalog", "/Pages": "2 0 R"}},
					"obj:2 0 R": {"value": [1, 0.5, false, null]},
					"trailer": {"value": {"/Size": 1, "/Root": "1 0 R"}}
				}
			}}
			"""), MAPPER.readTree(export(JsonExportSettings.defaults())));
	}

	@Test
	void output_isOrderedAndEndsWithNewline() throws IOException {
		document.replace(ObjGen.of(10, 0), new PdfInteger(10));
		document.replace(ObjGen.of(3, 1), new PdfInteger(3));
		String json = export(JsonExportSettings.defaults());
		assertThat(json.indexOf("\"obj:2 0 R\""), lessThan(json.indexOf("\"obj:3 1 R\"")));
		assertThat(json.indexOf("\"obj:3 1 R\""), lessThan(json.indexOf("\"obj:10 0 R\"")));
		assertThat(json.indexOf("\"obj:10 0 R\""), lessThan(json.indexOf("\"trailer\"")));
		assertThat(json, endsWith("}\n"));
	}

	@Test
	void strings_areTextOrHex() throws IOException {
		document.replace(ObjGen.of(3, 0), new PdfArray(List.of(
			PdfString.unicode("plain"),
			PdfString.unicode("naïve"),
			PdfString.of(new byte[] { 0, 1, (byte) 0xFE }))));
		JsonNode value = objects(export(JsonExportSettings.defaults())).get("obj:3 0 R").get("value");
		assertEquals("u:plain", value.get(0).asString());
		assertEquals("u:naïve", value.get(1).asString());
		assertEquals("b:0001fe", value.get(2).asString());
	}

	@Test
	void reservedObject_isNull() throws IOException {
		document.reserveIfAbsent(ObjGen.of(5, 0));
		JsonNode entry = objects(export(JsonExportSettings.defaults())).get("obj:5 0 R");
		assertTrue(entry.get("value").isNull());
	}

	@ParameterizedTest
	@CsvSource({
		".5, 0.5",
		"-.5, -0.5",
		"5., 5",
		"+1.25, 1.25",
		"-3.0, -3.0",
	})
	void reals_areNormalizedForJson(String pdf, String json) {
		assertEquals(json, JsonExporter.normalizeReal(pdf));
	}

	@Test
	void decodableStream_isExportedDecoded() throws IOException {
		byte[] content = "BT /F1 12 Tf (Hello) Tj ET".getBytes(US_ASCII);
		flateStream(ObjGen.of(3, 0), content);

		JsonNode stream = objects(export(JsonExportSettings.defaults())).get("obj:3 0 R").get("stream");
		assertFalse(stream.get("dict").has("/Filter"));
		assertFalse(stream.get("dict").has("/DecodeParms"));
		assertEquals("/XObject", stream.get("dict").get("/Type").asString());
		assertArrayEquals(content, Base64.getDecoder().decode(stream.get("data").asString()));
	}

	@Test
	void decodeLevelNone_exportsRawWithFilters() throws IOException {
		byte[] content = "raw".getBytes(US_ASCII);
		byte[] deflated = flateStream(ObjGen.of(3, 0), content);

		JsonNode stream = objects(export(JsonExportSettings.builder().decodeLevel(DecodeLevel.NONE).build()))
			.get("obj:3 0 R").get("stream");
		assertEquals("/FlateDecode", stream.get("dict").get("/Filter").asString());
		assertArrayEquals(deflated, Base64.getDecoder().decode(stream.get("data").asString()));
	}

	@Test
	void undecodableStream_exportsRawWithFilters() throws IOException {
		byte[] encoded = { 0x02, 'a', 'b', 'c', (byte) 0x80 };
		PdfStream stream = document.createStream(ObjGen.of(3, 0));
		stream.dict().replaceKey("/Filter", new PdfName("/RunLengthDecode"));
		stream.replaceStreamData(StreamDataProvider.ofBytes(encoded));

		JsonNode generalized = objects(export(JsonExportSettings.defaults())).get("obj:3 0 R").get("stream");
		assertEquals("/RunLengthDecode", generalized.get("dict").get("/Filter").asString());
		assertArrayEquals(encoded, Base64.getDecoder().decode(generalized.get("data").asString()));

		JsonNode specialized = objects(export(JsonExportSettings.builder().decodeLevel(DecodeLevel.SPECIALIZED).build()))
			.get("obj:3 0 R").get("stream");
		assertFalse(specialized.get("dict").has("/Filter"));
		assertArrayEquals("abc".getBytes(US_ASCII), Base64.getDecoder().decode(specialized.get("data").asString()));
	}

	@Test
	void largeStream_isStreamedInline() throws IOException {
		byte[] content = new byte[100_000];
		for (int i = 0; i < content.length; i++) {
			content[i] = (byte) (i * 31);
		}
		PdfStream stream = document.createStream(ObjGen.of(3, 0));
		stream.replaceStreamData(StreamDataProvider.ofBytes(content));

		JsonNode exported = objects(export(JsonExportSettings.defaults())).get("obj:3 0 R").get("stream");
		assertArrayEquals(content, Base64.getDecoder().decode(exported.get("data").asString()));
	}

	@Test
	void streamDataNone_writesOnlyDict() throws IOException {
		flateStream(ObjGen.of(3, 0), "x".getBytes(US_ASCII));
		JsonNode stream = objects(export(JsonExportSettings.builder().streamData(StreamDataMode.NONE).build()))
			.get("obj:3 0 R").get("stream");
		assertEquals(1, stream.size());
		assertEquals("/FlateDecode", stream.get("dict").get("/Filter").asString());
	}

	@Test
	void streamDataFile_writesOneFilePerStream() throws IOException {
		byte[] content = "external".getBytes(US_ASCII);
		flateStream(ObjGen.of(3, 0), content);
		String prefix = tempDir.resolve("data").toString();

		JsonNode stream = objects(export(JsonExportSettings.builder()
			.streamData(StreamDataMode.FILE)
			.filePrefix(prefix)
			.build()))
			.get("obj:3 0 R").get("stream");

		assertFalse(stream.has("data"));
		assertEquals(prefix + "-3", stream.get("datafile").asString());
		assertArrayEquals(content, Files.readAllBytes(Path.of(prefix + "-3")));
		assertFalse(stream.get("dict").has("/Filter"));
	}

	@Test
	void wantedObjects_restrictsOutput() throws IOException {
		JsonNode root = MAPPER.readTree(export(JsonExportSettings.builder()
			.wantedObjects(Set.of("trailer"))
			.build()));
		JsonNode objects = root.get("document").get("objects");
		assertEquals(1, objects.size());
		assertTrue(objects.has("trailer"));
		assertEquals(2, root.get("document").get("maxobjectid").asInt());
	}

	@Test
	void wantedObjects_canOmitTrailer() throws IOException {
		JsonNode objects = objects(export(JsonExportSettings.builder()
			.wantedObjects(Set.of("obj:2 0 R"))
			.build()));
		assertEquals(1, objects.size());
		assertTrue(objects.has("obj:2 0 R"));
	}

	@Test
	void unsupportedVersion_throws() {
		JsonExportSettings settings = JsonExportSettings.builder().version(1).build();
		assertThrows(IllegalArgumentException.class, () -> export(settings));
	}

	@Test
	void fileModeWithoutPrefix_throws() {
		JsonExportSettings settings = JsonExportSettings.builder().streamData(StreamDataMode.FILE).build();
		assertThrows(IllegalArgumentException.class, () -> export(settings));
	}

	@Test
	void streamDataFailure_propagates() {
		PdfStream stream = document.createStream(ObjGen.of(3, 0));
		stream.replaceStreamData(StreamDataProvider.ofBytes("9jqo^~x".getBytes(US_ASCII)));
		stream.dict().replaceKey("/Filter", new PdfName("/A85"));
		assertThrows(IOException.class, () -> export(JsonExportSettings.defaults()));
	}

	@Test
	void outputFailure_surfacesOriginalIOException() {
		IOException failure = new IOException("disk full");
		OutputStream broken = new OutputStream() {
			@Override
			public void write(int b) throws IOException {
				throw failure;
			}

			@Override
			public void write(byte[] b, int off, int len) throws IOException {
				throw failure;
			}
		};
		IOException e = assertThrows(IOException.class, () -> exporter.writeJson(document, broken, JsonExportSettings.defaults()));
		assertEquals(failure, e);
	}

	@Test
	void toPath_writesFile() throws IOException {
		Path file = tempDir.resolve("out.json");
		exporter.writeJson(document, file, JsonExportSettings.defaults());
		assertEquals(MAPPER.readTree(export(JsonExportSettings.defaults())), MAPPER.readTree(Files.readString(file)));
	}

	private byte[] flateStream(ObjGen og, byte[] content) {
		byte[] deflated = deflate(content);
		PdfStream stream = document.createStream(og);
		stream.dict().replaceKey("/Type", new PdfName("/XObject"));
		stream.dict().replaceKey("/Filter", new PdfName("/FlateDecode"));
		stream.dict().replaceKey("/Length", new PdfInteger(deflated.length));
		stream.replaceStreamData(StreamDataProvider.ofBytes(deflated));
		return deflated;
	}

	private String export(JsonExportSettings settings) throws IOException {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		exporter.writeJson(document, out, settings);
		return out.toString(UTF_8);
	}

	private static JsonNode objects(String json) {
		return MAPPER.readTree(json).get("document").get("objects");
	}

	static byte[] deflate(byte[] data) {
		Deflater deflater = new Deflater();
		deflater.setInput(data);
		deflater.finish();
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		byte[] buffer = new byte[1024];
		while (!deflater.finished()) {
			out.write(buffer, 0, deflater.deflate(buffer));
		}
		deflater.end();
		return out.toByteArray();
	}
}
