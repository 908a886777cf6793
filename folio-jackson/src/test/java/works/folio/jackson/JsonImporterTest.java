package works.folio.jackson;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import works.folio.BufferInputSource;
import works.folio.DecodeLevel;
import works.folio.InputSource;
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
import works.folio.PdfStream;
import works.folio.PdfString;
import works.folio.StreamDataProvider;
import works.folio.jackson.exceptions.JsonSchemaException;
import works.folio.jackson.exceptions.JsonStructureException;

import static java.nio.charset.StandardCharsets.US_ASCII;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonImporterTest {
	static final ObjGen OBJ_1 = ObjGen.of(1, 0);
	static final ObjGen OBJ_2 = ObjGen.of(2, 0);
	static final ObjGen OBJ_4 = ObjGen.of(4, 0);

	final JsonImporter importer = new JsonImporter();

	@TempDir
	Path tempDir;

	@Test
	void nameObjectAndTrailer_imports() {
		PdfDocument document = importer.createFromJson(json("""
			{"document":{"pdfversion":"1.3","objects":{"obj:1 0 R":{"value":"/Catalog"},"trailer":{"value":{"/Size":2}}}}}
			"""));
		assertEquals("1.3", document.pdfVersion());
		assertEquals(List.of(OBJ_1), document.objectIds());
		assertEquals(new PdfName("/Catalog"), document.get(OBJ_1));
		assertEquals(new PdfInteger(2), document.trailer().get("/Size"));
	}

	@Test
	void inlineStream_decodesBase64() throws IOException {
		PdfDocument document = importer.createFromJson(json(fullDocument("""
			"obj:4 0 R": {"stream": {"dict": {"/K": true}, "data": "cG90YXRv"}}
			""")));
		PdfStream stream = (PdfStream) document.get(OBJ_4);
		assertEquals(new PdfBoolean(true), stream.dict().get("/K"));
		assertArrayEquals("potato".getBytes(US_ASCII), stream.getStreamData(DecodeLevel.NONE));
	}

	@Test
	void inlineStream_canBeReadRepeatedly() throws IOException {
		PdfDocument document = importer.createFromJson(json(fullDocument("""
			"obj:4 0 R": {"stream": {"dict": {}, "data": "cG90 YXRv"}}
			""")));
		PdfStream stream = (PdfStream) document.get(OBJ_4);
		assertArrayEquals("potato".getBytes(US_ASCII), stream.getStreamData(DecodeLevel.NONE));
		assertArrayEquals("potato".getBytes(US_ASCII), stream.getStreamData(DecodeLevel.NONE));
	}

	@Test
	void emptyData_isEmptyStream() throws IOException {
		PdfDocument document = importer.createFromJson(json(fullDocument("""
			"obj:4 0 R": {"stream": {"dict": {}, "data": ""}}
			""")));
		assertArrayEquals(new byte[0], ((PdfStream) document.get(OBJ_4)).getStreamData(DecodeLevel.NONE));
	}

	@Test
	void datafile_readsExternalFile() throws IOException {
		Path data = tempDir.resolve("payload.bin");
		Files.write(data, new byte[] { 1, 2, 3 });
		PdfDocument document = importer.createFromJson(json(fullDocument(
			"\"obj:4 0 R\": {\"stream\": {\"dict\": {}, \"datafile\": \"" + jsonPath(data) + "\"}}")));
		assertArrayEquals(new byte[] { 1, 2, 3 }, ((PdfStream) document.get(OBJ_4)).getStreamData(DecodeLevel.NONE));
	}

	@Test
	void importedStream_keepsFilters() throws IOException {
		// "48656c6c6f>" in base64
		PdfDocument document = importer.createFromJson(json(fullDocument("""
			"obj:4 0 R": {"stream": {"dict": {"/Filter": "/AHx"}, "data": "NDg2NTZjNmM2Zj4="}}
			""")));
		PdfStream stream = (PdfStream) document.get(OBJ_4);
		assertArrayEquals("48656c6c6f>".getBytes(US_ASCII), stream.getStreamData(DecodeLevel.NONE));
		assertArrayEquals("Hello".getBytes(US_ASCII), stream.getStreamData(DecodeLevel.GENERALIZED));
	}

	@Test
	void forwardReference_resolvesToLaterDefinition() {
		PdfDocument document = importer.createFromJson(json(fullDocument("""
			"obj:1 0 R": {"value": {"/Next": "2 0 R"}},
			"obj:2 0 R": {"value": [1, 2]}
			""")));
		PdfDictionary one = (PdfDictionary) document.get(OBJ_1);
		PdfObject next = document.resolve(one.get("/Next"));
		assertThat(next, sameInstance(document.get(OBJ_2)));
		assertEquals(new PdfArray(List.of(new PdfInteger(1), new PdfInteger(2))), next);
	}

	@Test
	void unresolvedReference_becomesNull() {
		PdfDocument document = importer.createFromJson(json(fullDocument("""
			"obj:1 0 R": {"value": ["9 0 R"]}
			""")));
		assertEquals(new PdfArray(List.of(new PdfReference(ObjGen.of(9, 0)))), document.get(OBJ_1));
		assertThat(document.get(ObjGen.of(9, 0)), instanceOf(PdfNull.class));
		assertFalse(document.isReserved(ObjGen.of(9, 0)));
	}

	@Test
	void malformedUpdate_leavesNoReservedObjects() {
		PdfDocument document = PdfDocument.empty();
		assertThrows(JsonStructureException.class, () -> importer.updateFromJson(document, json("""
			{"document": {"objects": {
				"obj:1 0 R": {"value": "5 0 R"},
				"obj:2 0 R": {"value": [}
			}}}
			""")));
		ObjGen five = ObjGen.of(5, 0);
		assertFalse(document.isReserved(five));
		assertThat(document.get(five), instanceOf(PdfNull.class));
		assertEquals(new PdfReference(five), document.get(OBJ_1));
	}

	@Test
	void selfReference_isAllowed() {
		PdfDocument document = importer.createFromJson(json(fullDocument("""
			"obj:1 0 R": {"value": {"/Self": "1 0 R"}}
			""")));
		PdfDictionary one = (PdfDictionary) document.get(OBJ_1);
		assertThat(document.resolve(one.get("/Self")), sameInstance(one));
	}

	@Test
	void scalars_areClassified() {
		PdfDocument document = importer.createFromJson(json(fullDocument("""
			"obj:1 0 R": {"value": [
				null, false, 12, -3, 123456789012345678901234567890, 1.50, -0.25, 1e3,
				"u:café", "u:plain", "b:00ff", "/Name", "/", "3 0 R", {"/Nested": []}
			]}
			""")));
		PdfArray array = (PdfArray) document.get(OBJ_1);
		assertEquals(new PdfNull(), array.get(0));
		assertEquals(new PdfBoolean(false), array.get(1));
		assertEquals(new PdfInteger(12), array.get(2));
		assertEquals(new PdfInteger(-3), array.get(3));
		assertEquals(new PdfInteger(new BigInteger("123456789012345678901234567890")), array.get(4));
		assertEquals(new PdfReal("1.50"), array.get(5));
		assertEquals(new PdfReal("-0.25"), array.get(6));
		assertEquals(new PdfReal("1e3"), array.get(7));
		assertEquals(PdfString.unicode("café"), array.get(8));
		assertEquals(PdfString.of("plain".getBytes(US_ASCII)), array.get(9));
		assertEquals(PdfString.of(new byte[] { 0, (byte) 0xFF }), array.get(10));
		assertEquals(new PdfName("/Name"), array.get(11));
		assertEquals(new PdfName("/"), array.get(12));
		assertEquals(new PdfReference(ObjGen.of(3, 0)), array.get(13));
		PdfDictionary nested = new PdfDictionary();
		nested.replaceKey("/Nested", new PdfArray());
		assertEquals(nested, array.get(14));
	}

	@Test
	void dictionaryNullValue_isKept() {
		PdfDocument document = importer.createFromJson(json(fullDocument("""
			"obj:1 0 R": {"value": {"/A": null}}
			""")));
		PdfDictionary dict = (PdfDictionary) document.get(OBJ_1);
		assertTrue(dict.containsKey("/A"));
		assertEquals(new PdfNull(), dict.get("/A"));
	}

	@Test
	void objects_areDescribedByOffset() {
		String text = fullDocument("""
			"obj:1 0 R": {"value": "/X"}
			""");
		PdfDocument document = importer.createFromJson(json(text));
		int offset = text.getBytes(UTF_8).length - text.substring(text.indexOf("\"/X\"")).getBytes(UTF_8).length;
		assertEquals("test.json offset " + offset, document.get(OBJ_1).description());
	}

	@Test
	void unknownKeys_areIgnored() {
		PdfDocument document = importer.createFromJson(json("""
			{"version": 2, "extra": [1, {"a": "b"}], "document": {
				"pdfversion": "1.7",
				"maxobjectid": 99,
				"future": {"x": ["y"]},
				"objects": {
					"obj:1 0 R": {"value": 1, "comment": {"any": "thing"}},
					"trailer": {"value": {}, "note": "ignored"}
				}
			}}
			"""));
		assertEquals("1.7", document.pdfVersion());
		assertEquals(new PdfInteger(1), document.get(OBJ_1));
	}

	@Test
	void repeatedObjectKey_lastWins() {
		PdfDocument document = importer.createFromJson(json(fullDocument("""
			"obj:1 0 R": {"value": "/First"},
			"obj:1 0 R": {"value": "/Second"}
			""")));
		assertEquals(new PdfName("/Second"), document.get(OBJ_1));
	}

	@Test
	void create_startsFromMinimalDocument() {
		PdfDocument document = importer.createFromJson(json("""
			{"document": {"pdfversion": "2.0", "objects": {"trailer": {"value": {"/Root": "1 0 R"}}}}}
			"""));
		assertEquals("2.0", document.pdfVersion());
		assertEquals(new PdfReference(OBJ_1), document.trailer().get("/Root"));
		assertFalse(document.trailer().containsKey("/Size"));
		assertThat(document.get(OBJ_1), instanceOf(PdfNull.class));
	}

	@Test
	void bothValueAndStream_isOneError() {
		assertThat(problems(fullDocument("""
			"obj:1 0 R": {"value": 1, "stream": {"dict": {}, "data": ""}}
			""")), contains("object must have exactly one of \"value\" or \"stream\""));
	}

	@Test
	void neitherValueNorStream_isOneError() {
		List<ImportProblem> problems = schemaProblems(json(fullDocument("""
			"obj:1 0 R": {}
			""")), Completeness.FULL);
		assertEquals(1, problems.size());
		assertEquals("obj:1 0 R", problems.get(0).object());
		assertEquals("object must have exactly one of \"value\" or \"stream\"", problems.get(0).message());
	}

	@Test
	void streamWithoutDict_isError() {
		assertThat(problems(fullDocument("""
			"obj:1 0 R": {"stream": {"data": ""}}
			""")), contains("\"stream\" is missing \"dict\""));
	}

	@Test
	void streamDataCardinality_fullMode() {
		assertThat(problems(fullDocument("""
			"obj:1 0 R": {"stream": {"dict": {}}}
			""")), contains("\"stream\" must have exactly one of \"data\" or \"datafile\""));
		assertThat(problems(fullDocument("""
			"obj:1 0 R": {"stream": {"dict": {}, "data": "", "datafile": "x"}}
			""")), contains("\"stream\" must have exactly one of \"data\" or \"datafile\""));
	}

	@Test
	void streamDataCardinality_partialMode() {
		PdfDocument document = PdfDocument.empty();
		importer.updateFromJson(document, json("""
			{"document": {"objects": {"obj:1 0 R": {"stream": {"dict": {}}}}}}
			"""));
		assertThat(document.get(OBJ_1), instanceOf(PdfStream.class));

		List<ImportProblem> problems = schemaProblems(json("""
			{"document": {"objects": {"obj:1 0 R": {"stream": {"dict": {}, "data": "", "datafile": "x"}}}}}
			"""), Completeness.PARTIAL);
		assertEquals(List.of("\"stream\" may have at most one of \"data\" or \"datafile\""), messages(problems));
	}

	@Test
	void streamDataTypes_areChecked() {
		assertThat(problems(fullDocument("""
			"obj:1 0 R": {"stream": {"dict": {}, "data": 5}},
			"obj:2 0 R": {"stream": {"dict": {}, "datafile": ["x"]}}
			""")), contains(
				"\"stream.data\" must be a string",
				"\"stream.datafile\" must be a string containing a file name"));
	}

	@Test
	void streamDict_mustBeDictionary() {
		assertThat(problems(fullDocument("""
			"obj:1 0 R": {"stream": {"dict": [], "data": ""}}
			""")), contains("\"stream.dict\" must be a dictionary"));
	}

	@Test
	void trailerStream_isError() {
		assertThat(problems("""
			{"document": {"pdfversion": "1.3", "objects": {"trailer": {"value": {}, "stream": {"dict": {}}}}}}
			"""), contains("the trailer may not be a stream"));
	}

	@Test
	void trailerWithoutValue_isError() {
		assertThat(problems("""
			{"document": {"pdfversion": "1.3", "objects": {"trailer": {}}}}
			"""), contains("\"trailer\" is missing \"value\""));
	}

	@Test
	void trailerValue_mustBeDictionary() {
		assertThat(problems("""
			{"document": {"pdfversion": "1.3", "objects": {"trailer": {"value": 5}}}}
			"""), contains("\"trailer.value\" must be a dictionary"));
	}

	@Test
	void missingTrailer_isErrorOnlyInFullMode() {
		String text = """
			{"document": {"pdfversion": "1.3", "objects": {"obj:1 0 R": {"value": 1}}}}
			""";
		assertThat(problems(text), contains("\"document.objects.trailer\" was not seen"));

		PdfDocument document = PdfDocument.empty();
		importer.updateFromJson(document, json(text));
		assertEquals(new PdfInteger(1), document.get(OBJ_1));
		assertEquals(new PdfInteger(1), document.trailer().get("/Size"));
	}

	@Test
	void missingPdfVersion_isErrorOnlyInFullMode() {
		String text = """
			{"document": {"objects": {"trailer": {"value": {}}}}}
			""";
		assertThat(problems(text), contains("\"document.pdfversion\" was not seen"));
		importer.updateFromJson(PdfDocument.empty(), json(text));
	}

	@Test
	void missingObjects_isErrorInBothModes() {
		String text = """
			{"document": {"pdfversion": "1.3"}}
			""";
		assertThat(problems(text), contains("\"document.objects\" was not seen"));
		assertEquals(List.of("\"document.objects\" was not seen"),
			messages(schemaProblems(json(text), Completeness.PARTIAL)));
	}

	@Test
	void missingDocument_isError() {
		assertThat(problems("{\"pdf\": {}}"), contains("\"document\" object was not seen"));
	}

	@Test
	void invalidPdfVersion_isError() {
		assertThat(problems("""
			{"document": {"pdfversion": "1.x", "objects": {"trailer": {"value": {}}}}}
			"""), contains("invalid PDF version (must be x.y)"));
		assertThat(problems("""
			{"document": {"pdfversion": 1.4, "objects": {"trailer": {"value": {}}}}}
			"""), contains("invalid PDF version (must be x.y)"));
	}

	@Test
	void badObjectKey_isErrorAndEntryIsSkipped() {
		List<ImportProblem> problems = schemaProblems(json(fullDocument("""
			"obj:1 R": {},
			"obj:2 0 R": {"value": 2}
			""")), Completeness.FULL);
		assertEquals(List.of("object key should be \"trailer\" or \"obj:n n R\""), messages(problems));
		assertEquals("obj:1 R", problems.get(0).object());
	}

	@Test
	void nonDictionaryEntry_isError() {
		assertThat(problems(fullDocument("""
			"obj:1 0 R": [1]
			""")), contains("\"obj:1 0 R\" must be a dictionary"));
	}

	@Test
	void unrecognizedString_isErrorAndBecomesNull() {
		PdfDocument document = PdfDocument.empty();
		JsonSchemaException e = assertThrows(JsonSchemaException.class, () -> importer.updateFromJson(document, json("""
			{"document": {"objects": {"obj:1 0 R": {"value": ["/ok", "not valid", "b:abc"]}}}}
			""")));
		assertEquals(List.of("unrecognized string value", "unrecognized string value"), messages(e.problems()));
		// Valid parts were still applied
		assertEquals(new PdfArray(List.of(new PdfName("/ok"), new PdfNull(), new PdfNull())), document.get(OBJ_1));
	}

	@Test
	void errors_areAllCollected() {
		JsonSchemaException e = assertThrows(JsonSchemaException.class, () -> importer.createFromJson(json("""
			{"document": {"pdfversion": "bad", "objects": {
				"obj:1 0 R": {},
				"junk": 1,
				"obj:2 0 R": {"stream": {"dict": {}}}
			}}}
			""")));
		assertEquals("test.json: errors found in JSON", e.getMessage());
		assertEquals(List.of(
			"invalid PDF version (must be x.y)",
			"object must have exactly one of \"value\" or \"stream\"",
			"object key should be \"trailer\" or \"obj:n n R\"",
			"\"stream\" must have exactly one of \"data\" or \"datafile\"",
			"\"document.objects.trailer\" was not seen"
		), messages(e.problems()));
	}

	@Test
	void arrayRoot_isFatal() {
		JsonStructureException e = assertThrows(JsonStructureException.class, () -> importer.createFromJson(json("[1, 2]")));
		assertThat(e.getMessage(), containsString("JSON must be a dictionary"));
	}

	@Test
	void scalarRoot_isFatal() {
		assertThrows(JsonStructureException.class, () -> importer.createFromJson(json("\"document\"")));
	}

	@Test
	void malformedJson_isFatal() {
		PdfDocument document = PdfDocument.empty();
		assertThrows(JsonStructureException.class, () -> importer.updateFromJson(document, json("""
			{"document": {"objects": {"obj:1 0 R": {"value": 1}
			""")));
	}

	@Test
	void update_replacesOnlyMentionedObjects() throws IOException {
		PdfDocument document = PdfDocument.empty();
		document.replace(OBJ_1, new PdfName("/Kept"));
		document.replace(OBJ_2, new PdfName("/Old"));
		PdfStream stream = document.createStream(OBJ_4);
		stream.replaceStreamData(StreamDataProvider.ofBytes("original".getBytes(US_ASCII)));

		importer.updateFromJson(document, json("""
			{"document": {"objects": {
				"obj:2 0 R": {"value": "/New"},
				"obj:4 0 R": {"stream": {"dict": {"/Type": "/XObject"}}}
			}}}
			"""));

		assertEquals(new PdfName("/Kept"), document.get(OBJ_1));
		assertEquals(new PdfName("/New"), document.get(OBJ_2));
		assertThat(document.get(OBJ_4), sameInstance(stream));
		assertEquals(new PdfName("/XObject"), stream.dict().get("/Type"));
		assertArrayEquals("original".getBytes(US_ASCII), stream.getStreamData(DecodeLevel.NONE));
	}

	@Test
	void update_streamReplacesValue() throws IOException {
		PdfDocument document = PdfDocument.empty();
		document.replace(OBJ_1, new PdfInteger(7));
		importer.updateFromJson(document, json("""
			{"document": {"objects": {"obj:1 0 R": {"stream": {"dict": {}, "data": "AQID"}}}}}
			"""));
		PdfStream stream = (PdfStream) document.get(OBJ_1);
		assertArrayEquals(new byte[] { 1, 2, 3 }, stream.getStreamData(DecodeLevel.NONE));
	}

	@Test
	void fromFile_usesFileName() throws IOException {
		Path file = tempDir.resolve("doc.json");
		Files.writeString(file, "{\"document\": {}}");
		JsonSchemaException e = assertThrows(JsonSchemaException.class, () -> importer.createFromJson(file));
		assertThat(e.getMessage(), containsString("doc.json: errors found in JSON"));
	}

	static InputSource json(String text) {
		return new BufferInputSource("test.json", text.getBytes(UTF_8));
	}

	/**
	 * @param objects members of "objects" besides the trailer
	 */
	static String fullDocument(String objects) {
		return "{\"document\": {\"pdfversion\": \"1.3\", \"objects\": {\n"
			+ objects
			+ ",\n\"trailer\": {\"value\": {\"/Size\": 5}}}}}";
	}

	static String jsonPath(Path path) {
		return path.toString().replace("\\", "\\\\");
	}

	private List<String> problems(String text) {
		return messages(schemaProblems(json(text), Completeness.FULL));
	}

	private List<ImportProblem> schemaProblems(InputSource source, Completeness completeness) {
		JsonSchemaException e = assertThrows(JsonSchemaException.class,
			() -> importer.importJson(PdfDocument.empty(), source, completeness));
		return e.problems();
	}

	private static List<String> messages(List<ImportProblem> problems) {
		return problems.stream().map(ImportProblem::message).toList();
	}
}
