package works.folio.jackson;

import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.folio.FileInputSource;
import works.folio.InputSource;
import works.folio.PdfDocument;
import works.folio.jackson.exceptions.JsonProcessingException;
import works.folio.jackson.exceptions.JsonSchemaException;
import works.folio.jackson.exceptions.JsonStructureException;

import static java.util.Objects.requireNonNull;

/**
 * Reads documents from their JSON form.
 * <p>
 * Stream data isn't read during import. Each stream gets a provider
 * that goes back to the input, or to the named data file, when its data is asked for,
 * so the input must remain readable for as long as the document is in use.
 *
 * @see JsonExporter
 */
public final class JsonImporter {
	private final JacksonJsonTokenizer tokenizer;

	public JsonImporter() {
		this(new JacksonJsonTokenizer());
	}

	public JsonImporter(JacksonJsonTokenizer tokenizer) {
		this.tokenizer = requireNonNull(tokenizer);
	}

	/**
	 * @return a new document holding everything in the JSON file at {@code path}
	 * @throws JsonStructureException if the file can't be read or isn't a JSON dictionary
	 * @throws JsonSchemaException if the JSON doesn't describe a complete document
	 */
	public PdfDocument createFromJson(Path path) {
		return createFromJson(new FileInputSource(path));
	}

	/**
	 * @see #createFromJson(Path)
	 */
	public PdfDocument createFromJson(InputSource source) {
		PdfDocument result = PdfDocument.empty();
		importJson(result, source, Completeness.FULL);
		return result;
	}

	/**
	 * Applies the JSON file at {@code path} to an existing document.
	 * Objects it mentions are replaced; the rest are left alone.
	 * <p>
	 * When this throws {@link JsonSchemaException}, the parts of the input that were valid
	 * have already been applied.
	 *
	 * @throws JsonStructureException if the file can't be read or isn't a JSON dictionary
	 * @throws JsonSchemaException if the JSON doesn't match the document schema
	 */
	public void updateFromJson(PdfDocument document, Path path) {
		updateFromJson(document, new FileInputSource(path));
	}

	/**
	 * @see #updateFromJson(PdfDocument, Path)
	 */
	public void updateFromJson(PdfDocument document, InputSource source) {
		importJson(document, source, Completeness.PARTIAL);
	}

	/**
	 * @throws JsonProcessingException if something inconsistent happens inside the importer itself
	 */
	public void importJson(PdfDocument document, InputSource source, Completeness completeness) {
		LOGGER.debug("Importing {} into {} ({})", source.name(), document, completeness);
		ImportReactor reactor = new ImportReactor(document, source, completeness);
		try {
			tokenizer.parse(source, reactor);
		} finally {
			// Placeholders must not outlive the import, even one that failed part way through
			reactor.resolveReservations();
		}
		if (reactor.anyErrors()) {
			throw new JsonSchemaException(source.name() + ": errors found in JSON", reactor.problems());
		}
		LOGGER.debug("Imported {}: {}", source.name(), document);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(JsonImporter.class);
}
