package works.folio.jackson;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.folio.InputSource;
import works.folio.ObjGen;
import works.folio.PdfArray;
import works.folio.PdfDictionary;
import works.folio.PdfDocument;
import works.folio.PdfNull;
import works.folio.PdfObject;
import works.folio.PdfReference;
import works.folio.PdfStream;
import works.folio.jackson.Value.DictionaryValue;
import works.folio.jackson.Value.StringValue;
import works.folio.jackson.exceptions.JsonProcessingException;
import works.folio.jackson.exceptions.JsonStructureException;

import static works.folio.jackson.JsonSchema.DATA;
import static works.folio.jackson.JsonSchema.DATAFILE;
import static works.folio.jackson.JsonSchema.DICT;
import static works.folio.jackson.JsonSchema.DOCUMENT;
import static works.folio.jackson.JsonSchema.OBJECTS;
import static works.folio.jackson.JsonSchema.OBJECT_KEY_PATTERN;
import static works.folio.jackson.JsonSchema.PDF_VERSION;
import static works.folio.jackson.JsonSchema.PDF_VERSION_PATTERN;
import static works.folio.jackson.JsonSchema.STREAM;
import static works.folio.jackson.JsonSchema.TRAILER;
import static works.folio.jackson.JsonSchema.VALUE;

/**
 * Applies parse events to a {@link PdfDocument} as they arrive.
 * <p>
 * Schema problems are collected rather than thrown, so one pass reports all of them;
 * the part of the input with the problem is skipped.
 * Problems that make the rest of the input meaningless throw right away.
 * <p>
 * Every container in {@link ReactorState#OBJECT OBJECT} state has exactly one
 * PDF container on {@link #nodeStack}, pushed when the container starts and
 * popped when it ends. Items are added to whichever node is on top.
 */
final class ImportReactor implements JsonEventHandler, ObjectBuilder.Context {
	private final PdfDocument document;
	private final InputSource source;
	private final Completeness completeness;
	private final ObjectBuilder builder;
	private final List<ImportProblem> problems = new ArrayList<>();

	private final Deque<ReactorState> stateStack = new ArrayDeque<>();
	private ReactorState state = ReactorState.INITIAL;
	private ReactorState nextState = ReactorState.TOP;

	private final Deque<PdfObject> nodeStack = new ArrayDeque<>();
	private PdfObject pendingContainer;

	/**
	 * Objects referenced but not yet defined. Whatever is left when "objects" ends becomes null.
	 */
	private final Set<ObjGen> reserved = new LinkedHashSet<>();

	private boolean sawDocument = false;
	private boolean sawPdfVersion = false;
	private boolean sawObjects = false;
	private boolean sawTrailer = false;

	private Entry entry = Entry.none();

	ImportReactor(PdfDocument document, InputSource source, Completeness completeness) {
		this.document = document;
		this.source = source;
		this.completeness = completeness;
		this.builder = new ObjectBuilder(source.name(), this);
	}

	List<ImportProblem> problems() {
		return List.copyOf(problems);
	}

	boolean anyErrors() {
		return !problems.isEmpty();
	}

	@Override
	public void containerStart(Value container) {
		stateStack.push(state);
		state = nextState;
		if (state == ReactorState.TOP && !(container instanceof DictionaryValue)) {
			throw new JsonStructureException(source.name() + ": JSON must be a dictionary");
		}
		if (state == ReactorState.OBJECT) {
			if (pendingContainer == null) {
				throw new JsonProcessingException("No object was built for the container at offset " + container.start());
			}
			nodeStack.push(pendingContainer);
		}
		pendingContainer = null;
		LOGGER.trace("{} -> {} at offset {}", stateStack.peek(), state, container.start());
	}

	@Override
	public void containerEnd(Value container) {
		if (stateStack.isEmpty()) {
			throw new JsonProcessingException("Container ended at offset " + container.end() + " was never started");
		}
		ReactorState exited = state;
		state = stateStack.pop();
		if (exited == ReactorState.OBJECT) {
			if (nodeStack.isEmpty()) {
				throw new JsonProcessingException("No object is open for the container ending at offset " + container.end());
			}
			nodeStack.pop();
		}
		LOGGER.trace("{} <- {} at offset {}", state, exited, container.end());
		switch (state) {
			case INITIAL -> documentEnded();
			case DOCUMENT -> {
				if (exited == ReactorState.OBJECTS) {
					resolveReservations();
				}
			}
			case OBJECTS -> entryEnded(container);
			case OBJECT_TOP -> {
				if (exited == ReactorState.STREAM) {
					streamEnded(container);
				}
			}
			default -> { }
		}
	}

	@Override
	public void topLevelScalar() {
		throw new JsonStructureException(source.name() + ": JSON must be a dictionary");
	}

	@Override
	public void dictionaryItem(String key, Value value) {
		switch (state) {
			case TOP -> topItem(key, value);
			case DOCUMENT -> documentItem(key, value);
			case OBJECTS -> objectsItem(key, value);
			case OBJECT_TOP -> objectTopItem(key, value);
			case TRAILER -> trailerItem(key, value);
			case STREAM -> streamItem(key, value);
			case OBJECT -> {
				if (nodeStack.peek() instanceof PdfDictionary dict) {
					dict.replaceKey(key, buildObject(value));
					nextState = ReactorState.OBJECT;
				} else {
					throw new JsonProcessingException("Dictionary item \"" + key + "\" at offset " + value.start()
						+ " has no dictionary to go into");
				}
			}
			case IGNORE -> nextState = ReactorState.IGNORE;
			default -> throw new JsonProcessingException("Dictionary item \"" + key + "\" in state " + state);
		}
	}

	@Override
	public void arrayItem(Value value) {
		switch (state) {
			case OBJECT -> {
				if (nodeStack.peek() instanceof PdfArray array) {
					array.appendItem(buildObject(value));
					nextState = ReactorState.OBJECT;
				} else {
					throw new JsonProcessingException("Array item at offset " + value.start()
						+ " has no array to go into");
				}
			}
			case IGNORE -> nextState = ReactorState.IGNORE;
			default -> throw new JsonProcessingException("Array item at offset " + value.start() + " in state " + state);
		}
	}

	private void topItem(String key, Value value) {
		if (DOCUMENT.equals(key)) {
			sawDocument = true;
			nestedState(key, value, ReactorState.DOCUMENT);
		} else {
			nextState = ReactorState.IGNORE;
		}
	}

	private void documentItem(String key, Value value) {
		if (PDF_VERSION.equals(key)) {
			sawPdfVersion = true;
			nextState = ReactorState.IGNORE;
			if (value instanceof StringValue s && PDF_VERSION_PATTERN.matcher(s.text()).matches()) {
				document.setPdfVersion(s.text());
			} else {
				error(value.start(), "invalid PDF version (must be x.y)");
			}
		} else if (OBJECTS.equals(key)) {
			sawObjects = true;
			nestedState(key, value, ReactorState.OBJECTS);
		} else {
			// Informational keys like maxobjectid are recomputed on export
			nextState = ReactorState.IGNORE;
		}
	}

	private void objectsItem(String key, Value value) {
		if (TRAILER.equals(key)) {
			sawTrailer = true;
			entry = new Entry(key, null);
			nestedState(key, value, ReactorState.TRAILER);
			return;
		}
		Matcher m = OBJECT_KEY_PATTERN.matcher(key);
		if (m.matches()) {
			ObjGen og;
			try {
				og = ObjGen.parse(m.group(1), m.group(2));
			} catch (IllegalArgumentException e) {
				entry = new Entry(key, null);
				ignoreEntry(value, "object id out of range in \"" + key + "\"");
				return;
			}
			entry = new Entry(key, og);
			reserve(og);
			nestedState(key, value, ReactorState.OBJECT_TOP);
		} else {
			entry = new Entry(key, null);
			ignoreEntry(value, "object key should be \"trailer\" or \"obj:n n R\"");
		}
	}

	private void objectTopItem(String key, Value value) {
		ObjGen og = entry.objGen;
		if (og == null) {
			throw new JsonProcessingException("No object is being imported for \"" + key + "\" at offset " + value.start());
		}
		if (VALUE.equals(key)) {
			entry.sawValue = true;
			replaceObject(og, buildObject(value));
			nextState = ReactorState.OBJECT;
		} else if (STREAM.equals(key)) {
			entry.sawStream = true;
			nestedState(key, value, ReactorState.STREAM);
			if (document.get(og) instanceof PdfStream existing) {
				// Keeps the existing data in case this update supplies none
				entry.stream = existing;
			} else {
				entry.stream = document.createStream(og);
				reserved.remove(og);
			}
		} else {
			nextState = ReactorState.IGNORE;
		}
	}

	private void trailerItem(String key, Value value) {
		if (VALUE.equals(key)) {
			entry.sawValue = true;
			nestedState("trailer.value", value, ReactorState.OBJECT);
			if (value instanceof DictionaryValue) {
				document.setTrailer((PdfDictionary) buildObject(value));
			}
		} else if (STREAM.equals(key)) {
			ignoreEntry(value, "the trailer may not be a stream");
		} else {
			nextState = ReactorState.IGNORE;
		}
	}

	private void streamItem(String key, Value value) {
		PdfStream stream = entry.stream;
		if (stream == null || document.get(stream.objGen()) != stream) {
			ignoreEntry(value, "this object is not a stream");
			return;
		}
		if (DICT.equals(key)) {
			entry.sawDict = true;
			nestedState("stream.dict", value, ReactorState.OBJECT);
			if (value instanceof DictionaryValue) {
				stream.replaceDict((PdfDictionary) buildObject(value));
			}
		} else if (DATA.equals(key)) {
			entry.sawData = true;
			nextState = ReactorState.IGNORE;
			if (value instanceof StringValue s) {
				// The range excludes the quotes
				long start = s.start() + 1;
				long end = s.end() - 1;
				if (end < start) {
					throw new JsonProcessingException("String at offset " + s.start() + " has negative length");
				}
				stream.replaceStreamData(new InlineDataProvider(source, start, end));
			} else {
				error(value.start(), "\"stream.data\" must be a string");
			}
		} else if (DATAFILE.equals(key)) {
			entry.sawDatafile = true;
			nextState = ReactorState.IGNORE;
			if (value instanceof StringValue s && !s.text().isEmpty()) {
				stream.replaceStreamData(new FileDataProvider(Path.of(s.text())));
			} else {
				error(value.start(), "\"stream.datafile\" must be a string containing a file name");
			}
		} else {
			nextState = ReactorState.IGNORE;
		}
	}

	private void entryEnded(Value container) {
		if (!entry.parseError) {
			if (TRAILER.equals(entry.key)) {
				if (!entry.sawValue) {
					error(container.start(), "\"trailer\" is missing \"value\"");
				}
			} else if (entry.sawValue == entry.sawStream) {
				error(container.start(), "object must have exactly one of \"value\" or \"stream\"");
			}
		}
		if (!nodeStack.isEmpty()) {
			throw new JsonProcessingException("Objects still open at the end of \"" + entry.key + "\"");
		}
		entry = Entry.none();
	}

	private void streamEnded(Value container) {
		if (entry.parseError) {
			return;
		}
		if (!entry.sawDict) {
			error(container.start(), "\"stream\" is missing \"dict\"");
		}
		if (completeness == Completeness.FULL) {
			if (entry.sawData == entry.sawDatafile) {
				error(container.start(), "\"stream\" must have exactly one of \"data\" or \"datafile\"");
			}
		} else if (entry.sawData && entry.sawDatafile) {
			error(container.start(), "\"stream\" may have at most one of \"data\" or \"datafile\"");
		}
	}

	private void documentEnded() {
		if (!sawDocument) {
			error(0, "\"document\" object was not seen");
			return;
		}
		if (completeness == Completeness.FULL && !sawPdfVersion) {
			error(0, "\"document.pdfversion\" was not seen");
		}
		if (!sawObjects) {
			error(0, "\"document.objects\" was not seen");
		} else if (completeness == Completeness.FULL && !sawTrailer) {
			error(0, "\"document.objects.trailer\" was not seen");
		}
		resolveReservations();
	}

	/**
	 * Turns every object that was referenced but never defined into null.
	 * Safe to call more than once.
	 */
	void resolveReservations() {
		if (!reserved.isEmpty()) {
			LOGGER.debug("{}: {} referenced objects were never defined; they become null", source.name(), reserved.size());
		}
		for (ObjGen og : reserved) {
			document.replace(og, new PdfNull());
		}
		reserved.clear();
	}

	/**
	 * Expects {@code value} to be a dictionary whose items are handled in {@code state}.
	 */
	private void nestedState(String key, Value value, ReactorState state) {
		if (value instanceof DictionaryValue) {
			nextState = state;
		} else {
			ignoreEntry(value, "\"" + key + "\" must be a dictionary");
		}
	}

	private void ignoreEntry(Value value, String message) {
		error(value.start(), message);
		entry.parseError = true;
		nextState = ReactorState.IGNORE;
	}

	private PdfObject buildObject(Value value) {
		PdfObject result = builder.build(value);
		if (value.isContainer()) {
			pendingContainer = result;
		}
		return result;
	}

	private void replaceObject(ObjGen og, PdfObject replacement) {
		reserved.remove(og);
		document.replace(og, replacement);
	}

	@Override
	public PdfReference reserve(ObjGen og) {
		PdfReference result = document.reserveIfAbsent(og);
		if (document.isReserved(og)) {
			reserved.add(og);
		}
		return result;
	}

	@Override
	public void error(long offset, String message) {
		ImportProblem problem = new ImportProblem(entry.key, offset, message);
		problems.add(problem);
		LOGGER.warn("{}", problem.describe(source.name()));
	}

	/**
	 * What has been seen so far in one entry of "objects".
	 */
	private static final class Entry {
		final String key;
		/** Null unless the key names an object */
		final ObjGen objGen;
		PdfStream stream;
		boolean sawValue;
		boolean sawStream;
		boolean sawDict;
		boolean sawData;
		boolean sawDatafile;
		boolean parseError;

		Entry(String key, ObjGen objGen) {
			this.key = key;
			this.objGen = objGen;
		}

		/**
		 * Problems found between entries are reported against no object.
		 */
		static Entry none() {
			return new Entry("", null);
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(ImportReactor.class);
}
