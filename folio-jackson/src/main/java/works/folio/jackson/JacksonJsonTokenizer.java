package works.folio.jackson;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayDeque;
import java.util.Deque;
import tools.jackson.core.JacksonException;
import tools.jackson.core.JsonParser;
import tools.jackson.core.JsonToken;
import tools.jackson.databind.json.JsonMapper;
import works.folio.InputSource;
import works.folio.jackson.Value.ArrayValue;
import works.folio.jackson.Value.BoolValue;
import works.folio.jackson.Value.DictionaryValue;
import works.folio.jackson.Value.NullValue;
import works.folio.jackson.Value.NumberValue;
import works.folio.jackson.Value.StringValue;
import works.folio.jackson.exceptions.JsonStructureException;

import static java.util.Objects.requireNonNull;

/**
 * Turns JSON text into {@link JsonEventHandler} callbacks using Jackson's streaming parser.
 * Nothing but the current scalar is held in memory.
 */
public final class JacksonJsonTokenizer {
	private final JsonMapper mapper;

	public JacksonJsonTokenizer() {
		this(JsonSchema.newMapper());
	}

	public JacksonJsonTokenizer(JsonMapper mapper) {
		this.mapper = requireNonNull(mapper);
	}

	/**
	 * @throws JsonStructureException if the input can't be read or isn't well-formed JSON
	 */
	public void parse(InputSource source, JsonEventHandler handler) {
		try (
			InputStream in = source.openStream();
			JsonParser p = mapper.createParser(in)
		) {
			JsonToken token = p.nextToken();
			if (token == null) {
				throw new JsonStructureException(source.name() + ": input contains no JSON value");
			}
			Value root = currentValue(p, token);
			if (root.isContainer()) {
				parseContainers(p, root, handler);
			} else {
				handler.topLevelScalar();
			}
			if (p.nextToken() != null) {
				throw new JsonStructureException(source.name() + ": unexpected content after the JSON value at offset "
					+ p.currentTokenLocation().getByteOffset());
			}
		} catch (JacksonException e) {
			throw new JsonStructureException(source.name() + ": " + e.getOriginalMessage()
				+ " at offset " + offsetOf(e), e);
		} catch (IOException e) {
			throw new JsonStructureException(source.name() + ": unable to read input: " + e.getMessage(), e);
		}
	}

	private static void parseContainers(JsonParser p, Value root, JsonEventHandler handler) {
		Deque<Value> open = new ArrayDeque<>();
		handler.containerStart(root);
		open.push(root);
		while (!open.isEmpty()) {
			JsonToken token = p.nextToken();
			if (token == JsonToken.END_OBJECT || token == JsonToken.END_ARRAY) {
				Value ended = withEnd(open.pop(), p.currentTokenLocation().getByteOffset() + 1);
				handler.containerEnd(ended);
			} else {
				Value value;
				if (token == JsonToken.PROPERTY_NAME) {
					String key = p.currentName();
					value = currentValue(p, p.nextToken());
					handler.dictionaryItem(key, value);
				} else {
					value = currentValue(p, token);
					handler.arrayItem(value);
				}
				if (value.isContainer()) {
					handler.containerStart(value);
					open.push(value);
				}
			}
		}
	}

	private static Value currentValue(JsonParser p, JsonToken token) {
		long start = p.currentTokenLocation().getByteOffset();
		switch (token) {
			case START_OBJECT:
				return DictionaryValue.empty(start);
			case START_ARRAY:
				return ArrayValue.empty(start);
			case VALUE_STRING: {
				// Reading the text consumes the closing quote, so the location after it is the end
				String text = p.getString();
				return new StringValue(text, start, p.currentLocation().getByteOffset());
			}
			case VALUE_NUMBER_INT:
			case VALUE_NUMBER_FLOAT: {
				String text = p.getString();
				return new NumberValue(text, start, start + text.length());
			}
			case VALUE_TRUE:
				return new BoolValue(true, start, start + 4);
			case VALUE_FALSE:
				return new BoolValue(false, start, start + 5);
			case VALUE_NULL:
				return new NullValue(start, start + 4);
			default:
				throw new IllegalStateException("Unexpected token " + token + " at offset " + start);
		}
	}

	private static Value withEnd(Value container, long end) {
		if (container instanceof DictionaryValue d) {
			return d.withEnd(end);
		} else if (container instanceof ArrayValue a) {
			return a.withEnd(end);
		} else {
			throw new IllegalStateException("Not a container: " + container);
		}
	}

	private static long offsetOf(JacksonException e) {
		return (e.getLocation() == null) ? -1 : e.getLocation().getByteOffset();
	}
}
