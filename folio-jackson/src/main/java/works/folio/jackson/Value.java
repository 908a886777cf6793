package works.folio.jackson;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * A JSON value as delivered by the tokenizer, with the byte span it occupied in the input.
 * <p>
 * The tokenizer delivers containers empty, because their members arrive as
 * separate events; containers built in memory may be populated.
 */
public sealed interface Value {
	/**
	 * @return byte offset of the value's first character
	 */
	long start();

	/**
	 * @return byte offset just past the value's last character,
	 * or equal to {@link #start()} for a container whose end hasn't been reached yet
	 */
	long end();

	default boolean isContainer() {
		return false;
	}

	record NullValue(long start, long end) implements Value { }

	record BoolValue(boolean value, long start, long end) implements Value { }

	/**
	 * @param text the number exactly as written
	 */
	record NumberValue(String text, long start, long end) implements Value {
		public NumberValue {
			requireNonNull(text);
		}
	}

	/**
	 * @param text the decoded string, without quotes
	 */
	record StringValue(String text, long start, long end) implements Value {
		public StringValue {
			requireNonNull(text);
		}
	}

	record ArrayValue(List<Value> items, long start, long end) implements Value {
		public ArrayValue {
			items = List.copyOf(items);
		}

		public static ArrayValue empty(long start) {
			return new ArrayValue(List.of(), start, start);
		}

		public ArrayValue withEnd(long end) {
			return new ArrayValue(items, start, end);
		}

		@Override
		public boolean isContainer() {
			return true;
		}
	}

	record DictionaryValue(Map<String, Value> members, long start, long end) implements Value {
		public DictionaryValue {
			members = Collections.unmodifiableMap(new LinkedHashMap<>(members));
		}

		public static DictionaryValue empty(long start) {
			return new DictionaryValue(Map.of(), start, start);
		}

		public DictionaryValue withEnd(long end) {
			return new DictionaryValue(members, start, end);
		}

		@Override
		public boolean isContainer() {
			return true;
		}
	}
}
