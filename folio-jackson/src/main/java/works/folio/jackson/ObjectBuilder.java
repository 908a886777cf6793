package works.folio.jackson;

import java.math.BigInteger;
import java.util.Map;
import java.util.regex.Matcher;
import works.folio.ObjGen;
import works.folio.PdfArray;
import works.folio.PdfBoolean;
import works.folio.PdfDictionary;
import works.folio.PdfInteger;
import works.folio.PdfName;
import works.folio.PdfNull;
import works.folio.PdfObject;
import works.folio.PdfReal;
import works.folio.PdfReference;
import works.folio.PdfString;
import works.folio.jackson.Value.ArrayValue;
import works.folio.jackson.Value.BoolValue;
import works.folio.jackson.Value.DictionaryValue;
import works.folio.jackson.Value.NullValue;
import works.folio.jackson.Value.NumberValue;
import works.folio.jackson.Value.StringValue;

import static works.folio.jackson.JsonSchema.BINARY_PATTERN;
import static works.folio.jackson.JsonSchema.INDIRECT_OBJECT_PATTERN;
import static works.folio.jackson.JsonSchema.INTEGER_PATTERN;
import static works.folio.jackson.JsonSchema.NAME_PATTERN;
import static works.folio.jackson.JsonSchema.UNICODE_PATTERN;

/**
 * Converts JSON values to PDF objects.
 * <p>
 * Each object built is described by where its value started in the input.
 * Containers are built with whatever members the value already has,
 * which for values coming from the tokenizer is none.
 */
final class ObjectBuilder {
	interface Context {
		/**
		 * @return a reference to {@code og}, reserving it if it isn't defined yet
		 */
		PdfReference reserve(ObjGen og);

		void error(long offset, String message);
	}

	private final String inputName;
	private final Context context;

	ObjectBuilder(String inputName, Context context) {
		this.inputName = inputName;
		this.context = context;
	}

	PdfObject build(Value value) {
		PdfObject result;
		if (value instanceof DictionaryValue d) {
			PdfDictionary dict = new PdfDictionary();
			for (Map.Entry<String, Value> member : d.members().entrySet()) {
				dict.replaceKey(member.getKey(), build(member.getValue()));
			}
			result = dict;
		} else if (value instanceof ArrayValue a) {
			PdfArray array = new PdfArray();
			for (Value item : a.items()) {
				array.appendItem(build(item));
			}
			result = array;
		} else if (value instanceof NullValue) {
			result = new PdfNull();
		} else if (value instanceof BoolValue b) {
			result = new PdfBoolean(b.value());
		} else if (value instanceof NumberValue n) {
			result = number(n.text());
		} else {
			result = string((StringValue) value);
		}
		result.setDescription(inputName + " offset " + value.start());
		return result;
	}

	private static PdfObject number(String text) {
		if (INTEGER_PATTERN.matcher(text).matches()) {
			return new PdfInteger(new BigInteger(text));
		} else {
			return new PdfReal(text);
		}
	}

	private PdfObject string(StringValue value) {
		String text = value.text();
		Matcher m = INDIRECT_OBJECT_PATTERN.matcher(text);
		if (m.matches()) {
			ObjGen og;
			try {
				og = ObjGen.parse(m.group(1), m.group(2));
			} catch (IllegalArgumentException e) {
				context.error(value.start(), "indirect object id out of range: " + text);
				return new PdfNull();
			}
			return context.reserve(og);
		}
		m = UNICODE_PATTERN.matcher(text);
		if (m.matches()) {
			return PdfString.unicode(m.group(1));
		}
		m = BINARY_PATTERN.matcher(text);
		if (m.matches()) {
			return PdfString.fromHex(m.group(1));
		}
		if (NAME_PATTERN.matcher(text).matches()) {
			return new PdfName(text);
		}
		context.error(value.start(), "unrecognized string value");
		return new PdfNull();
	}
}
