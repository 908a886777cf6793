package works.folio.filters;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.WritableByteChannel;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;
import works.folio.DecodeLevel;
import works.folio.PdfArray;
import works.folio.PdfDictionary;
import works.folio.PdfInteger;
import works.folio.PdfName;
import works.folio.PdfNull;
import works.folio.PdfObject;

import static java.util.Objects.requireNonNull;

/**
 * Decodes stream data according to the {@code /Filter} and {@code /DecodeParms}
 * entries of a stream dictionary.
 * <p>
 * Data is pushed through in whatever chunks the writer likes:
 * <pre>
 *   raw bytes → filter 1 → filter 2 → ... → sink
 * </pre>
 * Closing the pipeline flushes every filter and then closes the sink.
 * A pipeline built for a dictionary whose filters can't all be decoded at the
 * requested {@link DecodeLevel} passes the bytes through untouched;
 * see {@link #isDecoding()}.
 */
public final class FilterPipeline implements WritableByteChannel {
	/**
	 * The most data any stage buffers at once while moving stream bytes around.
	 */
	public static final int CHUNK_SIZE = 8192;

	private final WritableByteChannel head;
	private final boolean decoding;

	private FilterPipeline(WritableByteChannel head, boolean decoding) {
		this.head = head;
		this.decoding = decoding;
	}

	public static FilterPipeline create(PdfDictionary streamDict, DecodeLevel level, WritableByteChannel sink) {
		requireNonNull(sink);
		Optional<List<StreamFilter>> filters = filtersFor(streamDict, level);
		if (filters.isEmpty()) {
			return new FilterPipeline(sink, false);
		}
		WritableByteChannel current = sink;
		List<StreamFilter> chain = filters.get();
		for (int i = chain.size() - 1; i >= 0; i--) {
			StreamFilter filter = chain.get(i);
			filter.setNext(current);
			current = filter;
		}
		return new FilterPipeline(current, true);
	}

	/**
	 * @return true if every filter named by {@code streamDict} can be decoded at {@code level}.
	 * A dictionary with no filters is trivially decodable.
	 */
	public static boolean canDecode(PdfDictionary streamDict, DecodeLevel level) {
		return filtersFor(streamDict, level).isPresent();
	}

	/**
	 * @return true if the bytes written are being decoded;
	 * false if they pass through unchanged
	 */
	public boolean isDecoding() {
		return decoding;
	}

	@Override
	public int write(ByteBuffer src) throws IOException {
		int count = src.remaining();
		while (src.hasRemaining()) {
			head.write(src);
		}
		return count;
	}

	@Override
	public boolean isOpen() {
		return head.isOpen();
	}

	@Override
	public void close() throws IOException {
		head.close();
	}

	/**
	 * @return the filter chain in the order the data flows, or empty if
	 * some filter is unknown, malformed, or not decodable at {@code level}
	 */
	private static Optional<List<StreamFilter>> filtersFor(PdfDictionary streamDict, DecodeLevel level) {
		List<PdfObject> names = asList(streamDict.get("/Filter"));
		List<PdfObject> parms = asList(streamDict.get("/DecodeParms"));
		if (names == null || parms == null) {
			return Optional.empty();
		}
		if (!names.isEmpty() && level == DecodeLevel.NONE) {
			return Optional.empty();
		}
		List<StreamFilter> result = new ArrayList<>();
		for (int i = 0; i < names.size(); i++) {
			if (!(names.get(i) instanceof PdfName name)) {
				return Optional.empty();
			}
			PdfObject p = (i < parms.size()) ? parms.get(i) : null;
			PdfDictionary params;
			if (p == null || p instanceof PdfNull) {
				params = new PdfDictionary();
			} else if (p instanceof PdfDictionary d) {
				params = d;
			} else {
				return Optional.empty();
			}
			if (!addFilter(name.value(), params, level, result)) {
				return Optional.empty();
			}
		}
		return Optional.of(result);
	}

	private static boolean addFilter(String name, PdfDictionary params, DecodeLevel level, List<StreamFilter> result) {
		switch (name) {
			case "/FlateDecode", "/Fl" -> {
				result.add(new FlateDecodeFilter());
				return addPredictor(params, result);
			}
			case "/LZWDecode", "/LZW" -> {
				Integer earlyChange = intParam(params, "/EarlyChange", 1);
				if (earlyChange == null || (earlyChange != 0 && earlyChange != 1)) {
					return false;
				}
				result.add(new LZWDecodeFilter(earlyChange));
				return addPredictor(params, result);
			}
			case "/ASCII85Decode", "/A85" -> {
				result.add(new ASCII85DecodeFilter());
				return true;
			}
			case "/ASCIIHexDecode", "/AHx" -> {
				result.add(new ASCIIHexDecodeFilter());
				return true;
			}
			case "/RunLengthDecode", "/RL" -> {
				if (!level.includes(DecodeLevel.SPECIALIZED)) {
					return false;
				}
				result.add(new RunLengthDecodeFilter());
				return true;
			}
			default -> {
				return false;
			}
		}
	}

	private static boolean addPredictor(PdfDictionary params, List<StreamFilter> result) {
		Integer predictor = intParam(params, "/Predictor", 1);
		Integer colors = intParam(params, "/Colors", 1);
		Integer bitsPerComponent = intParam(params, "/BitsPerComponent", 8);
		Integer columns = intParam(params, "/Columns", 1);
		if (predictor == null || colors == null || bitsPerComponent == null || columns == null) {
			return false;
		}
		if (predictor == 1) {
			return true;
		}
		if (!PredictorFilter.isSupported(predictor, colors, bitsPerComponent, columns)) {
			return false;
		}
		result.add(new PredictorFilter(predictor, colors, bitsPerComponent, columns));
		return true;
	}

	/**
	 * @return the parameter's value, {@code defaultValue} if absent, or null if it's not a small integer
	 */
	private static @Nullable Integer intParam(PdfDictionary params, String key, int defaultValue) {
		PdfObject value = params.get(key);
		if (value == null) {
			return defaultValue;
		} else if (value instanceof PdfInteger i && i.value().bitLength() < 32) {
			return i.value().intValue();
		} else {
			return null;
		}
	}

	/**
	 * Filters and their parameters may each be given alone or as an array.
	 *
	 * @return the entries, an empty list if absent, or null if malformed
	 */
	private static @Nullable List<PdfObject> asList(@Nullable PdfObject value) {
		if (value == null || value instanceof PdfNull) {
			return List.of();
		} else if (value instanceof PdfArray array) {
			return array.items();
		} else if (value instanceof PdfName || value instanceof PdfDictionary) {
			return List.of(value);
		} else {
			return null;
		}
	}

	static boolean isWhitespace(int b) {
		return b == 0 || b == 9 || b == 10 || b == 12 || b == 13 || b == 32;
	}
}
