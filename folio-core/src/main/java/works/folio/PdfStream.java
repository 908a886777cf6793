package works.folio;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.channels.Channels;
import java.nio.channels.WritableByteChannel;
import org.jetbrains.annotations.Nullable;
import works.folio.filters.FilterPipeline;

import static java.util.Objects.requireNonNull;

/**
 * A stream object: a dictionary plus a payload.
 * <p>
 * The payload is never held here; a {@link StreamDataProvider} produces the
 * raw bytes whenever they're needed. "Raw" means encoded as the dictionary's
 * {@code /Filter} says, so decoding happens only in {@link #pipeStreamData}.
 * <p>
 * Streams are always indirect objects, so they're stored only in an {@link ObjectTable}.
 */
public final class PdfStream extends PdfObject {
	private final ObjGen objGen;
	private PdfDictionary dict = new PdfDictionary();
	private StreamDataProvider provider;

	public PdfStream(ObjGen objGen) {
		this.objGen = requireNonNull(objGen);
	}

	public ObjGen objGen() {
		return objGen;
	}

	public PdfDictionary dict() {
		return dict;
	}

	public void replaceDict(PdfDictionary dict) {
		this.dict = requireNonNull(dict);
	}

	public boolean hasData() {
		return provider != null;
	}

	public void replaceStreamData(@Nullable StreamDataProvider provider) {
		this.provider = provider;
	}

	/**
	 * @return true if {@link #pipeStreamData} at {@code level} would decode the data
	 */
	public boolean isDecodable(DecodeLevel level) {
		return FilterPipeline.canDecode(dict, level);
	}

	/**
	 * Writes the stream's data to {@code sink}, decoded as far as {@code level} permits,
	 * then closes {@code sink}.
	 * A stream without data writes nothing.
	 *
	 * @return true if the data was decoded through all its filters;
	 * false if it was written raw because some filter isn't decodable at {@code level}
	 */
	public boolean pipeStreamData(WritableByteChannel sink, DecodeLevel level) throws IOException {
		FilterPipeline pipeline = FilterPipeline.create(dict, level, sink);
		try (pipeline) {
			if (provider != null) {
				provider.provideStreamData(pipeline);
			}
		}
		return pipeline.isDecoding();
	}

	/**
	 * Buffers the whole payload in memory. Prefer {@link #pipeStreamData} for large streams.
	 */
	public byte[] getStreamData(DecodeLevel level) throws IOException {
		ByteArrayOutputStream result = new ByteArrayOutputStream();
		pipeStreamData(Channels.newChannel(result), level);
		return result.toByteArray();
	}

	@Override
	public String typeName() {
		return "stream";
	}

	@Override
	public String toString() {
		return "stream " + objGen + " " + dict;
	}
}
