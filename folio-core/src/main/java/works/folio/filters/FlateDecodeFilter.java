package works.folio.filters;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.zip.DataFormatException;
import java.util.zip.Inflater;

/**
 * {@code /FlateDecode}: zlib decompression, fed incrementally.
 */
public final class FlateDecodeFilter extends StreamFilter {
	private final Inflater inflater = new Inflater();
	private final byte[] outputBuffer = new byte[FilterPipeline.CHUNK_SIZE];
	private byte[] inputBuffer = new byte[0];

	@Override
	protected void decode(ByteBuffer src) throws IOException {
		if (inflater.finished()) {
			src.position(src.limit());
			return;
		}
		int length = src.remaining();
		if (inputBuffer.length < length) {
			inputBuffer = new byte[length];
		}
		src.get(inputBuffer, 0, length);
		inflater.setInput(inputBuffer, 0, length);
		drain();
	}

	@Override
	protected void finish() throws IOException {
		drain();
		inflater.end();
	}

	private void drain() throws IOException {
		try {
			while (!inflater.finished()) {
				int count = inflater.inflate(outputBuffer);
				if (count == 0) {
					// Needs more input, or a preset dictionary we'll never have
					break;
				}
				writeToNext(outputBuffer, 0, count);
			}
		} catch (DataFormatException e) {
			throw new IOException("FlateDecode error: " + e.getMessage(), e);
		}
	}
}
