package works.folio;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.WritableByteChannel;

/**
 * Supplies the raw bytes of a {@link PdfStream} on demand.
 * <p>
 * Nothing is read when the provider is attached;
 * {@link #provideStreamData} runs only when someone asks for the stream's data,
 * and may run any number of times.
 */
@FunctionalInterface
public interface StreamDataProvider {
	/**
	 * Writes the stream's raw bytes to {@code sink}.
	 * Must not close {@code sink}; the caller does that once the data is complete.
	 */
	void provideStreamData(WritableByteChannel sink) throws IOException;

	static StreamDataProvider ofBytes(byte[] data) {
		byte[] copy = data.clone();
		return sink -> {
			ByteBuffer buffer = ByteBuffer.wrap(copy);
			while (buffer.hasRemaining()) {
				sink.write(buffer);
			}
		};
	}
}
