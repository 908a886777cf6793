package works.folio.jackson;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.nio.channels.WritableByteChannel;
import java.util.Base64;
import works.folio.InputSource;
import works.folio.StreamDataProvider;
import works.folio.filters.FilterPipeline;

/**
 * Supplies stream data from base64 text inside the JSON input,
 * rereading the input each time rather than keeping the decoded bytes.
 * <p>
 * Line breaks and other characters outside the base64 alphabet are skipped.
 */
final class InlineDataProvider implements StreamDataProvider {
	private final InputSource source;
	private final long start;
	private final long end;

	/**
	 * @param start offset of the first base64 character
	 * @param end offset just past the last base64 character
	 */
	InlineDataProvider(InputSource source, long start, long end) {
		if (end < start) {
			throw new IllegalArgumentException("Invalid range " + start + ".." + end);
		}
		this.source = source;
		this.start = start;
		this.end = end;
	}

	@Override
	public void provideStreamData(WritableByteChannel sink) throws IOException {
		try (
			SeekableByteChannel channel = source.openChannel();
			InputStream decoded = Base64.getMimeDecoder().wrap(new BufferedInputStream(
				new RangeInputStream(channel.position(start), end - start),
				FilterPipeline.CHUNK_SIZE))
		) {
			byte[] chunk = new byte[FilterPipeline.CHUNK_SIZE];
			int n;
			while ((n = decoded.read(chunk)) != -1) {
				ByteBuffer buffer = ByteBuffer.wrap(chunk, 0, n);
				while (buffer.hasRemaining()) {
					sink.write(buffer);
				}
			}
		}
	}

	@Override
	public String toString() {
		return "base64 data in " + source.name() + " at " + start + ".." + end;
	}

	/**
	 * Reads at most {@code remaining} bytes from the channel's current position.
	 */
	private static final class RangeInputStream extends InputStream {
		private final SeekableByteChannel channel;
		private final byte[] one = new byte[1];
		private long remaining;

		RangeInputStream(SeekableByteChannel channel, long length) {
			this.channel = channel;
			this.remaining = length;
		}

		@Override
		public int read() throws IOException {
			int n = read(one, 0, 1);
			return (n == -1) ? -1 : (one[0] & 0xFF);
		}

		@Override
		public int read(byte[] b, int off, int len) throws IOException {
			if (len == 0) {
				return 0;
			}
			if (remaining <= 0) {
				return -1;
			}
			int n = channel.read(ByteBuffer.wrap(b, off, (int) Math.min(len, remaining)));
			if (n == -1) {
				throw new IOException("Input ended " + remaining + " bytes before the end of the stream data");
			}
			remaining -= n;
			return n;
		}
	}
}
