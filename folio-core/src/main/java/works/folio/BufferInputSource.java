package works.folio;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.NonWritableChannelException;
import java.nio.channels.SeekableByteChannel;

import static java.util.Objects.requireNonNull;

/**
 * An {@link InputSource} over bytes already in memory.
 */
public final class BufferInputSource implements InputSource {
	private final String name;
	private final byte[] bytes;

	public BufferInputSource(String name, byte[] bytes) {
		this.name = requireNonNull(name);
		this.bytes = bytes.clone();
	}

	@Override
	public String name() {
		return name;
	}

	@Override
	public SeekableByteChannel openChannel() {
		return new ByteBufferChannel(ByteBuffer.wrap(bytes).asReadOnlyBuffer());
	}

	@Override
	public InputStream openStream() {
		return new ByteArrayInputStream(bytes);
	}

	@Override
	public String toString() {
		return "BufferInputSource(" + name + ", " + bytes.length + " bytes)";
	}

	/**
	 * Read-only channel over a buffer; position is tracked by the buffer itself.
	 */
	private static final class ByteBufferChannel implements SeekableByteChannel {
		private final ByteBuffer buffer;
		private boolean open = true;

		ByteBufferChannel(ByteBuffer buffer) {
			this.buffer = buffer;
		}

		@Override
		public int read(ByteBuffer dst) throws IOException {
			ensureOpen();
			if (!buffer.hasRemaining()) {
				return -1;
			}
			int n = Math.min(buffer.remaining(), dst.remaining());
			int limit = buffer.limit();
			buffer.limit(buffer.position() + n);
			dst.put(buffer);
			buffer.limit(limit);
			return n;
		}

		@Override
		public int write(ByteBuffer src) {
			throw new NonWritableChannelException();
		}

		@Override
		public long position() throws IOException {
			ensureOpen();
			return buffer.position();
		}

		@Override
		public SeekableByteChannel position(long newPosition) throws IOException {
			ensureOpen();
			if (newPosition < 0) {
				throw new IllegalArgumentException("Negative position: " + newPosition);
			}
			buffer.position((int) Math.min(newPosition, buffer.limit()));
			return this;
		}

		@Override
		public long size() throws IOException {
			ensureOpen();
			return buffer.limit();
		}

		@Override
		public SeekableByteChannel truncate(long size) {
			throw new NonWritableChannelException();
		}

		@Override
		public boolean isOpen() {
			return open;
		}

		@Override
		public void close() {
			open = false;
		}

		private void ensureOpen() throws ClosedChannelException {
			if (!open) {
				throw new ClosedChannelException();
			}
		}
	}
}
