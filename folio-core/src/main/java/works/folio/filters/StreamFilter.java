package works.folio.filters;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.WritableByteChannel;

/**
 * One stage of a {@link FilterPipeline}: accepts encoded bytes in arbitrary chunks
 * and writes decoded bytes to the next channel.
 * <p>
 * Input that cannot be decoded yet (a partial tuple, an incomplete row)
 * is kept until more arrives or until {@link #close()}.
 * Closing a filter flushes it and then closes the next channel.
 */
public abstract class StreamFilter implements WritableByteChannel {
	private WritableByteChannel next;
	private boolean open = true;

	void setNext(WritableByteChannel next) {
		this.next = next;
	}

	/**
	 * Consumes all of {@code src}.
	 */
	@Override
	public final int write(ByteBuffer src) throws IOException {
		int consumed = src.remaining();
		decode(src);
		return consumed;
	}

	@Override
	public final void close() throws IOException {
		if (!open) {
			return;
		}
		open = false;
		finish();
		next.close();
	}

	@Override
	public final boolean isOpen() {
		return open;
	}

	/**
	 * Decodes as much of {@code src} as possible, buffering what's left.
	 */
	protected abstract void decode(ByteBuffer src) throws IOException;

	/**
	 * Called once when the input is complete; writes anything still buffered.
	 */
	protected void finish() throws IOException {
	}

	protected final void writeToNext(ByteBuffer data) throws IOException {
		while (data.hasRemaining()) {
			next.write(data);
		}
	}

	protected final void writeToNext(byte[] data, int offset, int length) throws IOException {
		if (length > 0) {
			writeToNext(ByteBuffer.wrap(data, offset, length));
		}
	}
}
