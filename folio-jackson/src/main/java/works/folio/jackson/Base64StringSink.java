package works.folio.jackson;

import java.nio.ByteBuffer;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.WritableByteChannel;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Base64;
import tools.jackson.core.JsonGenerator;

/**
 * Writes the bytes it receives into a generator as one base64 JSON string value.
 * <p>
 * The opening quote is written on construction and the closing quote on {@link #close()}.
 * Only a partial chunk is ever buffered.
 */
final class Base64StringSink implements WritableByteChannel {
	/** A multiple of three, so chunks encode without padding */
	private static final int CHUNK_SIZE = 6144;

	private final JsonGenerator gen;
	private final byte[] pending = new byte[CHUNK_SIZE];
	private int pendingLength = 0;
	private boolean open = true;

	Base64StringSink(JsonGenerator gen) {
		this.gen = gen;
		gen.writeRawValue("\"");
	}

	@Override
	public int write(ByteBuffer src) throws ClosedChannelException {
		if (!open) {
			throw new ClosedChannelException();
		}
		int result = src.remaining();
		while (src.hasRemaining()) {
			int n = Math.min(src.remaining(), pending.length - pendingLength);
			src.get(pending, pendingLength, n);
			pendingLength += n;
			if (pendingLength == pending.length) {
				flushPending();
			}
		}
		return result;
	}

	@Override
	public boolean isOpen() {
		return open;
	}

	@Override
	public void close() {
		if (open) {
			open = false;
			flushPending();
			gen.writeRaw('"');
		}
	}

	private void flushPending() {
		if (pendingLength > 0) {
			byte[] encoded = ENCODER.encode(Arrays.copyOf(pending, pendingLength));
			gen.writeRaw(new String(encoded, StandardCharsets.US_ASCII));
			pendingLength = 0;
		}
	}

	private static final Base64.Encoder ENCODER = Base64.getEncoder();
}
