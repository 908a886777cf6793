package works.folio.filters;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;

/**
 * {@code /ASCIIHexDecode}: pairs of hex digits, whitespace ignored, terminated by {@code >}.
 * A final odd digit is treated as if followed by zero.
 */
public final class ASCIIHexDecodeFilter extends StreamFilter {
	private int pendingNibble = -1;
	private boolean ended;

	@Override
	protected void decode(ByteBuffer src) throws IOException {
		ByteArrayOutputStream output = new ByteArrayOutputStream();
		while (!ended && src.hasRemaining()) {
			int b = src.get() & 0xFF;
			if (b == '>') {
				flushNibble(output);
				ended = true;
			} else if (!FilterPipeline.isWhitespace(b)) {
				int nibble = Character.digit(b, 16);
				if (nibble < 0) {
					throw new IOException("ASCIIHexDecode: invalid character 0x" + Integer.toHexString(b));
				}
				if (pendingNibble < 0) {
					pendingNibble = nibble;
				} else {
					output.write((pendingNibble << 4) | nibble);
					pendingNibble = -1;
				}
			}
		}
		src.position(src.limit());
		writeToNext(output.toByteArray(), 0, output.size());
	}

	@Override
	protected void finish() throws IOException {
		ByteArrayOutputStream output = new ByteArrayOutputStream();
		flushNibble(output);
		writeToNext(output.toByteArray(), 0, output.size());
	}

	private void flushNibble(ByteArrayOutputStream output) {
		if (pendingNibble >= 0) {
			output.write(pendingNibble << 4);
			pendingNibble = -1;
		}
	}
}
