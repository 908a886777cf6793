package works.folio.filters;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;

/**
 * {@code /RunLengthDecode}: a length byte of 0-127 copies the next length+1 bytes,
 * 129-255 repeats the next byte 257-length times, and 128 ends the data.
 */
public final class RunLengthDecodeFilter extends StreamFilter {
	private static final int EOD = 128;

	private enum State { LENGTH, LITERAL, RUN }

	private State state = State.LENGTH;
	private int remaining;
	private boolean ended;

	@Override
	protected void decode(ByteBuffer src) throws IOException {
		ByteArrayOutputStream output = new ByteArrayOutputStream();
		while (!ended && src.hasRemaining()) {
			int b = src.get() & 0xFF;
			switch (state) {
				case LENGTH -> {
					if (b == EOD) {
						ended = true;
					} else if (b < EOD) {
						remaining = b + 1;
						state = State.LITERAL;
					} else {
						remaining = 257 - b;
						state = State.RUN;
					}
				}
				case LITERAL -> {
					output.write(b);
					if (--remaining == 0) {
						state = State.LENGTH;
					}
				}
				case RUN -> {
					for (int i = 0; i < remaining; i++) {
						output.write(b);
					}
					state = State.LENGTH;
				}
			}
		}
		src.position(src.limit());
		writeToNext(output.toByteArray(), 0, output.size());
	}
}
