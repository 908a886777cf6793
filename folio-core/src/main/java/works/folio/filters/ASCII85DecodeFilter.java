package works.folio.filters;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;

/**
 * {@code /ASCII85Decode}: groups of five characters from {@code !} to {@code u}
 * encode four bytes; {@code z} stands for four zero bytes; {@code ~>} ends the data.
 */
public final class ASCII85DecodeFilter extends StreamFilter {
	private static final long[] POW85 = { 85L * 85 * 85 * 85, 85L * 85 * 85, 85L * 85, 85L, 1L };

	private final int[] tuple = new int[5];
	private int tupleCount;
	private boolean sawTilde;
	private boolean ended;

	@Override
	protected void decode(ByteBuffer src) throws IOException {
		ByteArrayOutputStream output = new ByteArrayOutputStream();
		while (!ended && src.hasRemaining()) {
			int b = src.get() & 0xFF;
			if (sawTilde) {
				if (b != '>') {
					throw new IOException("ASCII85Decode: '~' not followed by '>'");
				}
				flushTuple(output);
				ended = true;
			} else if (b == '~') {
				sawTilde = true;
			} else if (FilterPipeline.isWhitespace(b)) {
				// skip
			} else if (b == 'z') {
				if (tupleCount != 0) {
					throw new IOException("ASCII85Decode: 'z' inside a group");
				}
				output.write(new byte[4], 0, 4);
			} else if (b >= '!' && b <= 'u') {
				tuple[tupleCount++] = b - '!';
				if (tupleCount == 5) {
					writeTuple(output, 4);
					tupleCount = 0;
				}
			} else {
				throw new IOException("ASCII85Decode: invalid character 0x" + Integer.toHexString(b));
			}
		}
		src.position(src.limit());
		writeToNext(output.toByteArray(), 0, output.size());
	}

	@Override
	protected void finish() throws IOException {
		ByteArrayOutputStream output = new ByteArrayOutputStream();
		flushTuple(output);
		writeToNext(output.toByteArray(), 0, output.size());
	}

	private void flushTuple(ByteArrayOutputStream output) throws IOException {
		if (tupleCount == 0) {
			return;
		}
		if (tupleCount == 1) {
			throw new IOException("ASCII85Decode: final group has only one character");
		}
		int byteCount = tupleCount - 1;
		for (int i = tupleCount; i < 5; i++) {
			tuple[i] = 'u' - '!';
		}
		writeTuple(output, byteCount);
		tupleCount = 0;
	}

	private void writeTuple(ByteArrayOutputStream output, int byteCount) {
		long value = 0;
		for (int i = 0; i < 5; i++) {
			value += tuple[i] * POW85[i];
		}
		for (int i = 0; i < byteCount; i++) {
			output.write((int) (value >> (24 - 8 * i)) & 0xFF);
		}
	}
}
