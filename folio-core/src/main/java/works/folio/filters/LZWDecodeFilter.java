package works.folio.filters;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

/**
 * {@code /LZWDecode}: variable-length codes from 9 to 12 bits, most significant bit first.
 */
public final class LZWDecodeFilter extends StreamFilter {
	private static final int CLEAR_TABLE = 256;
	private static final int EOD = 257;
	private static final int INITIAL_CODE_LENGTH = 9;
	private static final int MAX_CODE_LENGTH = 12;
	private static final int MAX_TABLE_SIZE = 1 << MAX_CODE_LENGTH;

	private final int earlyChange;
	private final List<byte[]> table = new ArrayList<>(MAX_TABLE_SIZE);
	private int codeLength;
	private byte[] previous;
	private int bitBuffer;
	private int bitsInBuffer;
	private boolean ended;

	/**
	 * @param earlyChange the {@code /EarlyChange} parameter: 1 (the default) or 0
	 */
	public LZWDecodeFilter(int earlyChange) {
		this.earlyChange = earlyChange;
		resetTable();
	}

	@Override
	protected void decode(ByteBuffer src) throws IOException {
		ByteArrayOutputStream output = new ByteArrayOutputStream();
		while (!ended && src.hasRemaining()) {
			while (bitsInBuffer < codeLength && src.hasRemaining()) {
				bitBuffer = (bitBuffer << 8) | (src.get() & 0xFF);
				bitsInBuffer += 8;
			}
			if (bitsInBuffer < codeLength) {
				break;
			}
			int code = (bitBuffer >>> (bitsInBuffer - codeLength)) & ((1 << codeLength) - 1);
			bitsInBuffer -= codeLength;
			bitBuffer &= (1 << bitsInBuffer) - 1;
			handleCode(code, output);
		}
		src.position(src.limit());
		writeToNext(output.toByteArray(), 0, output.size());
	}

	private void handleCode(int code, ByteArrayOutputStream output) throws IOException {
		if (code == EOD) {
			ended = true;
			return;
		}
		if (code == CLEAR_TABLE) {
			resetTable();
			return;
		}

		byte[] sequence;
		if (code < table.size()) {
			sequence = table.get(code);
		} else if (code == table.size() && previous != null) {
			sequence = append(previous, previous[0]);
		} else {
			throw new IOException("LZWDecode: invalid code " + code);
		}
		output.write(sequence, 0, sequence.length);

		if (previous != null && table.size() < MAX_TABLE_SIZE) {
			table.add(append(previous, sequence[0]));
			if (table.size() + earlyChange >= (1 << codeLength) && codeLength < MAX_CODE_LENGTH) {
				codeLength++;
			}
		}
		previous = sequence;
	}

	private void resetTable() {
		table.clear();
		for (int i = 0; i < 256; i++) {
			table.add(new byte[] { (byte) i });
		}
		table.add(null); // CLEAR_TABLE
		table.add(null); // EOD
		codeLength = INITIAL_CODE_LENGTH;
		previous = null;
	}

	private static byte[] append(byte[] prefix, byte last) {
		byte[] result = new byte[prefix.length + 1];
		System.arraycopy(prefix, 0, result, 0, prefix.length);
		result[prefix.length] = last;
		return result;
	}
}
