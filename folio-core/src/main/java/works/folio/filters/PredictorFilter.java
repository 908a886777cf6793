package works.folio.filters;

import java.io.IOException;
import java.nio.ByteBuffer;

/**
 * Reverses the TIFF (2) or PNG (10-15) predictor applied before
 * {@code /FlateDecode} or {@code /LZWDecode} compression.
 * <p>
 * Rows may span input chunks, so one partial row is kept between writes.
 */
public final class PredictorFilter extends StreamFilter {
	private final boolean png;
	private final int bytesPerPixel;
	private final int rowBytes;
	private final byte[] input;
	private byte[] current;
	private byte[] previous;
	private int inputFill;

	/**
	 * @throws IllegalArgumentException if {@link #isSupported} says no
	 */
	public PredictorFilter(int predictor, int colors, int bitsPerComponent, int columns) {
		if (!isSupported(predictor, colors, bitsPerComponent, columns)) {
			throw new IllegalArgumentException("Unsupported predictor parameters: predictor=" + predictor
				+ " colors=" + colors + " bitsPerComponent=" + bitsPerComponent + " columns=" + columns);
		}
		this.png = predictor >= 10;
		this.bytesPerPixel = Math.max(1, (colors * bitsPerComponent + 7) / 8);
		this.rowBytes = (int) (((long) columns * colors * bitsPerComponent + 7) / 8);
		this.input = new byte[png ? rowBytes + 1 : rowBytes];
		this.current = new byte[rowBytes];
		this.previous = new byte[rowBytes];
	}

	public static boolean isSupported(int predictor, int colors, int bitsPerComponent, int columns) {
		if (colors < 1 || columns < 1) {
			return false;
		}
		if (predictor == 2) {
			return bitsPerComponent == 8;
		}
		if (predictor >= 10 && predictor <= 15) {
			return bitsPerComponent == 1 || bitsPerComponent == 2 || bitsPerComponent == 4
				|| bitsPerComponent == 8 || bitsPerComponent == 16;
		}
		return false;
	}

	@Override
	protected void decode(ByteBuffer src) throws IOException {
		while (src.hasRemaining()) {
			int n = Math.min(src.remaining(), input.length - inputFill);
			src.get(input, inputFill, n);
			inputFill += n;
			if (inputFill == input.length) {
				if (png) {
					decodePngRow();
				} else {
					decodeTiffRow();
				}
				writeToNext(current, 0, rowBytes);
				byte[] swap = previous;
				previous = current;
				current = swap;
				inputFill = 0;
			}
		}
	}

	@Override
	protected void finish() throws IOException {
		if (inputFill != 0) {
			throw new IOException("Predictor: data ends with a partial row");
		}
	}

	private void decodeTiffRow() {
		for (int i = 0; i < rowBytes; i++) {
			int left = (i >= bytesPerPixel) ? current[i - bytesPerPixel] : 0;
			current[i] = (byte) (input[i] + left);
		}
	}

	private void decodePngRow() throws IOException {
		int tag = input[0] & 0xFF;
		for (int i = 0; i < rowBytes; i++) {
			int raw = input[i + 1] & 0xFF;
			int left = (i >= bytesPerPixel) ? (current[i - bytesPerPixel] & 0xFF) : 0;
			int up = previous[i] & 0xFF;
			int upLeft = (i >= bytesPerPixel) ? (previous[i - bytesPerPixel] & 0xFF) : 0;
			int value = switch (tag) {
				case 0 -> raw;
				case 1 -> raw + left;
				case 2 -> raw + up;
				case 3 -> raw + ((left + up) >>> 1);
				case 4 -> raw + paeth(left, up, upLeft);
				default -> throw new IOException("Predictor: invalid PNG row filter " + tag);
			};
			current[i] = (byte) value;
		}
	}

	private static int paeth(int a, int b, int c) {
		int p = a + b - c;
		int pa = Math.abs(p - a);
		int pb = Math.abs(p - b);
		int pc = Math.abs(p - c);
		if (pa <= pb && pa <= pc) {
			return a;
		} else if (pb <= pc) {
			return b;
		} else {
			return c;
		}
	}
}
