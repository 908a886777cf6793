package works.folio;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Optional;

import static java.nio.charset.StandardCharsets.US_ASCII;
import static java.nio.charset.StandardCharsets.UTF_16BE;
import static java.util.Objects.requireNonNull;

/**
 * A PDF string: an arbitrary sequence of bytes.
 * <p>
 * Text strings are stored as ASCII when every character is printable ASCII,
 * and otherwise as UTF-16BE preceded by the byte order mark {@code FE FF}.
 */
public final class PdfString extends PdfObject {
	private final byte[] bytes;

	private PdfString(byte[] bytes) {
		this.bytes = bytes;
	}

	public static PdfString of(byte[] bytes) {
		return new PdfString(requireNonNull(bytes).clone());
	}

	public static PdfString fromHex(String hex) {
		return new PdfString(HEX.parseHex(hex));
	}

	public static PdfString unicode(String text) {
		if (isPrintableAscii(text)) {
			return new PdfString(text.getBytes(US_ASCII));
		}
		byte[] utf16 = text.getBytes(UTF_16BE);
		byte[] result = new byte[utf16.length + 2];
		result[0] = (byte) 0xFE;
		result[1] = (byte) 0xFF;
		System.arraycopy(utf16, 0, result, 2, utf16.length);
		return new PdfString(result);
	}

	public byte[] bytes() {
		return bytes.clone();
	}

	public String hexValue() {
		return HEX.formatHex(bytes);
	}

	/**
	 * @return the text this string represents, if it is a text string
	 * produced by {@link #unicode}; empty if the bytes are not recognizable as text.
	 */
	public Optional<String> textValue() {
		if (bytes.length >= 2 && (bytes[0] & 0xFF) == 0xFE && (bytes[1] & 0xFF) == 0xFF) {
			try {
				return Optional.of(UTF_16BE.newDecoder()
					.onMalformedInput(CodingErrorAction.REPORT)
					.onUnmappableCharacter(CodingErrorAction.REPORT)
					.decode(ByteBuffer.wrap(bytes, 2, bytes.length - 2))
					.toString());
			} catch (CharacterCodingException e) {
				return Optional.empty();
			}
		}
		for (byte b : bytes) {
			if (!isPrintableAscii((char) (b & 0xFF))) {
				return Optional.empty();
			}
		}
		return Optional.of(new String(bytes, US_ASCII));
	}

	@Override
	public String typeName() {
		return "string";
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof PdfString other && Arrays.equals(other.bytes, bytes);
	}

	@Override
	public int hashCode() {
		return Arrays.hashCode(bytes);
	}

	@Override
	public String toString() {
		return "<" + hexValue() + ">";
	}

	private static boolean isPrintableAscii(String text) {
		for (int i = 0; i < text.length(); i++) {
			if (!isPrintableAscii(text.charAt(i))) {
				return false;
			}
		}
		return true;
	}

	private static boolean isPrintableAscii(char c) {
		return (c >= 0x20 && c <= 0x7E) || c == '\t' || c == '\n' || c == '\r';
	}

	private static final HexFormat HEX = HexFormat.of();
}
