package works.folio;

import java.io.IOException;
import java.io.InputStream;
import java.nio.channels.Channels;
import java.nio.channels.SeekableByteChannel;

/**
 * A named, randomly accessible sequence of bytes.
 * <p>
 * Importers read it front to back with {@link #openStream()},
 * and stream data providers come back later for byte ranges with {@link #openChannel()}.
 * Every call opens an independent view, so readers never disturb each other.
 */
public interface InputSource {
	/**
	 * @return the name used in diagnostics, such as a file name
	 */
	String name();

	/**
	 * @return a new channel positioned at offset zero; the caller closes it
	 */
	SeekableByteChannel openChannel() throws IOException;

	/**
	 * @return a new stream over the whole input, starting from offset zero
	 */
	default InputStream openStream() throws IOException {
		return Channels.newInputStream(openChannel());
	}
}
