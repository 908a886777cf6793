package works.folio;

import java.io.IOException;
import java.io.InputStream;
import java.nio.channels.FileChannel;
import java.nio.channels.SeekableByteChannel;
import java.nio.file.Files;
import java.nio.file.Path;

import static java.nio.file.StandardOpenOption.READ;
import static java.util.Objects.requireNonNull;

/**
 * An {@link InputSource} backed by a file.
 * No handle is held between calls.
 */
public final class FileInputSource implements InputSource {
	private final Path path;

	public FileInputSource(Path path) {
		this.path = requireNonNull(path);
	}

	public Path path() {
		return path;
	}

	@Override
	public String name() {
		return path.toString();
	}

	@Override
	public SeekableByteChannel openChannel() throws IOException {
		return FileChannel.open(path, READ);
	}

	@Override
	public InputStream openStream() throws IOException {
		return Files.newInputStream(path);
	}

	@Override
	public String toString() {
		return "FileInputSource(" + path + ")";
	}
}
