package works.folio.jackson;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.WritableByteChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import lombok.RequiredArgsConstructor;
import works.folio.StreamDataProvider;
import works.folio.filters.FilterPipeline;

/**
 * Supplies stream data from an external file, read each time the data is needed.
 * The file needn't exist until then.
 */
@RequiredArgsConstructor
final class FileDataProvider implements StreamDataProvider {
	private final Path path;

	@Override
	public void provideStreamData(WritableByteChannel sink) throws IOException {
		try (FileChannel in = FileChannel.open(path, StandardOpenOption.READ)) {
			ByteBuffer buffer = ByteBuffer.allocate(FilterPipeline.CHUNK_SIZE);
			while (in.read(buffer) != -1) {
				buffer.flip();
				while (buffer.hasRemaining()) {
					sink.write(buffer);
				}
				buffer.clear();
			}
		}
	}

	@Override
	public String toString() {
		return "data file " + path;
	}
}
