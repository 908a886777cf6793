package works.folio.jackson;

import java.util.Set;
import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;
import works.folio.DecodeLevel;

/**
 * @see JsonExporter
 */
@Value
@Builder(toBuilder = true)
public class JsonExportSettings {
	/**
	 * Schema version. Only {@value JsonSchema#VERSION} is supported.
	 */
	@Default int version = JsonSchema.VERSION;

	/**
	 * How far stream data is decoded. Streams whose filters can't be
	 * decoded at this level are exported raw, with their filters intact.
	 */
	@Default DecodeLevel decodeLevel = DecodeLevel.GENERALIZED;

	@Default StreamDataMode streamData = StreamDataMode.INLINE;

	/**
	 * With {@link StreamDataMode#FILE}, each stream's data goes
	 * to a file named by this prefix, a hyphen, and the object number.
	 */
	@Default String filePrefix = null;

	/**
	 * Keys of the entries to export, like {@code "obj:3 0 R"} or {@code "trailer"}.
	 * Empty means all of them.
	 */
	@Default Set<String> wantedObjects = Set.of();

	public static JsonExportSettings defaults() {
		return JsonExportSettings.builder().build();
	}
}
