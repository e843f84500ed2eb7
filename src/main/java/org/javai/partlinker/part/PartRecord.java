package org.javai.partlinker.part;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A part as delivered by the part source.
 *
 * <p>Fixed attributes hold whatever the source exposes besides the typed fields,
 * either as scalars or as nested maps (for example {@code footprint -> {name: ...}}).
 * The parameter bag holds the part's named parameters as text.</p>
 *
 * @param id the source identifier
 * @param name the part name
 * @param categoryPath the full category path, e.g. {@code Active → ICs → OpAmp}
 * @param attributes fixed attributes, insertion ordered
 * @param parameters the parameter bag, insertion ordered
 */
public record PartRecord(
		long id,
		String name,
		String categoryPath,
		Map<String, Object> attributes,
		Map<String, String> parameters) {

	public static final String UNCATEGORIZED = "Uncategorized";

	public PartRecord {
		Objects.requireNonNull(name, "name must not be null");
		categoryPath = categoryPath != null && !categoryPath.isBlank() ? categoryPath : UNCATEGORIZED;
		attributes = attributes != null
				? Collections.unmodifiableMap(new LinkedHashMap<>(attributes))
				: Map.of();
		parameters = parameters != null
				? Collections.unmodifiableMap(new LinkedHashMap<>(parameters))
				: Map.of();
	}

	public static PartRecord of(long id, String name, String categoryPath, Map<String, String> parameters) {
		return new PartRecord(id, name, categoryPath, Map.of(), parameters);
	}

	/**
	 * Typed field access first, then the attribute map.
	 */
	public Optional<Object> attribute(String key) {
		return switch (key) {
			case "id" -> Optional.of(id);
			case "name" -> Optional.of(name);
			case "category" -> Optional.of(categoryPath);
			case "parameters" -> Optional.of(parameters);
			default -> Optional.ofNullable(attributes.get(key));
		};
	}

	public Optional<String> parameter(String key) {
		return Optional.ofNullable(parameters.get(key));
	}

	@Override
	public String toString() {
		return "PartRecord[" + id + ", " + name + "]";
	}
}
