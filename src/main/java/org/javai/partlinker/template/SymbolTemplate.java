package org.javai.partlinker.template;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-category rendering configuration.
 *
 * @param name the template key in the configuration file
 * @param appliesToCategories category suffixes this template handles, in declaration order
 * @param fieldMapping target property to source, in declaration order
 * @param propertyTemplates target property to a pattern containing {@value #VALUE_PLACEHOLDER}
 * @param generator how graphics are produced
 * @param powerPinNames pin names treated as power pins by the IC generator
 * @param symbolOptions extra tokens for the symbol header, e.g. {@code (pin_names (offset 1.016))}
 * @param staticGraphics literal graphics and pins for {@link GeneratorKind#STATIC}
 */
public record SymbolTemplate(
		String name,
		List<String> appliesToCategories,
		Map<String, FieldSource> fieldMapping,
		Map<String, String> propertyTemplates,
		GeneratorKind generator,
		List<String> powerPinNames,
		String symbolOptions,
		String staticGraphics) {

	public static final String VALUE_PLACEHOLDER = "{VALUE}";

	public SymbolTemplate {
		Objects.requireNonNull(name, "name must not be null");
		Objects.requireNonNull(generator, "generator must not be null");
		appliesToCategories = appliesToCategories != null ? List.copyOf(appliesToCategories) : List.of();
		fieldMapping = fieldMapping != null
				? Collections.unmodifiableMap(new LinkedHashMap<>(fieldMapping))
				: Map.of();
		propertyTemplates = propertyTemplates != null
				? Collections.unmodifiableMap(new LinkedHashMap<>(propertyTemplates))
				: Map.of();
		powerPinNames = powerPinNames != null ? List.copyOf(powerPinNames) : List.of();
		symbolOptions = symbolOptions != null ? symbolOptions.trim() : "";
		staticGraphics = staticGraphics != null ? staticGraphics : "";
	}

	public Optional<String> propertyTemplate(String property) {
		return Optional.ofNullable(propertyTemplates.get(property));
	}

	/**
	 * True when one of the configured categories is a case-insensitive suffix of
	 * the given category path.
	 */
	public boolean appliesTo(String categoryPath) {
		if (categoryPath == null) {
			return false;
		}
		String path = categoryPath.strip().toLowerCase(Locale.ROOT);
		for (String category : appliesToCategories) {
			if (path.endsWith(category.strip().toLowerCase(Locale.ROOT))) {
				return true;
			}
		}
		return false;
	}
}
