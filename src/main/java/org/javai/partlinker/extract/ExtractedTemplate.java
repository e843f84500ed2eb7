package org.javai.partlinker.extract;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

/**
 * Template pieces lifted from an existing symbol.
 *
 * @param symbolName the symbol the pieces were taken from
 * @param symbolOptions option blocks on one line, empty when the symbol has none
 * @param propertyTemplates property name to property block with its value replaced by {@code {VALUE}}
 * @param graphics pin blocks and unit sub-symbols, in source order
 */
public record ExtractedTemplate(
		String symbolName,
		String symbolOptions,
		Map<String, String> propertyTemplates,
		List<String> graphics) {

	public ExtractedTemplate {
		propertyTemplates = Collections.unmodifiableMap(new LinkedHashMap<>(propertyTemplates));
		graphics = List.copyOf(graphics);
	}

	/**
	 * Renders a template definition ready to paste into the template file. The
	 * field mapping is a starting point and usually needs editing.
	 *
	 * @param categoryKey template name to use, defaults to {@code <symbol>_Category}
	 */
	public String toYaml(String categoryKey) {
		String key = categoryKey != null && !categoryKey.isBlank() ? categoryKey : symbolName + "_Category";

		Map<String, Object> fieldMapping = new LinkedHashMap<>();
		fieldMapping.put("Reference", "'U'");
		fieldMapping.put("Value", "name");
		fieldMapping.put("Footprint", "footprint.name");
		fieldMapping.put("Datasheet", "manufacturer_product_url");

		Map<String, Object> body = new LinkedHashMap<>();
		body.put("applies_to_categories", List.of(key));
		body.put("field_mapping", fieldMapping);
		if (!symbolOptions.isEmpty()) {
			body.put("symbol_options", symbolOptions);
		}
		if (!propertyTemplates.isEmpty()) {
			body.put("property_templates", new LinkedHashMap<>(propertyTemplates));
		}
		if (!graphics.isEmpty()) {
			body.put("symbol_template", String.join("\n", graphics) + "\n");
		}

		DumperOptions options = new DumperOptions();
		options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
		options.setIndent(2);
		options.setWidth(Integer.MAX_VALUE);
		Map<String, Object> root = new LinkedHashMap<>();
		root.put(key, body);
		return new Yaml(options).dump(root);
	}
}
