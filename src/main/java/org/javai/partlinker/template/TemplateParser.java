package org.javai.partlinker.template;

import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Parser for template YAML files.
 *
 * <p>The file is a map from template name to template definition:</p>
 * <pre>
 * Resistors:
 *   applies_to_categories: ["Resistors"]
 *   field_mapping:
 *     Reference: "'R'"
 *     Value: "Resistance"
 *     Footprint: "footprint.name"
 *   property_templates:
 *     Reference: '(property "Reference" "{VALUE}" (at 2.032 0 90) (effects (font (size 1.27 1.27))))'
 *   symbol_options: '(pin_numbers hide)'
 *   symbol_template: |
 *     (symbol "R_0_1" ...)
 * ICs:
 *   applies_to_categories: ["ICs"]
 *   symbol_generator: IC_Box
 *   power_pin_names: ["VCC", "GND"]
 * </pre>
 */
public class TemplateParser {

	private static final Logger logger = LoggerFactory.getLogger(TemplateParser.class);

	private final Yaml yaml = new Yaml();

	/**
	 * Parse a template file from a path.
	 */
	public TemplateCatalog parse(Path path) {
		try (var reader = Files.newBufferedReader(path)) {
			return parse(reader);
		} catch (NoSuchFileException e) {
			throw new TemplateConfigException("Template file not found: " + path, e);
		} catch (TemplateConfigException e) {
			throw new TemplateConfigException("Invalid template file " + path + ": " + e.getMessage(), e);
		} catch (Exception e) {
			throw new TemplateConfigException("Failed to read template file: " + path, e);
		}
	}

	/**
	 * Parse a template file from an input stream.
	 */
	public TemplateCatalog parse(InputStream inputStream) {
		try {
			return buildCatalog(yaml.load(inputStream));
		} catch (YAMLException e) {
			throw new TemplateConfigException("Failed to parse templates from input stream", e);
		}
	}

	/**
	 * Parse a template file from a reader.
	 */
	public TemplateCatalog parse(Reader reader) {
		try {
			return buildCatalog(yaml.load(reader));
		} catch (YAMLException e) {
			throw new TemplateConfigException("Failed to parse templates from reader", e);
		}
	}

	/**
	 * Parse templates from a YAML string.
	 */
	public TemplateCatalog parseString(String yamlContent) {
		try {
			return buildCatalog(yaml.load(yamlContent));
		} catch (YAMLException e) {
			throw new TemplateConfigException("Failed to parse templates from string", e);
		}
	}

	@SuppressWarnings("unchecked")
	private TemplateCatalog buildCatalog(Object data) {
		if (!(data instanceof Map<?, ?> root) || root.isEmpty()) {
			throw new TemplateConfigException("Template configuration is empty or not a map of templates");
		}
		List<SymbolTemplate> templates = new ArrayList<>();
		for (Map.Entry<?, ?> entry : root.entrySet()) {
			String templateName = String.valueOf(entry.getKey());
			if (!(entry.getValue() instanceof Map<?, ?> body)) {
				throw new TemplateConfigException("Template '" + templateName + "' must be a map");
			}
			templates.add(buildTemplate(templateName, (Map<String, Object>) body));
		}
		logger.info("Loaded {} templates", templates.size());
		return new TemplateCatalog(templates);
	}

	private SymbolTemplate buildTemplate(String templateName, Map<String, Object> body) {
		String staticGraphics = toStringOrNull(body.get("symbol_template"));
		GeneratorKind generator;
		try {
			generator = GeneratorKind.fromConfig(
					toStringOrNull(body.get("symbol_generator")),
					staticGraphics != null && !staticGraphics.isBlank());
		} catch (TemplateConfigException e) {
			throw new TemplateConfigException("Template '" + templateName + "': " + e.getMessage());
		}
		return new SymbolTemplate(
				templateName,
				toStringList(templateName, "applies_to_categories", body.get("applies_to_categories")),
				buildFieldMapping(templateName, body.get("field_mapping")),
				toStringMap(templateName, "property_templates", body.get("property_templates")),
				generator,
				toStringList(templateName, "power_pin_names", body.get("power_pin_names")),
				toStringOrNull(body.get("symbol_options")),
				staticGraphics);
	}

	private Map<String, FieldSource> buildFieldMapping(String templateName, Object mappingObj) {
		Map<String, FieldSource> mapping = new LinkedHashMap<>();
		toStringMap(templateName, "field_mapping", mappingObj)
				.forEach((property, source) -> mapping.put(property, FieldSource.parse(source)));
		return mapping;
	}

	private Map<String, String> toStringMap(String templateName, String key, Object obj) {
		if (obj == null) {
			return Map.of();
		}
		if (!(obj instanceof Map<?, ?> map)) {
			throw new TemplateConfigException("Template '" + templateName + "': '" + key + "' must be a map");
		}
		Map<String, String> result = new LinkedHashMap<>();
		map.forEach((k, v) -> result.put(String.valueOf(k), v != null ? String.valueOf(v) : ""));
		return result;
	}

	private List<String> toStringList(String templateName, String key, Object obj) {
		if (obj == null) {
			return List.of();
		}
		if (obj instanceof String single) {
			return List.of(single);
		}
		if (!(obj instanceof List<?> list)) {
			throw new TemplateConfigException("Template '" + templateName + "': '" + key + "' must be a list");
		}
		return list.stream().map(String::valueOf).toList();
	}

	private String toStringOrNull(Object obj) {
		return obj != null ? String.valueOf(obj) : null;
	}
}
