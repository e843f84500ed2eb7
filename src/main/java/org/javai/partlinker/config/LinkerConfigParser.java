package org.javai.partlinker.config;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Date;
import java.util.Map;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads a {@link LinkerConfig} from YAML:
 *
 * <pre>
 * partdb:
 *   base_url: http://localhost:8888
 *   api_token: tcp_...
 *   parts_after_date: 2025-10-01
 * paths:
 *   template_file: templates.yaml
 *   output_dir: kicad_libs
 * library:
 *   version: 20211014
 *   generator: partdb_linker
 * </pre>
 *
 * Missing sections or keys take their defaults. Relative paths are resolved against
 * the directory of the configuration file when one is given.
 */
public class LinkerConfigParser {

	private final Yaml yaml = new Yaml();

	public LinkerConfig parse(Path path) {
		try (InputStream in = Files.newInputStream(path)) {
			Path base = path.toAbsolutePath().getParent();
			return build(yaml.load(in), base);
		} catch (NoSuchFileException e) {
			throw new LinkerConfigException("Configuration file not found: " + path, e);
		} catch (LinkerConfigException e) {
			throw new LinkerConfigException("Invalid configuration file " + path + ": " + e.getMessage(), e);
		} catch (Exception e) {
			throw new LinkerConfigException("Failed to read configuration file: " + path, e);
		}
	}

	public LinkerConfig parse(InputStream inputStream) {
		try {
			return build(yaml.load(inputStream), null);
		} catch (YAMLException e) {
			throw new LinkerConfigException("Failed to parse configuration from input stream", e);
		}
	}

	public LinkerConfig parseString(String yamlContent) {
		try {
			return build(yaml.load(yamlContent), null);
		} catch (YAMLException e) {
			throw new LinkerConfigException("Failed to parse configuration from string", e);
		}
	}

	private LinkerConfig build(Object data, Path base) {
		if (data == null) {
			return LinkerConfig.defaults();
		}
		if (!(data instanceof Map<?, ?> root)) {
			throw new LinkerConfigException("Configuration must be a map");
		}
		Map<?, ?> partDb = section(root, "partdb");
		Map<?, ?> paths = section(root, "paths");
		Map<?, ?> library = section(root, "library");

		return LinkerConfig.builder()
				.partDb(new PartDbSettings(
						text(partDb, "base_url"),
						text(partDb, "api_token"),
						date(partDb, "parts_after_date")))
				.templateFile(path(paths, "template_file", base))
				.outputDirectory(path(paths, "output_dir", base))
				.libraryVersion(text(library, "version"))
				.generatorName(text(library, "generator"))
				.build();
	}

	private Map<?, ?> section(Map<?, ?> root, String name) {
		Object section = root.get(name);
		if (section == null) {
			return Map.of();
		}
		if (!(section instanceof Map<?, ?> map)) {
			throw new LinkerConfigException("Section '" + name + "' must be a map");
		}
		return map;
	}

	private String text(Map<?, ?> section, String key) {
		Object value = section.get(key);
		return value != null ? String.valueOf(value) : null;
	}

	private LocalDate date(Map<?, ?> section, String key) {
		Object value = section.get(key);
		if (value == null) {
			return null;
		}
		if (value instanceof Date date) {
			// snakeyaml resolves unquoted ISO dates to java.util.Date at UTC midnight
			return date.toInstant().atZone(ZoneOffset.UTC).toLocalDate();
		}
		try {
			return LocalDate.parse(String.valueOf(value).trim());
		} catch (DateTimeParseException e) {
			throw new LinkerConfigException("'" + key + "' must be a date in YYYY-MM-DD format, got '" + value + "'", e);
		}
	}

	private Path path(Map<?, ?> section, String key, Path base) {
		String value = text(section, key);
		if (value == null || value.isBlank()) {
			return null;
		}
		Path path = Path.of(value.trim());
		return base != null && !path.isAbsolute() ? base.resolve(path) : path;
	}
}
