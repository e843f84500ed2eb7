package org.javai.partlinker.config;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Settings for one reconciliation run.
 *
 * <pre>{@code
 * LinkerConfig config = LinkerConfig.builder()
 *     .outputDirectory(Path.of("kicad_libs"))
 *     .templateFile(Path.of("templates.yaml"))
 *     .build();
 * }</pre>
 *
 * @param partDb Part-DB connection settings
 * @param templateFile YAML template file
 * @param outputDirectory directory holding the library files
 * @param libraryVersion value of the {@code (version ...)} token in the file header
 * @param generatorName value of the {@code (generator ...)} token in the file header
 */
public record LinkerConfig(
		PartDbSettings partDb,
		Path templateFile,
		Path outputDirectory,
		String libraryVersion,
		String generatorName) {

	public static final Path DEFAULT_TEMPLATE_FILE = Path.of("templates.yaml");
	public static final Path DEFAULT_OUTPUT_DIRECTORY = Path.of("kicad_libs");
	public static final String DEFAULT_LIBRARY_VERSION = "20211014";
	public static final String DEFAULT_GENERATOR_NAME = "partdb_linker";

	public LinkerConfig {
		partDb = Objects.requireNonNullElseGet(partDb, PartDbSettings::defaults);
		templateFile = Objects.requireNonNullElse(templateFile, DEFAULT_TEMPLATE_FILE);
		outputDirectory = Objects.requireNonNullElse(outputDirectory, DEFAULT_OUTPUT_DIRECTORY);
		libraryVersion = isBlank(libraryVersion) ? DEFAULT_LIBRARY_VERSION : libraryVersion.trim();
		generatorName = isBlank(generatorName) ? DEFAULT_GENERATOR_NAME : generatorName.trim();
	}

	public static LinkerConfig defaults() {
		return builder().build();
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * First line of every library file.
	 */
	public String libraryHeader() {
		return "(kicad_symbol_lib (version " + libraryVersion + ") (generator " + generatorName + ")";
	}

	private static boolean isBlank(String value) {
		return value == null || value.isBlank();
	}

	public static final class Builder {
		private PartDbSettings partDb;
		private Path templateFile;
		private Path outputDirectory;
		private String libraryVersion;
		private String generatorName;

		private Builder() {
		}

		public Builder partDb(PartDbSettings partDb) {
			this.partDb = partDb;
			return this;
		}

		public Builder templateFile(Path templateFile) {
			this.templateFile = templateFile;
			return this;
		}

		public Builder outputDirectory(Path outputDirectory) {
			this.outputDirectory = outputDirectory;
			return this;
		}

		public Builder libraryVersion(String libraryVersion) {
			this.libraryVersion = libraryVersion;
			return this;
		}

		public Builder generatorName(String generatorName) {
			this.generatorName = generatorName;
			return this;
		}

		public LinkerConfig build() {
			return new LinkerConfig(partDb, templateFile, outputDirectory, libraryVersion, generatorName);
		}
	}
}
