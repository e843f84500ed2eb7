package org.javai.partlinker.template;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import java.util.List;
import java.util.Map;
import org.javai.partlinker.part.PartRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("TemplateCatalog")
class TemplateCatalogTest {

	private static SymbolTemplate template(String name, String... categories) {
		return new SymbolTemplate(name, List.of(categories), Map.of(), Map.of(), GeneratorKind.NONE,
				List.of(), null, null);
	}

	@Nested
	@DisplayName("category matching")
	class Matching {

		@Test
		@DisplayName("matches a case-insensitive suffix of the category path")
		void suffixMatch() {
			TemplateCatalog catalog = new TemplateCatalog(List.of(template("OpAmps", " opamp ")));

			assertThat(catalog.match("Active → ICs → OpAmp ")).map(SymbolTemplate::name).hasValue("OpAmps");
			assertThat(catalog.match("Active → OpAmp → Dual")).isEmpty();
		}

		@Test
		@DisplayName("first template in declaration order wins")
		void firstWins() {
			TemplateCatalog catalog = new TemplateCatalog(List.of(
					template("Generic", "Resistors"),
					template("Specific", "SMD Resistors")));

			assertThat(catalog.match(PartRecord.of(1, "R1", "Passive → SMD Resistors", Map.of())))
					.map(SymbolTemplate::name).hasValue("Generic");
		}

		@Test
		@DisplayName("a template without categories never matches")
		void noCategories() {
			TemplateCatalog catalog = new TemplateCatalog(List.of(template("Empty")));

			assertThat(catalog.match("Anything")).isEmpty();
			assertThat(catalog.isEmpty()).isFalse();
		}
	}

	@Nested
	@DisplayName("field sources")
	class FieldSources {

		@Test
		@DisplayName("single-quoted values are literals")
		void literal() {
			assertThat(FieldSource.parse("'R?'")).isEqualTo(new FieldSource.Literal("R?"));
			assertThat(FieldSource.parse("''")).isEqualTo(new FieldSource.Literal(""));
		}

		@Test
		@DisplayName("everything else is a path")
		void path() {
			assertThat(FieldSource.parse("footprint.name")).isEqualTo(new FieldSource.Path("footprint.name"));
			assertThat(FieldSource.parse("'")).isEqualTo(new FieldSource.Path("'"));
			assertThat(FieldSource.parse(null)).isEqualTo(new FieldSource.Path(""));
		}
	}

	@Nested
	@DisplayName("generator kinds")
	class Generators {

		@Test
		@DisplayName("static graphics without a generator give a static template")
		void staticKind() {
			assertThat(GeneratorKind.fromConfig(null, true)).isEqualTo(GeneratorKind.STATIC);
			assertThat(GeneratorKind.fromConfig(" ", false)).isEqualTo(GeneratorKind.NONE);
		}

		@Test
		@DisplayName("a generator overrides static graphics")
		void generatorWins() {
			assertThat(GeneratorKind.fromConfig("Connector", true)).isEqualTo(GeneratorKind.CONNECTOR);
		}

		@Test
		@DisplayName("unknown generator names are rejected")
		void unknown() {
			assertThatThrownBy(() -> GeneratorKind.fromConfig("ic_box", false))
					.isInstanceOf(TemplateConfigException.class);
		}
	}
}
