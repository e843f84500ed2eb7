package org.javai.partlinker.render;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.Level;
import org.javai.partlinker.part.PartRecord;
import org.javai.partlinker.sxl.SymbolLibraryParser;
import org.javai.partlinker.template.GeneratorKind;
import org.javai.partlinker.template.SymbolTemplate;
import org.javai.partlinker.testsupport.Fixtures;
import org.javai.partlinker.testsupport.LogCaptorAppender;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("SymbolRenderer")
class SymbolRendererTest {

	private final SymbolRenderer renderer = new SymbolRenderer();

	private static List<String> lines(SymbolBlock block) {
		return block.text().lines().map(String::strip).toList();
	}

	@Test
	@DisplayName("rendering twice gives byte-identical text")
	void idempotent() {
		SymbolTemplate template = Fixtures.template("OpAmps");

		SymbolBlock first = renderer.render(Fixtures.lm358(), template);
		SymbolBlock second = renderer.render(Fixtures.lm358(), template);

		assertThat(second).isEqualTo(first);
	}

	@Test
	@DisplayName("every block is balanced and extractable by the library scanner")
	void balanced() {
		for (SymbolBlock block : List.of(
				renderer.render(Fixtures.lm358(), Fixtures.template("OpAmps")),
				renderer.render(Fixtures.header(2, "Header 2x4", 2, 4), Fixtures.template("Connectors")),
				renderer.render(Fixtures.resistor(3, "10k 0603", "10k"), Fixtures.template("Resistors")),
				renderer.render(PartRecord.of(4, "Widget", "Misc", Map.of()), Fixtures.template("Misc")))) {
			String text = block.text();
			int start = text.indexOf('(');
			assertThat(SymbolLibraryParser.findClosingParen(text, start)).isEqualTo(text.length() - 1);
		}
	}

	@Nested
	@DisplayName("IC_Box symbols")
	class IcBox {

		private final SymbolBlock block = renderer.render(Fixtures.lm358(), Fixtures.template("OpAmps"));

		@Test
		@DisplayName("header carries the symbol options")
		void header() {
			assertThat(block.name()).isEqualTo("LM358");
			assertThat(block.text()).startsWith(
					"  (symbol \"LM358\" (pin_names (offset 1.016)) (in_bom yes) (on_board yes)\n");
			assertThat(block.text()).endsWith("\n  )");
		}

		@Test
		@DisplayName("reference, part number and description are placed around the body")
		void placedProperties() {
			assertThat(lines(block)).contains(
					"(property \"Reference\" \"U\" (at -7.62 6.35 0) (effects (font (size 1.524 1.524)) (justify left)) )",
					"(property \"Manufacturer Partnumber\" \"LM358\" (at -7.62 -6.35 0)"
							+ " (effects (font (size 1.27 1.27)) (justify left)) )",
					"(property \"Description\" \"Dual op-amp\" (at -7.62 -8.89 0)"
							+ " (effects (font (size 1.27 1.27)) (justify left)) )");
		}

		@Test
		@DisplayName("other properties use their template or stay hidden at the origin")
		void otherProperties() {
			assertThat(lines(block)).contains(
					"(property \"Value\" \"LM358\" (at 0 -2.54 0) (effects (font (size 1.27 1.27)) (hide yes)))",
					"(property \"Footprint\" \"SOIC-8\" (at 0 0 0) (effects (font (size 1.27 1.27)) (hide yes)) )",
					"(property \"Pin Description\" \"IN+,IN-,VCC,OUT,GND\" (at 0 0 0)"
							+ " (effects (font (size 1.27 1.27)) (hide yes)) )");
		}

		@Test
		@DisplayName("emits a main unit and a power unit")
		void units() {
			List<String> lines = lines(block);

			assertThat(lines).containsSubsequence(
					"(symbol \"LM358_1_1\"",
					"(rectangle (start -7.62 5.08) (end 7.62 -5.08)",
					"(pin passive line (at -10.16 1.27 0) (length 2.54)",
					"(name \"IN+\" (effects (font (size 1.27 1.27))))",
					"(number \"1\" (effects (font (size 1.27 1.27))))",
					"(pin passive line (at -10.16 -1.27 0) (length 2.54)",
					"(pin passive line (at 10.16 0.00 180) (length 2.54)",
					"(number \"4\" (effects (font (size 1.27 1.27))))",
					"(symbol \"LM358_2_1\"",
					"(rectangle (start -7.62 3.81) (end 7.62 -3.81)",
					"(pin power_in line (at -10.16 0.00 0) (length 2.54)",
					"(name \"VCC\" (effects (font (size 1.27 1.27))))",
					"(pin power_in line (at 10.16 0.00 180) (length 2.54)",
					"(number \"5\" (effects (font (size 1.27 1.27))))");
		}
	}

	@Nested
	@DisplayName("Connector symbols")
	class Connector {

		@Test
		@DisplayName("draws hidden pin names and gender overlays")
		void connector() {
			SymbolBlock block = renderer.render(Fixtures.header(2, "Header 1x2", 1, 2), Fixtures.template("Connectors"));

			assertThat(block.name()).isEqualTo("Header_1x2");
			assertThat(lines(block)).containsSubsequence(
					"(property \"Reference\" \"J\" (at -1.91 5.08 0) (effects (font (size 1.27 1.27)) (justify left)) )",
					"(symbol \"Header_1x2_1_1\"",
					"(pin passive line (at -4.45 1.27 0) (length 2.54)",
					"(name \"1\" (effects (font (size 1.27 1.27)) (hide yes)))",
					"(number \"1\" (effects (font (size 1.27 1.27))))");
			assertThat(block.text()).contains("(polyline (pts (xy ");
		}
	}

	@Nested
	@DisplayName("static and empty templates")
	class StaticTemplates {

		@Test
		@DisplayName("copies static graphics and renames their units")
		void staticGraphics() {
			SymbolBlock block = renderer.render(Fixtures.resistor(3, "10k 0603", "10k"), Fixtures.template("Resistors"));

			assertThat(block.text()).contains("    (symbol \"10k_0603_0_1\"");
			assertThat(block.text()).contains("(symbol \"10k_0603_1_1\"");
			assertThat(block.text()).doesNotContain("\"R_0_1\"");
			assertThat(lines(block)).contains(
					"(property \"Value\" \"10k\" (at 0 0 0) (effects (font (size 1.27 1.27)) (hide yes)) )");
		}

		@Test
		@DisplayName("a template without graphics renders a visible placeholder and warns")
		void placeholder() {
			try (LogCaptorAppender log = LogCaptorAppender.capture(SymbolRenderer.class)) {
				SymbolBlock block = renderer.render(PartRecord.of(4, "Widget", "Misc", Map.of()),
						Fixtures.template("Misc"));

				assertThat(block.text()).contains("(text \"No template found for Widget\"");
				assertThat(block.text()).contains("(property \"Reference\" \"X\"");
				assertThat(log.messages(Level.WARN)).anySatisfy(msg -> assertThat(msg).contains("Widget"));
			}
		}

		@Test
		@DisplayName("renameUnits renames quoted unit names only")
		void renameOnlyUnitNames() {
			String graphics = "(symbol \"R_1_1\" (pin passive line (name \"R\") (number \"1\")))\n"
					+ "(text \"R_load\" (at 0 0 0))";

			assertThat(SymbolRenderer.renameUnits(graphics, "10k"))
					.isEqualTo("(symbol \"10k_1_1\" (pin passive line (name \"R\") (number \"1\")))\n"
							+ "(text \"R_load\" (at 0 0 0))");
		}

		@Test
		@DisplayName("renameUnits leaves graphics without unit sub-symbols alone")
		void renameWithoutUnits() {
			String graphics = "(rectangle (start 0 0) (end 1 1))";

			assertThat(SymbolRenderer.renameUnits(graphics, "X")).isEqualTo(graphics);
		}
	}

	@Nested
	@DisplayName("property values")
	class Values {

		@Test
		@DisplayName("quotes and backslashes are escaped")
		void escaping() {
			SymbolTemplate template = new SymbolTemplate("T", List.of("Misc"), Map.of(), Map.of(),
					GeneratorKind.NONE, List.of(), null, null);
			PartRecord part = PartRecord.of(5, "Cable", "Misc", Map.of("Length", "5\" \\ long"));

			SymbolBlock block = renderer.render(part, template);

			assertThat(block.text()).contains("(property \"Length\" \"5\\\" \\\\ long\"");
		}

		@Test
		@DisplayName("empty parameters are not rendered")
		void emptyParameters() {
			SymbolTemplate template = Fixtures.template("Misc");
			PartRecord part = PartRecord.of(6, "Widget", "Misc", Map.of("Color", ""));

			assertThat(renderer.render(part, template).text()).doesNotContain("Color");
		}

		@Test
		@DisplayName("a missing part or template is rejected")
		void nulls() {
			assertThatThrownBy(() -> renderer.render(null, Fixtures.template("Misc")))
					.isInstanceOf(NullPointerException.class);
		}
	}
}
