package org.javai.partlinker.testsupport;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.javai.partlinker.part.PartRecord;
import org.javai.partlinker.template.SymbolTemplate;
import org.javai.partlinker.template.TemplateCatalog;
import org.javai.partlinker.template.TemplateParser;

/**
 * Parts and templates shared by the rendering and reconciliation tests.
 */
public final class Fixtures {

	public static final String OPAMP_CATEGORY = "Active → ICs → OpAmp";
	public static final String CONNECTOR_CATEGORY = "Electromechanical → Connectors";
	public static final String RESISTOR_CATEGORY = "Passive → Resistors";

	private Fixtures() {
	}

	public static TemplateCatalog templates() {
		try (InputStream in = Fixtures.class.getResourceAsStream("/templates.yaml")) {
			if (in == null) {
				throw new IllegalStateException("templates.yaml not on the test classpath");
			}
			return new TemplateParser().parse(in);
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
	}

	public static SymbolTemplate template(String name) {
		return templates().templates().stream()
				.filter(t -> t.name().equals(name))
				.findFirst()
				.orElseThrow();
	}

	public static PartRecord opAmp(long id, String name, String pins) {
		Map<String, Object> attributes = new LinkedHashMap<>();
		attributes.put("description", "Dual op-amp");
		attributes.put("footprint", Map.of("name", "SOIC-8"));
		Map<String, String> parameters = new LinkedHashMap<>();
		parameters.put("Pin Description", pins);
		return new PartRecord(id, name, OPAMP_CATEGORY, attributes, parameters);
	}

	public static PartRecord lm358() {
		return opAmp(1, "LM358", "IN+,IN-,VCC,OUT,GND");
	}

	public static PartRecord header(long id, String name, int rows, int pinsPerRow) {
		Map<String, String> parameters = new LinkedHashMap<>();
		parameters.put("Number of Rows", Integer.toString(rows));
		parameters.put("Pins per Row", Integer.toString(pinsPerRow));
		parameters.put("Gender", "male");
		return PartRecord.of(id, name, CONNECTOR_CATEGORY, parameters);
	}

	public static PartRecord resistor(long id, String name, String resistance) {
		Map<String, String> parameters = new LinkedHashMap<>();
		parameters.put("Resistance", resistance);
		return PartRecord.of(id, name, RESISTOR_CATEGORY, parameters);
	}
}
