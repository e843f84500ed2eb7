package org.javai.partlinker.render;

import static org.javai.partlinker.render.SymbolSyntax.coord;
import static org.javai.partlinker.render.SymbolSyntax.quote;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.javai.partlinker.geometry.BoxGeometry;
import org.javai.partlinker.geometry.ConnectorLayout;
import org.javai.partlinker.geometry.ConnectorSpec;
import org.javai.partlinker.geometry.IcBoxLayout;
import org.javai.partlinker.geometry.SchematicGrid;
import org.javai.partlinker.geometry.SymbolLayout;
import org.javai.partlinker.geometry.UnitLayout;
import org.javai.partlinker.part.PartRecord;
import org.javai.partlinker.part.ValueResolver;
import org.javai.partlinker.template.SymbolTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders a part into a symbol block using its category template.
 *
 * <p>The output is a single {@code (symbol ...)} block: header, properties, then
 * either the generated units ({@code IC_Box}, {@code Connector}), the template's
 * literal graphics, or a visible "No template found" text. Rendering is a pure
 * function of the part and the template.</p>
 *
 * <p>For generated symbols, {@code Reference}, {@code Manufacturer Partnumber} and
 * {@code Description} are placed relative to the body of unit 1: the reference above
 * the top-left corner, the part number below the bottom-left corner, the description
 * one grid lower. Only the font size of their configured templates is kept.</p>
 */
public class SymbolRenderer {

	private static final Logger logger = LoggerFactory.getLogger(SymbolRenderer.class);

	public static final String PIN_DESCRIPTION = "Pin Description";
	public static final String REFERENCE = "Reference";
	public static final String PARTNUMBER = "Manufacturer Partnumber";
	public static final String DESCRIPTION = "Description";

	private static final double LABEL_OFFSET = 1.27;
	private static final String DEFAULT_FONT_SIZE = "(size 1.27 1.27)";
	private static final Pattern FONT_SIZE = Pattern.compile("\\(size\\s+([\\d.]+)\\s+([\\d.]+)\\)");
	private static final Pattern UNIT_SYMBOL = Pattern.compile("\\(symbol\\s+\"(.*?)(?:_\\d+_\\d+)\"");

	private static final int SYMBOL_DEPTH = 1;
	private static final int CONTENT_DEPTH = 2;

	private final IcBoxLayout icBoxLayout;
	private final ConnectorLayout connectorLayout;
	private final UnitWriter unitWriter = new UnitWriter();

	public SymbolRenderer() {
		this(new IcBoxLayout(), new ConnectorLayout());
	}

	public SymbolRenderer(IcBoxLayout icBoxLayout, ConnectorLayout connectorLayout) {
		this.icBoxLayout = Objects.requireNonNull(icBoxLayout);
		this.connectorLayout = Objects.requireNonNull(connectorLayout);
	}

	public SymbolBlock render(PartRecord part, SymbolTemplate template) {
		Objects.requireNonNull(part, "part must not be null");
		Objects.requireNonNull(template, "template must not be null");

		String symbolName = SymbolNames.of(part);
		Map<String, String> properties = PropertyResolver.resolve(part, template);

		BlockWriter out = new BlockWriter();
		out.line(SYMBOL_DEPTH, header(symbolName, template));

		switch (template.generator()) {
			case IC_BOX -> {
				SymbolLayout layout = icBoxLayout.layout(
						ValueResolver.resolve(part, PIN_DESCRIPTION), template.powerPinNames());
				writeGenerated(out, symbolName, properties, template, layout);
			}
			case CONNECTOR -> {
				SymbolLayout layout = connectorLayout.layout(ConnectorSpec.from(part));
				writeGenerated(out, symbolName, properties, template, layout);
			}
			case STATIC -> {
				writeProperties(out, properties, template);
				out.verbatim(CONTENT_DEPTH, renameUnits(template.staticGraphics(), symbolName));
			}
			case NONE -> {
				writeProperties(out, properties, template);
				out.line(CONTENT_DEPTH, "(text " + quote("No template found for " + symbolName)
						+ " (at 0 0 0) (effects (font " + DEFAULT_FONT_SIZE + ")))");
				logger.warn("No symbol_template or symbol_generator in template '{}' for part '{}'. "
						+ "No graphics will be added.", template.name(), part.name());
			}
		}

		out.line(SYMBOL_DEPTH, ")");
		return new SymbolBlock(symbolName, out.toString());
	}

	private String header(String symbolName, SymbolTemplate template) {
		StringBuilder header = new StringBuilder("(symbol ").append(quote(symbolName));
		if (!template.symbolOptions().isEmpty()) {
			header.append(' ').append(template.symbolOptions());
		}
		return header.append(" (in_bom yes) (on_board yes)").toString();
	}

	private void writeGenerated(BlockWriter out, String symbolName, Map<String, String> properties,
			SymbolTemplate template, SymbolLayout layout) {
		BoxGeometry box = layout.primaryBox();
		double partnumberY = box.bottom() - LABEL_OFFSET;

		properties.forEach((name, value) -> {
			switch (name) {
				case REFERENCE -> out.line(CONTENT_DEPTH,
						placedProperty(name, value, box.left(), box.top() + LABEL_OFFSET, template));
				case PARTNUMBER -> out.line(CONTENT_DEPTH,
						placedProperty(name, value, box.left(), partnumberY, template));
				case DESCRIPTION -> out.line(CONTENT_DEPTH,
						placedProperty(name, value, box.left(), partnumberY - SchematicGrid.SPACING, template));
				default -> out.line(CONTENT_DEPTH, property(name, value, template));
			}
		});

		for (UnitLayout unit : layout.units()) {
			unitWriter.write(out, CONTENT_DEPTH, symbolName, unit);
		}
	}

	private void writeProperties(BlockWriter out, Map<String, String> properties, SymbolTemplate template) {
		properties.forEach((name, value) -> out.line(CONTENT_DEPTH, property(name, value, template)));
	}

	static String property(String name, String value, SymbolTemplate template) {
		Optional<String> configured = template.propertyTemplate(name);
		if (configured.isPresent()) {
			return SymbolSyntax.collapse(configured.get())
					.replace(SymbolTemplate.VALUE_PLACEHOLDER, SymbolSyntax.escape(value));
		}
		return "(property " + quote(name) + " " + quote(value)
				+ " (at 0 0 0) (effects (font " + DEFAULT_FONT_SIZE + ") (hide yes)) )";
	}

	static String placedProperty(String name, String value, double x, double y, SymbolTemplate template) {
		String fontSize = template.propertyTemplate(name)
				.map(FONT_SIZE::matcher)
				.filter(Matcher::find)
				.map(m -> "(size " + m.group(1) + " " + m.group(2) + ")")
				.orElse(DEFAULT_FONT_SIZE);
		return "(property " + quote(name) + " " + quote(value)
				+ " (at " + coord(x) + " " + coord(y) + " 0) (effects (font " + fontSize + ") (justify left)) )";
	}

	/**
	 * Static graphics are usually extracted from another symbol; their unit
	 * sub-symbols ({@code "R_0_1"}) are renamed to this symbol.
	 */
	static String renameUnits(String graphics, String symbolName) {
		Matcher matcher = UNIT_SYMBOL.matcher(graphics);
		if (!matcher.find() || matcher.group(1).isEmpty()) {
			return graphics;
		}
		Pattern unitName = Pattern.compile("\"" + Pattern.quote(matcher.group(1)) + "(_\\d+_\\d+)\"");
		return unitName.matcher(graphics)
				.replaceAll(Matcher.quoteReplacement("\"" + symbolName) + "$1\"");
	}
}
