package org.javai.partlinker.render;

import java.util.LinkedHashMap;
import java.util.Map;
import org.javai.partlinker.part.PartRecord;
import org.javai.partlinker.part.ValueResolver;
import org.javai.partlinker.template.FieldSource;
import org.javai.partlinker.template.SymbolTemplate;

/**
 * Builds the ordered property set of a symbol.
 *
 * <p>Mapped fields come first, in mapping order. A path that resolves to nothing
 * is retried with the property's own name. Remaining non-empty parameters of the
 * part follow in bag order.</p>
 */
public final class PropertyResolver {

	private PropertyResolver() {
	}

	public static Map<String, String> resolve(PartRecord part, SymbolTemplate template) {
		Map<String, String> properties = new LinkedHashMap<>();
		template.fieldMapping().forEach((property, source) ->
				properties.put(property, resolveField(part, property, source)));

		part.parameters().forEach((parameter, value) -> {
			if (!properties.containsKey(parameter) && value != null && !value.isEmpty()) {
				properties.put(parameter, ValueResolver.resolve(part, parameter));
			}
		});
		return properties;
	}

	private static String resolveField(PartRecord part, String property, FieldSource source) {
		if (source instanceof FieldSource.Literal literal) {
			return literal.value();
		}
		String value = ValueResolver.resolve(part, ((FieldSource.Path) source).path());
		return value.isEmpty() ? ValueResolver.resolve(part, property) : value;
	}
}
