package org.javai.partlinker.part;

import java.util.Map;
import java.util.Optional;

/**
 * Looks up named values on a {@link PartRecord}.
 *
 * <p>A plain key is looked up as a fixed attribute, then in the parameter bag as
 * given, then in the parameter bag with its first letter upper-cased. A dotted key
 * ({@code footprint.name}) resolves its first hop in the attribute map, then as a typed
 * field or parameter, and walks nested maps for the remaining hops. Anything that cannot be resolved yields
 * an empty string.</p>
 */
public final class ValueResolver {

	private ValueResolver() {
	}

	public static String resolve(PartRecord part, String path) {
		if (part == null || path == null || path.isEmpty()) {
			return "";
		}
		Object value = path.indexOf('.') >= 0 ? walk(part, path.split("\\.")) : lookup(part, path);
		return value != null ? String.valueOf(value) : "";
	}

	private static Object lookup(PartRecord part, String key) {
		Optional<Object> attribute = part.attribute(key);
		if (attribute.isPresent()) {
			return attribute.get();
		}
		Optional<String> parameter = part.parameter(key);
		if (parameter.isPresent()) {
			return parameter.get();
		}
		return part.parameter(capitalize(key)).orElse(null);
	}

	private static Object walk(PartRecord part, String[] hops) {
		// the decoded attribute map can hold a nested object under a typed field's key (category)
		Object current = part.attributes().containsKey(hops[0])
				? part.attributes().get(hops[0])
				: part.attribute(hops[0]).orElseGet(() -> part.parameter(hops[0]).orElse(null));
		for (int i = 1; i < hops.length && current != null; i++) {
			current = current instanceof Map<?, ?> map ? map.get(hops[i]) : null;
		}
		return current;
	}

	static String capitalize(String key) {
		return Character.toUpperCase(key.charAt(0)) + key.substring(1);
	}
}
