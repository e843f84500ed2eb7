package org.javai.partlinker.template;

import java.util.List;
import java.util.Optional;
import org.javai.partlinker.part.PartRecord;

/**
 * The ordered set of templates loaded for a run.
 */
public final class TemplateCatalog {

	private final List<SymbolTemplate> templates;

	public TemplateCatalog(List<SymbolTemplate> templates) {
		this.templates = templates != null ? List.copyOf(templates) : List.of();
	}

	public List<SymbolTemplate> templates() {
		return templates;
	}

	public boolean isEmpty() {
		return templates.isEmpty();
	}

	/**
	 * Returns the first template, in declaration order, whose categories match
	 * the given category path.
	 */
	public Optional<SymbolTemplate> match(String categoryPath) {
		for (SymbolTemplate template : templates) {
			if (template.appliesTo(categoryPath)) {
				return Optional.of(template);
			}
		}
		return Optional.empty();
	}

	public Optional<SymbolTemplate> match(PartRecord part) {
		return match(part.categoryPath());
	}
}
