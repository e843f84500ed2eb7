package org.javai.partlinker.library;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.javai.partlinker.config.LinkerConfig;
import org.javai.partlinker.part.PartRecord;
import org.javai.partlinker.partdb.PartSource;
import org.javai.partlinker.render.SymbolBlock;
import org.javai.partlinker.render.SymbolNames;
import org.javai.partlinker.render.SymbolRenderer;
import org.javai.partlinker.sxl.ParsedLibrary;
import org.javai.partlinker.sxl.SymbolLibraryParser;
import org.javai.partlinker.sxl.SymbolText;
import org.javai.partlinker.template.SymbolTemplate;
import org.javai.partlinker.template.TemplateCatalog;
import org.javai.partlinker.template.TemplateConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Brings the library files in the output directory in line with a batch of parts.
 *
 * <p>A run goes through {@link ReconcileStage} in order. {@link #plan(List)} groups
 * the parts by library file, parses each existing file once, renders every part
 * that has a template and classifies the result against the file. {@link #commit}
 * rebuilds each file that holds at least one selected part: selected parts get their
 * fresh block, every other symbol keeps its block from the file as it was, and parts
 * that are new but not selected are left out.</p>
 *
 * <p>Per-part problems (no template, render failure, unreadable existing symbol) are
 * logged and recorded as {@link Diagnostic}s. Duplicate symbol names and I/O failures
 * abort the run.</p>
 *
 * <pre>{@code
 * LibraryReconciler reconciler = LibraryReconciler.builder()
 *     .config(config)
 *     .templates(new TemplateParser().parse(config.templateFile()))
 *     .build();
 * ReconcileOutcome outcome = reconciler.run(partSource, ChangeSelector.all());
 * }</pre>
 *
 * <p>Two runs must not target the same output directory at the same time.</p>
 */
public class LibraryReconciler {

	private static final Logger logger = LoggerFactory.getLogger(LibraryReconciler.class);

	private final LinkerConfig config;
	private final TemplateCatalog templates;
	private final SymbolRenderer renderer;
	private final SymbolLibraryParser parser;
	private final LibraryFileStore store;

	private LibraryReconciler(Builder builder) {
		this.config = Objects.requireNonNull(builder.config, "config must not be null");
		this.templates = Objects.requireNonNull(builder.templates, "templates must not be null");
		this.renderer = builder.renderer != null ? builder.renderer : new SymbolRenderer();
		this.parser = builder.parser != null ? builder.parser : new SymbolLibraryParser();
		this.store = builder.store != null ? builder.store : new LibraryFileStore();
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Runs the whole pipeline: fetch, classify, select and commit.
	 * Stops after classification when nothing changed.
	 */
	public ReconcileOutcome run(PartSource source, ChangeSelector selector) {
		Objects.requireNonNull(source, "source must not be null");
		Objects.requireNonNull(selector, "selector must not be null");

		logger.debug("Stage {}", ReconcileStage.FETCH);
		List<PartRecord> parts = source.fetchParts();
		logger.info("Fetched {} parts", parts.size());

		ReconciliationPlan plan = plan(parts);
		if (plan.isEmpty()) {
			logger.info("All libraries are up to date");
			return new ReconcileOutcome(plan, Optional.empty(), ReconcileStage.CLASSIFY);
		}

		logger.debug("Stage {}", ReconcileStage.SELECT);
		Collection<PartRecord> selected = selector.select(plan.changes());
		CommitResult result = commit(plan, selected);
		return new ReconcileOutcome(plan, Optional.of(result), ReconcileStage.COMMIT);
	}

	/**
	 * Groups, parses, renders and classifies.
	 *
	 * @throws DuplicateSymbolException when two parts render to one name in a file
	 * @throws LibraryIoException when an existing library cannot be read
	 * @throws TemplateConfigException when no templates are configured
	 */
	public ReconciliationPlan plan(List<PartRecord> parts) {
		if (templates.isEmpty()) {
			throw new TemplateConfigException("No templates configured; nothing can be rendered");
		}
		List<Diagnostic> diagnostics = new ArrayList<>();

		logger.debug("Stage {}", ReconcileStage.GROUP);
		Map<String, List<PartRecord>> groups = group(parts);

		List<PartRecord> newParts = new ArrayList<>();
		List<PartRecord> modifiedParts = new ArrayList<>();
		Map<String, LibraryState> libraries = new LinkedHashMap<>();

		for (Map.Entry<String, List<PartRecord>> group : groups.entrySet()) {
			String fileName = group.getKey();
			Path path = config.outputDirectory().resolve(fileName);

			logger.debug("Stage {} for {}", ReconcileStage.PARSE_EXISTING, fileName);
			ParsedLibrary existing = parseExisting(fileName, path, diagnostics);

			logger.debug("Stage {} for {}", ReconcileStage.GENERATE_DESIRED, fileName);
			Map<PartRecord, SymbolBlock> desired = generate(fileName, group.getValue(), diagnostics);

			logger.debug("Stage {} for {}", ReconcileStage.CLASSIFY, fileName);
			checkUniqueNames(fileName, group.getValue(), desired, diagnostics);
			desired.forEach((part, block) -> {
				Optional<String> current = existing.block(block.name());
				if (current.isEmpty()) {
					newParts.add(part);
				} else if (!SymbolText.equivalent(current.get(), block.text())) {
					modifiedParts.add(part);
				}
			});

			libraries.put(fileName, new LibraryState(fileName, path, group.getValue(), existing, desired));
		}

		ChangeSet changes = new ChangeSet(newParts, modifiedParts);
		logger.info("Found {} new and {} modified symbols in {} libraries",
				changes.newParts().size(), changes.modifiedParts().size(), libraries.size());
		return new ReconciliationPlan(libraries, changes, diagnostics);
	}

	/**
	 * Rebuilds every library file that holds at least one selected part.
	 * Selected parts that are not in the plan's change set are ignored.
	 *
	 * @throws LibraryIoException when a file cannot be written
	 */
	public CommitResult commit(ReconciliationPlan plan, Collection<PartRecord> selected) {
		Objects.requireNonNull(plan, "plan must not be null");
		Set<PartRecord> selection = new HashSet<>();
		for (PartRecord part : selected != null ? selected : List.<PartRecord>of()) {
			if (plan.changes().contains(part)) {
				selection.add(part);
			} else {
				logger.debug("Ignoring selection of unchanged part '{}'", part.name());
			}
		}
		if (selection.isEmpty()) {
			logger.info("No changes selected; libraries left untouched");
			return CommitResult.nothingWritten();
		}

		logger.debug("Stage {}", ReconcileStage.COMMIT);
		List<Path> written = new ArrayList<>();
		int symbolsWritten = 0;
		int symbolsUpdated = 0;
		for (LibraryState library : plan.libraries().values()) {
			if (library.parts().stream().noneMatch(selection::contains)) {
				continue;
			}
			List<String> blocks = new ArrayList<>();
			int updated = rebuild(library, selection, blocks);
			store.write(library.path(), LibraryFileStore.format(config.libraryHeader(), blocks));
			logger.info("Wrote {} symbols ({} updated) to {}", blocks.size(), updated, library.path());

			written.add(library.path());
			symbolsWritten += blocks.size();
			symbolsUpdated += updated;
		}
		return new CommitResult(written, symbolsWritten, symbolsUpdated);
	}

	private Map<String, List<PartRecord>> group(List<PartRecord> parts) {
		Map<String, List<PartRecord>> groups = new LinkedHashMap<>();
		for (PartRecord part : parts) {
			groups.computeIfAbsent(LibraryFiles.fileNameFor(part.categoryPath()), k -> new ArrayList<>()).add(part);
		}
		return groups;
	}

	private ParsedLibrary parseExisting(String fileName, Path path, List<Diagnostic> diagnostics) {
		Optional<String> content = store.read(path);
		if (content.isEmpty()) {
			return ParsedLibrary.empty();
		}
		ParsedLibrary existing = parser.parse(content.get());
		for (String name : existing.unparsable()) {
			diagnostics.add(new Diagnostic(DiagnosticKind.UNPARSABLE_SYMBOL, name, fileName,
					"Could not find the end of the existing symbol; treating it as absent"));
		}
		logger.debug("Found {} existing symbols in {}", existing.symbols().size(), path);
		return existing;
	}

	private Map<PartRecord, SymbolBlock> generate(String fileName, List<PartRecord> parts,
			List<Diagnostic> diagnostics) {
		Map<PartRecord, SymbolBlock> desired = new LinkedHashMap<>();
		for (PartRecord part : parts) {
			Optional<SymbolTemplate> template = templates.match(part);
			if (template.isEmpty()) {
				logger.info("No template applies to category '{}'; skipping part '{}'",
						part.categoryPath(), part.name());
				diagnostics.add(new Diagnostic(DiagnosticKind.UNMATCHED_CATEGORY, part.name(), fileName,
						"No template applies to category '" + part.categoryPath() + "'"));
				continue;
			}
			try {
				desired.put(part, renderer.render(part, template.get()));
			} catch (RuntimeException e) {
				logger.error("Failed to render symbol for part '{}' with template '{}'",
						part.name(), template.get().name(), e);
				diagnostics.add(new Diagnostic(DiagnosticKind.RENDER_FAILURE, part.name(), fileName,
						"Render failed: " + e.getMessage()));
			}
		}
		return desired;
	}

	private void checkUniqueNames(String fileName, List<PartRecord> parts, Map<PartRecord, SymbolBlock> desired,
			List<Diagnostic> diagnostics) {
		Map<String, PartRecord> owners = new HashMap<>();
		for (PartRecord part : parts) {
			SymbolBlock block = desired.get(part);
			if (block == null) {
				continue;
			}
			PartRecord previous = owners.putIfAbsent(block.name(), part);
			if (previous != null) {
				DuplicateSymbolException failure =
						new DuplicateSymbolException(fileName, block.name(), previous, part);
				diagnostics.add(new Diagnostic(DiagnosticKind.DUPLICATE_SYMBOL, block.name(), fileName,
						failure.getMessage()));
				logger.error(failure.getMessage());
				throw failure;
			}
		}
	}

	/**
	 * Fills {@code blocks} with the content of the rebuilt file and returns how many
	 * fresh blocks were used. The file is rebuilt from the batch in input order: a
	 * selected part contributes its fresh block, any other part its previous block if
	 * the file had one. Symbols with no part in the batch are dropped.
	 */
	private int rebuild(LibraryState library, Set<PartRecord> selection, List<String> blocks) {
		Set<String> emitted = new HashSet<>();
		int fresh = 0;
		for (PartRecord part : library.parts()) {
			Optional<SymbolBlock> desired = library.desiredBlock(part);
			String name = desired.map(SymbolBlock::name).orElseGet(() -> SymbolNames.of(part));
			if (emitted.contains(name)) {
				continue;
			}
			if (selection.contains(part) && desired.isPresent()) {
				blocks.add(desired.get().text());
				fresh++;
				emitted.add(name);
				continue;
			}
			Optional<String> previous = library.existing().block(name);
			if (previous.isPresent()) {
				blocks.add(previous.get());
				emitted.add(name);
			}
		}
		long dropped = library.existing().symbols().keySet().stream()
				.filter(name -> !emitted.contains(name))
				.count();
		if (dropped > 0) {
			logger.info("Dropping {} symbols with no part in this batch from {}", dropped, library.fileName());
		}
		return fresh;
	}

	/**
	 * Builder for a {@link LibraryReconciler}. Configuration and templates are
	 * required; the collaborators default to the standard implementations.
	 */
	public static final class Builder {
		private LinkerConfig config;
		private TemplateCatalog templates;
		private SymbolRenderer renderer;
		private SymbolLibraryParser parser;
		private LibraryFileStore store;

		private Builder() {
		}

		public Builder config(LinkerConfig config) {
			this.config = config;
			return this;
		}

		public Builder templates(TemplateCatalog templates) {
			this.templates = templates;
			return this;
		}

		public Builder renderer(SymbolRenderer renderer) {
			this.renderer = renderer;
			return this;
		}

		public Builder parser(SymbolLibraryParser parser) {
			this.parser = parser;
			return this;
		}

		public Builder store(LibraryFileStore store) {
			this.store = store;
			return this;
		}

		public LibraryReconciler build() {
			return new LibraryReconciler(this);
		}
	}
}
