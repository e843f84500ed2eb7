package org.javai.partlinker.library;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.javai.partlinker.part.PartRecord;
import org.javai.partlinker.render.SymbolBlock;
import org.javai.partlinker.sxl.ParsedLibrary;

/**
 * Everything known about one library file during a run.
 *
 * @param fileName library file name, e.g. {@code OpAmp.kicad_sym}
 * @param path location in the output directory
 * @param parts parts grouped into this file, in input order
 * @param existing blocks parsed from the current file content
 * @param desired freshly rendered blocks of the parts that rendered successfully
 */
public record LibraryState(
		String fileName,
		Path path,
		List<PartRecord> parts,
		ParsedLibrary existing,
		Map<PartRecord, SymbolBlock> desired) {

	public LibraryState {
		parts = List.copyOf(parts);
		desired = Collections.unmodifiableMap(new LinkedHashMap<>(desired));
	}

	public Optional<SymbolBlock> desiredBlock(PartRecord part) {
		return Optional.ofNullable(desired.get(part));
	}
}
