package org.javai.partlinker.library;

/**
 * Maps category paths to library file names.
 */
public final class LibraryFiles {

	public static final String EXTENSION = ".kicad_sym";

	/** Separator between levels of a Part-DB category path. */
	public static final String CATEGORY_SEPARATOR = " → ";

	private LibraryFiles() {
	}

	/**
	 * {@code "Passives → Resistors → SMD 0603"} becomes {@code "SMD_0603.kicad_sym"}.
	 */
	public static String fileNameFor(String categoryPath) {
		String path = categoryPath != null ? categoryPath : "";
		int cut = path.lastIndexOf(CATEGORY_SEPARATOR);
		String tail = cut >= 0 ? path.substring(cut + CATEGORY_SEPARATOR.length()) : path;
		return tail.replace(' ', '_').replace('/', '_') + EXTENSION;
	}
}
