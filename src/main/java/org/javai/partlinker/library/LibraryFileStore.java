package org.javai.partlinker.library;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads and writes library files.
 *
 * <p>Writes go to a temporary file next to the target which is then moved over
 * it, so a failed write never leaves a partial library behind.</p>
 */
public class LibraryFileStore {

	private static final Logger logger = LoggerFactory.getLogger(LibraryFileStore.class);

	private static final String TEMP_SUFFIX = ".tmp";
	private static final String BLOCK_INDENT = "  ";

	/**
	 * @return the file content, or empty when the file does not exist
	 * @throws LibraryIoException when the file exists but cannot be read
	 */
	public Optional<String> read(Path file) {
		if (!Files.exists(file)) {
			return Optional.empty();
		}
		try {
			return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
		} catch (IOException e) {
			throw new LibraryIoException(file, "Failed to read library file", e);
		}
	}

	public void write(Path file, String content) {
		Path directory = file.toAbsolutePath().getParent();
		Path temp = null;
		try {
			Files.createDirectories(directory);
			temp = Files.createTempFile(directory, file.getFileName().toString() + ".", TEMP_SUFFIX);
			Files.writeString(temp, content, StandardCharsets.UTF_8);
			move(temp, file);
		} catch (IOException e) {
			LibraryIoException failure = new LibraryIoException(file, "Failed to write library file", e);
			discard(temp, failure);
			throw failure;
		}
	}

	/**
	 * Renders a library file: header line, each block on its own lines, closing parenthesis.
	 * The first line of every block is indented one level; blocks taken from an
	 * existing file start at their opening parenthesis.
	 */
	public static String format(String header, List<String> blocks) {
		StringBuilder content = new StringBuilder(header).append('\n');
		for (String block : blocks) {
			content.append(BLOCK_INDENT).append(block.stripLeading()).append('\n');
		}
		return content.append(")\n").toString();
	}

	private void move(Path temp, Path file) throws IOException {
		try {
			Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
		} catch (AtomicMoveNotSupportedException e) {
			logger.debug("Atomic move not supported for {}, falling back to replace", file);
			Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
		}
	}

	private void discard(Path temp, LibraryIoException failure) {
		if (temp == null) {
			return;
		}
		try {
			Files.deleteIfExists(temp);
		} catch (IOException e) {
			failure.addSuppressed(e);
		}
	}
}
