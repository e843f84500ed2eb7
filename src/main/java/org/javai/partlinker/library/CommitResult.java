package org.javai.partlinker.library;

import java.nio.file.Path;
import java.util.List;

/**
 * @param writtenFiles library files rebuilt by the commit
 * @param symbolsWritten total number of symbol blocks in the rebuilt files
 * @param symbolsUpdated number of selected parts whose fresh block was written
 */
public record CommitResult(List<Path> writtenFiles, int symbolsWritten, int symbolsUpdated) {

	public CommitResult {
		writtenFiles = List.copyOf(writtenFiles);
	}

	public static CommitResult nothingWritten() {
		return new CommitResult(List.of(), 0, 0);
	}
}
