package org.javai.partlinker.partdb;

import java.util.List;
import org.javai.partlinker.part.PartRecord;

/**
 * Supplies the parts for a run.
 */
@FunctionalInterface
public interface PartSource {

	/**
	 * @throws PartSourceException when the parts cannot be fetched
	 */
	List<PartRecord> fetchParts();
}
