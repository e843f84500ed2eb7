package org.javai.partlinker.partdb;

import java.io.IOException;

/**
 * Performs authenticated GET requests against a Part-DB instance.
 */
public interface PartDbTransport {

	/**
	 * @param pathAndQuery path relative to the instance root, starting with {@code /}
	 * @return the response body
	 * @throws IOException on connection failure or a non-success status
	 */
	String get(String pathAndQuery) throws IOException, InterruptedException;
}
