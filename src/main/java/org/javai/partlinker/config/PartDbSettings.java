package org.javai.partlinker.config;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Connection settings for the Part-DB instance.
 *
 * @param baseUrl instance URL without trailing slash, e.g. {@code http://localhost:8888}
 * @param apiToken bearer token
 * @param partsAfter only parts added after this date are fetched
 */
public record PartDbSettings(String baseUrl, String apiToken, LocalDate partsAfter) {

	public static final String DEFAULT_BASE_URL = "http://localhost:8888";
	public static final LocalDate DEFAULT_PARTS_AFTER = LocalDate.of(2020, 1, 1);

	public PartDbSettings {
		baseUrl = baseUrl != null && !baseUrl.isBlank() ? stripTrailingSlash(baseUrl.trim()) : DEFAULT_BASE_URL;
		apiToken = apiToken != null ? apiToken : "";
		partsAfter = Objects.requireNonNullElse(partsAfter, DEFAULT_PARTS_AFTER);
	}

	public static PartDbSettings defaults() {
		return new PartDbSettings(null, null, null);
	}

	private static String stripTrailingSlash(String url) {
		return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
	}

	@Override
	public String toString() {
		return "PartDbSettings[baseUrl=" + baseUrl + ", apiToken=" + (apiToken.isEmpty() ? "<none>" : "****")
				+ ", partsAfter=" + partsAfter + "]";
	}
}
