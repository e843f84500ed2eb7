package org.javai.partlinker.partdb;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpResponse.BodyHandlers;
import java.time.Duration;
import org.javai.partlinker.config.PartDbSettings;

public final class HttpPartDbTransport implements PartDbTransport {

	private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);
	private static final Duration READ_TIMEOUT = Duration.ofSeconds(30);

	private final String baseUrl;
	private final String apiToken;
	private final HttpClient client;

	public HttpPartDbTransport(PartDbSettings settings) {
		this.baseUrl = settings.baseUrl();
		this.apiToken = settings.apiToken();
		this.client = HttpClient.newBuilder().connectTimeout(CONNECT_TIMEOUT).build();
	}

	@Override
	public String get(String pathAndQuery) throws IOException, InterruptedException {
		HttpRequest.Builder request = HttpRequest.newBuilder()
				.uri(URI.create(baseUrl + pathAndQuery))
				.timeout(READ_TIMEOUT)
				.header("Accept", "application/ld+json");
		if (!apiToken.isEmpty()) {
			request.header("Authorization", "Bearer " + apiToken);
		}

		HttpResponse<String> response = client.send(request.GET().build(), BodyHandlers.ofString());
		if (response.statusCode() / 100 != 2) {
			throw new IOException("GET " + pathAndQuery + " returned HTTP " + response.statusCode());
		}
		return response.body();
	}
}
