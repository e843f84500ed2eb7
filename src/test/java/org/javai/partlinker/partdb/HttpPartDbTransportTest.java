package org.javai.partlinker.partdb;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import com.sun.net.httpserver.Headers;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.concurrent.atomic.AtomicReference;
import org.javai.partlinker.config.PartDbSettings;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("HttpPartDbTransport")
class HttpPartDbTransportTest {

	private HttpServer server;
	private final AtomicReference<Headers> headers = new AtomicReference<>();
	private final AtomicReference<String> query = new AtomicReference<>();

	@BeforeEach
	void startServer() throws IOException {
		server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
		server.createContext("/api/parts", exchange -> {
			headers.set(exchange.getRequestHeaders());
			query.set(exchange.getRequestURI().getRawQuery());
			byte[] body = "{\"hydra:member\": []}".getBytes(StandardCharsets.UTF_8);
			exchange.sendResponseHeaders(200, body.length);
			try (OutputStream out = exchange.getResponseBody()) {
				out.write(body);
			}
		});
		server.createContext("/api/missing", exchange -> {
			exchange.sendResponseHeaders(404, -1);
			exchange.close();
		});
		server.start();
	}

	@AfterEach
	void stopServer() {
		server.stop(0);
	}

	private PartDbSettings settings(String token) {
		return new PartDbSettings("http://127.0.0.1:" + server.getAddress().getPort() + "/", token,
				LocalDate.of(2025, 10, 1));
	}

	@Test
	@DisplayName("sends the JSON-LD accept header and the bearer token")
	void headers() throws Exception {
		String body = new HttpPartDbTransport(settings("tcp_abc")).get("/api/parts?page=1");

		assertThat(body).contains("hydra:member");
		assertThat(headers.get().getFirst("Accept")).isEqualTo("application/ld+json");
		assertThat(headers.get().getFirst("Authorization")).isEqualTo("Bearer tcp_abc");
		assertThat(query.get()).isEqualTo("page=1");
	}

	@Test
	@DisplayName("omits the authorization header without a token")
	void noToken() throws Exception {
		new HttpPartDbTransport(settings("")).get("/api/parts");

		assertThat(headers.get().containsKey("Authorization")).isFalse();
	}

	@Test
	@DisplayName("a non-success status is an I/O error")
	void errorStatus() {
		assertThatThrownBy(() -> new HttpPartDbTransport(settings("")).get("/api/missing"))
				.isInstanceOf(IOException.class)
				.hasMessageContaining("404");
	}

	@Test
	@DisplayName("the client fetches through the transport built from settings")
	void clientFromSettings() {
		assertThat(new PartDbClient(settings("tcp_abc")).fetchParts()).isEmpty();
	}
}
