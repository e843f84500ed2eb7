package org.javai.partlinker.partdb;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.javai.partlinker.config.PartDbSettings;
import org.javai.partlinker.part.PartRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fetches parts from the Part-DB REST API.
 *
 * <p>The part list is read page by page from {@code /api/parts}, following the
 * {@code hydra:next} link. Each part's parameters are references that are fetched
 * one by one and flattened into the part's parameter bag.</p>
 */
public class PartDbClient implements PartSource {

	private static final Logger logger = LoggerFactory.getLogger(PartDbClient.class);

	static final int ITEMS_PER_PAGE = 500;
	static final String BLANK_PARAMETER_VALUE = "-";

	private static final DateTimeFormatter API_DATE = DateTimeFormatter.ofPattern("dd.MM.yyyy");
	private static final TypeReference<Map<String, Object>> ATTRIBUTES = new TypeReference<>() {
	};

	private final PartDbTransport transport;
	private final LocalDate partsAfter;
	private final ObjectMapper mapper;

	public PartDbClient(PartDbSettings settings) {
		this(new HttpPartDbTransport(settings), settings.partsAfter());
	}

	public PartDbClient(PartDbTransport transport, LocalDate partsAfter) {
		this.transport = Objects.requireNonNull(transport, "transport must not be null");
		this.partsAfter = Objects.requireNonNull(partsAfter, "partsAfter must not be null");
		this.mapper = new ObjectMapper();
	}

	/**
	 * @throws PartSourceException when a page of the part list cannot be fetched or decoded
	 */
	@Override
	public List<PartRecord> fetchParts() {
		List<PartRecord> parts = new ArrayList<>();
		Set<String> visited = new HashSet<>();
		String next = firstPage();
		while (next != null && visited.add(next)) {
			JsonNode page = fetchPage(next);
			JsonNode members = page.path("hydra:member");
			if (!members.isArray()) {
				logger.warn("Response for {} has no 'hydra:member' list", next);
				break;
			}
			for (JsonNode member : members) {
				parts.add(toPart(member));
			}
			next = page.path("hydra:view").path("hydra:next").asText(null);
		}
		logger.info("Fetched {} parts added after {}", parts.size(), partsAfter);
		return parts;
	}

	String firstPage() {
		return "/api/parts?page=1"
				+ "&itemsPerPage=" + ITEMS_PER_PAGE
				+ "&" + encode("addedDate[after]") + "=" + encode(partsAfter.format(API_DATE))
				+ "&" + encode("order[name]") + "=asc";
	}

	private JsonNode fetchPage(String pathAndQuery) {
		logger.debug("Fetching {}", pathAndQuery);
		try {
			return mapper.readTree(transport.get(pathAndQuery));
		} catch (JsonProcessingException e) {
			throw new PartSourceException("Invalid JSON from Part-DB at " + pathAndQuery, e);
		} catch (IOException e) {
			throw new PartSourceException("Failed to fetch parts from Part-DB at " + pathAndQuery, e);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new PartSourceException("Interrupted while fetching parts from Part-DB", e);
		}
	}

	private PartRecord toPart(JsonNode json) {
		Map<String, Object> attributes = new LinkedHashMap<>();
		Iterator<Map.Entry<String, JsonNode>> fields = json.fields();
		while (fields.hasNext()) {
			Map.Entry<String, JsonNode> field = fields.next();
			if (!"parameters".equals(field.getKey())) {
				attributes.put(field.getKey(), toValue(field.getValue()));
			}
		}
		String name = json.path("name").asText("");
		return new PartRecord(
				json.path("id").asLong(),
				name,
				categoryPath(json.path("category")),
				attributes,
				fetchParameters(name, json.path("parameters")));
	}

	private Object toValue(JsonNode node) {
		if (node.isObject()) {
			return mapper.convertValue(node, ATTRIBUTES);
		}
		if (node.isNull() || node.isMissingNode()) {
			return null;
		}
		if (node.isValueNode()) {
			return node.isTextual() ? node.asText() : mapper.convertValue(node, Object.class);
		}
		return mapper.convertValue(node, Object.class);
	}

	static String categoryPath(JsonNode category) {
		String fullPath = category.path("full_path").asText("");
		if (!fullPath.isBlank()) {
			return fullPath;
		}
		String name = category.path("name").asText("");
		return name.isBlank() ? PartRecord.UNCATEGORIZED : name;
	}

	private Map<String, String> fetchParameters(String partName, JsonNode references) {
		Map<String, String> parameters = new LinkedHashMap<>();
		if (!references.isArray()) {
			return parameters;
		}
		for (JsonNode reference : references) {
			String id = reference.isTextual() ? reference.asText() : reference.path("@id").asText("");
			if (id.isEmpty()) {
				continue;
			}
			try {
				JsonNode parameter = mapper.readTree(transport.get(id));
				String name = parameter.path("name").asText("");
				if (name.isEmpty()) {
					continue;
				}
				String value = parameter.path("value_text").asText("");
				parameters.put(name, value.isBlank() ? BLANK_PARAMETER_VALUE : value);
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				throw new PartSourceException("Interrupted while fetching parameters of part '" + partName + "'", e);
			} catch (IOException e) {
				logger.warn("Could not fetch parameter {} of part '{}': {}", id, partName, e.getMessage());
			}
		}
		return parameters;
	}

	private static String encode(String value) {
		return URLEncoder.encode(value, StandardCharsets.UTF_8);
	}
}
