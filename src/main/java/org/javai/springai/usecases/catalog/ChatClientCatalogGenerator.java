package org.javai.springai.usecases.catalog;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.ai.chat.client.ChatClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link CatalogGenerator} backed by a Spring AI {@link ChatClient}.
 *
 * <p>The model is asked for five data-manipulation use cases per CRUD category, written with
 * {@code :name} placeholders in the dialect of the active backend, and answers with a JSON
 * document of the form:</p>
 *
 * <pre>{@code
 * {"use_cases": [
 *   {"use_case": "...", "query": "...", "affected_columns": [...], "user_input_columns": {"name": "type"}}
 * ]}
 * }</pre>
 *
 * <p>The answer may be wrapped in a markdown code fence.</p>
 */
public class ChatClientCatalogGenerator implements CatalogGenerator {

	private static final Logger logger = LoggerFactory.getLogger(ChatClientCatalogGenerator.class);

	private static final Pattern JSON_BLOCK_PATTERN = Pattern.compile("```(?:json)?\\s*\\n?(\\{.*?\\})\\s*```", Pattern.DOTALL);

	private static final ObjectMapper JSON_MAPPER = new ObjectMapper()
			.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

	static final String SYSTEM_PROMPT = """
			You are an expert SQL query generator specializing in business database operations.
			Given a database schema, generate EXACTLY %d business-relevant use cases for each category:
			- Create: INSERT statements adding new business records
			- Read: SELECT statements for business insights and reporting
			- Update: UPDATE statements maintaining accurate business data
			- Delete: DELETE statements for data cleanup and compliance

			Instructions:
			- Use joins to connect related business entities where it helps.
			- Use named placeholders (:param_name) instead of literal values.
			- Declare every placeholder in user_input_columns, mapping its name to its data type.
			- Generate statements that manipulate DATA ONLY. Never create, alter or drop tables, \
			indexes or constraints.
			- %s

			Answer with a single JSON object and nothing else:
			{"use_cases": [{"use_case": "<description>", "query": "<sql>", \
			"affected_columns": ["<column>"], "user_input_columns": {"<placeholder>": "<type>"}}]}
			""";

	static final String USER_PROMPT = """
			Schema:
			%s

			Generate SQL statements for real-world business use cases categorized into Create, Read, \
			Update and Delete operations.
			""";

	private final ChatClient chatClient;
	private final Supplier<String> dialectInstruction;

	/**
	 * @param chatClient the client used to reach the model
	 * @param dialectInstruction supplies the syntax instruction of the currently active backend
	 */
	public ChatClientCatalogGenerator(ChatClient chatClient, Supplier<String> dialectInstruction) {
		this.chatClient = Objects.requireNonNull(chatClient, "chatClient must not be null");
		this.dialectInstruction = Objects.requireNonNull(dialectInstruction, "dialectInstruction must not be null");
	}

	@Override
	public List<GeneratedUseCase> generate(String schema) {
		Objects.requireNonNull(schema, "schema must not be null");
		String system = SYSTEM_PROMPT.formatted(Catalog.MAX_PER_CATEGORY, dialectInstruction.get());
		String user = USER_PROMPT.formatted(schema);
		String content;
		try {
			content = chatClient.prompt()
					.system(system)
					.user(user)
					.call()
					.content();
		}
		catch (RuntimeException e) {
			throw new CatalogGenerationException("Failed to generate use cases: " + e.getMessage(), e);
		}
		logger.debug("Generator response:\n{}", content);
		List<GeneratedUseCase> useCases = parse(content);
		logger.info("Generator proposed {} use case(s)", useCases.size());
		return useCases;
	}

	/**
	 * Parses a generator response.
	 *
	 * @throws CatalogGenerationException if the response holds no readable JSON document
	 */
	static List<GeneratedUseCase> parse(String response) {
		if (response == null || response.isBlank()) {
			throw new CatalogGenerationException("Generator returned an empty response");
		}
		String json = extractJsonContent(response)
				.orElseThrow(() -> new CatalogGenerationException("Generator response does not contain a JSON object"));
		try {
			GenerationResponse parsed = JSON_MAPPER.readValue(json, GenerationResponse.class);
			return parsed.useCases() != null ? parsed.useCases() : List.of();
		}
		catch (JsonProcessingException e) {
			throw new CatalogGenerationException("Failed to parse generator response: " + e.getOriginalMessage(), e);
		}
	}

	private static Optional<String> extractJsonContent(String response) {
		String trimmed = response.trim();
		Matcher matcher = JSON_BLOCK_PATTERN.matcher(trimmed);
		if (matcher.find()) {
			return Optional.of(matcher.group(1).trim());
		}
		if (trimmed.startsWith("{") && trimmed.endsWith("}")) {
			return Optional.of(trimmed);
		}
		return Optional.empty();
	}

	@JsonIgnoreProperties(ignoreUnknown = true)
	record GenerationResponse(@JsonProperty("use_cases") List<GeneratedUseCase> useCases) {
	}
}
