package org.javai.springai.usecases.catalog;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import org.springframework.ai.chat.client.ChatClient;

@DisplayName("ChatClientCatalogGenerator")
@SuppressWarnings("NullAway")
class ChatClientCatalogGeneratorTest {

	private static final String RESPONSE = """
			{
				"use_cases": [
					{
						"use_case": "Remove an employee",
						"query": "DELETE FROM employees WHERE id = :employee_id",
						"affected_columns": ["id"],
						"user_input_columns": {"employee_id": "int"},
						"confidence": 0.9
					},
					{
						"use_case_id": "hire",
						"use_case": "Hire an employee",
						"query": "INSERT INTO employees (id, name) VALUES (:id, :name)",
						"affected_columns": ["id", "name"],
						"user_input_columns": {"id": "int", "name": "varchar"}
					}
				]
			}
			""";

	private ChatClient chatClientAnswering(String content) {
		ChatClient chatClient = mock(ChatClient.class, Mockito.RETURNS_DEEP_STUBS);
		when(chatClient.prompt().system(anyString()).user(anyString()).call().content()).thenReturn(content);
		return chatClient;
	}

	@Test
	void parsesGeneratedUseCases() {
		ChatClientCatalogGenerator generator = new ChatClientCatalogGenerator(chatClientAnswering(RESPONSE),
				() -> "Use PostgreSQL syntax only.");

		List<GeneratedUseCase> generated = generator.generate("Table: employees");

		assertThat(generated).hasSize(2);
		GeneratedUseCase remove = generated.get(0);
		assertThat(remove.id()).isNull();
		assertThat(remove.description()).isEqualTo("Remove an employee");
		assertThat(remove.inputParameters()).containsEntry("employee_id", "int");
		assertThat(generated.get(1).id()).isEqualTo("hire");
		assertThat(generated.get(1).inputParameters().keySet()).containsExactly("id", "name");
	}

	@Test
	void promptCarriesSchemaDialectAndQuota() {
		ChatClient chatClient = mock(ChatClient.class);
		ChatClient.ChatClientRequestSpec request = mock(ChatClient.ChatClientRequestSpec.class);
		ChatClient.CallResponseSpec response = mock(ChatClient.CallResponseSpec.class);
		when(chatClient.prompt()).thenReturn(request);
		when(request.system(anyString())).thenReturn(request);
		when(request.user(anyString())).thenReturn(request);
		when(request.call()).thenReturn(response);
		when(response.content()).thenReturn(RESPONSE);
		ChatClientCatalogGenerator generator = new ChatClientCatalogGenerator(chatClient, () -> "Use MySQL syntax only.");

		generator.generate("Table: employees\nid (INT) NOT NULL");

		ArgumentCaptor<String> system = ArgumentCaptor.forClass(String.class);
		ArgumentCaptor<String> user = ArgumentCaptor.forClass(String.class);
		verify(request).system(system.capture());
		verify(request).user(user.capture());
		assertThat(system.getValue())
				.contains("EXACTLY 5")
				.contains("Use MySQL syntax only.")
				.contains(":param_name")
				.contains("DATA ONLY");
		assertThat(user.getValue()).contains("Table: employees\nid (INT) NOT NULL");
	}

	@Test
	void chatFailureBecomesGenerationException() {
		ChatClient chatClient = mock(ChatClient.class, Mockito.RETURNS_DEEP_STUBS);
		when(chatClient.prompt().system(anyString()).user(anyString()).call().content())
				.thenThrow(new IllegalStateException("quota exceeded"));
		ChatClientCatalogGenerator generator = new ChatClientCatalogGenerator(chatClient, () -> "");

		assertThatThrownBy(() -> generator.generate("Table: employees"))
				.isInstanceOf(CatalogGenerationException.class)
				.hasMessageContaining("quota exceeded")
				.hasCauseInstanceOf(IllegalStateException.class);
	}

	@Nested
	@DisplayName("Response parsing")
	class ResponseParsing {

		@Test
		void acceptsMarkdownCodeFence() {
			String fenced = "Here you go:\n```json\n" + RESPONSE + "```\n";

			assertThat(ChatClientCatalogGenerator.parse(fenced)).hasSize(2);
		}

		@Test
		void acceptsMissingUseCaseList() {
			assertThat(ChatClientCatalogGenerator.parse("{\"note\": \"nothing to suggest\"}")).isEmpty();
		}

		@Test
		void rejectsEmptyResponse() {
			assertThatThrownBy(() -> ChatClientCatalogGenerator.parse("  "))
					.isInstanceOf(CatalogGenerationException.class)
					.hasMessageContaining("empty");
		}

		@Test
		void rejectsResponseWithoutJson() {
			assertThatThrownBy(() -> ChatClientCatalogGenerator.parse("I cannot help with that."))
					.isInstanceOf(CatalogGenerationException.class)
					.hasMessageContaining("does not contain");
		}

		@Test
		void rejectsMalformedJson() {
			assertThatThrownBy(() -> ChatClientCatalogGenerator.parse("{\"use_cases\": [ {\"use_case\": }"))
					.isInstanceOf(CatalogGenerationException.class)
					.hasMessageContaining("Failed to parse");
		}
	}
}
