package org.javai.tabletalk.semantic;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;
import org.javai.tabletalk.error.EmbeddingUnavailableException;
import org.javai.tabletalk.schema.ColumnRef;
import org.javai.tabletalk.testsupport.FakeEmbeddingModel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.ai.embedding.EmbeddingModel;

class SemanticMatcherTest {

	private FakeEmbeddingModel model;
	private SemanticMatcher matcher;

	@BeforeEach
	void setUp() {
		model = new FakeEmbeddingModel(Map.of("cust", "customer", "qty", "quantity"));
		matcher = new SemanticMatcher(model, new EmbeddingCache());
	}

	@Nested
	@DisplayName("findSimilar")
	class FindSimilar {

		private final List<ColumnRef> candidates = List.of(
				new ColumnRef("orders.csv", "customer_id"),
				new ColumnRef("crm.csv", "customerId"),
				new ColumnRef("payments.csv", "cust_id"),
				new ColumnRef("orders.csv", "order_id"));

		@Test
		void returnsMatchesAboveThresholdBestFirst() {
			List<SemanticMatch> matches = matcher.findSimilar("customer_id", candidates, 0.75);

			assertThat(matches).extracting(SemanticMatch::columnName)
					.containsExactly("customer_id", "customerId", "cust_id");
			assertThat(matches.get(0).similarity()).isCloseTo(1.0, within(1e-9));
			assertThat(matches.get(2).similarity()).isCloseTo(5 / Math.sqrt(40), within(1e-6));
		}

		@Test
		void exactNameIsMarkedExact() {
			List<SemanticMatch> matches = matcher.findSimilar("customer_id", candidates, 0.75);

			assertThat(matches.get(0).matchType()).isEqualTo(SemanticMatch.MatchType.EXACT);
			assertThat(matches.get(1).matchType()).isEqualTo(SemanticMatch.MatchType.SEMANTIC);
		}

		@Test
		void tiesKeepCandidateOrder() {
			List<ColumnRef> reversed = List.of(
					new ColumnRef("crm.csv", "customerId"),
					new ColumnRef("orders.csv", "customer_id"));

			assertThat(matcher.findSimilar("customer_id", reversed, 0.9))
					.extracting(SemanticMatch::fileName)
					.containsExactly("crm.csv", "orders.csv");
		}

		@Test
		void lowerThresholdAdmitsWeakerMatches() {
			assertThat(matcher.findSimilar("customer_id", candidates, 0.5))
					.extracting(SemanticMatch::columnName)
					.contains("order_id");
		}

		@Test
		void blankTermOrNoCandidatesMatchNothing() {
			assertThat(matcher.findSimilar(" ", candidates, 0.5)).isEmpty();
			assertThat(matcher.findSimilar("customer_id", List.of(), 0.5)).isEmpty();
		}
	}

	@Test
	void nameComparedWithItselfScoresOne() {
		assertThat(matcher.similarity("order_date", "order_date")).isCloseTo(1.0, within(1e-9));
	}

	@Test
	void vectorsAreEmbeddedOnce() {
		matcher.similarity("customer_id", "cust_id");
		int embeddedAfterFirstCall = model.embeddedTexts().size();

		matcher.similarity("cust_id", "customer_id");

		assertThat(model.embeddedTexts()).hasSize(embeddedAfterFirstCall);
	}

	@Test
	void groupsColumnsByConcept() {
		List<ColumnRef> columns = List.of(
				new ColumnRef("orders.csv", "quantity"),
				new ColumnRef("payments.csv", "qty"),
				new ColumnRef("orders.csv", "customer_id"));

		Map<Concept, List<SemanticMatch>> groups = matcher.conceptGroups(columns, 0.9);

		assertThat(groups).containsOnlyKeys(Concept.QUANTITY);
		assertThat(groups.get(Concept.QUANTITY)).extracting(SemanticMatch::columnName)
				.containsExactly("quantity", "qty");
	}

	@Nested
	@DisplayName("without a model")
	class Unavailable {

		@Test
		void reportsUnavailableAndThrows() {
			SemanticMatcher unavailable = SemanticMatcher.unavailable();

			assertThat(unavailable.isAvailable()).isFalse();
			assertThatThrownBy(() -> unavailable.similarity("a", "b"))
					.isInstanceOf(EmbeddingUnavailableException.class);
		}

		@Test
		void providerFailureBecomesEmbeddingUnavailable() {
			EmbeddingModel failing = mock(EmbeddingModel.class);
			when(failing.embed(anyList())).thenThrow(new IllegalStateException("model not loaded"));
			SemanticMatcher broken = new SemanticMatcher(failing, new EmbeddingCache());

			assertThatThrownBy(() -> broken.similarity("customer_id", "cust_id"))
					.isInstanceOf(EmbeddingUnavailableException.class)
					.hasMessageContaining("model not loaded");
		}
	}
}
