package org.springaicommunity.github.issuesync;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link RetryingIssuesClient}.
 *
 * Tests retry classification, wait hints, exponential backoff and exhaustion.
 */
@DisplayName("RetryingIssuesClient Tests")
@ExtendWith(MockitoExtension.class)
class RetryingIssuesClientTest {

	@Mock
	private IssuesClient mockDelegate;

	private final List<Duration> sleeps = new ArrayList<>();

	private RetryingIssuesClient retryingClient;

	@BeforeEach
	void setUp() {
		retryingClient = RetryingIssuesClient.builder()
			.wrapping(mockDelegate)
			.maxAttempts(3)
			.baseDelay(Duration.ofMillis(500))
			.sleeper(sleeps::add)
			.jitter(() -> 0.0)
			.build();
	}

	private static RemoteIssueException rateLimited(String diagnostic) {
		return new RemoteIssueException("GitHub API rate limit exceeded (403)", 403, diagnostic);
	}

	@Nested
	@DisplayName("Delegation Tests")
	class DelegationTest {

		@Test
		@DisplayName("Should delegate list() to wrapped client")
		void shouldDelegateList() {
			List<RemoteIssue> issues = List.of(TestFixtures.remote(1, "Alpha"));
			when(mockDelegate.list()).thenReturn(issues);

			assertThat(retryingClient.list()).isEqualTo(issues);
			verify(mockDelegate, times(1)).list();
			assertThat(sleeps).isEmpty();
		}

		@Test
		@DisplayName("Should delegate create() and return the new number")
		void shouldDelegateCreate() {
			when(mockDelegate.create("T", "B", List.of("x"), "M")).thenReturn(42);

			assertThat(retryingClient.create("T", "B", List.of("x"), "M")).isEqualTo(42);
		}

		@Test
		@DisplayName("Should delegate update() and close()")
		void shouldDelegateUpdateAndClose() {
			retryingClient.update(5, "body", List.of("a"), null, null);
			retryingClient.close(6);

			verify(mockDelegate).update(5, "body", List.of("a"), null, null);
			verify(mockDelegate).close(6);
		}

	}

	@Nested
	@DisplayName("Retry Behavior Tests")
	class RetryBehaviorTest {

		@Test
		@DisplayName("Should honour an explicit Retry-After hint")
		void shouldHonourRetryAfter() {
			when(mockDelegate.list()).thenThrow(rateLimited("secondary rate limit\nRetry-After: 5"))
				.thenReturn(List.of());

			retryingClient.list();

			assertThat(sleeps).containsExactly(Duration.ofSeconds(5));
			verify(mockDelegate, times(2)).list();
		}

		@Test
		@DisplayName("Should back off exponentially without a hint")
		void shouldBackOffExponentially() {
			when(mockDelegate.list()).thenThrow(rateLimited("API rate limit exceeded"))
				.thenThrow(rateLimited("API rate limit exceeded"))
				.thenReturn(List.of());

			retryingClient.list();

			assertThat(sleeps).containsExactly(Duration.ofMillis(500), Duration.ofMillis(1000));
		}

		@Test
		@DisplayName("Should add jitter to computed backoff")
		void shouldAddJitter() {
			RetryingIssuesClient client = RetryingIssuesClient.builder()
				.wrapping(mockDelegate)
				.baseDelay(Duration.ofMillis(500))
				.jitter(() -> 0.2)
				.sleeper(sleeps::add)
				.build();
			when(mockDelegate.list()).thenThrow(rateLimited("rate limit")).thenReturn(List.of());

			client.list();

			assertThat(sleeps).containsExactly(Duration.ofMillis(700));
		}

		@Test
		@DisplayName("Should cap sleeps at the configured maximum")
		void shouldCapAtMaxSleep() {
			RetryingIssuesClient client = RetryingIssuesClient.builder()
				.wrapping(mockDelegate)
				.maxSleep(Duration.ofSeconds(2))
				.sleeper(sleeps::add)
				.build();
			when(mockDelegate.list()).thenThrow(rateLimited("wait 60 seconds")).thenReturn(List.of());

			client.list();

			assertThat(sleeps).containsExactly(Duration.ofSeconds(2));
		}

		@Test
		@DisplayName("Should retry transport failures")
		void shouldRetryTransportFailures() {
			when(mockDelegate.list())
				.thenThrow(new RemoteIssueException("HTTP request failed", new IOException("connection reset")))
				.thenReturn(List.of());

			retryingClient.list();

			verify(mockDelegate, times(2)).list();
		}

	}

	@Nested
	@DisplayName("Failure Tests")
	class FailureTest {

		@Test
		@DisplayName("Should not retry permanent failures")
		void shouldNotRetryPermanentFailures() {
			RemoteIssueException notFound = new RemoteIssueException("Not Found", 404, "{\"message\":\"Not Found\"}");
			doThrow(notFound).when(mockDelegate).close(9);

			assertThatThrownBy(() -> retryingClient.close(9)).isSameAs(notFound);
			verify(mockDelegate, times(1)).close(9);
			assertThat(sleeps).isEmpty();
		}

		@Test
		@DisplayName("Should rethrow the original failure after exhausting attempts")
		void shouldRethrowAfterExhaustion() {
			RemoteIssueException limited = rateLimited("rate limit");
			when(mockDelegate.create(anyString(), anyString(), anyList(), any())).thenThrow(limited);

			assertThatThrownBy(() -> retryingClient.create("T", "B", List.of(), null)).isSameAs(limited);
			verify(mockDelegate, times(3)).create(anyString(), anyString(), anyList(), any());
			assertThat(sleeps).hasSize(2);
		}

		@Test
		@DisplayName("Should make a single attempt when maxAttempts is below one")
		void shouldClampAttempts() {
			RetryingIssuesClient client = RetryingIssuesClient.builder()
				.wrapping(mockDelegate)
				.maxAttempts(0)
				.sleeper(sleeps::add)
				.build();
			when(mockDelegate.list()).thenThrow(rateLimited("rate limit"));

			assertThatThrownBy(client::list).isInstanceOf(RemoteIssueException.class);
			assertThat(client.getMaxAttempts()).isEqualTo(1);
			verify(mockDelegate, times(1)).list();
		}

	}

	@Nested
	@DisplayName("Builder Tests")
	class BuilderTest {

		@Test
		@DisplayName("Should require a delegate")
		void shouldRequireDelegate() {
			assertThatThrownBy(() -> RetryingIssuesClient.builder().build()).isInstanceOf(IllegalStateException.class)
				.hasMessageContaining("wrapping()");
		}

		@Test
		@DisplayName("Should reject a negative base delay")
		void shouldRejectNegativeDelay() {
			assertThatThrownBy(
					() -> RetryingIssuesClient.builder().wrapping(mockDelegate).baseDelay(Duration.ofMillis(-1)).build())
				.isInstanceOf(IllegalStateException.class);
		}

	}

}
