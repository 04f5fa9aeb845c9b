package org.springaicommunity.github.issuesync;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ProcessCommandRunner}.
 */
@DisplayName("ProcessCommandRunner Tests")
class ProcessCommandRunnerTest {

	private static final String MISSING_EXECUTABLE = "github-issue-sync-no-such-binary";

	@Test
	@DisplayName("Should report a missing executable as a command that could not be run")
	void shouldReportMissingExecutable() {
		assertThatThrownBy(() -> new ProcessCommandRunner().run(List.of(MISSING_EXECUTABLE, "issue", "list")))
			.isInstanceOfSatisfying(RemoteIssueException.class, e -> {
				assertThat(e.getStatusCode()).isEqualTo(RemoteIssueException.COMMAND_NOT_RUN);
				assertThat(e.getMessage()).startsWith("Failed to start " + MISSING_EXECUTABLE);
			});
	}

	@Test
	@DisplayName("Should not retry when the gh executable is missing")
	void shouldNotRetryMissingExecutable() {
		List<Duration> sleeps = new ArrayList<>();
		IssuesClient client = RetryingIssuesClient.builder()
			.wrapping(new GhCliIssuesClient("acme/widgets", ObjectMapperFactory.create(), new ProcessCommandRunner(),
					MISSING_EXECUTABLE))
			.sleeper(sleeps::add)
			.build();

		assertThatThrownBy(client::list).isInstanceOf(RemoteIssueException.class);
		assertThat(sleeps).isEmpty();
	}

}
