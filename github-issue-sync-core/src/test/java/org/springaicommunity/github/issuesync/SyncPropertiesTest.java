package org.springaicommunity.github.issuesync;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link SyncProperties} defaults and environment overrides.
 */
@DisplayName("SyncProperties Tests")
class SyncPropertiesTest {

	@Test
	@DisplayName("Should expose documented defaults")
	void shouldHaveDefaults() {
		SyncProperties properties = new SyncProperties();

		assertThat(properties.getBackend()).isEqualTo(SyncProperties.Backend.REST);
		assertThat(properties.getSourceFile()).isEqualTo("ISSUES.md");
		assertThat(properties.getIndexFile()).isEqualTo(".issuesuite/index.json");
		assertThat(properties.getSummaryFile()).isEqualTo("issues_summary.json");
		assertThat(properties.isUpdate()).isTrue();
		assertThat(properties.isRespectStatus()).isTrue();
		assertThat(properties.getRetryAttempts()).isEqualTo(3);
		assertThat(properties.getRetryBase()).isEqualTo(Duration.ofMillis(500));
		assertThat(properties.getRetryMaxSleep()).isNull();
		assertThat(properties.isConcurrencyEnabled()).isFalse();
	}

	@Test
	@DisplayName("Should apply retry and mock overrides")
	void shouldApplyOverrides() {
		Map<String, String> env = Map.of(SyncProperties.ENV_RETRY_ATTEMPTS, "6", SyncProperties.ENV_RETRY_BASE, "0.25",
				SyncProperties.ENV_RETRY_MAX_SLEEP, "4", SyncProperties.ENV_MOCK, "true");

		SyncProperties properties = new SyncProperties().applyOverrides(env::get);

		assertThat(properties.getRetryAttempts()).isEqualTo(6);
		assertThat(properties.getRetryBase()).isEqualTo(Duration.ofMillis(250));
		assertThat(properties.getRetryMaxSleep()).isEqualTo(Duration.ofSeconds(4));
		assertThat(properties.getBackend()).isEqualTo(SyncProperties.Backend.MOCK);
	}

	@Test
	@DisplayName("Should ignore invalid and negative values")
	void shouldIgnoreInvalidValues() {
		Map<String, String> env = Map.of(SyncProperties.ENV_RETRY_ATTEMPTS, "many", SyncProperties.ENV_RETRY_BASE,
				"-1", SyncProperties.ENV_RETRY_MAX_SLEEP, "soon", SyncProperties.ENV_MOCK, "0");

		SyncProperties properties = new SyncProperties().applyOverrides(env::get);

		assertThat(properties.getRetryAttempts()).isEqualTo(3);
		assertThat(properties.getRetryBase()).isEqualTo(Duration.ofMillis(500));
		assertThat(properties.getRetryMaxSleep()).isNull();
		assertThat(properties.getBackend()).isEqualTo(SyncProperties.Backend.REST);
	}

	@Test
	@DisplayName("Should map properties onto sync options")
	void shouldMapToOptions() {
		SyncProperties properties = new SyncProperties();
		properties.setDryRun(true);
		properties.setPrune(true);
		properties.setTruncateBodyDiff(20);

		SyncOptions options = SyncOptions.from(properties);

		assertThat(options.dryRun()).isTrue();
		assertThat(options.prune()).isTrue();
		assertThat(options.update()).isTrue();
		assertThat(options.truncateBodyDiff()).isEqualTo(20);
	}

	@Test
	@DisplayName("Should carry preflight settings onto sync options")
	void shouldMapPreflight() {
		SyncProperties properties = new SyncProperties();
		properties.setPreflight(true);
		properties.setInjectLabels(List.of("triage"));
		properties.setEnsureMilestones(List.of("Sprint 1"));

		SyncOptions options = SyncOptions.from(properties);

		assertThat(options.preflight()).isTrue();
		assertThat(options.injectLabels()).containsExactly("triage");
		assertThat(options.ensureMilestones()).containsExactly("Sprint 1");
		assertThat(SyncOptions.defaults().preflight()).isFalse();
	}

}
