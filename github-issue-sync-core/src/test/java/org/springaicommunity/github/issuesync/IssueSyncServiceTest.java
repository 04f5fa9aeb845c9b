package org.springaicommunity.github.issuesync;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springaicommunity.github.issuesync.TestFixtures.*;

/**
 * Unit tests for {@link IssueSyncService}.
 *
 * Tests the per-item decision rules, dry-run planning, pruning, failure isolation and
 * the full run flow with index and summary files.
 */
@DisplayName("IssueSyncService Tests")
@ExtendWith(MockitoExtension.class)
class IssueSyncServiceTest {

	@TempDir
	Path tempDir;

	@Mock
	private IssuesClient mockClient;

	private ObjectMapper objectMapper;

	private IssueSyncService service;

	private SyncPaths paths;

	@BeforeEach
	void setUp() {
		objectMapper = ObjectMapperFactory.create();
		service = newService(mockClient);
		paths = new SyncPaths(tempDir.resolve("index.json"), null, tempDir.resolve("summary.json"));
	}

	private IssueSyncService newService(IssuesClient client) {
		return new IssueSyncService(client, new IssueSpecParser(), new IssueDiffEngine(),
				new FileSystemIndexStateRepository(objectMapper), ConcurrentBatchDispatcher.sequential(), "owner/repo");
	}

	private Path writeSource(String text) throws IOException {
		Path source = tempDir.resolve("ISSUES.md");
		Files.writeString(source, text);
		return source;
	}

	@Nested
	@DisplayName("Decision Tests")
	class DecisionTest {

		@Test
		@DisplayName("Should create an unmatched spec")
		void shouldCreateUnmatched() {
			IssueSpec alpha = spec("alpha", "Alpha", List.of("bug"), "M1", null, "body");
			when(mockClient.create("Alpha", alpha.body(), List.of("bug"), "M1")).thenReturn(1001);

			RunSummary summary = service.sync(List.of(alpha), List.of(), Map.of(), SyncOptions.defaults());

			assertThat(summary.totals()).isEqualTo(new SyncTotals(1, 1, 0, 0, 0));
			assertThat(summary.mapping()).containsEntry("alpha", 1001);
			assertThat(summary.plan()).isNull();
		}

		@Test
		@DisplayName("Should close a matched open issue whose spec is closed")
		void shouldCloseWhenSpecClosed() {
			IssueSpec beta = spec("beta", "Beta", List.of(), null, "closed", "body");

			RunSummary summary = service.sync(List.of(beta), List.of(remote(7, "Beta")), Map.of(),
					SyncOptions.defaults());

			verify(mockClient).close(7);
			assertThat(summary.changes().closed()).extracting(ChangeEntry::number).containsExactly(7);
		}

		@Test
		@DisplayName("Should not close an issue that is already closed")
		void shouldSkipAlreadyClosed() {
			IssueSpec beta = spec("beta", "Beta", List.of(), null, "closed", "body");

			RunSummary summary = service.sync(List.of(beta), List.of(closed(remoteFor(7, beta))), Map.of(),
					SyncOptions.defaults());

			verifyNoInteractions(mockClient);
			assertThat(summary.totals().skipped()).isEqualTo(1);
		}

		@Test
		@DisplayName("Should update a drifted issue with the desired content")
		void shouldUpdateDrifted() {
			IssueSpec alpha = spec("alpha", "Alpha", List.of("bug", "docs"), "M1", null, "body");
			RemoteIssue issue = new RemoteIssue(5, "Alpha", List.of("bug"), "M1", alpha.body(), "OPEN");

			RunSummary summary = service.sync(List.of(alpha), List.of(issue), Map.of(), SyncOptions.defaults());

			verify(mockClient).update(5, alpha.body(), List.of("bug", "docs"), "M1", null);
			assertThat(summary.changes().updated()).singleElement()
				.satisfies(entry -> assertThat(entry.diff().labelsAdded()).containsExactly("docs"));
		}

		@Test
		@DisplayName("Should skip when the prior fingerprint matches")
		void shouldSkipOnPriorFingerprint() {
			IssueSpec alpha = spec("alpha", "Alpha", List.of("bug", "docs"), null, null, "body");
			RemoteIssue issue = remote(5, "Alpha");

			RunSummary summary = service.sync(List.of(alpha), List.of(issue), Map.of("alpha", alpha.fingerprint()),
					SyncOptions.defaults());

			verifyNoInteractions(mockClient);
			assertThat(summary.totals().skipped()).isEqualTo(1);
			assertThat(summary.mapping()).containsEntry("alpha", 5);
		}

		@Test
		@DisplayName("Should not update when updates are disabled")
		void shouldHonourUpdateSwitch() {
			IssueSpec alpha = spec("alpha", "Alpha", List.of("bug"), null, null, "body");
			SyncOptions noUpdate = SyncOptions.defaults().withUpdate(false);

			service.sync(List.of(alpha), List.of(remote(5, "Alpha")), Map.of(), noUpdate);

			verifyNoInteractions(mockClient);
		}

	}

	@Nested
	@DisplayName("Dry Run Tests")
	class DryRunTest {

		@Test
		@DisplayName("Should plan without mutating")
		void shouldPlanWithoutMutating() {
			IssueSpec alpha = spec("alpha", "Alpha");
			IssueSpec beta = spec("beta", "Beta", List.of("x"), null, null, "changed");

			RunSummary summary = service.sync(List.of(alpha, beta), List.of(remote(3, "Beta")), Map.of(),
					SyncOptions.defaults().asDryRun());

			verifyNoInteractions(mockClient);
			assertThat(summary.plan()).hasSize(2);
			PlanEntry create = summary.plan().get(0);
			assertThat(create.externalId()).isEqualTo("alpha");
			assertThat(create.action()).isEqualTo(SyncAction.CREATE);
			assertThat(create.number()).isNull();
			PlanEntry update = summary.plan().get(1);
			assertThat(update.action()).isEqualTo(SyncAction.UPDATE);
			assertThat(update.number()).isEqualTo(3);
			assertThat(update.changes()).containsEntry("labels_added", 1).containsEntry("body_changed", 1);
		}

		@Test
		@DisplayName("Should not prune in a dry-run")
		void shouldNotPruneInDryRun() {
			service.sync(List.of(spec("alpha", "Alpha")), List.of(remote(1, "Alpha"), remote(2, "Orphan")), Map.of(),
					SyncOptions.defaults().asDryRun().withPrune(true));

			verify(mockClient, never()).close(anyInt());
		}

	}

	@Nested
	@DisplayName("Prune Tests")
	class PruneTest {

		@Test
		@DisplayName("Should close issues no spec refers to")
		void shouldCloseUnreferenced() {
			IssueSpec alpha = spec("alpha", "Alpha");

			service.sync(List.of(alpha), List.of(remoteFor(1, alpha), remote(2, "Orphan")), Map.of(),
					SyncOptions.defaults().withPrune(true));

			verify(mockClient).close(2);
			verify(mockClient, never()).close(1);
		}

		@Test
		@DisplayName("Should continue pruning when one close fails")
		void shouldContinueAfterPruneFailure() {
			doThrow(new RemoteIssueException("Forbidden", 403, "")).when(mockClient).close(2);

			service.sync(List.of(spec("alpha", "Alpha")), List.of(remote(2, "Orphan A"), remote(3, "Orphan B")),
					Map.of(), SyncOptions.defaults().withPrune(true));

			verify(mockClient).close(3);
		}

		@Test
		@DisplayName("Should keep the issue of a spec whose processing failed")
		void shouldKeepIssueOfFailedSpec() {
			IssueSpec alpha = spec("alpha", "Alpha", List.of("new"), null, null, "body");
			doThrow(new RemoteIssueException("Validation Failed", 422, "")).when(mockClient)
				.update(eq(1), anyString(), anyList(), any(), any());

			RunSummary summary = service.sync(List.of(alpha), List.of(remote(1, "Alpha")), Map.of(),
					SyncOptions.defaults().withPrune(true));

			verify(mockClient, never()).close(anyInt());
			assertThat(summary.errors()).extracting(SyncError::slug).containsExactly("alpha");
		}

	}

	@Nested
	@DisplayName("Failure Isolation Tests")
	class FailureIsolationTest {

		@Test
		@DisplayName("Should record a failing spec and continue with the rest")
		void shouldIsolateFailures() {
			when(mockClient.create(anyString(), anyString(), anyList(), any())).thenReturn(1)
				.thenThrow(new RemoteIssueException("Validation Failed", 422, "{}"))
				.thenReturn(3);

			RunSummary summary = service.sync(List.of(spec("a", "A"), spec("b", "B"), spec("c", "C")), List.of(),
					Map.of(), SyncOptions.defaults());

			assertThat(summary.totals()).isEqualTo(new SyncTotals(3, 2, 0, 0, 1));
			assertThat(summary.errors()).singleElement()
				.satisfies(error -> assertThat(error.message()).contains("Validation Failed"));
			assertThat(summary.mapping()).containsOnlyKeys("a", "c");
		}

	}

	@Nested
	@DisplayName("Run Tests")
	class RunTest {

		@Test
		@DisplayName("Should fail the milestone gate before any remote call")
		void shouldFailMilestoneGateEarly() throws IOException {
			Path source = writeSource(IssueSpecParserTest.entry("alpha", "title: Alpha\nmilestone: M1")
					+ IssueSpecParserTest.entry("beta", "title: Beta"));

			assertThatThrownBy(() -> service.run(source, SyncOptions.defaults().withMilestoneRequired(true), paths))
				.isInstanceOfSatisfying(PreconditionFailedException.class,
						e -> assertThat(e.getOffendingSlugs()).containsExactly("beta"))
				.hasMessageContaining("beta");
			verifyNoInteractions(mockClient);
			assertThat(paths.summary()).doesNotExist();
		}

		@Test
		@DisplayName("Should preview at most five offending slugs")
		void shouldPreviewFiveSlugs() {
			List<IssueSpec> specs = List.of(spec("a", "A"), spec("b", "B"), spec("c", "C"), spec("d", "D"),
					spec("e", "E"), spec("f", "F"));

			assertThatThrownBy(() -> IssueSyncService.checkMilestones(specs))
				.hasMessage("Milestone required but missing for 6 spec(s): a, b, c, d, e...");
		}

		@Test
		@DisplayName("Should persist the index and become idempotent")
		void shouldPersistIndexAndConverge() throws IOException {
			Path source = writeSource(IssueSpecParserTest.entry("alpha", "title: Alpha\nlabels: [bug]")
					+ IssueSpecParserTest.entry("beta", "title: Beta"));
			InMemoryIssuesClient remote = new InMemoryIssuesClient();
			IssueSyncService inMemory = newService(remote);

			SummaryDocument first = inMemory.run(source, SyncOptions.defaults(), paths);
			SummaryDocument second = inMemory.run(source, SyncOptions.defaults(), paths);

			assertThat(first.totals().created()).isEqualTo(2);
			assertThat(first.mappingSnapshot()).containsEntry("alpha", 1001).containsEntry("beta", 1002);
			assertThat(second.totals()).isEqualTo(new SyncTotals(2, 0, 0, 0, 2));
			assertThat(remote.list()).hasSize(2);

			JsonNode index = objectMapper.readTree(paths.index().toFile());
			assertThat(index.path("entries").path("alpha").path("hash").asText()).hasSize(16);
			JsonNode summary = objectMapper.readTree(paths.summary().toFile());
			assertThat(summary.path("totals").path("skipped").asInt()).isEqualTo(2);
		}

		@Test
		@DisplayName("Should drop index entries of removed specs")
		void shouldPruneStaleIndexEntries() throws IOException {
			InMemoryIssuesClient remote = new InMemoryIssuesClient();
			IssueSyncService inMemory = newService(remote);
			Path source = writeSource(
					IssueSpecParserTest.entry("alpha", "title: Alpha") + IssueSpecParserTest.entry("beta", "title: Beta"));
			inMemory.run(source, SyncOptions.defaults(), paths);

			writeSource(IssueSpecParserTest.entry("alpha", "title: Alpha"));
			SummaryDocument second = inMemory.run(source, SyncOptions.defaults(), paths);

			assertThat(second.mappingSnapshot()).containsOnlyKeys("alpha");
		}

		@Test
		@DisplayName("Should not write the index in a dry-run")
		void shouldNotWriteIndexInDryRun() throws IOException {
			Path source = writeSource(IssueSpecParserTest.entry("alpha", "title: Alpha"));
			when(mockClient.list()).thenReturn(List.of());

			SummaryDocument document = service.run(source, SyncOptions.defaults().asDryRun(), paths);

			assertThat(paths.index()).doesNotExist();
			assertThat(paths.summary()).exists();
			assertThat(document.dryRun()).isTrue();
			assertThat(document.plan()).extracting(PlanEntry::action).containsExactly(SyncAction.CREATE);
			verify(mockClient, never()).create(anyString(), anyString(), anyList(), any());
		}

		@Test
		@DisplayName("Should write the summary with the error when listing fails")
		void shouldWriteSummaryOnFailure() throws IOException {
			Path source = writeSource(IssueSpecParserTest.entry("alpha", "title: Alpha"));
			RemoteIssueException failure = new RemoteIssueException("Unauthorized", 401, "Bad credentials");
			when(mockClient.list()).thenThrow(failure);

			assertThatThrownBy(() -> service.run(source, SyncOptions.defaults(), paths)).isSameAs(failure);

			JsonNode summary = objectMapper.readTree(paths.summary().toFile());
			assertThat(summary.path("last_error").path("category").asText()).isEqualTo("RemoteIssueException");
			assertThat(summary.path("last_error").path("transient").asBoolean()).isFalse();
			assertThat(summary.path("last_error").path("message").asText()).isEqualTo("Unauthorized");
		}

		@Test
		@DisplayName("Should propagate parse failures without writing a summary")
		void shouldPropagateParseFailure() throws IOException {
			Path source = writeSource("## 001 | legacy\n");

			assertThatThrownBy(() -> service.run(source, SyncOptions.defaults(), paths))
				.isInstanceOf(SpecParseException.class);
			assertThat(paths.summary()).doesNotExist();
			verifyNoInteractions(mockClient);
		}

	}

	@Nested
	@DisplayName("Preflight Tests")
	class PreflightTest {

		private Path twoSpecs() throws IOException {
			return writeSource(IssueSpecParserTest.entry("alpha", "title: Alpha\nlabels: [bug]")
					+ IssueSpecParserTest.entry("beta", "title: Beta\nlabels: [docs, bug]"));
		}

		@Test
		@DisplayName("Should create spec and injected labels and milestones before listing issues")
		void shouldEnsureBeforeListing() throws IOException {
			Path source = twoSpecs();
			when(mockClient.list()).thenReturn(List.of());

			service.run(source, SyncOptions.defaults().withPreflight(List.of("triage"), List.of("Sprint 1")), paths);

			InOrder inOrder = inOrder(mockClient);
			inOrder.verify(mockClient).ensureLabels(Set.of("bug", "docs", "triage"));
			inOrder.verify(mockClient).ensureMilestones(List.of("Sprint 1"));
			inOrder.verify(mockClient).list();
		}

		@Test
		@DisplayName("Should skip milestone creation when none are configured")
		void shouldSkipEmptyMilestones() throws IOException {
			Path source = twoSpecs();
			when(mockClient.list()).thenReturn(List.of());

			service.run(source, SyncOptions.defaults().withPreflight(List.of(), List.of()), paths);

			verify(mockClient).ensureLabels(Set.of("bug", "docs"));
			verify(mockClient, never()).ensureMilestones(anyList());
		}

		@Test
		@DisplayName("Should not run preflight unless enabled or in a dry-run")
		void shouldNotRunWhenDisabledOrDryRun() throws IOException {
			Path source = twoSpecs();
			when(mockClient.list()).thenReturn(List.of());

			service.run(source, SyncOptions.defaults(), paths);
			service.run(source, SyncOptions.defaults().asDryRun().withPreflight(List.of("triage"), List.of("M1")),
					paths);

			verify(mockClient, never()).ensureLabels(anySet());
			verify(mockClient, never()).ensureMilestones(anyList());
		}

		@Test
		@DisplayName("Should continue the sync when label creation fails")
		void shouldContinueAfterPreflightFailure() throws IOException {
			Path source = writeSource(IssueSpecParserTest.entry("alpha", "title: Alpha\nlabels: [bug]"));
			when(mockClient.ensureLabels(anySet()))
				.thenThrow(new RemoteIssueException("Forbidden", 403, "Resource not accessible by integration"));
			when(mockClient.list()).thenReturn(List.of());
			when(mockClient.create(anyString(), anyString(), anyList(), any())).thenReturn(7);

			SummaryDocument document = service.run(source,
					SyncOptions.defaults().withPreflight(List.of(), List.of()), paths);

			assertThat(document.totals().created()).isEqualTo(1);
			assertThat(document.lastError()).isNull();
		}

		@Test
		@DisplayName("Should leave labels and milestones in place on the remote")
		void shouldCreateRemotely() throws IOException {
			InMemoryIssuesClient remote = new InMemoryIssuesClient();
			IssueSyncService inMemory = newService(remote);
			Path source = twoSpecs();

			inMemory.run(source, SyncOptions.defaults().withPreflight(List.of("triage"), List.of("Sprint 1")), paths);

			assertThat(remote.labels()).containsExactly("bug", "docs", "triage");
			assertThat(remote.milestones()).containsExactly("Sprint 1");
		}

	}

}
