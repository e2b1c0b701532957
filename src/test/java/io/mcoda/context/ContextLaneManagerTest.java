package io.mcoda.context;

import io.mcoda.config.ContextSettings;
import io.mcoda.config.McodaConfig;
import io.mcoda.security.PatternRedactor;
import io.mcoda.testing.TempDirs;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

final class ContextLaneManagerTest {
    private static final String LANE = "job-42:task-7:builder";

    @Test
    void byteLimitKeepsNewestMessagesOldestFirst() throws Exception {
        Path root = TempDirs.create("lanes-bytes");
        try {
            FileContextStore store = new FileContextStore(root);
            ContextLaneManager manager = manager(ContextSettings.defaults().withLimits(200, 2000), store, null);
            manager.getLane(LaneScope.forTask("job-42", "task-7", LaneRole.BUILDER));
            for (int i = 0; i < 10; i++) {
                manager.append(LANE, LaneMessage.user(i + "x".repeat(999)));
            }

            List<LaneMessage> stored = store.loadLane(LANE);
            Assertions.assertEquals(2, stored.size());
            Assertions.assertTrue(stored.get(0).content().startsWith("8"));
            Assertions.assertTrue(stored.get(1).content().startsWith("9"));
            Assertions.assertEquals(stored, manager.findLane(LANE).orElseThrow().messages());
            Assertions.assertEquals(2000L, manager.findLane(LANE).orElseThrow().byteSize());
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void messageLimitKeepsNewest() throws Exception {
        Path root = TempDirs.create("lanes-count");
        try {
            FileContextStore store = new FileContextStore(root);
            ContextLaneManager manager = manager(ContextSettings.defaults().withLimits(3, -1), store, null);
            for (int i = 1; i <= 5; i++) {
                manager.append(LANE, LaneMessage.user("message " + i));
            }
            Assertions.assertEquals(List.of("message 3", "message 4", "message 5"),
                    store.loadLane(LANE).stream().map(LaneMessage::content).toList());
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void summarizesOldestHalfUntilWithinBudget() throws Exception {
        Path root = TempDirs.create("lanes-summarize");
        try {
            FileContextStore store = new FileContextStore(root);
            AtomicInteger calls = new AtomicInteger();
            Summarizer summarizer = (messages, model) -> {
                calls.incrementAndGet();
                return LaneMessage.system("Context summary: " + messages.size() + " earlier messages");
            };
            ContextLaneManager manager = manager(tightBudget(), store, summarizer);
            for (int i = 0; i < 10; i++) {
                manager.append(LANE, LaneMessage.user(i + "y".repeat(79)));
            }

            List<LaneMessage> prepared = manager.prepare(LANE, PrepareOptions.forModel("llama3"));
            SummarizeOutcome outcome = manager.lastSummarizeOutcome(LANE).orElseThrow();

            Assertions.assertTrue(outcome.summarized());
            Assertions.assertEquals(calls.get(), outcome.passes());
            Assertions.assertTrue(outcome.tokensAfter() <= outcome.modelLimit(), outcome.toString());
            Assertions.assertFalse(outcome.overBudget());
            Assertions.assertFalse(outcome.capReached());
            Assertions.assertEquals(LaneMessage.SYSTEM, prepared.get(0).role());
            Assertions.assertTrue(prepared.get(0).content().startsWith("Context summary: "));
            Assertions.assertTrue(prepared.get(prepared.size() - 1).content().startsWith("9"));
            Assertions.assertEquals(prepared, store.loadLane(LANE));
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void withinBudgetLaneIsLeftAlone() throws Exception {
        Path root = TempDirs.create("lanes-fits");
        try {
            FileContextStore store = new FileContextStore(root);
            Summarizer summarizer = (messages, model) -> {
                throw new AssertionError("summarizer must not be called");
            };
            ContextLaneManager manager = manager(tightBudget(), store, summarizer);
            manager.append(LANE, LaneMessage.user("short"));
            manager.append(LANE, LaneMessage.assistant("also short"));

            List<LaneMessage> prepared = manager.prepare(LANE, new PrepareOptions("be brief", "bundle", "llama3"));
            Assertions.assertEquals(2, prepared.size());
            Assertions.assertFalse(manager.lastSummarizeOutcome(LANE).orElseThrow().summarized());
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void givesUpAfterFivePassesAndReportsIt() throws Exception {
        Path root = TempDirs.create("lanes-cap");
        try {
            FileContextStore store = new FileContextStore(root);
            AtomicInteger calls = new AtomicInteger();
            Summarizer verbose = (messages, model) -> {
                calls.incrementAndGet();
                return LaneMessage.system("Context summary: " + "z".repeat(1000));
            };
            ContextLaneManager manager = manager(tightBudget(), store, verbose);
            for (int i = 0; i < 10; i++) {
                manager.append(LANE, LaneMessage.user("m" + i + "q".repeat(78)));
            }

            SummarizeOutcome outcome = manager.summarizeIfNeeded(LANE, PrepareOptions.forModel(null));

            Assertions.assertEquals(ContextLaneManager.MAX_SUMMARIZE_PASSES, calls.get());
            Assertions.assertEquals(ContextLaneManager.MAX_SUMMARIZE_PASSES, outcome.passes());
            Assertions.assertTrue(outcome.overBudget());
            Assertions.assertTrue(outcome.capReached());
            Assertions.assertEquals(outcome.messagesAfter(), store.loadLane(LANE).size());
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void singleOversizedMessageIsNotSummarized() throws Exception {
        Path root = TempDirs.create("lanes-single");
        try {
            ContextLaneManager manager = manager(tightBudget(), new FileContextStore(root), (messages, model) -> {
                throw new AssertionError("summarizer must not be called");
            });
            manager.append(LANE, LaneMessage.user("w".repeat(2000)));

            SummarizeOutcome outcome = manager.summarizeIfNeeded(LANE, PrepareOptions.forModel(null));
            Assertions.assertEquals(0, outcome.passes());
            Assertions.assertTrue(outcome.overBudget());
            Assertions.assertFalse(outcome.capReached());
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void failingSummarizerLeavesStoredLaneUntouched() throws Exception {
        Path root = TempDirs.create("lanes-fail");
        try {
            FileContextStore store = new FileContextStore(root);
            AtomicInteger calls = new AtomicInteger();
            Summarizer flaky = (messages, model) -> {
                if (calls.incrementAndGet() > 1) {
                    throw new SummarizerFailureException("provider down");
                }
                return LaneMessage.system("Context summary: first pass");
            };
            ContextLaneManager manager = manager(tightBudget(), store, flaky);
            for (int i = 0; i < 10; i++) {
                manager.append(LANE, LaneMessage.user(i + "p".repeat(99)));
            }
            List<LaneMessage> before = store.loadLane(LANE);

            Assertions.assertThrows(SummarizerFailureException.class, () -> manager.prepare(LANE, PrepareOptions.forModel(null)));
            Assertions.assertEquals(before, store.loadLane(LANE));
            Assertions.assertEquals(before, manager.findLane(LANE).orElseThrow().messages());
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void emptySummaryIsAFailure() throws Exception {
        Path root = TempDirs.create("lanes-empty-summary");
        try {
            ContextLaneManager manager = manager(tightBudget(), new FileContextStore(root),
                    (messages, model) -> LaneMessage.system(" "));
            for (int i = 0; i < 10; i++) {
                manager.append(LANE, LaneMessage.user("e".repeat(100)));
            }
            Assertions.assertThrows(SummarizerFailureException.class,
                    () -> manager.summarizeIfNeeded(LANE, PrepareOptions.forModel(null)));
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void toolMessagesAreDroppedUnlessConfigured() throws Exception {
        Path root = TempDirs.create("lanes-tool");
        try {
            FileContextStore store = new FileContextStore(root);
            ContextLaneManager dropping = manager(ContextSettings.defaults(), store, null);
            dropping.append(LANE, LaneMessage.user("run the tests"));
            dropping.append(LANE, LaneMessage.of(LaneMessage.TOOL, "{\"exit\":0}"));
            Assertions.assertEquals(1, store.loadLane(LANE).size());

            ContextSettings keepTools = new ContextSettings(true, "context", true, 200, 200_000L, Map.of(),
                    ContextSettings.DEFAULT_MODEL_TOKEN_LIMIT, 4, true, List.of(), false);
            ContextLaneManager keeping = manager(keepTools, store, null);
            keeping.append(LANE, LaneMessage.of(LaneMessage.TOOL, "{\"exit\":1}"));
            Assertions.assertEquals(List.of("user", "tool"), store.loadLane(LANE).stream().map(LaneMessage::role).toList());
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void ephemeralLanesStayInMemory() throws Exception {
        Path root = TempDirs.create("lanes-ephemeral");
        try {
            FileContextStore store = new FileContextStore(root);
            ContextLaneManager manager = manager(tightBudget(), store, (messages, model) -> {
                throw new AssertionError("ephemeral lanes are not summarized");
            });
            LaneScope scope = LaneScope.forTask("job-1", "task-1", LaneRole.CRITIC).asEphemeral();
            ContextLane lane = manager.getLane(scope);
            Assertions.assertFalse(lane.persisted());
            for (int i = 0; i < 10; i++) {
                manager.append(scope.laneId(), LaneMessage.user("r".repeat(100)));
            }

            Assertions.assertEquals(10, manager.prepare(scope.laneId(), PrepareOptions.forModel(null)).size());
            Assertions.assertFalse(Files.exists(store.laneFile(scope.laneId())));
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void persistedLaneReloadsInNewManager() throws Exception {
        Path root = TempDirs.create("lanes-reload");
        try {
            FileContextStore store = new FileContextStore(root);
            ContextLaneManager first = manager(ContextSettings.defaults(), store, null);
            first.append(LANE, LaneMessage.user("hello"), new AppendMeta("llama3", 2, LaneRole.BUILDER, null));
            first.append(LANE, LaneMessage.assistant("hi there"), AppendMeta.model("llama3"));

            ContextLaneManager second = manager(ContextSettings.defaults(), store, null);
            ContextLane lane = second.getLane(LaneScope.forTask("job-42", "task-7", LaneRole.BUILDER));
            Assertions.assertEquals(List.of("hello", "hi there"), lane.messages().stream().map(LaneMessage::content).toList());
            Assertions.assertEquals("llama3", lane.messages().get(0).model());
            Assertions.assertEquals(2, lane.messages().get(0).tokens());
            Assertions.assertNotNull(lane.messages().get(1).ts());
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void redactsBeforeStoring() throws Exception {
        Path root = TempDirs.create("lanes-redact");
        try {
            FileContextStore store = new FileContextStore(root);
            ContextLaneManager manager = new ContextLaneManager(ContextSettings.defaults(), store, null,
                    new PatternRedactor(List.of("sk-[a-z0-9]{8,}")));
            ContextLane lane = manager.append(LANE, LaneMessage.user("use sk-abcd1234efgh for the call"));

            Assertions.assertEquals("use <redacted> for the call", store.loadLane(LANE).get(0).content());
            Assertions.assertEquals(1, lane.redactionCount());
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void workspaceLanesKeepOrdinaryCodeUntouched() throws Exception {
        Path root = TempDirs.create("lanes-workspace");
        try {
            McodaConfig config = McodaConfig.fromRoot(root.toString(), "ws-lanes");
            String code = "int maxTokens = 4096; class AbstractHttp2ServerConnectionFactoryBean {}";
            ContextLaneManager manager = ContextLaneManager.forWorkspace(config, ContextSettings.defaults(), null);
            ContextLane lane = manager.append(LANE, LaneMessage.user(code));

            Assertions.assertEquals(0, lane.redactionCount());
            Assertions.assertEquals(code, new FileContextStore(config.contextDir("context")).loadLane(LANE).get(0).content());

            ContextLaneManager strict = ContextLaneManager.forWorkspace(config,
                    ContextSettings.defaults().withRedactHeuristics(true), null);
            ContextLane redacted = strict.append("job-42:task-8:builder", LaneMessage.user("DB_PASSWORD=s3cret"));
            Assertions.assertEquals("DB_PASSWORD=<redacted>", redacted.messages().get(0).content());
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void limitsTreatZeroAsKeepNothingAndNegativeAsUnbounded() {
        List<LaneMessage> messages = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            messages.add(LaneMessage.user("0123456789"));
        }
        Assertions.assertEquals(4, ContextLaneManager.applyLimits(messages, -1, -1).size());
        Assertions.assertEquals(0, ContextLaneManager.applyLimits(messages, 0, -1).size());
        Assertions.assertEquals(0, ContextLaneManager.applyLimits(messages, -1, 0).size());
        Assertions.assertEquals(2, ContextLaneManager.applyLimits(messages, -1, 25).size());
        Assertions.assertEquals(1, ContextLaneManager.applyLimits(messages, 1, 1000).size());
        Assertions.assertEquals(0, ContextLaneManager.applyLimits(messages, -1, 5).size());
    }

    @Test
    void laneIdsFallBackToRunAndAdHoc() {
        Assertions.assertEquals(LANE, LaneScope.forTask("job-42", "task-7", LaneRole.BUILDER).laneId());
        Assertions.assertEquals("run-1:T-1:custom", new LaneScope(null, "run-1", " ", "T-1", null, false).laneId());
        Assertions.assertEquals("run:ad-hoc:librarian", new LaneScope(null, null, null, null, LaneRole.LIBRARIAN, false).laneId());
    }

    private static ContextSettings tightBudget() {
        return ContextSettings.defaults().withTokenLimits(Map.of(), 100);
    }

    private static ContextLaneManager manager(ContextSettings settings, ContextStore store, Summarizer summarizer) {
        return new ContextLaneManager(settings, store, summarizer, ContentRedactor.none());
    }
}
