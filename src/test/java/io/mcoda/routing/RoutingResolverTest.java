package io.mcoda.routing;

import io.mcoda.config.McodaConfig;
import io.mcoda.storage.AgentStore;
import io.mcoda.storage.Database;
import io.mcoda.testing.TempDirs;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

final class RoutingResolverTest {
    private static final String WS = "ws-routing";
    private static final String GLOBAL = McodaConfig.GLOBAL_WORKSPACE_ID;

    @Test
    void skipsGlobalBindingWithoutCapabilityAndUsesWorkspaceDefault() throws Exception {
        Path root = TempDirs.create("routing-capability");
        try {
            AgentStore agents = open(root);
            agents.saveAgent(agent("a", "plain", List.of("code_write"), HealthStatus.HEALTHY));
            agents.saveAgent(agent("b", "qa-bot", List.of("qa_interpretation"), HealthStatus.HEALTHY));
            agents.applyRoutingDefaults(GLOBAL, Map.of("qa-tasks", "a"), List.of(), null, null);
            agents.applyRoutingDefaults(WS, Map.of("default", "b"), List.of(), null, null);

            ResolvedAgent resolved = resolver(agents).resolveAgentForCommand(ResolveRequest.of(WS, "qa-tasks"));

            Assertions.assertEquals("b", resolved.agent().id());
            Assertions.assertEquals(RoutingSource.WORKSPACE_DEFAULT, resolved.source());
            Assertions.assertEquals(List.of("qa_interpretation"), resolved.requiredCapabilities());
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void deficientOverrideFallsBackToWorkspaceDefault() throws Exception {
        Path root = TempDirs.create("routing-override");
        try {
            AgentStore agents = open(root);
            agents.saveAgent(agent("o", "reviewer", List.of("code_review"), HealthStatus.HEALTHY));
            agents.saveAgent(agent("w", "writer", List.of("code_write"), HealthStatus.HEALTHY));
            agents.applyRoutingDefaults(WS, Map.of("work-on-tasks", "w"), List.of(), null, null);

            ResolvedAgent resolved = resolver(agents).resolveAgentForCommand(
                    ResolveRequest.of(WS, "work-on-tasks").withOverride("reviewer"));

            Assertions.assertEquals("writer", resolved.agentSlug());
            Assertions.assertEquals(RoutingSource.WORKSPACE_DEFAULT, resolved.source());
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void capableOverrideWinsEvenWhenUnreachable() throws Exception {
        Path root = TempDirs.create("routing-override-ok");
        try {
            AgentStore agents = open(root);
            agents.saveAgent(agent("o", "local-llm", List.of("code_write"), HealthStatus.UNREACHABLE));
            agents.saveAgent(agent("w", "writer", List.of("code_write"), HealthStatus.HEALTHY));
            agents.applyRoutingDefaults(WS, Map.of("work-on-tasks", "w"), List.of(), null, null);

            ResolvedAgent resolved = resolver(agents).resolveAgentForCommand(
                    ResolveRequest.of(WS, "work_on_tasks").withOverride("local-llm"));

            Assertions.assertEquals("local-llm", resolved.agentSlug());
            Assertions.assertEquals(RoutingSource.OVERRIDE, resolved.source());
            Assertions.assertEquals("work-on-tasks", resolved.commandName());
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void unknownOverrideIsAnError() throws Exception {
        Path root = TempDirs.create("routing-override-unknown");
        try {
            AgentStore agents = open(root);
            Assertions.assertThrows(RoutingException.class, () -> resolver(agents).resolveAgentForCommand(
                    ResolveRequest.of(WS, "work-on-tasks").withOverride("ghost")));
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void unreachableAgentsAreSkippedDownToGlobalDefault() throws Exception {
        Path root = TempDirs.create("routing-health");
        try {
            AgentStore agents = open(root);
            agents.saveAgent(agent("c", "down", List.of("code_review"), HealthStatus.UNREACHABLE));
            agents.saveAgent(agent("d", "degraded", List.of("code_review", "code_write"), HealthStatus.DEGRADED));
            agents.applyRoutingDefaults(WS, Map.of("code-review", "c"), List.of(), null, null);
            agents.applyRoutingDefaults(GLOBAL, Map.of("default", "d"), List.of(), null, "code");

            ResolvedAgent resolved = resolver(agents).resolveAgentForCommand(ResolveRequest.of(WS, "code review"));

            Assertions.assertEquals("d", resolved.agent().id());
            Assertions.assertEquals(RoutingSource.GLOBAL_DEFAULT, resolved.source());
            Assertions.assertEquals(HealthStatus.DEGRADED, resolved.healthStatus());
            Assertions.assertEquals("code", resolved.docdexScope());
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void reportsMissingCapabilityBeforeUnreachable() throws Exception {
        Path root = TempDirs.create("routing-errors");
        try {
            AgentStore agents = open(root);
            agents.saveAgent(agent("c", "down", List.of("plan"), HealthStatus.UNREACHABLE));
            agents.saveAgent(agent("p", "plain", List.of("code_write"), HealthStatus.HEALTHY));
            agents.applyRoutingDefaults(WS, Map.of("create-tasks", "c", "default", "p"), List.of(), null, null);
            RoutingResolver resolver = resolver(agents);

            MissingCapabilityException missing = Assertions.assertThrows(MissingCapabilityException.class,
                    () -> resolver.resolveAgentForCommand(ResolveRequest.of(WS, "create-tasks")));
            Assertions.assertEquals(List.of("plan"), missing.missingCapabilities());

            agents.applyRoutingDefaults(WS, Map.of(), List.of("default"), null, null);
            AgentUnreachableException unreachable = Assertions.assertThrows(AgentUnreachableException.class,
                    () -> resolver.resolveAgentForCommand(ResolveRequest.of(WS, "create-tasks")));
            Assertions.assertEquals(List.of("down"), unreachable.agents());
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void noBindingsAnywhereIsNoRoutingDefaults() throws Exception {
        Path root = TempDirs.create("routing-empty");
        try {
            AgentStore agents = open(root);
            Assertions.assertThrows(NoRoutingDefaultsException.class,
                    () -> resolver(agents).resolveAgentForCommand(ResolveRequest.of(WS, "work-on-tasks")));
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void qaTaskTypeAddsInterpretationRequirement() throws Exception {
        Path root = TempDirs.create("routing-task-type");
        try {
            AgentStore agents = open(root);
            agents.saveAgent(agent("w", "writer", List.of("code_write"), HealthStatus.HEALTHY));
            agents.saveAgent(agent("q", "writer-qa", List.of("code_write", "qa_interpretation"), HealthStatus.HEALTHY));
            agents.applyRoutingDefaults(WS, Map.of("work-on-tasks", "w", "default", "q"), List.of(), null, null);
            RoutingResolver resolver = resolver(agents);

            Assertions.assertEquals("w", resolver.resolveAgentForCommand(ResolveRequest.of(WS, "work-on-tasks")).agent().id());
            ResolvedAgent qa = resolver.resolveAgentForCommand(ResolveRequest.of(WS, "work-on-tasks").withTaskType("QA-followup"));
            Assertions.assertEquals("q", qa.agent().id());
            Assertions.assertEquals(List.of("code_write", "qa_interpretation"), qa.requiredCapabilities());
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void previewListsChainWithoutFiltering() throws Exception {
        Path root = TempDirs.create("routing-preview");
        try {
            AgentStore agents = open(root);
            agents.saveAgent(agent("a", "plain", List.of("code_write"), HealthStatus.UNREACHABLE));
            agents.saveAgent(agent("b", "qa-bot", List.of("qa_interpretation"), HealthStatus.HEALTHY));
            agents.applyRoutingDefaults(WS, Map.of("qa-tasks", "a"), List.of(), null, null);
            agents.applyRoutingDefaults(GLOBAL, Map.of("default", "b"), List.of(), null, null);

            RoutingPreview preview = resolver(agents).preview(ResolveRequest.of(WS, "qa_tasks"));

            Assertions.assertEquals("qa-tasks", preview.commandName());
            Assertions.assertEquals(List.of(RoutingSource.WORKSPACE_DEFAULT, RoutingSource.GLOBAL_DEFAULT),
                    preview.candidates().stream().map(RoutingCandidate::source).toList());
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void updateValidatesEveryBindingBeforeWriting() throws Exception {
        Path root = TempDirs.create("routing-update");
        try {
            AgentStore agents = open(root);
            agents.saveAgent(agent("w", "writer", List.of("code_write"), HealthStatus.HEALTHY));
            agents.saveAgent(agent("r", "reviewer", List.of("code_review"), HealthStatus.HEALTHY));
            RoutingResolver resolver = resolver(agents);

            List<RoutingDefault> written = resolver.updateWorkspaceDefaults(WS,
                    new RoutingDefaultsUpdate(Map.of("work_on_tasks", "writer"), List.of(), "Unit", null));
            Assertions.assertEquals(1, written.size());
            Assertions.assertEquals("work-on-tasks", written.get(0).commandName());
            Assertions.assertEquals("w", written.get(0).agentId());
            Assertions.assertEquals("unit", written.get(0).qaProfile());

            Assertions.assertThrows(MissingCapabilityException.class, () -> resolver.updateWorkspaceDefaults(WS,
                    new RoutingDefaultsUpdate(Map.of("code-review", "reviewer", "create-tasks", "writer"),
                            List.of("work-on-tasks"), null, null)));
            Assertions.assertThrows(UnknownProfileException.class, () -> resolver.updateWorkspaceDefaults(WS,
                    new RoutingDefaultsUpdate(Map.of("code-review", "reviewer"), List.of(), "chaos", null)));
            RoutingException unknown = Assertions.assertThrows(RoutingException.class,
                    () -> resolver.updateWorkspaceDefaults(WS, RoutingDefaultsUpdate.bind("code review", "ghost")));
            Assertions.assertEquals("Unknown agent ghost for command code-review", unknown.getMessage());

            List<RoutingDefault> after = resolver.getWorkspaceDefaults(WS);
            Assertions.assertEquals(1, after.size());
            Assertions.assertEquals("work-on-tasks", after.get(0).commandName());
            Assertions.assertTrue(resolver.getGlobalDefaults().isEmpty());
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void updateMessageNamesAgentAndCommand() throws Exception {
        Path root = TempDirs.create("routing-update-msg");
        try {
            AgentStore agents = open(root);
            agents.saveAgent(agent("w", "writer", List.of("code_write"), HealthStatus.HEALTHY));
            MissingCapabilityException e = Assertions.assertThrows(MissingCapabilityException.class,
                    () -> resolver(agents).updateWorkspaceDefaults(WS, RoutingDefaultsUpdate.bind("qa-tasks", "writer")));
            Assertions.assertEquals("Agent writer missing required capabilities for qa-tasks: qa_interpretation",
                    e.getMessage());
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    private static RoutingResolver resolver(AgentStore agents) {
        return new RoutingResolver(new LocalRoutingBackend(agents));
    }

    private static Agent agent(String id, String slug, List<String> capabilities, HealthStatus status) {
        return new Agent(id, slug, "openai-api", "gpt-4o", capabilities,
                new AgentHealth(status, 25L, Instant.parse("2025-03-01T00:00:00Z"), null), null, null);
    }

    private static AgentStore open(Path root) {
        Database database = new Database(McodaConfig.fromRoot(root.toString(), WS));
        database.init();
        return new AgentStore(database);
    }
}
