package io.mcoda.context;

import io.mcoda.config.ContextSettings;
import io.mcoda.config.McodaConfig;
import io.mcoda.security.PatternRedactor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Keeps one conversation history per (job, task, role) lane and holds it within the model's
 * token budget and the configured storage limits.
 *
 * <p>Persisted lanes write through to the {@link ContextStore}. A summarization result is only
 * stored after the whole new message list has been computed, so a failing summarizer leaves the
 * stored lane as it was.
 *
 * <p>Not thread-safe; one manager serves one CLI invocation.
 */
public final class ContextLaneManager {
    private static final Logger log = LoggerFactory.getLogger(ContextLaneManager.class);
    static final int MAX_SUMMARIZE_PASSES = 5;

    private final ContextSettings settings;
    private final ContextStore store;
    private final Summarizer summarizer;
    private final ContentRedactor redactor;
    private final TokenBudget budget;
    private final Clock clock;
    private final Map<String, ContextLane> lanes = new HashMap<>();
    private final Map<String, SummarizeOutcome> lastOutcomes = new HashMap<>();

    public ContextLaneManager(ContextSettings settings, ContextStore store, Summarizer summarizer, ContentRedactor redactor) {
        this(settings, store, summarizer, redactor, Clock.systemUTC());
    }

    public ContextLaneManager(
            ContextSettings settings,
            ContextStore store,
            Summarizer summarizer,
            ContentRedactor redactor,
            Clock clock
    ) {
        this.settings = settings;
        this.store = store;
        this.summarizer = summarizer;
        this.redactor = redactor == null ? ContentRedactor.none() : redactor;
        this.budget = new TokenBudget(settings.charsPerToken());
        this.clock = clock;
    }

    public static ContextLaneManager forWorkspace(McodaConfig config, ContextSettings settings, Summarizer summarizer) {
        return new ContextLaneManager(
                settings,
                new FileContextStore(config.contextDir(settings.storageDir())),
                summarizer,
                new PatternRedactor(settings.redactPatterns(), settings.redactHeuristics())
        );
    }

    public ContextLane getLane(LaneScope scope) {
        boolean persisted = settings.enabled() && !scope.ephemeral();
        return ensureLane(scope.laneId(), scope.role(), persisted);
    }

    public Optional<ContextLane> findLane(String laneId) {
        return Optional.ofNullable(lanes.get(laneId));
    }

    public ContextLane append(String laneId, LaneMessage message) {
        return append(laneId, message, AppendMeta.none());
    }

    public ContextLane append(String laneId, LaneMessage message, AppendMeta meta) {
        AppendMeta m = meta == null ? AppendMeta.none() : meta;
        boolean persisted = m.persisted() == null ? settings.enabled() : m.persisted();
        ContextLane lane = ensureLane(laneId, m.role() == null ? LaneRole.CUSTOM : m.role(), persisted);
        if (!settings.persistToolMessages() && LaneMessage.TOOL.equals(message.role())) {
            log.debug("Dropping tool message for lane {}", laneId);
            return lane;
        }

        ContentRedactor.Redaction redaction = redactor.redact(message.content());
        Instant now = clock.instant();
        LaneMessage record = message.withContent(redaction.content()).stamped(now, m.model(), m.tokens());
        List<LaneMessage> messages = new ArrayList<>(lane.messages());
        messages.add(record);
        int redactions = lane.redactionCount() + redaction.redactions();
        ContextLane next = withMessages(lane, messages, redactions, now);
        lanes.put(laneId, next);
        if (redaction.redactions() > 0) {
            log.info("Redacted {} value(s) in lane {}", redaction.redactions(), laneId);
        }
        if (!lane.persisted()) {
            return next;
        }

        List<LaneMessage> stored = store.append(laneId, record);
        lanes.put(laneId, withMessages(next, stored, redactions, now));
        return enforceStorageLimits(laneId);
    }

    /**
     * Returns the lane history to send with the next model call, summarizing first when the
     * prompt, bundle and history together exceed the model's token limit.
     */
    public List<LaneMessage> prepare(String laneId, PrepareOptions options) {
        ContextLane lane = lanes.get(laneId);
        if (lane == null) {
            lane = ensureLane(laneId, LaneRole.CUSTOM, settings.enabled());
        }
        if (!lane.persisted()) {
            return lane.messages();
        }
        summarizeIfNeeded(laneId, options);
        return lanes.get(laneId).messages();
    }

    public SummarizeOutcome summarizeIfNeeded(String laneId, PrepareOptions options) {
        PrepareOptions opts = options == null ? new PrepareOptions(null, null, null) : options;
        ContextLane lane = lanes.get(laneId);
        int limit = settings.tokenLimitFor(opts.model());
        if (lane == null) {
            return SummarizeOutcome.unchanged(laneId, 0, 0, limit);
        }
        int total = budget.estimate(opts.systemPrompt(), opts.bundle(), lane.messages());
        if (!lane.persisted() || !settings.enabled() || summarizer == null || !settings.summarizeEnabled()) {
            return SummarizeOutcome.unchanged(laneId, lane.messages().size(), total, limit);
        }

        int tokensBefore = total;
        List<LaneMessage> messages = lane.messages();
        int passes = 0;
        while (total > limit && messages.size() > 1 && passes < MAX_SUMMARIZE_PASSES) {
            int split = Math.max(1, messages.size() / 2);
            LaneMessage summary = summarizer.summarize(messages.subList(0, split), opts.model());
            if (summary == null || summary.content().isBlank()) {
                throw new SummarizerFailureException("Summarizer returned empty content for lane " + laneId);
            }
            List<LaneMessage> next = new ArrayList<>(messages.size() - split + 1);
            next.add(summary.stamped(clock.instant(), null, null));
            next.addAll(messages.subList(split, messages.size()));
            messages = next;
            total = budget.estimate(opts.systemPrompt(), opts.bundle(), messages);
            passes++;
        }

        SummarizeOutcome outcome;
        if (passes == 0) {
            outcome = SummarizeOutcome.unchanged(laneId, lane.messages().size(), total, limit);
        } else {
            List<LaneMessage> stored = store.replace(laneId, messages);
            lanes.put(laneId, withMessages(lane, stored, lane.redactionCount(), clock.instant()));
            ContextLane limited = enforceStorageLimits(laneId);
            boolean overBudget = total > limit;
            outcome = new SummarizeOutcome(
                    laneId,
                    passes,
                    lane.messages().size(),
                    limited.messages().size(),
                    tokensBefore,
                    total,
                    limit,
                    overBudget,
                    overBudget && passes >= MAX_SUMMARIZE_PASSES
            );
            log.info("Summarized lane {} in {} pass(es): {} -> {} tokens (limit {})",
                    laneId, passes, tokensBefore, total, limit);
            if (overBudget) {
                log.warn("Lane {} still exceeds token limit {} after summarization ({} tokens)", laneId, limit, total);
            }
        }
        lastOutcomes.put(laneId, outcome);
        return outcome;
    }

    public Optional<SummarizeOutcome> lastSummarizeOutcome(String laneId) {
        return Optional.ofNullable(lastOutcomes.get(laneId));
    }

    /**
     * Trims a persisted lane to {@code maxMessages}, then to {@code maxBytesPerLane}, keeping the
     * newest messages. Writes back only when something was dropped.
     */
    public ContextLane enforceStorageLimits(String laneId) {
        ContextLane lane = lanes.get(laneId);
        if (lane == null || !lane.persisted()) {
            return lane;
        }
        List<LaneMessage> trimmed = applyLimits(lane.messages(), settings.maxMessages(), settings.maxBytesPerLane());
        if (trimmed.size() == lane.messages().size()) {
            return lane;
        }
        List<LaneMessage> stored = store.replace(laneId, trimmed);
        ContextLane next = withMessages(lane, stored, lane.redactionCount(), clock.instant());
        lanes.put(laneId, next);
        log.info("Trimmed lane {} from {} to {} messages ({} -> {} bytes)",
                laneId, lane.messages().size(), next.messages().size(), lane.byteSize(), next.byteSize());
        return next;
    }

    public void flush(String laneId) {
        ContextLane lane = lanes.get(laneId);
        if (lane == null || !lane.persisted()) {
            return;
        }
        store.replace(laneId, lane.messages());
    }

    /**
     * Negative limits are unbounded; zero keeps nothing.
     */
    static List<LaneMessage> applyLimits(List<LaneMessage> messages, int maxMessages, long maxBytes) {
        List<LaneMessage> out = messages;
        if (maxMessages >= 0 && out.size() > maxMessages) {
            out = out.subList(out.size() - maxMessages, out.size());
        }
        if (maxBytes == 0) {
            return List.of();
        }
        if (maxBytes > 0) {
            long total = 0L;
            List<LaneMessage> kept = new ArrayList<>();
            for (int i = out.size() - 1; i >= 0; i--) {
                long size = out.get(i).byteSize();
                if (total + size > maxBytes) {
                    break;
                }
                total += size;
                kept.add(out.get(i));
            }
            Collections.reverse(kept);
            out = kept;
        }
        return List.copyOf(out);
    }

    private ContextLane ensureLane(String laneId, LaneRole role, boolean persisted) {
        ContextLane existing = lanes.get(laneId);
        if (existing != null) {
            return existing;
        }
        List<LaneMessage> messages = persisted ? store.loadLane(laneId) : List.of();
        ContextLane lane = new ContextLane(
                laneId,
                role,
                messages,
                budget.estimate(messages),
                persisted,
                0,
                clock.instant()
        );
        lanes.put(laneId, lane);
        return lane;
    }

    private ContextLane withMessages(ContextLane lane, List<LaneMessage> messages, int redactions, Instant at) {
        return new ContextLane(
                lane.id(),
                lane.role(),
                messages,
                budget.estimate(messages),
                lane.persisted(),
                redactions,
                at
        );
    }
}
