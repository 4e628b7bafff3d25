package com.tidewatch.heartbeat;

import com.tidewatch.heartbeat.check.CheckResult;
import com.tidewatch.heartbeat.check.InboundMessage;
import com.tidewatch.heartbeat.check.InfrastructureCheck;
import com.tidewatch.heartbeat.check.MessageSourceCheck;

import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Turns check results into the short multi-line summary a person (or the
 * woken agent) reads first.
 */
public final class BriefingAssembler {

    static final int MAX_PRIORITY_SHOWN = 5;
    static final int PREVIEW_LENGTH = 120;
    private static final String WARN = "⚠";
    private static final DateTimeFormatter HH_MM = DateTimeFormatter.ofPattern("HH:mm");

    private BriefingAssembler() {
    }

    public record Briefing(String text, boolean urgent) {
    }

    public static Briefing assemble(List<CheckResult> checks, Tier tier, long beatNumber, LocalTime time) {
        List<String> lines = new ArrayList<>();
        Set<String> warned = new HashSet<>();
        boolean urgent = false;

        lines.add("Heartbeat #" + beatNumber + " [" + tier.label() + "] - " + time.format(HH_MM));
        lines.add("");

        // ── Messages ──
        Optional<CheckResult> messageCheck = find(checks, MessageSourceCheck.NAME);
        List<InboundMessage> messages = messageCheck
                .map(c -> c.dataList(MessageSourceCheck.DATA_MESSAGES, InboundMessage.class))
                .orElse(List.of());
        if (!messages.isEmpty()) {
            List<InboundMessage> priority = messageCheck.get()
                    .dataList(MessageSourceCheck.DATA_PRIORITY, InboundMessage.class);
            if (!priority.isEmpty()) {
                urgent = true;
                lines.add(priority.size() + " priority message" + (priority.size() > 1 ? "s" : "") + ":");
                for (InboundMessage msg : priority.subList(0, Math.min(MAX_PRIORITY_SHOWN, priority.size()))) {
                    lines.add("   [" + msg.source() + "] " + msg.sender() + ": " + preview(msg.content()));
                }
                lines.add("");
            }
            long others = messages.stream().filter(m -> !priority.contains(m)).count();
            if (others > 0) {
                lines.add(others + " other message" + (others > 1 ? "s" : ""));
            }
        } else if (messageCheck.isPresent() && !messageCheck.get().ok()) {
            urgent = true;
            warned.add(MessageSourceCheck.NAME);
            lines.add(WARN + " " + MessageSourceCheck.NAME + ": " + messageCheck.get().message());
        }

        // ── Infrastructure ──
        Optional<CheckResult> infra = find(checks, InfrastructureCheck.NAME);
        if (infra.isPresent() && !infra.get().ok()) {
            urgent = true;
            warned.add(InfrastructureCheck.NAME);
            lines.add(WARN + " " + InfrastructureCheck.NAME + ": " + infra.get().message());
        } else if (infra.isPresent()) {
            lines.add(infra.get().message());
        }

        // ── Failures without a line of their own ──
        List<String> failed = checks.stream()
                .filter(c -> !c.ok() && !warned.contains(c.name()))
                .map(CheckResult::name)
                .toList();
        if (!failed.isEmpty()) {
            urgent = true;
            lines.add(WARN + " Failed: " + String.join(", ", failed));
        }

        return new Briefing(String.join("\n", lines), urgent);
    }

    private static Optional<CheckResult> find(List<CheckResult> checks, String name) {
        return checks.stream().filter(c -> c.name().equals(name)).findFirst();
    }

    private static String preview(String content) {
        return content.length() > PREVIEW_LENGTH ? content.substring(0, PREVIEW_LENGTH) + "…" : content;
    }
}
