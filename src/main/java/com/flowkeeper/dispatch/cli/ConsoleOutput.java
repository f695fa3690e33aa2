package com.flowkeeper.dispatch.cli;

import com.flowkeeper.core.events.FlowEvent;
import picocli.CommandLine;

import java.util.Map;

/**
 * ANSI-colored terminal output utilities for the Flowkeeper CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) FLOWKEEPER v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [FLOWKEEPER]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void agent(String role, String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(blue) [" + role.toUpperCase() + "]|@ " + message));
    }

    public static void event(FlowEvent event) {
        String prefix = switch (event.eventType()) {
            case "execution.started", "execution.progress" -> "@|fg(cyan) [EXECUTION]|@";
            case "node.started", "node.completed" -> "@|fg(blue) [NODE]|@";
            case "node.failed" -> "@|fg(red) [NODE]|@";
            case "agent.started", "agent.thinking", "agent.message" -> "@|fg(magenta) [AGENT]|@";
            case "agent.tool_call.started", "agent.tool_call.completed" -> "@|fg(yellow) [TOOL]|@";
            case "agent.tool_call.failed" -> "@|fg(red) [TOOL]|@";
            case "execution.completed", "agent.completed" -> "@|fg(green),bold [COMPLETE]|@";
            case "execution.failed", "agent.failed" -> "@|fg(red),bold [FAILED]|@";
            default -> "@|fg(white) [" + event.eventType() + "]|@";
        };
        String subject = event.nodeId() != null ? event.nodeId() + " " : "";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                prefix + " " + subject + summarize(event.eventType(), event.payload())));
    }

    private static String summarize(String type, Map<String, Object> payload) {
        return switch (type) {
            case "execution.progress" -> payload.get("completedNodes") + "/" + payload.get("totalNodes")
                    + " (" + payload.get("percentage") + "%)";
            case "node.completed" -> "done in " + formatDuration(asLong(payload.get("duration")));
            case "node.failed", "execution.failed", "agent.failed", "agent.tool_call.failed" ->
                    String.valueOf(payload.get("error"));
            case "agent.tool_call.started", "agent.tool_call.completed" -> String.valueOf(payload.get("toolName"));
            default -> type;
        };
    }

    private static long asLong(Object value) {
        return value instanceof Number n ? n.longValue() : 0L;
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
