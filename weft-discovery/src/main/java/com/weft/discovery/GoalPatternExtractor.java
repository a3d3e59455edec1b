package com.weft.discovery;

import com.weft.plugin.PluginDescriptor;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives the natural-language summary and goal-pattern fragments for a plugin descriptor.
 * Fragments come from a fixed verb vocabulary matched as {@code <verb> <word>} plus keyword-triggered
 * goal lists. Stateless and thread-safe.
 */
public final class GoalPatternExtractor {

    static final List<String> GOAL_VERBS = List.of(
            "analyze", "optimize", "generate", "test", "debug", "monitor",
            "manage", "create", "process", "validate", "transform");

    private static final Pattern VERB_PATTERN = Pattern.compile(
            "\\b(" + String.join("|", GOAL_VERBS) + ")\\s+(\\w+)");

    private static final Map<String, List<String>> KEYWORD_GOALS = new LinkedHashMap<>();

    static {
        KEYWORD_GOALS.put("performance", List.of("analyze performance", "optimize performance", "monitor performance"));
        KEYWORD_GOALS.put("test", List.of("run tests", "generate tests", "validate code"));
        KEYWORD_GOALS.put("debug", List.of("debug code", "find errors", "troubleshoot"));
        KEYWORD_GOALS.put("code", List.of("generate code", "refactor code", "analyze code"));
        KEYWORD_GOALS.put("data", List.of("process data", "analyze data", "transform data"));
        KEYWORD_GOALS.put("file", List.of("manage files", "process files", "organize files"));
    }

    /**
     * Summary text: {@code "This is a <category> plugin. that <description>. It can <capabilities>."}
     * with empty parts left out.
     */
    public String summarize(PluginDescriptor descriptor) {
        List<String> parts = new ArrayList<>(3);
        if (!descriptor.getCategory().isEmpty()) {
            parts.add("This is a " + descriptor.getCategory() + " plugin");
        }
        if (!descriptor.getDescription().isEmpty()) {
            parts.add("that " + descriptor.getDescription().toLowerCase(Locale.ROOT));
        }
        if (!descriptor.getCapabilities().isEmpty()) {
            parts.add("It can " + String.join(", ", descriptor.getCapabilities()));
        }
        if (parts.isEmpty()) {
            return "Plugin " + descriptor.getIdentity() + " provides extended functionality.";
        }
        return String.join(". ", parts) + ".";
    }

    /**
     * Goal fragments for the descriptor, derived from description, summary, tags and capabilities.
     * Insertion-ordered and free of duplicates.
     */
    public List<String> extractGoals(PluginDescriptor descriptor, String summary) {
        StringBuilder text = new StringBuilder(descriptor.getDescription()).append(' ').append(summary);
        for (String tag : descriptor.getTags()) {
            text.append(' ').append(tag);
        }
        for (String capability : descriptor.getCapabilities()) {
            text.append(' ').append(capability);
        }
        return extractGoals(text.toString());
    }

    /** Goal fragments found in free text. */
    public List<String> extractGoals(String text) {
        String lower = text != null ? text.toLowerCase(Locale.ROOT) : "";
        Set<String> goals = new LinkedHashSet<>();
        Matcher m = VERB_PATTERN.matcher(lower);
        while (m.find()) {
            goals.add(m.group(1) + " " + m.group(2));
        }
        for (Map.Entry<String, List<String>> e : KEYWORD_GOALS.entrySet()) {
            if (lower.contains(e.getKey())) {
                goals.addAll(e.getValue());
            }
        }
        return new ArrayList<>(goals);
    }

    /** Relevance of a fragment: {@code min(1, words / 3)}. */
    public static double relevance(String goalPattern) {
        String t = goalPattern.trim();
        if (t.isEmpty()) return 0.0;
        int words = t.split("\\s+").length;
        return Math.min(1.0, words / 3.0);
    }

    /** Goal index entries for the fragments of one plugin. */
    public List<GoalIndexEntry> toEntries(String pluginId, List<String> goals) {
        List<GoalIndexEntry> out = new ArrayList<>(goals.size());
        for (String g : goals) {
            out.add(new GoalIndexEntry(g, pluginId, relevance(g)));
        }
        return out;
    }

    /** SHA-256 (hex) over the text that determines matching; unchanged hash means re-index is a no-op. */
    public static String contentHash(PluginDescriptor descriptor, List<String> goals) {
        StringBuilder sb = new StringBuilder();
        sb.append(descriptor.getDescription()).append('\u0000')
                .append(descriptor.getCategory()).append('\u0000')
                .append(descriptor.getCapabilities()).append('\u0000')
                .append(descriptor.getTags()).append('\u0000')
                .append(goals);
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] digest = md.digest(sb.toString().getBytes(StandardCharsets.UTF_8));
            StringBuilder hex = new StringBuilder(digest.length * 2);
            for (byte b : digest) {
                hex.append(String.format("%02x", b));
            }
            return hex.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
