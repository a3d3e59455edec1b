package com.weft.discovery.store;

import com.weft.discovery.IndexedPlugin;

import java.util.Locale;

/** Matching rules shared by the stores and the index. */
public final class GoalMatcher {

    private GoalMatcher() {
    }

    /**
     * Direct-match rule: the fragment contains the goal, the goal contains the fragment, or the
     * fragment contains the goal's first token.
     */
    public static boolean matches(String fragment, String goal, String firstToken) {
        if (fragment == null || fragment.isEmpty() || goal == null || goal.isEmpty()) return false;
        if (fragment.contains(goal) || goal.contains(fragment)) return true;
        return firstToken != null && !firstToken.isEmpty() && fragment.contains(firstToken);
    }

    /** Keyword rule for fuzzy search over plugin text. */
    public static boolean mentions(IndexedPlugin plugin, String keyword) {
        String k = keyword.toLowerCase(Locale.ROOT);
        if (plugin.getDescription().toLowerCase(Locale.ROOT).contains(k)) return true;
        if (plugin.getSummary().toLowerCase(Locale.ROOT).contains(k)) return true;
        for (String tag : plugin.getTags()) {
            if (tag.toLowerCase(Locale.ROOT).contains(k)) return true;
        }
        for (String capability : plugin.getCapabilities()) {
            if (capability.toLowerCase(Locale.ROOT).contains(k)) return true;
        }
        return false;
    }
}
