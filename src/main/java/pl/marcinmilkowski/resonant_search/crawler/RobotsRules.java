package pl.marcinmilkowski.resonant_search.crawler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Parsed robots.txt rules for one agent.
 *
 * <p>Rules from groups naming this agent win over the {@code *} group. A path is
 * allowed unless the longest matching rule is a Disallow; on equal length Allow
 * wins. A trailing {@code *} is ignored and a trailing {@code $} anchors the rule
 * to the end of the path. An empty Disallow allows everything.</p>
 */
public final class RobotsRules {

    private static final String USER_AGENT = "user-agent:";
    private static final String DISALLOW = "disallow:";
    private static final String ALLOW = "allow:";

    private static final RobotsRules ALLOW_ALL = new RobotsRules(List.of());

    private record Rule(String path, boolean allow, boolean anchored) {

        boolean matches(String target) {
            return anchored ? target.equals(path) : target.startsWith(path);
        }
    }

    private final List<Rule> rules;

    private RobotsRules(List<Rule> rules) {
        this.rules = rules;
    }

    public static RobotsRules allowAll() {
        return ALLOW_ALL;
    }

    /**
     * Parse robots.txt content for the given User-Agent string. The product token
     * (text before the first '/') is matched case-insensitively.
     */
    public static RobotsRules parse(String content, String userAgent) {
        if (content == null || content.isBlank()) {
            return ALLOW_ALL;
        }
        String agentToken = productToken(userAgent);

        List<Rule> forAll = new ArrayList<>();
        List<Rule> forThisAgent = new ArrayList<>();
        boolean groupForAll = false;
        boolean groupForThis = false;
        boolean inRules = false;   // a rule line closes the run of User-agent lines
        boolean thisAgentFound = false;

        for (String rawLine : content.split("\\r?\\n|\\r")) {
            String line = stripComment(rawLine).replace('\t', ' ').trim();
            if (line.isEmpty()) continue;
            String lower = line.toLowerCase(Locale.ROOT);

            if (lower.startsWith(USER_AGENT)) {
                if (inRules) {
                    groupForAll = false;
                    groupForThis = false;
                    inRules = false;
                }
                String agent = line.substring(USER_AGENT.length()).trim().toLowerCase(Locale.ROOT);
                if (agent.equals("*")) {
                    groupForAll = true;
                } else if (!agent.isEmpty() && agentToken.startsWith(agent)) {
                    groupForThis = true;
                    thisAgentFound = true;
                }
                continue;
            }

            boolean isDisallow = lower.startsWith(DISALLOW);
            boolean isAllow = lower.startsWith(ALLOW);
            if (!isDisallow && !isAllow) {
                // Sitemap, Crawl-delay and unknown fields do not end a group
                continue;
            }
            inRules = true;
            String path = line.substring(isDisallow ? DISALLOW.length() : ALLOW.length()).trim();
            if (path.isEmpty()) {
                continue;
            }
            Rule rule = toRule(path, isAllow);
            if (groupForAll) forAll.add(rule);
            if (groupForThis) forThisAgent.add(rule);
        }

        List<Rule> effective = thisAgentFound ? forThisAgent : forAll;
        return effective.isEmpty() ? ALLOW_ALL : new RobotsRules(Collections.unmodifiableList(effective));
    }

    /**
     * @param pathAndQuery request path, optionally with "?query"
     */
    public boolean isAllowed(String pathAndQuery) {
        String target = pathAndQuery == null || pathAndQuery.isEmpty() ? "/" : pathAndQuery;
        Rule best = null;
        for (Rule rule : rules) {
            if (!rule.matches(target)) continue;
            if (best == null
                || rule.path().length() > best.path().length()
                || (rule.path().length() == best.path().length() && rule.allow())) {
                best = rule;
            }
        }
        return best == null || best.allow();
    }

    public boolean isAllowAll() {
        return rules.isEmpty();
    }

    private static Rule toRule(String path, boolean allow) {
        boolean anchored = false;
        if (path.endsWith("$")) {
            anchored = true;
            path = path.substring(0, path.length() - 1);
        }
        while (path.endsWith("*")) {
            path = path.substring(0, path.length() - 1);
            anchored = false;
        }
        if (path.isEmpty()) {
            path = "/";
        }
        return new Rule(path, allow, anchored);
    }

    private static String stripComment(String line) {
        int pos = line.indexOf('#');
        return pos == -1 ? line : line.substring(0, pos);
    }

    private static String productToken(String userAgent) {
        if (userAgent == null) return "";
        String token = userAgent.trim();
        int slash = token.indexOf('/');
        if (slash != -1) token = token.substring(0, slash);
        return token.toLowerCase(Locale.ROOT);
    }
}
