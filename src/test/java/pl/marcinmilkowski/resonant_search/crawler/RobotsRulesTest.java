package pl.marcinmilkowski.resonant_search.crawler;

import org.junit.jupiter.api.*;

import static org.junit.jupiter.api.Assertions.*;

class RobotsRulesTest {

    private static final String AGENT = "ResonantSearchBot/1.0";

    @Test
    @DisplayName("Disallow all blocks every path")
    void testDisallowAll() {
        RobotsRules rules = RobotsRules.parse("User-agent: *\nDisallow: /\n", AGENT);
        assertFalse(rules.isAllowed("/"));
        assertFalse(rules.isAllowed("/any/page?x=1"));
        assertFalse(rules.isAllowAll());
    }

    @Test
    @DisplayName("Longest match wins and Allow wins ties")
    void testLongestMatch() {
        String robots = String.join("\n",
            "User-agent: *",
            "Disallow: /private/",
            "Allow: /private/public/",
            "Disallow: /tmp",
            "Allow: /tmp");
        RobotsRules rules = RobotsRules.parse(robots, AGENT);
        assertTrue(rules.isAllowed("/index.html"));
        assertFalse(rules.isAllowed("/private/secret.html"));
        assertTrue(rules.isAllowed("/private/public/page.html"));
        assertTrue(rules.isAllowed("/tmp/file"));
    }

    @Test
    @DisplayName("A group for this agent overrides the wildcard group")
    void testAgentSpecificGroup() {
        String robots = String.join("\n",
            "User-agent: *",
            "Disallow: /",
            "",
            "User-agent: resonantsearchbot",
            "Disallow: /admin");
        RobotsRules rules = RobotsRules.parse(robots, AGENT);
        assertTrue(rules.isAllowed("/docs"));
        assertFalse(rules.isAllowed("/admin/panel"));

        RobotsRules other = RobotsRules.parse(robots, "OtherBot/2.0");
        assertFalse(other.isAllowed("/docs"));
    }

    @Test
    @DisplayName("Comments, empty Disallow and wildcards are handled")
    void testSyntax() {
        String robots = String.join("\n",
            "# comment line",
            "User-agent: *   # all bots",
            "Disallow:",
            "Disallow: /search*",
            "Disallow: /exact$",
            "Sitemap: http://example.com/sitemap.xml");
        RobotsRules rules = RobotsRules.parse(robots, AGENT);
        assertTrue(rules.isAllowed("/"));
        assertFalse(rules.isAllowed("/search?q=x"));
        assertFalse(rules.isAllowed("/exact"));
        assertTrue(rules.isAllowed("/exact/more"));
    }

    @Test
    @DisplayName("Empty content allows everything")
    void testEmpty() {
        assertTrue(RobotsRules.parse("", AGENT).isAllowAll());
        assertTrue(RobotsRules.parse(null, AGENT).isAllowed("/x"));
        assertTrue(RobotsRules.allowAll().isAllowed("/x"));
    }
}
