package com.weft.discovery;

import com.weft.config.WeftConfig;
import com.weft.discovery.store.InMemoryDiscoveryStore;
import com.weft.plugin.PluginDescriptor;
import com.weft.plugin.PluginRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SemanticPluginDiscoveryTest {

    private SemanticPluginDiscovery discovery;

    @BeforeEach
    void setUp() {
        PluginRegistry registry = new PluginRegistry();
        for (String id : List.of("csv", "json", "xml", "yaml")) {
            registry.register(PluginDescriptor.builder(id).description("Process data from " + id).build(),
                    (command, input) -> Map.of());
        }
        discovery = new SemanticPluginDiscovery(new SemanticDiscoveryIndex(new InMemoryDiscoveryStore()), 5);
        assertEquals(4, discovery.indexRegistry(registry));
    }

    @Test
    void describeSuggestions_listsTopThreeAndCountsTheRest() {
        String text = discovery.describeSuggestions("process data");

        assertTrue(text.startsWith("I found 4 plugins that can help with 'process data':"));
        assertTrue(text.contains("1. **csv** - This is a general plugin. that process data from csv. (0.7 relevance)"));
        assertTrue(text.contains("3. **xml**"));
        assertTrue(text.endsWith("...and 1 more. Which one would you like to use?"));
    }

    @Test
    void describeSuggestions_noMatch() {
        assertEquals("I couldn't find any plugins specifically for 'xyz_unmatched_goal'. "
                + "Would you like me to search for related capabilities?", discovery.describeSuggestions("xyz_unmatched_goal"));
    }

    @Test
    void goalHistory_keepsLastTen() {
        for (int i = 0; i < 12; i++) {
            discovery.describeSuggestions("goal " + i);
        }
        List<SemanticPluginDiscovery.GoalRecord> history = discovery.getGoalHistory();
        assertEquals(10, history.size());
        assertEquals("goal 2", history.get(0).goal());
        assertEquals("goal 11", history.get(9).goal());
    }

    @Test
    void findRelevantPlugins_returnsIdentities() {
        assertEquals(List.of("csv", "json"), discovery.findRelevantPlugins("process data", 2));
    }

    @Test
    void open_createsSchemaAndIndexesThroughJdbc() {
        WeftConfig config = WeftConfig.builder()
                .dbUrl("jdbc:h2:mem:weft-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1")
                .discoveryLimit(2)
                .build();
        SemanticPluginDiscovery jdbc = SemanticPluginDiscovery.open(config);

        assertTrue(jdbc.getIndex().index(PluginDescriptor.builder("etl").description("Process data files").build()));
        assertEquals(List.of("etl"), jdbc.findRelevantPlugins("process data", 5));
    }
}
