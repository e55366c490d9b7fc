package com.imperium.searchinsight;

import com.imperium.searchinsight.ai.orchestrator.SearchOrchestrator;
import com.imperium.searchinsight.ai.tools.WebSearchTool;
import com.imperium.searchinsight.content.ContentProcessor;
import com.imperium.searchinsight.provider.ProviderGateway;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest(properties = "app.search.primary.api-key=")
class SearchInsightApplicationTest {

    @Autowired
    private SearchOrchestrator orchestrator;

    @Autowired
    private ProviderGateway providerGateway;

    @Autowired
    private ContentProcessor contentProcessor;

    @Autowired
    private WebSearchTool webSearchTool;

    @Test
    void contextWiresSearchPipeline() {
        assertNotNull(orchestrator);
        assertNotNull(providerGateway);
        assertNotNull(webSearchTool);
        assertTrue(contentProcessor.isEnhanced());
    }
}
