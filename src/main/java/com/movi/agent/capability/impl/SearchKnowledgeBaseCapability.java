package com.movi.agent.capability.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.movi.agent.transport.TransportRepository;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Keyword lookup over the product documentation table.
 */
@Component
public class SearchKnowledgeBaseCapability extends TransportCapability {

    private static final int MAX_SNIPPETS = 2;

    public SearchKnowledgeBaseCapability(TransportRepository repository, ObjectMapper objectMapper) {
        super(repository, objectMapper);
    }

    @Override
    public String getName() {
        return "search_knowledge_base";
    }

    @Override
    public String getDescription() {
        return """
                Search the product documentation for help.
                Use this when the user asks 'How do I...' or generic questions about how the system works.
                """;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return objectSchema(
                Map.of("query", stringProperty("Keywords to look for in the documentation")),
                List.of("query"));
    }

    @Override
    public String execute(Map<String, Object> arguments) {
        String query = stringArg(arguments, "query");
        if (query == null) {
            return "ERROR: 'query' is required";
        }
        List<String> snippets = repository.searchDocuments(query, MAX_SNIPPETS);
        if (snippets.isEmpty()) {
            return "No specific documentation found.";
        }
        return String.join("\n\n", snippets);
    }
}
