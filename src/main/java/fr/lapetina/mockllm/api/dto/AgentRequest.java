package fr.lapetina.mockllm.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of the agent chat and analyze endpoints.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class AgentRequest {

    private String query;

    @JsonProperty("user_id")
    private String userId;

    @JsonProperty("mock_mode")
    private boolean mockMode;

    public AgentRequest() {
    }

    public AgentRequest(String query, String userId, boolean mockMode) {
        this.query = query;
        this.userId = userId;
        this.mockMode = mockMode;
    }

    // Getters and setters
    public String getQuery() { return query; }
    public void setQuery(String query) { this.query = query; }

    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }

    public boolean isMockMode() { return mockMode; }
    public void setMockMode(boolean mockMode) { this.mockMode = mockMode; }
}
