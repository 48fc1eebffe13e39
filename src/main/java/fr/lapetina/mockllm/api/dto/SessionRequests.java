package fr.lapetina.mockllm.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request bodies of the session endpoints.
 */
public final class SessionRequests {

    private SessionRequests() {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CreateSession {
        @JsonProperty("agent_id")
        private String agentId;

        public CreateSession() {
        }

        public CreateSession(String agentId) {
            this.agentId = agentId;
        }

        public String getAgentId() { return agentId; }
        public void setAgentId(String agentId) { this.agentId = agentId; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CreateEvent {
        private String kind;
        private String source;
        private String message;

        public CreateEvent() {
        }

        public CreateEvent(String kind, String source, String message) {
            this.kind = kind;
            this.source = source;
            this.message = message;
        }

        public String getKind() { return kind; }
        public void setKind(String kind) { this.kind = kind; }

        public String getSource() { return source; }
        public void setSource(String source) { this.source = source; }

        public String getMessage() { return message; }
        public void setMessage(String message) { this.message = message; }
    }
}
