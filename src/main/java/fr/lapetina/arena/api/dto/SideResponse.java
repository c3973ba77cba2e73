package fr.lapetina.arena.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.arena.domain.model.SideResult;

/**
 * One anonymized side of a round.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SideResponse {

    private boolean success;
    private String text;

    @JsonProperty("error_type")
    private String errorType;

    @JsonProperty("error")
    private String errorMessage;

    @JsonProperty("latency_ms")
    private long latencyMs;

    @JsonProperty("token_count")
    private int tokenCount;

    private int attempts;

    public static SideResponse from(SideResult result) {
        if (result == null) {
            return null;
        }
        SideResponse response = new SideResponse();
        response.success = result.isSuccess();
        response.text = result.text();
        response.errorType = result.errorType() != null ? result.errorType().name() : null;
        response.errorMessage = result.errorMessage();
        response.latencyMs = result.latency().toMillis();
        response.tokenCount = result.tokenCount();
        response.attempts = result.attempts();
        return response;
    }

    public boolean isSuccess() { return success; }
    public void setSuccess(boolean success) { this.success = success; }

    public String getText() { return text; }
    public void setText(String text) { this.text = text; }

    public String getErrorType() { return errorType; }
    public void setErrorType(String errorType) { this.errorType = errorType; }

    public String getErrorMessage() { return errorMessage; }
    public void setErrorMessage(String errorMessage) { this.errorMessage = errorMessage; }

    public long getLatencyMs() { return latencyMs; }
    public void setLatencyMs(long latencyMs) { this.latencyMs = latencyMs; }

    public int getTokenCount() { return tokenCount; }
    public void setTokenCount(int tokenCount) { this.tokenCount = tokenCount; }

    public int getAttempts() { return attempts; }
    public void setAttempts(int attempts) { this.attempts = attempts; }
}
