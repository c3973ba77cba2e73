package fr.lapetina.arena.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.arena.round.RoundView;

/**
 * JSON view of a session's current round. Model ids appear only after the vote.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RoundResponse {

    @JsonProperty("session_id")
    private String sessionId;

    private long sequence;
    private String state;

    @JsonProperty("round_id")
    private String roundId;

    private String prompt;

    @JsonProperty("side_a")
    private SideResponse sideA;

    @JsonProperty("side_b")
    private SideResponse sideB;

    private String vote;

    @JsonProperty("model_a")
    private String modelA;

    @JsonProperty("model_b")
    private String modelB;

    public static RoundResponse from(RoundView view) {
        RoundResponse response = new RoundResponse();
        response.sessionId = view.sessionId();
        response.sequence = view.sequence();
        response.state = view.state().name();
        response.roundId = view.roundId();
        response.prompt = view.prompt();
        response.sideA = SideResponse.from(view.sideA());
        response.sideB = SideResponse.from(view.sideB());
        response.vote = view.vote() != null ? view.vote().label() : null;
        response.modelA = view.revealedModelA();
        response.modelB = view.revealedModelB();
        return response;
    }

    public String getSessionId() { return sessionId; }
    public void setSessionId(String sessionId) { this.sessionId = sessionId; }

    public long getSequence() { return sequence; }
    public void setSequence(long sequence) { this.sequence = sequence; }

    public String getState() { return state; }
    public void setState(String state) { this.state = state; }

    public String getRoundId() { return roundId; }
    public void setRoundId(String roundId) { this.roundId = roundId; }

    public String getPrompt() { return prompt; }
    public void setPrompt(String prompt) { this.prompt = prompt; }

    public SideResponse getSideA() { return sideA; }
    public void setSideA(SideResponse sideA) { this.sideA = sideA; }

    public SideResponse getSideB() { return sideB; }
    public void setSideB(SideResponse sideB) { this.sideB = sideB; }

    public String getVote() { return vote; }
    public void setVote(String vote) { this.vote = vote; }

    public String getModelA() { return modelA; }
    public void setModelA(String modelA) { this.modelA = modelA; }

    public String getModelB() { return modelB; }
    public void setModelB(String modelB) { this.modelB = modelB; }
}
