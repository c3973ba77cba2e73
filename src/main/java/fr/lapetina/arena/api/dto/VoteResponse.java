package fr.lapetina.arena.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.arena.round.RoundView;
import fr.lapetina.arena.round.VoteOutcome;

/**
 * Result of a vote call, with the revealed identities once the round is voted.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class VoteResponse {

    private String status;
    private String choice;
    private String reason;

    @JsonProperty("round_id")
    private String roundId;

    @JsonProperty("model_a")
    private String modelA;

    @JsonProperty("model_b")
    private String modelB;

    public static VoteResponse from(VoteOutcome outcome, RoundView view) {
        VoteResponse response = new VoteResponse();
        response.status = outcome.status().name();
        response.choice = outcome.choice() != null ? outcome.choice().label() : null;
        response.reason = outcome.reason();
        response.roundId = view.roundId();
        response.modelA = view.revealedModelA();
        response.modelB = view.revealedModelB();
        return response;
    }

    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }

    public String getChoice() { return choice; }
    public void setChoice(String choice) { this.choice = choice; }

    public String getReason() { return reason; }
    public void setReason(String reason) { this.reason = reason; }

    public String getRoundId() { return roundId; }
    public void setRoundId(String roundId) { this.roundId = roundId; }

    public String getModelA() { return modelA; }
    public void setModelA(String modelA) { this.modelA = modelA; }

    public String getModelB() { return modelB; }
    public void setModelB(String modelB) { this.modelB = modelB; }
}
