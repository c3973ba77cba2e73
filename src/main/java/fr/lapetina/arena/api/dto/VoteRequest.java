package fr.lapetina.arena.api.dto;

/**
 * Body of {@code POST /v1/sessions/{id}/vote}. {@code choice} is one of A, B, Tie, BothBad.
 */
public class VoteRequest {

    private String choice;

    public String getChoice() { return choice; }
    public void setChoice(String choice) { this.choice = choice; }
}
