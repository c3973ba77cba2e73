package fr.lapetina.arena.api.dto;

/**
 * Body of {@code POST /v1/sessions/{id}/prompt}.
 */
public class PromptRequest {

    private String prompt;

    public String getPrompt() { return prompt; }
    public void setPrompt(String prompt) { this.prompt = prompt; }
}
