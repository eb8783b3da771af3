package com.movi.agent.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class ChatRequest {

    @NotBlank(message = "message must not be blank")
    private String message;

    /**
     * Optional: if provided, the conversation resumes from this thread's checkpoint.
     * If null, a new thread is created.
     */
    @JsonProperty("thread_id")
    private String threadId;

    /** Page the user is on; passed through to the session unchanged */
    @JsonProperty("current_page")
    private String currentPage = "busDashboard";
}
