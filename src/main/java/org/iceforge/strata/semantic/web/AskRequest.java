package org.iceforge.strata.semantic.web;

import jakarta.validation.constraints.NotBlank;

public class AskRequest {

    /**
     * Natural-language question, e.g. "Show me weekly sales revenue since the start of 2024".
     */
    @NotBlank
    private String question;

    /**
     * Generator model; the configured default is used when absent.
     */
    private String model;

    /**
     * Run the compiled SQL on the warehouse and report its row count.
     */
    private boolean execute;

    public String getQuestion() {
        return question;
    }

    public void setQuestion(String question) {
        this.question = question;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public boolean isExecute() {
        return execute;
    }

    public void setExecute(boolean execute) {
        this.execute = execute;
    }
}
