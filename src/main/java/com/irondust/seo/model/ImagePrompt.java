package com.irondust.seo.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/** Image the generator should produce, with the alt text it will carry. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ImagePrompt {
    private String prompt;
    private String alt;

    public ImagePrompt() {}

    public ImagePrompt(String prompt, String alt) {
        this.prompt = prompt;
        this.alt = alt;
    }

    public ImagePrompt copy() {
        return new ImagePrompt(prompt, alt);
    }

    public String getPrompt() { return prompt; }
    public void setPrompt(String prompt) { this.prompt = prompt; }
    public String getAlt() { return alt; }
    public void setAlt(String alt) { this.alt = alt; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ImagePrompt)) return false;
        ImagePrompt that = (ImagePrompt) o;
        return Objects.equals(prompt, that.prompt) && Objects.equals(alt, that.alt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(prompt, alt);
    }
}
