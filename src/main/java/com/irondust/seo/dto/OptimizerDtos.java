package com.irondust.seo.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.irondust.seo.model.Content;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public class OptimizerDtos {
    public static class OptimizeRequest {
        @NotNull @Valid
        private Content content;
        @JsonProperty("focus_keyword")
        private String focusKeyword; // falls back to content.focus_keyword
        @JsonProperty("secondary_keywords")
        private List<String> secondaryKeywords;

        public Content getContent() { return content; }
        public void setContent(Content content) { this.content = content; }
        public String getFocusKeyword() { return focusKeyword; }
        public void setFocusKeyword(String focusKeyword) { this.focusKeyword = focusKeyword; }
        public List<String> getSecondaryKeywords() { return secondaryKeywords; }
        public void setSecondaryKeywords(List<String> secondaryKeywords) { this.secondaryKeywords = secondaryKeywords; }
    }

    public static class WarmUpRequest {
        @NotEmpty
        private List<Content> contents;

        public List<Content> getContents() { return contents; }
        public void setContents(List<Content> contents) { this.contents = contents; }
    }

    public static class TitlesRequest {
        @NotEmpty
        private List<String> titles;

        public List<String> getTitles() { return titles; }
        public void setTitles(List<String> titles) { this.titles = titles; }
    }
}
