package com.irondust.seo.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A piece of generated content as it moves through the optimizer.
 *
 * <p>Instances are treated as values: correctors never modify the content they
 * receive, they work on a {@link #copy()} and return it. Two passes therefore
 * never share mutable state.
 *
 * <p>The JSON shape follows the content record exchanged with the generator:
 * <pre>
 * {title, content, meta_description, excerpt, focus_keyword, secondary_keywords[],
 *  image_prompts[{prompt, alt}], internal_links[{url, anchor}], outbound_links[{url, anchor}]}
 * </pre>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Content {
    private String title;

    /** Marked-up body text */
    @JsonProperty("content")
    private String body;

    @JsonProperty("meta_description")
    private String metaDescription;

    private String excerpt;

    @JsonProperty("focus_keyword")
    private String focusKeyword;

    @JsonProperty("secondary_keywords")
    private List<String> secondaryKeywords = new ArrayList<>();

    @JsonProperty("image_prompts")
    private List<ImagePrompt> imagePrompts = new ArrayList<>();

    @JsonProperty("internal_links")
    private List<Link> internalLinks = new ArrayList<>();

    @JsonProperty("outbound_links")
    private List<Link> outboundLinks = new ArrayList<>();

    public Content() {}

    public Content(String title, String body, String metaDescription) {
        this.title = title;
        this.body = body;
        this.metaDescription = metaDescription;
    }

    /**
     * Returns a deep copy; lists and their elements are duplicated.
     */
    public Content copy() {
        Content c = new Content(title, body, metaDescription);
        c.excerpt = excerpt;
        c.focusKeyword = focusKeyword;
        c.secondaryKeywords = secondaryKeywords != null ? new ArrayList<>(secondaryKeywords) : new ArrayList<>();
        c.imagePrompts = new ArrayList<>();
        if (imagePrompts != null) {
            for (ImagePrompt p : imagePrompts) {
                c.imagePrompts.add(p != null ? p.copy() : null);
            }
        }
        c.internalLinks = copyLinks(internalLinks);
        c.outboundLinks = copyLinks(outboundLinks);
        return c;
    }

    private static List<Link> copyLinks(List<Link> links) {
        List<Link> out = new ArrayList<>();
        if (links != null) {
            for (Link l : links) {
                out.add(l != null ? l.copy() : null);
            }
        }
        return out;
    }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }
    public String getBody() { return body; }
    public void setBody(String body) { this.body = body; }
    public String getMetaDescription() { return metaDescription; }
    public void setMetaDescription(String metaDescription) { this.metaDescription = metaDescription; }
    public String getExcerpt() { return excerpt; }
    public void setExcerpt(String excerpt) { this.excerpt = excerpt; }
    public String getFocusKeyword() { return focusKeyword; }
    public void setFocusKeyword(String focusKeyword) { this.focusKeyword = focusKeyword; }
    public List<String> getSecondaryKeywords() { return secondaryKeywords; }
    public void setSecondaryKeywords(List<String> secondaryKeywords) { this.secondaryKeywords = secondaryKeywords; }
    public List<ImagePrompt> getImagePrompts() { return imagePrompts; }
    public void setImagePrompts(List<ImagePrompt> imagePrompts) { this.imagePrompts = imagePrompts; }
    public List<Link> getInternalLinks() { return internalLinks; }
    public void setInternalLinks(List<Link> internalLinks) { this.internalLinks = internalLinks; }
    public List<Link> getOutboundLinks() { return outboundLinks; }
    public void setOutboundLinks(List<Link> outboundLinks) { this.outboundLinks = outboundLinks; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Content)) return false;
        Content that = (Content) o;
        return Objects.equals(title, that.title)
                && Objects.equals(body, that.body)
                && Objects.equals(metaDescription, that.metaDescription)
                && Objects.equals(excerpt, that.excerpt)
                && Objects.equals(focusKeyword, that.focusKeyword)
                && Objects.equals(secondaryKeywords, that.secondaryKeywords)
                && Objects.equals(imagePrompts, that.imagePrompts)
                && Objects.equals(internalLinks, that.internalLinks)
                && Objects.equals(outboundLinks, that.outboundLinks);
    }

    @Override
    public int hashCode() {
        return Objects.hash(title, body, metaDescription, excerpt, focusKeyword,
                secondaryKeywords, imagePrompts, internalLinks, outboundLinks);
    }

    @Override
    public String toString() {
        return "Content{title='" + title + "'}";
    }
}
