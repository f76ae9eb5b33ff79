package com.irondust.seo.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class Link {
    private String url;
    private String anchor;

    public Link() {}

    public Link(String url, String anchor) {
        this.url = url;
        this.anchor = anchor;
    }

    public Link copy() {
        return new Link(url, anchor);
    }

    public String getUrl() { return url; }
    public void setUrl(String url) { this.url = url; }
    public String getAnchor() { return anchor; }
    public void setAnchor(String anchor) { this.anchor = anchor; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Link)) return false;
        Link that = (Link) o;
        return Objects.equals(url, that.url) && Objects.equals(anchor, that.anchor);
    }

    @Override
    public int hashCode() {
        return Objects.hash(url, anchor);
    }
}
