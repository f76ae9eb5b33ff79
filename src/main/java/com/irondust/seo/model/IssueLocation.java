package com.irondust.seo.model;

/**
 * Where in a text an issue was found. {@code text} carries the surrounding context.
 */
public record IssueLocation(int position, int length, String text) {}
