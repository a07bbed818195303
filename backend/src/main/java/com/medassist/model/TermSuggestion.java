package com.medassist.model;

public record TermSuggestion(String candidate, String canonical, double similarity) {
}
