package com.opro.optimization.model;

public record ModelCompletion(String text, long promptTokens, long completionTokens) {
}
