package com.projectkb.retrieval;

public record ContextPassage(RankedChunk ranked, String text, SourceAttribution attribution, boolean truncated) {
}
