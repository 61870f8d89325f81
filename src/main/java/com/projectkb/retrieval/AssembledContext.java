package com.projectkb.retrieval;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

public record AssembledContext(List<ContextPassage> passages, int totalChars) {
    public AssembledContext {
        passages = List.copyOf(passages);
    }

    /** Passages numbered {@code [1]}, {@code [2]}, ... so an answer can cite them. */
    public String render() {
        return IntStream.range(0, passages.size())
                .mapToObj(i -> "[%d] %s%n%s".formatted(i + 1, passages.get(i).attribution().label(),
                        passages.get(i).text()))
                .collect(Collectors.joining(System.lineSeparator() + System.lineSeparator()));
    }
}
