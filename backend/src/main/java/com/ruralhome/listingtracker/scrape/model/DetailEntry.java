package com.ruralhome.listingtracker.scrape.model;

import java.util.List;

public record DetailEntry(String category, List<String> texts) {
    public DetailEntry {
        texts = texts == null ? List.of() : List.copyOf(texts);
    }
}
