package com.quoteplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * A single quote as served to callers, normalised from whichever provider produced it.
 *
 * @param source provider name, e.g. {@code "ZenQuotes"} or {@code "Bundled"}
 */
public record Quote(
    @JsonProperty("id")       String id,
    @JsonProperty("text")     String text,
    @JsonProperty("author")   String author,
    @JsonProperty("category") String category,
    @JsonProperty("tags")     List<String> tags,
    @JsonProperty("source")   String source
) {

    public static final String DEFAULT_AUTHOR   = "Unknown";
    public static final String DEFAULT_CATEGORY = "general";

    public Quote {
        text     = text == null ? "" : text.trim();
        author   = author == null || author.isBlank() ? DEFAULT_AUTHOR : author.trim();
        category = category == null || category.isBlank() ? DEFAULT_CATEGORY : category.trim().toLowerCase(Locale.ROOT);
        tags     = tags == null ? List.of() : List.copyOf(tags);
        id       = id == null || id.isBlank() ? UUID.randomUUID().toString().substring(0, 8) : id;
    }

    public static Quote of(String text, String author, String category, String source) {
        return new Quote(null, text, author, category, List.of(), source);
    }

    /** Identity used to de-duplicate quotes collected from different calls; ids are not stable across providers. */
    public String signature() {
        return text.toLowerCase(Locale.ROOT) + "|" + author.toLowerCase(Locale.ROOT);
    }

    @JsonIgnore
    public boolean isBlank() {
        return text.isBlank();
    }

    /** Case-insensitive match on category or any tag. */
    public boolean matchesCategory(String wanted) {
        if (wanted == null || wanted.isBlank()) {
            return true;
        }
        String needle = wanted.trim().toLowerCase(Locale.ROOT);
        return category.contains(needle) || tags.stream().anyMatch(t -> t.toLowerCase(Locale.ROOT).contains(needle));
    }
}
