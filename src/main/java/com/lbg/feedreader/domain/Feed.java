package com.lbg.feedreader.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A catalog entry describing one syndication source - where to fetch articles from
 * and how to present it in a listing. Not the fetched content itself.
 */
public record Feed(
        @JsonProperty("ID") String id,
        @JsonProperty("Title") String title,
        @JsonProperty("Description") String description,
        @JsonProperty("URL") String url,
        @JsonProperty("ImageURL") String imageUrl,
        @JsonProperty("Category") String category
) {
    public Feed {
        id = id != null ? id : "";
        title = title != null ? title : "";
        description = description != null ? description : "";
        url = url != null ? url : "";
        imageUrl = imageUrl != null ? imageUrl : "";
        category = category != null ? category : "";
    }

    /**
     * Candidate for registration; the store assigns the id.
     */
    public static Feed candidate(String title, String description, String url, String imageUrl, String category) {
        return new Feed("", title, description, url, imageUrl, category);
    }

    public Feed withId(String newId) {
        return new Feed(newId, title, description, url, imageUrl, category);
    }
}
