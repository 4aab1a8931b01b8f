package com.warehouse.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Sellable product defined by the articles it is built from.
 */
public record Product(
    String name,
    @JsonProperty("contain_articles") List<ContainedArticle> containArticles
) {
    public Product {
        containArticles = containArticles == null ? List.of() : List.copyOf(containArticles);
    }
}
