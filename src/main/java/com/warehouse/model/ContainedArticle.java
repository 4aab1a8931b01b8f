package com.warehouse.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One entry of a product's composition: the article and how many of it a
 * single product consumes. {@code amount_of} is accepted as a number or as
 * numeric text.
 */
public record ContainedArticle(
    @JsonProperty("art_id") String artId,
    @JsonProperty("amount_of") long amountOf
) {}
