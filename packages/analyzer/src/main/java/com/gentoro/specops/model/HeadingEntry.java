package com.gentoro.specops.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** One line of a file's heading outline, flagged with its classification. */
public record HeadingEntry(
    int level,
    String title,
    @JsonProperty("is_concept") boolean concept,
    @JsonProperty("is_setup") boolean setup) {}
