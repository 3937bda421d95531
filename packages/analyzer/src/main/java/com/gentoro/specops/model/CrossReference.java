package com.gentoro.specops.model;

/**
 * A link or textual pointer from one document to another document or to external content.
 *
 * @param context about 100 chars around a link, or the sentence holding a textual reference
 */
public record CrossReference(ReferenceType type, String text, String target, String context) {}
