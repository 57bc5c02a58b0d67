package com.journal.archive.descriptor;

/**
 * A quoted or paraphrased reference. Either {@code content} or {@code description}
 * must be present, and the source is mandatory.
 */
public record ReferenceSpec(String content, String description, String speaker, String mode, SourceSpec source) {
}
