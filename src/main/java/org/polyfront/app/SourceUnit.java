package org.polyfront.app;

/**
 * One compilation unit of a batch: a file name used in positions and
 * diagnostics, and the source text.
 */
public record SourceUnit(String fileName, String code) {
}
