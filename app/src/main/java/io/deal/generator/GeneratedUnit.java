package io.deal.generator;

/**
 * One emitted source file.
 *
 * @param path output path relative to the output root, e.g. {@code com/example/MyServiceProtoContracts.java}
 * @param content Java source text
 */
public record GeneratedUnit(
    String path,
    String content
) {
}
