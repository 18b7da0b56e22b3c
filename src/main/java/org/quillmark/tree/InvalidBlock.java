package org.quillmark.tree;

/**
 * A block that could not be processed.
 *
 * @param message The reason.
 * @param fallback The literal source of the block.
 */
public record InvalidBlock(SystemMessage message, Block fallback) implements Block, Invalid {

    public static InvalidBlock of(String message, Block fallback) {
        return new InvalidBlock(SystemMessage.error(message), fallback);
    }
}
