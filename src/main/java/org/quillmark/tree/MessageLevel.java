package org.quillmark.tree;

/**
 * The severity of a {@link SystemMessage}.
 */
public enum MessageLevel {
    DEBUG,
    INFO,
    WARNING,
    ERROR,
    FATAL
}
