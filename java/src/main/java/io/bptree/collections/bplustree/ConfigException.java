package io.bptree.collections.bplustree;

/** Thrown when a tree is constructed with an unusable configuration, such as an order below 3. */
public class ConfigException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    public ConfigException(String message) {
        super(message);
    }
}
