package com.lancluster.protocol;

/**
 * Base of the closed set of protocol messages.
 *
 * The constructor is package-private: the only variants are the ones declared in
 * this package, one per {@link MessageType}.
 */
public abstract class Message {

    Message() {
    }

    /**
     * @return discriminator written in the {@code type} field
     */
    public abstract MessageType getType();

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{type=" + getType().getWireName() + "}";
    }
}
