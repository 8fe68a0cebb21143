package com.questrail.testkit.api;

import java.util.Objects;

/**
 * The name and stable key of an application or handler.
 *
 * <p>The name is for humans and may change between releases. The key is an
 * opaque value that must never change once the handler is in use.</p>
 */
public record Identity(String name, String key) {
    public Identity {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(key, "key");

        if (name.isEmpty() || name.chars().anyMatch(Character::isWhitespace)) {
            throw new IllegalArgumentException(
                    "invalid name \"" + name + "\", names must be non-empty and contain no whitespace");
        }
        if (key.isEmpty() || key.chars().anyMatch(Character::isWhitespace)) {
            throw new IllegalArgumentException(
                    "invalid key \"" + key + "\", keys must be non-empty and contain no whitespace");
        }
    }

    @Override
    public String toString() {
        return name + "/" + key;
    }
}
