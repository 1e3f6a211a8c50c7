package io.firelite.core.value;

/**
 * Native document reference holding a path relative to the database root,
 * for example {@code users/alice}.
 */
public record DocumentReference(String path) {
}
