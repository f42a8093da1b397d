package com.questrail.osc.dispatch;

import com.questrail.osc.pattern.OscAddressPattern;

import java.util.Objects;

/**
 * One dispatcher registry entry.
 *
 * <p>{@code pattern} is null for a default method. {@code typeSignature} is a
 * required prefix of the incoming type tags; the empty signature accepts any
 * arguments.</p>
 */
public record OscMethod(
    OscMethodId id,
    String pathPattern,
    OscAddressPattern pattern,
    String typeSignature,
    OscMethodHandler handler,
    boolean isDefault
) {
    public OscMethod {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(typeSignature, "typeSignature");
        Objects.requireNonNull(handler, "handler");
        if (!isDefault) {
            Objects.requireNonNull(pattern, "pattern");
        }
    }

    static OscMethod of(OscMethodId id, OscAddressPattern pattern, String typeSignature, OscMethodHandler handler) {
        return new OscMethod(id, pattern.pattern(), pattern, typeSignature, handler, false);
    }

    static OscMethod ofDefault(OscMethodId id, OscMethodHandler handler) {
        return new OscMethod(id, null, null, "", handler, true);
    }

    /**
     * True when this non-default method accepts {@code path} and {@code typeTags}.
     */
    public boolean matches(String path, String typeTags) {
        return !isDefault && pattern.matches(path) && typeTags.startsWith(typeSignature);
    }
}
