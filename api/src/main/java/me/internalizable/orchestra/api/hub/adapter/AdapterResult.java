package me.internalizable.orchestra.api.hub.adapter;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Result of an adapter start, stop or recovery call.
 *
 * @param success whether the call succeeded
 * @param reason failure reason, null on success
 */
public record AdapterResult(boolean success, @Nullable String reason) {

    private static final AdapterResult OK = new AdapterResult(true, null);

    @Nonnull
    public static AdapterResult ok() {
        return OK;
    }

    @Nonnull
    public static AdapterResult failure(@Nonnull String reason) {
        return new AdapterResult(false, Objects.requireNonNull(reason, "reason"));
    }
}
