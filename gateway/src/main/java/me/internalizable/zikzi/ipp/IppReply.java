package me.internalizable.zikzi.ipp;

import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;

/**
 * What to send back for one request: an IPP response, or an HTTP 401 challenge when the
 * operation needs credentials the client did not present.
 */
public final class IppReply {

    private final IppMessage response;
    private final List<String> challenges;

    private IppReply(@Nullable IppMessage response, @Nonnull List<String> challenges) {
        this.response = response;
        this.challenges = challenges;
    }

    @Nonnull
    public static IppReply respond(@Nonnull IppMessage response) {
        return new IppReply(Objects.requireNonNull(response, "response"), ImmutableList.of());
    }

    /**
     * @param challenges the {@code WWW-Authenticate} header values
     */
    @Nonnull
    public static IppReply challenge(@Nonnull List<String> challenges) {
        return new IppReply(null, ImmutableList.copyOf(challenges));
    }

    public boolean isChallenge() {
        return response == null;
    }

    /**
     * The response, or null for a challenge.
     */
    @Nullable
    public IppMessage getResponse() {
        return response;
    }

    @Nonnull
    public List<String> getChallenges() {
        return challenges;
    }
}
