package me.internalizable.quickplay.classify;

import me.internalizable.quickplay.candidate.ClassifiedServer;
import me.internalizable.quickplay.candidate.RawCandidate;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Outcome of classifying one candidate: exactly one of {@link Accepted} or
 * {@link Rejected}.
 */
public interface ClassificationResult {

    /**
     * @return the candidate the result is about
     */
    @Nonnull
    RawCandidate candidate();

    default boolean isAccepted() {
        return this instanceof Accepted;
    }

    record Accepted(@Nonnull ClassifiedServer server) implements ClassificationResult {

        public Accepted {
            Objects.requireNonNull(server, "server");
        }

        @Override
        @Nonnull
        public RawCandidate candidate() {
            return server.candidate();
        }
    }

    /**
     * @param reason first failing predicate
     * @param candidate the candidate as it was evaluated
     * @param detail human readable detail, may be empty
     */
    record Rejected(@Nonnull RejectionReason reason, @Nonnull RawCandidate candidate, @Nonnull String detail)
            implements ClassificationResult {

        public Rejected {
            Objects.requireNonNull(reason, "reason");
            Objects.requireNonNull(candidate, "candidate");
            detail = detail != null ? detail : "";
        }
    }
}
