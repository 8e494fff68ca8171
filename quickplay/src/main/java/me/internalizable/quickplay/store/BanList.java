package me.internalizable.quickplay.store;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Immutable view of the ban registry, read once per tick.
 *
 * @param identities banned server identities
 * @param addresses banned hosts
 * @param names banned lowercase name substrings
 * @param tags banned tags
 */
public record BanList(
        @Nonnull Set<String> identities,
        @Nonnull Set<String> addresses,
        @Nonnull List<String> names,
        @Nonnull Set<String> tags
) {

    public static final BanList EMPTY = new BanList(Set.of(), Set.of(), List.of(), Set.of());

    public BanList {
        identities = Set.copyOf(identities);
        addresses = Set.copyOf(addresses);
        names = names.stream().map(n -> n.toLowerCase(Locale.ROOT)).toList();
        tags = Set.copyOf(tags);
    }

    /**
     * Check a display name against the banned substrings.
     *
     * @param name display name
     * @return the first banned substring found, or null
     */
    @Nullable
    public String bannedSubstringIn(@Nonnull String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        for (String banned : names) {
            if (!banned.isEmpty() && lower.contains(banned)) {
                return banned;
            }
        }
        return null;
    }
}
