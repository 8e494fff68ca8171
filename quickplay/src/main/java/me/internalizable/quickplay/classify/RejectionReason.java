package me.internalizable.quickplay.classify;

import javax.annotation.Nonnull;

/**
 * Why a candidate was dropped, in predicate order.
 */
public enum RejectionReason {

    RELAY_ADDRESS("relay"),
    INVALID_IDENTITY("identity"),
    PROBE_FAILED("probe"),
    APP_MISMATCH("app"),
    CAPACITY_TOO_LOW("minplayers"),
    CAPACITY_TOO_HIGH("maxplayers"),
    PLAYER_COUNT_MISMATCH("playercount"),
    OUTDATED("outdated"),
    NO_MAP("nomap"),
    HOLIDAY_MAP("holidaymap"),
    CUSTOM_MAP("custommap"),
    UNKNOWN_MAP("badmap"),
    BANNED_IDENTITY("identityban"),
    BANNED_ADDRESS("ipban"),
    NO_TAGS("notags"),
    CAPACITY_TAG_MISMATCH("maxplayerstag"),
    NO_VALID_TAG("nogametype"),
    MISSING_GAMEMODE_TAG("unexpectedtag"),
    TAG_EXCLUSIVITY("exclusivity"),
    BETA_MISMATCH("beta"),
    BANNED_TAG("badgametype"),
    BANNED_NAME("badname"),
    PROBE_TIMEOUT("timeout"),
    PASSWORD_PROTECTED("password"),
    /** Classification itself failed; not a predicate. */
    CLASSIFICATION_FAILED("error");

    private final String code;

    RejectionReason(String code) {
        this.code = code;
    }

    /**
     * Short code written to the rejections artifact.
     *
     * @return the code
     */
    @Nonnull
    public String getCode() {
        return code;
    }
}
