package com.questrail.plcsim.protocol.telegram.model;

import java.util.Optional;

/**
 * Telegram type, keyed by its two-character wire code.
 *
 * <p>Any code outside the known set maps to {@link #UNKNOWN}. Unknown codes are
 * never rejected; the original code is preserved on the {@link Telegram}.</p>
 */
public enum TelegramType
{
    LIFE("LI", "LIFE"),
    MOVE("MO", "MOVE"),
    CONFIRM("CF", "CNFM"),
    ERROR("ER", "ERROR"),
    UNKNOWN(null, "UNKNOWN");

    private final String code;
    private final String label;

    TelegramType(String code, String label)
    {
        this.code = code;
        this.label = label;
    }

    /**
     * Returns the two-character wire code, or empty for {@link #UNKNOWN}.
     */
    public Optional<String> code()
    {
        return Optional.ofNullable(code);
    }

    /** Short operator-facing label (e.g. {@code CNFM}). */
    public String label()
    {
        return label;
    }

    public static TelegramType fromCode(String code)
    {
        if (code == null) {
            return UNKNOWN;
        }
        for (TelegramType type : values()) {
            if (code.equals(type.code)) {
                return type;
            }
        }
        return UNKNOWN;
    }
}
