package com.questrail.plcsim.protocol.telegram.model;

/**
 * TelegramLayout
 * -----------------------------------------------------------------------------
 * Positional layout of the fixed 128-byte ASCII telegram.
 *
 * <pre>
 *   [0:2]    Type         LI | MO | CF | ER
 *   [2:4]    SubType      00-99
 *   [4:12]   Source       device/system name, space padded
 *   [12:20]  Destination  device/system name, space padded
 *   [20:26]  Sequence     zero padded decimal
 *   [26:128] Data         type specific, space padded
 * </pre>
 *
 * <p>There is no delimiter and no length prefix on the wire. Framing is purely
 * positional: a stream is a concatenation of whole 128-byte frames.</p>
 */
public final class TelegramLayout
{
    /** Total frame length in bytes. */
    public static final int FRAME_LENGTH = 128;

    public static final int TYPE_OFFSET = 0;
    public static final int TYPE_WIDTH = 2;

    public static final int SUBTYPE_OFFSET = 2;
    public static final int SUBTYPE_WIDTH = 2;

    public static final int SOURCE_OFFSET = 4;
    public static final int SOURCE_WIDTH = 8;

    public static final int DESTINATION_OFFSET = 12;
    public static final int DESTINATION_WIDTH = 8;

    public static final int SEQUENCE_OFFSET = 20;
    public static final int SEQUENCE_WIDTH = 6;

    public static final int DATA_OFFSET = 26;
    public static final int DATA_WIDTH = 102;

    /** Sequence numbers wrap modulo this value. */
    public static final int SEQUENCE_MODULUS = 1_000_000;

    private TelegramLayout() {}
}
