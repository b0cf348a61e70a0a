package com.questrail.sensorlog.fault;

import com.questrail.sensorlog.api.FaultReason;

/**
 * FaultDecoder
 * -----------------------------------------------------------------------------
 * Derives the dominant {@link FaultReason} from the two packed status fields
 * of a faulty record.
 *
 * <h2>Algorithm</h2>
 * <ol>
 *   <li>Empty S_P_1 or S_P_2: {@link FaultReason#UNKNOWN}</li>
 *   <li>Drop the last character of S_P_1 (checksum)</li>
 *   <li>Strip all leading {@code '-'} from S_P_2</li>
 *   <li>Concatenate, left-pad with {@code '0'} to six characters, keep the
 *       first six</li>
 *   <li>Read three two-digit decimal pairs</li>
 *   <li>Test bit 4 of each pair's 8-bit form, counted from the MSB
 *       ({@code 0b0000_1000})</li>
 * </ol>
 *
 * <p>Priority is fixed: pair 1 reports {@link FaultReason#BATTERY}, pair 2
 * {@link FaultReason#TEMPERATURE}, pair 3 {@link FaultReason#THRESHOLD}. Only
 * the first set flag is reported, so simultaneous faults collapse to the
 * highest-priority one.</p>
 *
 * <p>Decoding is total. If any pair is not two decimal digits the whole
 * status word is treated as unreadable and {@link FaultReason#UNKNOWN} is
 * returned.</p>
 */
public final class FaultDecoder
{
    static final int STATUS_WIDTH = 6;

    /* Bit index 4 of an 8-bit value, counted from the most significant bit. */
    static final int FAULT_FLAG_MASK = 0x08;

    private static final FaultReason[] PAIR_PRIORITY = {
            FaultReason.BATTERY,
            FaultReason.TEMPERATURE,
            FaultReason.THRESHOLD
    };

    /**
     * Decodes the fault reason for one {@code "DD"} record.
     *
     * @param sp1 status part 1 (last character is a checksum)
     * @param sp2 status part 2 (may carry leading minus signs)
     * @return the highest-priority fault flagged, never {@code null}
     */
    public FaultReason decode(String sp1, String sp2)
    {
        if (sp1 == null || sp2 == null || sp1.isEmpty() || sp2.isEmpty()) {
            return FaultReason.UNKNOWN;
        }

        try {
            final String status = normalize(sp1, sp2);

            // All pairs must be numeric before any flag is trusted.
            final int[] pairs = new int[PAIR_PRIORITY.length];
            for (int i = 0; i < pairs.length; i++) {
                pairs[i] = parsePair(status, i * 2);
            }

            for (int i = 0; i < pairs.length; i++) {
                if ((pairs[i] & FAULT_FLAG_MASK) != 0) {
                    return PAIR_PRIORITY[i];
                }
            }
            return FaultReason.UNKNOWN;
        }
        catch (FaultDecodeException e) {
            // Malformed status data is classified, not propagated.
            return FaultReason.UNKNOWN;
        }
    }

    /**
     * Builds the six-character status word from the raw fields.
     */
    static String normalize(String sp1, String sp2)
    {
        final String checksumDropped = sp1.substring(0, sp1.length() - 1);

        int signs = 0;
        while (signs < sp2.length() && sp2.charAt(signs) == '-') {
            signs++;
        }

        final StringBuilder status = new StringBuilder(checksumDropped).append(sp2, signs, sp2.length());
        while (status.length() < STATUS_WIDTH) {
            status.insert(0, '0');
        }
        return status.substring(0, STATUS_WIDTH);
    }

    /**
     * Parses the two-digit decimal pair starting at {@code offset}.
     *
     * @throws FaultDecodeException if either character is not an ASCII digit
     */
    static int parsePair(String status, int offset)
    {
        final char hi = status.charAt(offset);
        final char lo = status.charAt(offset + 1);

        if (!isAsciiDigit(hi) || !isAsciiDigit(lo)) {
            throw new FaultDecodeException(
                    "Status pair is not numeric: '" + hi + lo + "' at offset " + offset);
        }
        return (hi - '0') * 10 + (lo - '0');
    }

    private static boolean isAsciiDigit(char c)
    {
        return c >= '0' && c <= '9';
    }
}
