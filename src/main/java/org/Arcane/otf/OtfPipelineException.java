package org.Arcane.otf;

import lombok.Getter;

import java.util.Objects;

/**
 * OTF pipeline contract exception with deterministic reason codes.
 *
 * <p>Every fatal condition of the cross-match and partition/merge pipeline is
 * reported through this type. The message is prefixed with the reason code and
 * names the offending identifier (path, field name, pointing id or time value).</p>
 */
@Getter
public final class OtfPipelineException extends RuntimeException {
    public static final String MISSING_FILE = "MISSING_FILE";
    public static final String FORMAT = "FORMAT";
    public static final String UNKNOWN_FIELD = "UNKNOWN_FIELD";
    public static final String INVALID_SELECTION = "INVALID_SELECTION";
    public static final String NON_INJECTIVE_MATCH = "NON_INJECTIVE_MATCH";
    public static final String NO_POINTINGS_SELECTED = "NO_POINTINGS_SELECTED";
    public static final String STALE_MATCH = "STALE_MATCH";
    public static final String AMBIGUOUS_FIELD = "AMBIGUOUS_FIELD";
    public static final String INCOMPLETE_INPUT = "INCOMPLETE_INPUT";
    public static final String UNKNOWN_POINTING_ID = "UNKNOWN_POINTING_ID";
    public static final String ENGINE_FAILURE = "ENGINE_FAILURE";
    public static final String STATE_EXISTS = "STATE_EXISTS";
    public static final String CONFIG = "CONFIG";

    private final String reasonCode;

    /**
     * Creates a reason-coded pipeline failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     */
    public OtfPipelineException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Creates a reason-coded pipeline failure with a cause.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     * @param cause underlying cause.
     */
    public OtfPipelineException(String reasonCode, String message, Throwable cause) {
        super(formatMessage(reasonCode, message), cause);
        this.reasonCode = requireReasonCode(reasonCode);
    }

    private static String formatMessage(String reasonCode, String message) {
        return "[" + requireReasonCode(reasonCode) + "] " + Objects.requireNonNull(message, "message");
    }

    private static String requireReasonCode(String reasonCode) {
        String code = Objects.requireNonNull(reasonCode, "reasonCode");
        if (code.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return code;
    }
}
