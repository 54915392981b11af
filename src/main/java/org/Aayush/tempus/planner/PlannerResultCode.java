package org.Aayush.tempus.planner;

/**
 * Stable integer codes for callers on the far side of a foreign-function boundary.
 */
public enum PlannerResultCode {
    SUCCESS(0),
    SOLUTION_FOUND(1),
    NO_SOLUTION(2),
    PARSE_ERROR(3),
    FILE_ERROR(4),
    INVALID_HANDLE(5);

    private final int code;

    PlannerResultCode(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * Looks a result code up by its integer value.
     *
     * @throws IllegalArgumentException for unknown values.
     */
    public static PlannerResultCode fromCode(int code) {
        for (PlannerResultCode value : values()) {
            if (value.code == code) {
                return value;
            }
        }
        throw new IllegalArgumentException("unknown planner result code " + code);
    }
}
