package com.devflow.core.safety;

/**
 * A safety check that fired.
 *
 * @param check name of the check, used as a metrics tag
 * @param note  text appended to the decision reasoning in parentheses, {@code null} for none
 */
public record SafetyFinding(String check, String note) {

    public static SafetyFinding silent(String check) {
        return new SafetyFinding(check, null);
    }
}
