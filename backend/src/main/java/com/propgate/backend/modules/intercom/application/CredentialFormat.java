package com.propgate.backend.modules.intercom.application;

import java.nio.charset.StandardCharsets;

import com.propgate.backend.global.error.ProblemException;
import com.propgate.backend.modules.intercom.application.matcher.VerificationAttempt;

/**
 * 평문 PIN / 출입 코드 형식 검증.
 */
final class CredentialFormat {

    static final int MIN_PIN_LENGTH = 4;
    static final int MAX_PIN_LENGTH = 20;
    static final int MIN_CODE_LENGTH = 4;
    static final int MAX_CODE_LENGTH = 72;

    private CredentialFormat() {
    }

    static void requireValidPin(String pin) {
        requireValid(pin, MIN_PIN_LENGTH, MAX_PIN_LENGTH, "INVALID_PIN", "pin");
    }

    static void requireValidCode(String code) {
        requireValid(code, MIN_CODE_LENGTH, MAX_CODE_LENGTH, "INVALID_CODE", "code");
    }

    private static void requireValid(String value, int min, int max, String problemCode, String label) {
        if (value == null || value.isBlank()) {
            throw ProblemException.invalid(problemCode, label + " is required");
        }
        if (!value.equals(value.strip())) {
            throw ProblemException.invalid(problemCode, label + " must not start or end with whitespace");
        }
        if (value.length() < min || value.length() > max) {
            throw ProblemException.invalid(problemCode, label + " must be " + min + "-" + max + " characters");
        }
        if (value.getBytes(StandardCharsets.UTF_8).length > VerificationAttempt.MAX_SECRET_BYTES) {
            throw ProblemException.invalid(
                    problemCode,
                    label + " must not exceed " + VerificationAttempt.MAX_SECRET_BYTES + " bytes"
            );
        }
    }
}
