package com.propgate.backend.modules.intercom.application;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.propgate.backend.global.error.ProblemException;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CredentialFormatTest {

    @Test
    @DisplayName("72바이트를 넘는 출입 코드는 BCrypt 가 잘라내므로 거부한다")
    void rejectsCodeLongerThanBcryptInput() {
        String overLong = "x".repeat(72) + "-visitor-secret";

        assertThatThrownBy(() -> CredentialFormat.requireValidCode(overLong))
                .isInstanceOf(ProblemException.class)
                .extracting(ex -> ((ProblemException) ex).getCode())
                .isEqualTo("INVALID_CODE");
        assertThatCode(() -> CredentialFormat.requireValidCode("x".repeat(72))).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("글자 수가 한도 안이어도 UTF-8 바이트가 72를 넘으면 거부한다")
    void countsUtf8BytesNotCharacters() {
        // 3 bytes per character in UTF-8
        String overLong = "가".repeat(25);

        assertThatThrownBy(() -> CredentialFormat.requireValidCode(overLong))
                .isInstanceOf(ProblemException.class)
                .extracting(ex -> ((ProblemException) ex).getCode())
                .isEqualTo("INVALID_CODE");
        assertThatCode(() -> CredentialFormat.requireValidCode("가".repeat(24))).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("앞뒤 공백이나 짧은 값은 거부한다")
    void rejectsPaddingAndShortValues() {
        assertThatThrownBy(() -> CredentialFormat.requireValidPin(" 1234")).isInstanceOf(ProblemException.class);
        assertThatThrownBy(() -> CredentialFormat.requireValidCode("abc")).isInstanceOf(ProblemException.class);
    }
}
