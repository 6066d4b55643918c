package com.tencent.scanflow.app.parser;

import com.tencent.scanflow.domain.exception.RunbookParseException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EnvironmentSubstitutorTest {

    private final EnvironmentSubstitutor substitutor =
            new EnvironmentSubstitutor(Map.of("SCAN_ROOT", "/data", "DB", "orders")::get);

    @Test
    void replacesEveryPlaceholder() {
        assertThat(substitutor.substitute("path: ${SCAN_ROOT}/src\ndb: ${DB}"))
                .isEqualTo("path: /data/src\ndb: orders");
    }

    @Test
    void leavesTextWithoutPlaceholdersUntouched() {
        assertThat(substitutor.substitute("cost: $5")).isEqualTo("cost: $5");
    }

    @Test
    void undefinedVariableIsAParseError() {
        assertThatThrownBy(() -> substitutor.substitute("token: ${MISSING_TOKEN}"))
                .isInstanceOf(RunbookParseException.class)
                .hasMessage("Environment variable 'MISSING_TOKEN' is not defined");
    }
}
