package com.dataops.loader.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class RunContextUtilTest {

    @AfterEach
    void tearDown() {
        RunContextUtil.clear();
    }

    @Test
    void testSet_PutsRunAndFileIntoMdc() {
        UUID runId = UUID.randomUUID();

        RunContextUtil.set(12L, runId);

        assertThat(RunContextUtil.hasRunContext()).isTrue();
        assertThat(RunContextUtil.getCurrentRunId()).isEqualTo(runId.toString());
        assertThat(MDC.get(RunContextUtil.SOURCE_FILE_ID_KEY)).isEqualTo("12");
    }

    @Test
    void testClear_RemovesContext() {
        RunContextUtil.set(12L, UUID.randomUUID());

        RunContextUtil.clear();

        assertThat(RunContextUtil.hasRunContext()).isFalse();
        assertThat(RunContextUtil.getCurrentRunId()).isEqualTo("NO-RUN");
        assertThat(MDC.get(RunContextUtil.SOURCE_FILE_ID_KEY)).isNull();
    }
}
