package com.example.CourseRag.util;

import org.junit.jupiter.api.Test;
import org.slf4j.Logger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;

class OneTimeWarningsTest {

    private final Logger log = mock(Logger.class);
    private final OneTimeWarnings warnings = new OneTimeWarnings(log);

    @Test
    void secondWarningForSameKeyIsSuppressed() {
        assertThat(warnings.hasFired("neo4j")).isFalse();

        assertThat(warnings.warn("neo4j", "Graph store unavailable: {}", "connection refused")).isTrue();
        assertThat(warnings.warn("neo4j", "Graph store unavailable: {}", "connection refused")).isFalse();

        assertThat(warnings.hasFired("neo4j")).isTrue();
        verify(log, times(1)).warn("Graph store unavailable: {}", new Object[]{"connection refused"});
        verifyNoMoreInteractions(log);
    }

    @Test
    void keysAreIndependent() {
        assertThat(warnings.warn("neo4j", "graph down")).isTrue();
        assertThat(warnings.warn("embedding-model", "embedding down")).isTrue();
        assertThat(warnings.warn("embedding-model", "embedding down")).isFalse();

        assertThat(warnings.hasFired("chat-model")).isFalse();
    }
}
