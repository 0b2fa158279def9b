package com.smurthy.ai.search.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DomainExceptionTest {

    @Test
    @DisplayName("Message starts with the kind's sentinel")
    void testMessageFormat() {
        DomainException error = new DomainException(ErrorKind.RATE_LIMITED, "slow down");

        assertThat(error.getMessage()).isEqualTo("rate limit exceeded: slow down");
        assertThat(error.getKind()).isEqualTo(ErrorKind.RATE_LIMITED);
    }

    @Test
    @DisplayName("Kind without detail uses the bare sentinel")
    void testBareSentinel() {
        assertThat(new DomainException(ErrorKind.TIMEOUT_ERROR, null).getMessage()).isEqualTo("request timeout");
    }

    @Test
    @DisplayName("is() finds a kind through the cause chain")
    void testIsThroughCauseChain() {
        DomainException network = new DomainException(ErrorKind.NETWORK_ERROR, "connection reset");
        DomainException wrapped = DomainException.wrap(ErrorKind.TOOL_EXECUTION, network);

        assertThat(DomainException.is(wrapped, ErrorKind.TOOL_EXECUTION)).isTrue();
        assertThat(DomainException.is(wrapped, ErrorKind.NETWORK_ERROR)).isTrue();
        assertThat(DomainException.is(wrapped, ErrorKind.API_ERROR)).isFalse();
        assertThat(DomainException.is(null, ErrorKind.API_ERROR)).isFalse();
        assertThat(DomainException.is(new IllegalStateException("x"), ErrorKind.API_ERROR)).isFalse();
    }

    @Test
    @DisplayName("Wrapped message keeps the original message")
    void testWrapMessage() {
        DomainException invalid = new DomainException(ErrorKind.INVALID_REQUEST, "query must not be blank");

        DomainException wrapped = DomainException.wrap(ErrorKind.TOOL_EXECUTION, invalid);

        assertThat(wrapped.getMessage())
                .isEqualTo("tool execution failed: invalid request parameters: query must not be blank");
        assertThat(wrapped.getCause()).isSameAs(invalid);
    }

    @Test
    @DisplayName("Only network errors are transient")
    void testTransientKinds() {
        assertThat(ErrorKind.NETWORK_ERROR.isTransient()).isTrue();
        assertThat(ErrorKind.TIMEOUT_ERROR.isTransient()).isFalse();
        assertThat(ErrorKind.RATE_LIMITED.isTransient()).isFalse();
        assertThat(ErrorKind.INVALID_REQUEST.isClientError()).isTrue();
    }
}
