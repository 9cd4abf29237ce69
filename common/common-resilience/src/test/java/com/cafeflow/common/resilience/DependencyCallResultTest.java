package com.cafeflow.common.resilience;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DependencyCallResultTest {

    @Test
    @DisplayName("map은 실패 종류와 메시지를 보존")
    void mapPreservesFailure() {
        DependencyCallResult<Integer> failure = DependencyCallResult.failure(FailureKind.TIMEOUT, "slow");

        DependencyCallResult<String> mapped = failure.map(String::valueOf);

        assertThat(mapped.kind()).isEqualTo(FailureKind.TIMEOUT);
        assertThat(mapped.message()).isEqualTo("slow");
    }

    @Test
    @DisplayName("flatMap은 성공일 때만 다음 단계를 실행")
    void flatMapChainsOnSuccess() {
        DependencyCallResult<Integer> result = DependencyCallResult.success(2)
                .flatMap(n -> n > 1
                        ? DependencyCallResult.failure(FailureKind.INVALID_ARGUMENT, "too many")
                        : DependencyCallResult.success(n));

        assertThat(result.kind()).isEqualTo(FailureKind.INVALID_ARGUMENT);
    }

    @Test
    @DisplayName("성공 결과는 castFailure 불가")
    void castFailureRejectsSuccess() {
        assertThatThrownBy(() -> DependencyCallResult.success("ok").castFailure())
                .isInstanceOf(IllegalStateException.class);
    }
}
