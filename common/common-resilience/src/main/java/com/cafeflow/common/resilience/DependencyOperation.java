package com.cafeflow.common.resilience;

/**
 * 보호 대상 호출 한 번. 예외를 던지지 않고 항상 결과 값으로 실패를 보고해야 한다.
 */
@FunctionalInterface
public interface DependencyOperation<T> {

    DependencyCallResult<T> call();
}
