package com.cafeflow.common.client.discovery;

/**
 * 디스커버리에서 사용 가능한 인스턴스를 찾지 못함.
 * 어댑터는 이를 DEPENDENCY_UNAVAILABLE 실패로 변환하고 브레이커 집계에 포함시킨다.
 */
public class NoHealthyInstanceException extends RuntimeException {

    public NoHealthyInstanceException(String dependency) {
        super("No healthy instance registered for " + dependency);
    }
}
