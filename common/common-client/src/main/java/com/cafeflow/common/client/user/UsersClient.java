package com.cafeflow.common.client.user;

import com.cafeflow.common.client.DependencyNames;
import com.cafeflow.common.client.transport.BackendInvoker;
import com.cafeflow.common.dto.UserSnapshot;
import com.cafeflow.common.resilience.DependencyCallResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Users 서비스 어댑터
 *
 * <h3>역할</h3>
 * 사용자 조회를 "users" 의존성의 타임아웃/재시도/서킷 브레이커 정책으로 감싸고
 * 결과를 {@link DependencyCallResult}로 돌려준다. 예외를 던지지 않는다.
 *
 * <pre>
 *   사용자 없음         → NOT_FOUND (재시도 X, 브레이커 성공으로 집계)
 *   연결 거부/타임아웃   → 재시도 후 CONNECTION_REFUSED / TIMEOUT
 *   서킷 OPEN          → DEPENDENCY_UNAVAILABLE (전송 계층 호출 없음)
 * </pre>
 */
@Component
@RequiredArgsConstructor
public class UsersClient {

    private final UsersFeignClient usersFeignClient;
    private final BackendInvoker backendInvoker;

    public DependencyCallResult<UserSnapshot> getUser(Long userId) {
        return backendInvoker.invoke(DependencyNames.USERS,
                baseUri -> usersFeignClient.getUser(baseUri, userId));
    }
}
