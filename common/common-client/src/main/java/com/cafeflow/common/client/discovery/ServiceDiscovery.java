package com.cafeflow.common.client.discovery;

import java.net.URI;

/**
 * 서비스 디스커버리 협력자 인터페이스
 *
 * <p>어댑터는 호출할 때마다 대상 주소를 이 인터페이스로 조회한다.
 * 정적 설정, DNS, 디스커버리 서버 중 무엇이 뒤에 있든 어댑터 로직은 동일하다.</p>
 */
public interface ServiceDiscovery {

    /**
     * @param dependency 의존 서비스 이름 (예: "users")
     * @return 호출 가능한 인스턴스의 기본 URI (예: http://users:8080)
     * @throws NoHealthyInstanceException 사용 가능한 인스턴스가 없을 때
     */
    URI resolve(String dependency);
}
