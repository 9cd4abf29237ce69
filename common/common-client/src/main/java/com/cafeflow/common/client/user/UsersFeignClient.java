package com.cafeflow.common.client.user;

import com.cafeflow.common.dto.ApiResponse;
import com.cafeflow.common.dto.UserSnapshot;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;

import java.net.URI;

/**
 * Users 백엔드 Feign 클라이언트
 *
 * <p>첫 번째 {@link URI} 인자가 요청 대상 기본 주소가 된다. 주소는 호출마다
 * ServiceDiscovery에서 조회하며, {@code url} 속성은 사용되지 않는 자리 표시자다.</p>
 */
@FeignClient(name = "users", url = "http://discovery-resolved")
public interface UsersFeignClient {

    @GetMapping("/api/users/{id}")
    ApiResponse<UserSnapshot> getUser(URI baseUri, @PathVariable("id") Long id);
}
