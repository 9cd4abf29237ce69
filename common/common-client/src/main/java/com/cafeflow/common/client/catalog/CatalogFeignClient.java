package com.cafeflow.common.client.catalog;

import com.cafeflow.common.dto.ApiResponse;
import com.cafeflow.common.dto.CatalogItemSnapshot;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;

import java.net.URI;
import java.util.List;

/**
 * Catalog 백엔드 Feign 클라이언트 (메뉴 항목 조회)
 */
@FeignClient(name = "catalog", url = "http://discovery-resolved")
public interface CatalogFeignClient {

    /** 개별 항목 조회. 주문 시 가격 스냅샷과 판매 가능 여부 확인용 */
    @GetMapping("/api/catalog/items/{id}")
    ApiResponse<CatalogItemSnapshot> getItem(URI baseUri, @PathVariable("id") Long id);

    /** 전체 항목 목록 */
    @GetMapping("/api/catalog/items")
    ApiResponse<List<CatalogItemSnapshot>> listItems(URI baseUri);
}
