package com.cafeflow.common.client.catalog;

import com.cafeflow.common.client.DependencyNames;
import com.cafeflow.common.client.transport.BackendInvoker;
import com.cafeflow.common.dto.CatalogItemSnapshot;
import com.cafeflow.common.resilience.DependencyCallResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Catalog 서비스 어댑터
 *
 * <p>주문 워크플로는 항목마다 {@link #getCatalogItem(Long)}을 병렬로 호출한다.
 * 모든 호출이 같은 "catalog" 브레이커를 공유한다.</p>
 */
@Component
@RequiredArgsConstructor
public class CatalogClient {

    private final CatalogFeignClient catalogFeignClient;
    private final BackendInvoker backendInvoker;

    public DependencyCallResult<CatalogItemSnapshot> getCatalogItem(Long itemId) {
        return backendInvoker.invoke(DependencyNames.CATALOG,
                baseUri -> catalogFeignClient.getItem(baseUri, itemId));
    }

    public DependencyCallResult<List<CatalogItemSnapshot>> listCatalogItems() {
        return backendInvoker.invoke(DependencyNames.CATALOG, catalogFeignClient::listItems);
    }
}
