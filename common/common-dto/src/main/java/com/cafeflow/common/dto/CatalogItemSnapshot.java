package com.cafeflow.common.dto;

import java.math.BigDecimal;

/**
 * 카탈로그 항목 스냅샷 (Catalog 백엔드 응답).
 *
 * <p>price는 조회 시점의 가격이다. 주문 워크플로는 이 값을 주문 항목에 복사해 두므로
 * 이후 카탈로그 가격이 바뀌어도 이미 만들어진 주문 금액은 변하지 않는다.</p>
 *
 * <p>응답에 available 필드가 없으면(null) 주문 가능으로 본다. 명시적인 false만 주문을 막는다.</p>
 */
public record CatalogItemSnapshot(Long id, String name, BigDecimal price, Boolean available) {

    public CatalogItemSnapshot {
        if (available == null) {
            available = Boolean.TRUE;
        }
    }
}
