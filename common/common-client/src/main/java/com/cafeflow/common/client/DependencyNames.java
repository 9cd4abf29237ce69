package com.cafeflow.common.client;

/**
 * 의존 서비스 이름. 서킷 브레이커, 타임아웃, 디스커버리 설정의 키로 쓰인다.
 */
public final class DependencyNames {

    public static final String USERS = "users";
    public static final String CATALOG = "catalog";
    public static final String ORDERS = "orders";

    private DependencyNames() {
    }
}
