package com.cafeflow.gateway.route;

/**
 * 게이트웨이 외부 경로 (Routing Table)
 *
 * <pre>
 *   GET  /api/users/{id}           → users   UsersClient.getUser
 *   GET  /api/catalog/items        → catalog CatalogClient.listCatalogItems
 *   GET  /api/catalog/items/{id}   → catalog CatalogClient.getCatalogItem
 *   POST /api/orders               → orders  OrdersClient.createOrder
 *   GET  /api/orders/{id}          → orders  OrdersClient.getOrder
 * </pre>
 *
 * <p>경로와 핸들러의 바인딩은 각 컨트롤러의 {@code @RequestMapping}이 담당한다.</p>
 */
public final class GatewayRoutes {

    public static final String USERS = "/api/users";
    public static final String CATALOG_ITEMS = "/api/catalog/items";
    public static final String ORDERS = "/api/orders";

    public static final String BY_ID = "/{id}";

    public static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private GatewayRoutes() {
    }
}
