package com.cafeflow.gateway.controller;

import com.cafeflow.common.client.DependencyNames;
import com.cafeflow.common.client.catalog.CatalogClient;
import com.cafeflow.common.dto.ApiResponse;
import com.cafeflow.common.dto.CatalogItemSnapshot;
import com.cafeflow.gateway.route.GatewayRoutes;
import com.cafeflow.gateway.translation.GatewayResponseTranslator;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 카탈로그(메뉴) 조회 라우트
 */
@RestController
@RequestMapping(GatewayRoutes.CATALOG_ITEMS)
@RequiredArgsConstructor
public class CatalogGatewayController {

    private final CatalogClient catalogClient;
    private final GatewayResponseTranslator translator;

    @GetMapping
    public ApiResponse<List<CatalogItemSnapshot>> listItems() {
        return ApiResponse.ok(translator.translate(DependencyNames.CATALOG, "listCatalogItems",
                catalogClient::listCatalogItems));
    }

    @GetMapping(GatewayRoutes.BY_ID)
    public ApiResponse<CatalogItemSnapshot> getItem(@PathVariable Long id) {
        return ApiResponse.ok(translator.translate(DependencyNames.CATALOG, "getCatalogItem",
                () -> catalogClient.getCatalogItem(id)));
    }
}
