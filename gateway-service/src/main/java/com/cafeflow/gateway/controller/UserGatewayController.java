package com.cafeflow.gateway.controller;

import com.cafeflow.common.client.DependencyNames;
import com.cafeflow.common.client.user.UsersClient;
import com.cafeflow.common.dto.ApiResponse;
import com.cafeflow.common.dto.UserSnapshot;
import com.cafeflow.gateway.route.GatewayRoutes;
import com.cafeflow.gateway.translation.GatewayResponseTranslator;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(GatewayRoutes.USERS)
@RequiredArgsConstructor
public class UserGatewayController {

    private final UsersClient usersClient;
    private final GatewayResponseTranslator translator;

    @GetMapping(GatewayRoutes.BY_ID)
    public ApiResponse<UserSnapshot> getUser(@PathVariable Long id) {
        return ApiResponse.ok(translator.translate(DependencyNames.USERS, "getUser",
                () -> usersClient.getUser(id)));
    }
}
