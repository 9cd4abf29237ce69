package com.cafeflow.order.workflow;

import com.cafeflow.common.client.catalog.CatalogClient;
import com.cafeflow.common.client.user.UsersClient;
import com.cafeflow.order.config.OrderProperties;
import com.cafeflow.order.store.OrderStore;
import io.github.resilience4j.bulkhead.ThreadPoolBulkhead;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 요청마다 새 {@link OrderCreationWorkflow}를 만든다. 워크플로는 상태를 가지므로 재사용하지 않는다.
 */
@Component
@RequiredArgsConstructor
public class OrderCreationWorkflowFactory {

    private final UsersClient usersClient;
    private final CatalogClient catalogClient;
    private final ThreadPoolBulkhead itemResolutionBulkhead;
    private final OrderStore orderStore;
    private final OrderProperties orderProperties;

    public OrderCreationWorkflow create() {
        return new OrderCreationWorkflow(usersClient, catalogClient, itemResolutionBulkhead, orderStore,
                orderProperties.getItemResolution().getDeadline());
    }
}
