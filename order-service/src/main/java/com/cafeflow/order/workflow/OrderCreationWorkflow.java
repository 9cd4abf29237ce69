package com.cafeflow.order.workflow;

import com.cafeflow.common.client.catalog.CatalogClient;
import com.cafeflow.common.client.user.UsersClient;
import com.cafeflow.common.dto.CatalogItemSnapshot;
import com.cafeflow.common.dto.CreateOrderRequest;
import com.cafeflow.common.dto.OrderLineRequest;
import com.cafeflow.common.dto.UserSnapshot;
import com.cafeflow.common.resilience.DependencyCallResult;
import com.cafeflow.common.resilience.FailureKind;
import com.cafeflow.order.entity.Order;
import com.cafeflow.order.store.OrderStore;
import io.github.resilience4j.bulkhead.BulkheadFullException;
import io.github.resilience4j.bulkhead.ThreadPoolBulkhead;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 주문 생성 워크플로 (Users + Catalog fan-out 후 저장)
 *
 * <h3>역할</h3>
 * 주문 1건을 만들기 위해 두 의존 서비스를 조합하고, 어느 단계에서 실패하든
 * 일관된 실패 종류 하나로 정리해서 돌려준다. 호출 1회마다 새 인스턴스를 쓴다.
 *
 * <h3>실행 흐름</h3>
 * <pre>
 * 1. 입력 검증 (원격 호출 전)              → INVALID_ARGUMENT
 * 2. VALIDATING_USER: UsersClient.getUser  실패 시 즉시 종료, Catalog 호출 없음
 * 3. RESOLVING_ITEMS: 서로 다른 productId마다 CatalogClient.getCatalogItem을
 *    ThreadPoolBulkhead 위에서 병렬 실행
 *    - 첫 실패가 도착하면 나머지를 기다리지 않고 종료 (진행 중인 호출은 결과만 버림)
 *    - 전체 조회 데드라인 초과                → UNAVAILABLE
 *    - 판매 중지 항목                        → INVALID_ARGUMENT
 * 4. PERSISTING: OrderStore.save (단일 트랜잭션)  실패 시 INTERNAL
 * 5. COMPLETED
 * </pre>
 *
 * <h3>실패 종류 변환</h3>
 * <pre>
 *   TIMEOUT / CONNECTION_REFUSED / DEPENDENCY_UNAVAILABLE / UNAVAILABLE → UNAVAILABLE
 *   NOT_FOUND (사용자 또는 항목)                                         → INVALID_ARGUMENT
 *   INVALID_ARGUMENT, INTERNAL                                          → 그대로
 * </pre>
 *
 * ★ Prices are captured once, at resolution time, as immutable snapshots
 */
@Slf4j
public class OrderCreationWorkflow {

    private final UsersClient usersClient;
    private final CatalogClient catalogClient;
    private final ThreadPoolBulkhead itemResolutionBulkhead;
    private final OrderStore orderStore;
    private final Duration resolutionDeadline;

    private OrderWorkflowState state = OrderWorkflowState.START;
    private OrderDraft draft;

    public OrderCreationWorkflow(UsersClient usersClient,
                                 CatalogClient catalogClient,
                                 ThreadPoolBulkhead itemResolutionBulkhead,
                                 OrderStore orderStore,
                                 Duration resolutionDeadline) {
        this.usersClient = usersClient;
        this.catalogClient = catalogClient;
        this.itemResolutionBulkhead = itemResolutionBulkhead;
        this.orderStore = orderStore;
        this.resolutionDeadline = resolutionDeadline;
    }

    public DependencyCallResult<Order> execute(CreateOrderRequest request, String idempotencyKey) {
        if (state != OrderWorkflowState.START) {
            throw new IllegalStateException("OrderCreationWorkflow instances are single-use");
        }

        DependencyCallResult<OrderDraft> validated = validate(request);
        if (validated.isFailure()) {
            return fail(validated.kind(), validated.message());
        }
        draft = validated.payload();

        // 1단계: 사용자 검증
        transitionTo(OrderWorkflowState.VALIDATING_USER);
        Long userId = draft.getRequestedUserId();
        DependencyCallResult<UserSnapshot> user = usersClient.getUser(userId);
        if (user.isFailure()) {
            return fail(outwardKind(user.kind()), user.kind() == FailureKind.NOT_FOUND
                    ? "User " + userId + " does not exist"
                    : user.message());
        }
        draft = draft.withUser(user.payload());

        // 2단계: 항목 가격 확정 (병렬)
        transitionTo(OrderWorkflowState.RESOLVING_ITEMS);
        DependencyCallResult<Map<Long, CatalogItemSnapshot>> items = resolveItems(draft.distinctProductIds());
        if (items.isFailure()) {
            return fail(outwardKind(items.kind()), items.message());
        }
        for (CatalogItemSnapshot item : items.payload().values()) {
            if (!item.available()) {
                return fail(FailureKind.INVALID_ARGUMENT, "Catalog item " + item.id() + " is not available");
            }
        }
        draft = draft.withResolvedItems(items.payload());

        // 3단계: 저장
        transitionTo(OrderWorkflowState.PERSISTING);
        Order saved;
        try {
            saved = orderStore.save(draft.toOrder(idempotencyKey));
        } catch (RuntimeException e) {
            log.error("Failed to persist order: userId={}, idempotencyKey={}", userId, idempotencyKey, e);
            return fail(FailureKind.INTERNAL, "Order could not be stored");
        }

        transitionTo(OrderWorkflowState.COMPLETED);
        log.info("Order created: orderId={}, userId={}, total={}",
                saved.getId(), userId, saved.getTotalAmount());
        return DependencyCallResult.success(saved);
    }

    private DependencyCallResult<OrderDraft> validate(CreateOrderRequest request) {
        if (request == null || request.userId() == null) {
            return DependencyCallResult.failure(FailureKind.INVALID_ARGUMENT, "userId is required");
        }
        if (request.items() == null || request.items().isEmpty()) {
            return DependencyCallResult.failure(FailureKind.INVALID_ARGUMENT, "items must not be empty");
        }
        List<OrderDraft.RequestedLine> lines = new ArrayList<>();
        for (OrderLineRequest line : request.items()) {
            if (line == null || line.productId() == null) {
                return DependencyCallResult.failure(FailureKind.INVALID_ARGUMENT, "productId is required");
            }
            if (line.quantity() == null || line.quantity() < 1) {
                return DependencyCallResult.failure(FailureKind.INVALID_ARGUMENT,
                        "quantity must be at least 1");
            }
            lines.add(new OrderDraft.RequestedLine(line.productId(), line.quantity()));
        }
        return DependencyCallResult.success(OrderDraft.of(request.userId(), lines));
    }

    /**
     * productId마다 Catalog 조회를 병렬 실행하고 첫 실패 또는 전체 완료 중 먼저 오는 쪽을 기다린다.
     */
    private DependencyCallResult<Map<Long, CatalogItemSnapshot>> resolveItems(Set<Long> productIds) {
        CompletableFuture<DependencyCallResult<Map<Long, CatalogItemSnapshot>>> firstFailure =
                new CompletableFuture<>();
        Map<Long, CompletableFuture<DependencyCallResult<CatalogItemSnapshot>>> pending = new LinkedHashMap<>();

        for (Long productId : productIds) {
            CompletableFuture<DependencyCallResult<CatalogItemSnapshot>> future;
            try {
                future = itemResolutionBulkhead
                        .executeSupplier(() -> catalogClient.getCatalogItem(productId))
                        .toCompletableFuture();
            } catch (BulkheadFullException e) {
                log.warn("Item resolution bulkhead is full: {}", e.getMessage());
                return DependencyCallResult.failure(FailureKind.UNAVAILABLE,
                        "Item resolution capacity exhausted");
            }
            future.whenComplete((result, error) -> {
                if (error != null) {
                    firstFailure.complete(unexpectedFailure(productId, error));
                } else if (result.isFailure()) {
                    firstFailure.complete(itemFailure(productId, result));
                }
            });
            pending.put(productId, future);
        }

        CompletableFuture<Void> all = CompletableFuture.allOf(pending.values().toArray(new CompletableFuture[0]));
        try {
            CompletableFuture.anyOf(all, firstFailure)
                    .get(resolutionDeadline.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Item resolution exceeded deadline of {}ms", resolutionDeadline.toMillis());
            return DependencyCallResult.failure(FailureKind.TIMEOUT,
                    "Item resolution did not finish within " + resolutionDeadline.toMillis() + "ms");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return DependencyCallResult.failure(FailureKind.UNAVAILABLE, "Item resolution was interrupted");
        } catch (ExecutionException e) {
            log.debug("Item resolution completed exceptionally: {}", e.getCause().toString());
        }

        if (firstFailure.isDone()) {
            return firstFailure.join();
        }

        // 모든 조회가 정상 완료. 요청 순서대로 결과 수집
        Map<Long, CatalogItemSnapshot> resolved = new LinkedHashMap<>();
        for (Map.Entry<Long, CompletableFuture<DependencyCallResult<CatalogItemSnapshot>>> entry : pending.entrySet()) {
            DependencyCallResult<CatalogItemSnapshot> result;
            try {
                result = entry.getValue().join();
            } catch (CompletionException e) {
                return unexpectedFailure(entry.getKey(), e);
            }
            if (result.isFailure()) {
                return itemFailure(entry.getKey(), result);
            }
            resolved.put(entry.getKey(), result.payload());
        }
        return DependencyCallResult.success(resolved);
    }

    private static <T> DependencyCallResult<T> itemFailure(Long productId,
                                                           DependencyCallResult<CatalogItemSnapshot> result) {
        return DependencyCallResult.failure(result.kind(), result.kind() == FailureKind.NOT_FOUND
                ? "Catalog item " + productId + " does not exist"
                : result.message());
    }

    private static <T> DependencyCallResult<T> unexpectedFailure(Long productId, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null
                ? error.getCause()
                : error;
        if (cause instanceof BulkheadFullException) {
            return DependencyCallResult.failure(FailureKind.UNAVAILABLE, "Item resolution capacity exhausted");
        }
        log.error("Catalog lookup for item {} failed unexpectedly", productId, cause);
        return DependencyCallResult.failure(FailureKind.INTERNAL,
                "Catalog item " + productId + " could not be resolved");
    }

    static FailureKind outwardKind(FailureKind kind) {
        if (kind.isOutage()) {
            return FailureKind.UNAVAILABLE;
        }
        if (kind == FailureKind.NOT_FOUND) {
            return FailureKind.INVALID_ARGUMENT;
        }
        return kind;
    }

    private <T> DependencyCallResult<T> fail(FailureKind kind, String message) {
        OrderWorkflowState failedAt = state;
        transitionTo(OrderWorkflowState.FAILED);
        log.info("Order workflow failed at {}: kind={}, message={}", failedAt, kind, message);
        return DependencyCallResult.failure(kind, message);
    }

    private void transitionTo(OrderWorkflowState next) {
        log.debug("Order workflow {} -> {}", state, next);
        state = next;
    }

    public OrderWorkflowState getState() {
        return state;
    }

    /** 현재까지 확정된 초안 (입력 검증 전에는 null) */
    public OrderDraft getDraft() {
        return draft;
    }
}
