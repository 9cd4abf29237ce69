package com.cafeflow.common.dto;

/**
 * 사용자 조회 결과 스냅샷 (Users 백엔드 응답).
 *
 * <p>주문 워크플로는 사용자 존재 여부 확인에만 사용하며, 주문에는 userId만 저장한다.</p>
 */
public record UserSnapshot(Long id, String name, String email) {}
