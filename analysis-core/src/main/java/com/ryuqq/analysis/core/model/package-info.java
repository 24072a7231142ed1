/**
 * 도메인 모델 패키지.
 *
 * <p>콘텐츠 주소(ContentHash), 캐시 키, 프레임워크 버전, 감사 이벤트 등
 * 모든 모듈이 공유하는 불변 값 객체를 정의합니다.</p>
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>불변성:</strong> 모든 모델은 생성 후 변경 불가</li>
 *   <li><strong>내용 기반 식별:</strong> 경로나 이름 대신 전체 내용의 해시로 식별</li>
 *   <li><strong>생성 시 검증:</strong> 유효하지 않은 값은 IllegalArgumentException</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.analysis.core.model;
