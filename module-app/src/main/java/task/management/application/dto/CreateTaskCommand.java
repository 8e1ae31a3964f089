package task.management.application.dto;

import java.time.Instant;

/**
 * 작업 생성 입력
 *
 * @param priority 필수, 1~5
 * @param dueDate 선택
 * @param createdBy 인증된 호출자 ID
 */
public record CreateTaskCommand(
    String title, String description, Integer priority, Instant dueDate, String createdBy) {}
