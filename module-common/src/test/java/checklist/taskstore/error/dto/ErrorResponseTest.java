package checklist.taskstore.error.dto;

import static org.assertj.core.api.Assertions.assertThat;

import checklist.taskstore.error.ErrorStatus;
import checklist.taskstore.error.TaskErrorCode;
import checklist.taskstore.error.exception.InternalSystemException;
import checklist.taskstore.error.exception.StoreConnectionException;
import checklist.taskstore.error.exception.TaskNotFoundException;
import java.sql.SQLException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ErrorResponseTest {

  private static final String RAW_SQL = "SELECT id, title FROM tasks WHERE id = ?";

  @Test
  @DisplayName("비즈니스 예외는 코드와 포맷된 메시지를 그대로 전달한다")
  void fromBusinessException() {
    ErrorResponse response = ErrorResponse.of(new TaskNotFoundException("42"));

    assertThat(response.status()).isEqualTo(ErrorStatus.NOT_FOUND);
    assertThat(response.code()).isEqualTo("T001");
    assertThat(response.message()).contains("42");
    assertThat(response.httpStatusCode()).isEqualTo(404);
  }

  @Test
  @DisplayName("Internal 분류는 원인 예외의 쿼리 문자열을 노출하지 않는다")
  void internalNeverLeaksDetail() {
    InternalSystemException e =
        new InternalSystemException("TaskStore:List", new SQLException("bad grammar: " + RAW_SQL));

    ErrorResponse response = ErrorResponse.of(e);

    assertThat(response.status()).isEqualTo(ErrorStatus.INTERNAL);
    assertThat(response.message()).isEqualTo(TaskErrorCode.INTERNAL_SERVER_ERROR.getMessage());
    assertThat(response.message()).doesNotContain(RAW_SQL).doesNotContain("TaskStore");
  }

  @Test
  @DisplayName("연결 실패는 UNAVAILABLE로 매핑되며 원인 메시지를 숨긴다")
  void connectionFailureHidesCause() {
    ErrorResponse response =
        ErrorResponse.of(
            new StoreConnectionException("GetById", new SQLException("host db-1:3306 refused")));

    assertThat(response.status()).isEqualTo(ErrorStatus.UNAVAILABLE);
    assertThat(response.message()).doesNotContain("db-1");
  }

  @Test
  @DisplayName("분류 체계 밖의 예외도 Internal 로 매핑된다")
  void unknownThrowableFallsBackToInternal() {
    ErrorResponse response = ErrorResponse.of(new IllegalStateException(RAW_SQL));

    assertThat(response.code()).isEqualTo(TaskErrorCode.INTERNAL_SERVER_ERROR.getCode());
    assertThat(response.message()).doesNotContain(RAW_SQL);
    assertThat(response.httpStatusCode()).isEqualTo(500);
  }
}
