package checklist.taskstore.error;

import org.springframework.http.HttpStatus;

/**
 * 전송 계층에 독립적인 외부 상태 카테고리
 *
 * <p>각 전송 계층(HTTP, gRPC 등)은 이 카테고리를 자신의 상태 코드로 변환합니다. HTTP 매핑은 참고용으로 함께 제공합니다.
 */
public enum ErrorStatus {
  NOT_FOUND(HttpStatus.NOT_FOUND),
  ALREADY_EXISTS(HttpStatus.CONFLICT),
  FAILED_PRECONDITION(HttpStatus.UNPROCESSABLE_ENTITY),
  INVALID_ARGUMENT(HttpStatus.BAD_REQUEST),
  UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE),
  INTERNAL(HttpStatus.INTERNAL_SERVER_ERROR);

  private final HttpStatus httpStatus;

  ErrorStatus(HttpStatus httpStatus) {
    this.httpStatus = httpStatus;
  }

  public HttpStatus httpStatus() {
    return httpStatus;
  }

  public boolean isClientError() {
    return httpStatus.is4xxClientError();
  }
}
