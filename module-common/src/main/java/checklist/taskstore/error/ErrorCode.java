package checklist.taskstore.error;

/** 태스크 저장소 전 계층이 공유하는 에러 코드 계약 */
public interface ErrorCode {
  String getCode();

  String getMessage();

  ErrorStatus getStatus();
}
