package ai.aedify.autoDeploy.controller;

import ai.aedify.autoDeploy.dto.ErrorResponse;
import ai.aedify.autoDeploy.infra.CoolifyApiException;
import ai.aedify.autoDeploy.portCounter.PortCounterException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * 컨트롤러 공통 예외 -> HTTP 응답 변환.
 * <ul>
 *     <li>{@link IllegalArgumentException}: 400</li>
 *     <li>{@link CoolifyApiException}: Coolify 상태 코드 그대로</li>
 *     <li>{@link PortCounterException}: 503 (해당 요청만 실패, 서버는 계속 동작)</li>
 *     <li>그 외: 500</li>
 * </ul>
 */
final class ErrorResponses {

    private ErrorResponses() {
    }

    static ResponseEntity<Object> from(Exception e, String failurePrefix) {
        if (e instanceof IllegalArgumentException) {
            return ResponseEntity.badRequest().body(new ErrorResponse(e.getMessage()));
        }
        if (e instanceof CoolifyApiException apiException) {
            return ResponseEntity.status(apiException.getStatusCode())
                    .body(new ErrorResponse(apiException.toErrorDetail()));
        }
        if (e instanceof PortCounterException) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(new ErrorResponse("Host port allocation failed: " + e.getMessage()));
        }
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse(failurePrefix + e.getMessage()));
    }
}
