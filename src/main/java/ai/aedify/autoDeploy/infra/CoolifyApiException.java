package ai.aedify.autoDeploy.infra;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Coolify API 호출 실패. Coolify가 돌려준 상태 코드와 응답 본문을 그대로 담습니다.
 */
public class CoolifyApiException extends RuntimeException {

    private final int statusCode;
    private final Object detail;

    public CoolifyApiException(int statusCode, Object detail, String message) {
        super(message);
        this.statusCode = statusCode;
        this.detail = detail;
    }

    public CoolifyApiException(int statusCode, Object detail, String message, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.detail = detail;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public Object getDetail() {
        return detail;
    }

    /**
     * 응답 본문에 실을 오류 상세. {@code {"status_code": ..., "detail": ...}} 형태입니다.
     */
    public Map<String, Object> toErrorDetail() {
        Map<String, Object> errorDetail = new LinkedHashMap<>();
        errorDetail.put("status_code", statusCode);
        errorDetail.put("detail", detail);
        return errorDetail;
    }
}
