package ai.aedify.autoDeploy.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 오류 응답 본문. {@code detail}은 문자열이거나 Coolify가 돌려준 오류 객체입니다.
 */
@Getter
@AllArgsConstructor
public class ErrorResponse {
    private final Object detail;
}
