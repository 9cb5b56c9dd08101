package ai.aedify.autoDeploy.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class EnvVarRequest {
    private String key;
    private String value;

    @JsonProperty("is_preview")
    private boolean preview = false;

    @JsonProperty("is_literal")
    private boolean literal = true;
}
