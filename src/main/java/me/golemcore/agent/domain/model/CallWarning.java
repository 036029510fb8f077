package me.golemcore.agent.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Non-fatal warning reported by a provider, e.g. an unsupported setting that
 * was ignored.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CallWarning {

    public static final String UNSUPPORTED_SETTING = "unsupported-setting";
    public static final String UNSUPPORTED_TOOL = "unsupported-tool";
    public static final String OTHER = "other";

    private String type;
    private String setting;
    private String details;
    private String message;
}
