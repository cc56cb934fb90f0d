package com.tablehub.gameservice.common;

import com.tablehub.gameservice.common.error.ValidationException;

/**
 * 快照版本参数解析："latest"（或空）-> null，其余必须是非负整数。
 */
public final class VersionParam {

    public static final String LATEST = "latest";

    private VersionParam() {
    }

    public static Integer parse(String raw) {
        if (raw == null || raw.isBlank() || LATEST.equalsIgnoreCase(raw.trim())) {
            return null;
        }
        try {
            int v = Integer.parseInt(raw.trim());
            if (v < 0) {
                throw new ValidationException("版本号不能为负数: " + raw);
            }
            return v;
        } catch (NumberFormatException e) {
            throw new ValidationException("版本参数应为 latest 或整数: " + raw, e);
        }
    }
}
