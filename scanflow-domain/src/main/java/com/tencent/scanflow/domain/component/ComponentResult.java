package com.tencent.scanflow.domain.component;

import com.tencent.scanflow.domain.schema.Message;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * ComponentResult - 组件调用结果
 * <p>
 * 三种结果之一:
 * <ul>
 *   <li>SUCCESS: 产出消息</li>
 *   <li>PENDING: 无法同步完成 (例如异步批处理 API 尚未返回)，属正常挂起而非故障</li>
 *   <li>FAILURE: 执行失败</li>
 * </ul>
 * </p>
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ComponentResult {

    public enum Kind {
        SUCCESS,
        PENDING,
        FAILURE
    }

    private final Kind kind;

    private final Message message;

    /**
     * PENDING 时为挂起原因，FAILURE 时为错误信息
     */
    private final String reason;

    private final Throwable cause;

    public static ComponentResult success(Message message) {
        if (message == null) {
            throw new IllegalArgumentException("Success result requires a message");
        }
        return new ComponentResult(Kind.SUCCESS, message, null, null);
    }

    public static ComponentResult pending(String reason) {
        return new ComponentResult(Kind.PENDING, null, reason, null);
    }

    public static ComponentResult failure(String reason) {
        return new ComponentResult(Kind.FAILURE, null, reason, null);
    }

    public static ComponentResult failure(String reason, Throwable cause) {
        return new ComponentResult(Kind.FAILURE, null, reason, cause);
    }

    public boolean isSuccess() {
        return kind == Kind.SUCCESS;
    }

    public boolean isPending() {
        return kind == Kind.PENDING;
    }

    public boolean isFailure() {
        return kind == Kind.FAILURE;
    }
}
