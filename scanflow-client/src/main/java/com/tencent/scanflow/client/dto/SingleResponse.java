package com.tencent.scanflow.client.dto;

import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * Single Response with data
 */
@EqualsAndHashCode(callSuper = true)
@Data
public class SingleResponse<T> extends Response {
    private T data;

    public static <T> SingleResponse<T> of(T data) {
        SingleResponse<T> response = new SingleResponse<>();
        response.setSuccess(true);
        response.setData(data);
        return response;
    }
}
