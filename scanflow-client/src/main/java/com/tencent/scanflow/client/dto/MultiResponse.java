package com.tencent.scanflow.client.dto;

import lombok.Data;
import lombok.EqualsAndHashCode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Response with a list of data
 */
@EqualsAndHashCode(callSuper = true)
@Data
public class MultiResponse<T> extends Response {
    private List<T> data = new ArrayList<>();

    public static <T> MultiResponse<T> of(Collection<T> data) {
        MultiResponse<T> response = new MultiResponse<>();
        response.setSuccess(true);
        response.setData(new ArrayList<>(data));
        return response;
    }

    public boolean isEmpty() {
        return data == null || data.isEmpty();
    }
}
