package com.tencent.scanflow.domain.schema;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * MessageMerger - 扇入消息合并
 * <p>
 * 对无 transform 的多输入制品，将各输入的 "data" 列表按声明顺序拼接为一条消息；
 * 不含 "data" 列表的输入整体作为一个元素加入。其余字段取第一个输入的值。
 * </p>
 */
public final class MessageMerger {

    public static final String DATA_KEY = "data";

    private MessageMerger() {
    }

    public static Message concatenate(String id, Schema schema, List<Message> inputs) {
        if (inputs.isEmpty()) {
            throw new IllegalArgumentException("Cannot merge an empty input list");
        }
        if (inputs.size() == 1) {
            return inputs.get(0).toBuilder().id(id).schema(schema).build();
        }

        Map<String, Object> merged = new LinkedHashMap<>(inputs.get(0).getContent());
        List<Object> data = new ArrayList<>();
        for (Message input : inputs) {
            Object items = input.getContent().get(DATA_KEY);
            if (items instanceof List) {
                data.addAll((List<?>) items);
            } else {
                data.add(input.getContent());
            }
        }
        merged.put(DATA_KEY, data);

        return Message.builder()
                .id(id)
                .schema(schema)
                .content(merged)
                .source("merge:concatenate")
                .build();
    }
}
