package com.tencent.scanflow.infrastructure.filesystem;

/**
 * 文件系统存储的键校验，runId / artifactId 会直接拼接进路径
 */
final class StoreKeys {

    private StoreKeys() {
    }

    static String validate(String kind, String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException(kind + " must not be empty");
        }
        if (key.contains("..") || key.startsWith("/") || key.startsWith("\\")) {
            throw new IllegalArgumentException("Invalid " + kind + ": " + key);
        }
        return key;
    }
}
