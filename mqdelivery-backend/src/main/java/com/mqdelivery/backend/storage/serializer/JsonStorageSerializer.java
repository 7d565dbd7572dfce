/**
 * JSON存储序列化器实现
 *
 * @author zhenglin
 * @date 2026/10/15
 */
package com.mqdelivery.backend.storage.serializer;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;

/**
 * 基于Jackson的JSON序列化器
 * 会话快照和保留消息都以JSON存储，字节数组载荷按Base64编码
 */
@Slf4j
public class JsonStorageSerializer<T> implements StorageSerializer<T> {

    private static final ObjectMapper OBJECT_MAPPER;

    static {
        OBJECT_MAPPER = new ObjectMapper();
        OBJECT_MAPPER.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
        OBJECT_MAPPER.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        // 只序列化非空字段，减少存储空间
        OBJECT_MAPPER.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    private final Class<T> targetType;

    public JsonStorageSerializer(Class<T> targetType) {
        this.targetType = targetType;
    }

    public static <U> JsonStorageSerializer<U> forType(Class<U> targetType) {
        return new JsonStorageSerializer<>(targetType);
    }

    @Override
    public byte[] serialize(T object) throws SerializationException {
        if (object == null) {
            return null;
        }
        try {
            return OBJECT_MAPPER.writeValueAsBytes(object);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize object of type {}: {}",
                    object.getClass().getSimpleName(), e.getMessage());
            throw new SerializationException("Failed to serialize object", e);
        }
    }

    @Override
    public T deserialize(byte[] bytes) throws SerializationException {
        if (bytes == null || bytes.length == 0) {
            return null;
        }
        try {
            return OBJECT_MAPPER.readValue(bytes, targetType);
        } catch (IOException e) {
            log.error("Failed to deserialize object to type {}: {}",
                    targetType.getSimpleName(), e.getMessage());
            throw new SerializationException("Failed to deserialize object", e);
        }
    }
}
