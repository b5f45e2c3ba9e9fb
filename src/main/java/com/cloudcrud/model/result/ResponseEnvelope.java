package com.cloudcrud.model.result;

import lombok.Data;
import lombok.AllArgsConstructor;
import lombok.NoArgsConstructor;
import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Uniform result of every cloud function: {@code success}, an optional
 * {@code message}, and the operation payload flattened next to them
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"success", "message"})
public class ResponseEnvelope {

    private Boolean success;
    private String message;

    @JsonIgnore
    private Map<String, Object> payload = new LinkedHashMap<>();

    @JsonAnyGetter
    public Map<String, Object> getPayload() {
        return payload;
    }

    /**
     * Create successful envelope
     */
    public static ResponseEnvelope success() {
        ResponseEnvelope envelope = new ResponseEnvelope();
        envelope.setSuccess(true);
        return envelope;
    }

    /**
     * Create successful envelope with a message
     */
    public static ResponseEnvelope success(String message) {
        ResponseEnvelope envelope = success();
        envelope.setMessage(message);
        return envelope;
    }

    /**
     * Add a payload entry
     */
    public ResponseEnvelope with(String key, Object value) {
        payload.put(key, value);
        return this;
    }

    public Object get(String key) {
        return payload.get(key);
    }
}
