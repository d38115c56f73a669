package com.acme.autodoist.core;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HTTP-visible outcome of a delivery: a status code and the JSON body fields.
 */
public record PipelineResult(int status, Map<String, Object> body) {

    public static PipelineResult ok(String deliveryId, Map<String, Object> fields) {
        var body = new LinkedHashMap<String, Object>();
        body.put("ok", true);
        body.put("delivery_id", deliveryId);
        body.putAll(fields);
        return new PipelineResult(200, body);
    }

    public static PipelineResult failure(int status, String error, String deliveryId) {
        var body = new LinkedHashMap<String, Object>();
        body.put("ok", false);
        if (deliveryId != null) {
            body.put("delivery_id", deliveryId);
        }
        body.put("error", error);
        return new PipelineResult(status, body);
    }

    public boolean isDuplicate() {
        return Boolean.TRUE.equals(body.get("duplicate"));
    }
}
