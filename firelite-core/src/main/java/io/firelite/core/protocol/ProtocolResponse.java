package io.firelite.core.protocol;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * HTTP status plus JSON body of one documents API call.
 */
public record ProtocolResponse(int status, JsonNode body) {

    public boolean isSuccess() {
        return status == 200;
    }
}
