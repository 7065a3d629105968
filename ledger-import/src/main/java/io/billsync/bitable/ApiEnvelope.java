package io.billsync.bitable;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;

import java.math.BigInteger;

/**
 * The {code, msg, data} wrapper every Open API response uses. The API reports application
 * failures with a non-zero code, often inside an HTTP 200.
 */
record ApiEnvelope(BigInteger code, String msg, JsonNode data, JsonNode root) {

    static ApiEnvelope parse(ObjectMapper json, String body) throws JsonProcessingException {
        JsonNode root = json.readTree(body);
        if (root == null) root = MissingNode.getInstance();
        JsonNode c = root.get("code");
        BigInteger code = c != null && c.isIntegralNumber() ? c.bigIntegerValue() : null;
        JsonNode m = root.get("msg");
        String msg = m != null && !m.isNull() ? m.asText() : null;
        JsonNode data = root.get("data");
        return new ApiEnvelope(code, msg, data == null ? MissingNode.getInstance() : data, root);
    }

    /** Success sentinel: code present and zero. */
    boolean ok() { return code != null && code.signum() == 0; }
}
