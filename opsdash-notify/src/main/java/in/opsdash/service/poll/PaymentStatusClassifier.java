package in.opsdash.service.poll;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.opsdash.domain.poll.PollVerdict;

/**
 * Classifier for checkout payment confirmation.
 *
 * - {@code {"payment_status":"paid"}} on a 2xx response: success
 * - {@code {"status":"expired"}} on a 2xx response: failure
 * - anything else (other statuses, non-2xx, malformed body): inconclusive
 */
public final class PaymentStatusClassifier implements PollClassifier {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public PollVerdict classify(StatusResponse response) {
        if (response == null || !response.isSuccessful() || response.body() == null) {
            return PollVerdict.INCONCLUSIVE;
        }

        JsonNode root;
        try {
            root = MAPPER.readTree(response.body());
        } catch (JsonProcessingException e) {
            return PollVerdict.INCONCLUSIVE;
        }
        if (root == null || !root.isObject()) {
            return PollVerdict.INCONCLUSIVE;
        }

        if ("paid".equals(root.path("payment_status").asText(null))) {
            return PollVerdict.SUCCESS;
        }
        if ("expired".equals(root.path("status").asText(null))) {
            return PollVerdict.FAILURE;
        }
        return PollVerdict.INCONCLUSIVE;
    }
}
