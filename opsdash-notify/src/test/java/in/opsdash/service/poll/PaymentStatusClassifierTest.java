package in.opsdash.service.poll;

import in.opsdash.domain.poll.PollVerdict;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PaymentStatusClassifierTest {

    private final PaymentStatusClassifier classifier = new PaymentStatusClassifier();

    private PollVerdict classify(int status, String body) {
        return classifier.classify(new StatusResponse(status, body));
    }

    @Test
    void testPaidIsSuccess() {
        assertEquals(PollVerdict.SUCCESS, classify(200, "{\"payment_status\":\"paid\",\"status\":\"complete\"}"));
    }

    @Test
    void testExpiredIsFailure() {
        assertEquals(PollVerdict.FAILURE, classify(200, "{\"payment_status\":\"unpaid\",\"status\":\"expired\"}"));
    }

    @Test
    void testEverythingElseIsInconclusive() {
        assertEquals(PollVerdict.INCONCLUSIVE, classify(200, "{}"));
        assertEquals(PollVerdict.INCONCLUSIVE, classify(200, "{\"payment_status\":\"unpaid\",\"status\":\"open\"}"));
        assertEquals(PollVerdict.INCONCLUSIVE, classify(200, "not json"));
        assertEquals(PollVerdict.INCONCLUSIVE, classify(200, "[]"));
        assertEquals(PollVerdict.INCONCLUSIVE, classify(200, null));
        assertEquals(PollVerdict.INCONCLUSIVE, classify(500, "{\"payment_status\":\"paid\"}"));
        assertEquals(PollVerdict.INCONCLUSIVE, classify(404, "{\"status\":\"expired\"}"));
        assertEquals(PollVerdict.INCONCLUSIVE, classifier.classify(null));
    }
}
