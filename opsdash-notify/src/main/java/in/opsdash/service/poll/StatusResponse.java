package in.opsdash.service.poll;

/**
 * Raw response to one status request.
 *
 * @param statusCode HTTP status code
 * @param body       Response body, may be null or not JSON at all
 */
public record StatusResponse(int statusCode, String body) {

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }
}
