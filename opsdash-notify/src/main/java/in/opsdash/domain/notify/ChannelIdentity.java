package in.opsdash.domain.notify;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Identity the notification channel is addressed by.
 *
 * Immutable for the life of one channel. A different identity always means a
 * different channel address and therefore a fresh connect.
 *
 * @param subjectId Admin subject id supplied by the auth subsystem
 * @param role      Admin role (support, finance, super_admin, ...)
 */
public record ChannelIdentity(String subjectId, String role) {

    public ChannelIdentity {
        if (subjectId == null || subjectId.isBlank()) {
            throw new IllegalArgumentException("subjectId must not be blank");
        }
        if (role == null || role.isBlank()) {
            throw new IllegalArgumentException("role must not be blank");
        }
    }

    /**
     * Channel path for this identity: {@code /notify/{subjectId}?role={role}}.
     * Pure function of the two fields.
     */
    public String channelPath() {
        return "/notify/" + encode(subjectId) + "?role=" + encode(role);
    }

    /**
     * Full channel URI under the given base (trailing slash tolerated).
     */
    public URI channelUri(String baseUrl) {
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        return URI.create(base + channelPath());
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    @Override
    public String toString() {
        return subjectId + ":" + role;
    }
}
