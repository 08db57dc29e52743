package tech.ledgerbridge.broker.shared;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;

public final class RedirectUris {

    private RedirectUris() {
    }

    /**
     * Append URL-encoded query parameters to a redirect target that may already carry a query.
     */
    public static URI withQuery(String base, Map<String, String> params) {
        StringBuilder url = new StringBuilder(base);
        char separator = base.contains("?") ? '&' : '?';
        for (Map.Entry<String, String> param : params.entrySet()) {
            url.append(separator)
                .append(URLEncoder.encode(param.getKey(), StandardCharsets.UTF_8))
                .append('=')
                .append(URLEncoder.encode(param.getValue(), StandardCharsets.UTF_8));
            separator = '&';
        }
        return URI.create(url.toString());
    }
}
