package com.kita.invoicing.client;

import com.kita.invoicing.exception.SecurityInvariantException;
import okhttp3.HttpUrl;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Locale;
import java.util.Set;

/**
 * Interceptor that blocks organization directory searches keyed by tax id
 *
 * <p>A tenant's provider organization is only ever resolved from the local
 * mapping store. Any {@code GET} on a directory resource carrying a tax-id
 * filter is rejected before it leaves the process.
 */
public class DirectorySearchGuard implements Interceptor {

    private static final Logger logger = LoggerFactory.getLogger(DirectorySearchGuard.class);

    /** Path segments naming an organization or person directory */
    public static final Set<String> DIRECTORY_SEGMENTS = Set.of("organizations", "people", "persons");

    /** Query parameters that filter by tax id */
    public static final Set<String> TAX_ID_PARAMETERS = Set.of("tin", "rfc", "tax_id", "taxid");

    private static final String[] TAX_ID_SEARCH_TERMS = {"tax_id:", "rfc:", "tin:"};

    @Override
    public Response intercept(Chain chain) throws IOException {
        Request request = chain.request();
        check(request);
        return chain.proceed(request);
    }

    /**
     * Reject the request if it is a directory search by tax id
     *
     * @param request outgoing request
     * @throws SecurityInvariantException if the request searches by tax id
     */
    public void check(Request request) {
        if (!"GET".equalsIgnoreCase(request.method())) {
            return;
        }
        HttpUrl url = request.url();
        if (!isDirectoryPath(url)) {
            return;
        }
        for (String name : url.queryParameterNames()) {
            String lower = name.toLowerCase(Locale.ROOT);
            if (TAX_ID_PARAMETERS.contains(lower)) {
                reject(url, name);
            }
            if ("q".equals(lower) || "search".equals(lower)) {
                for (String value : url.queryParameterValues(name)) {
                    if (containsTaxIdTerm(value)) {
                        reject(url, name);
                    }
                }
            }
        }
    }

    private boolean isDirectoryPath(HttpUrl url) {
        for (String segment : url.pathSegments()) {
            if (DIRECTORY_SEGMENTS.contains(segment.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    private boolean containsTaxIdTerm(String value) {
        if (value == null) {
            return false;
        }
        String lower = value.toLowerCase(Locale.ROOT);
        for (String term : TAX_ID_SEARCH_TERMS) {
            if (lower.contains(term)) {
                return true;
            }
        }
        return false;
    }

    private void reject(HttpUrl url, String parameter) {
        logger.error("Blocked directory search by tax id on {} (parameter '{}')", url.encodedPath(), parameter);
        throw new SecurityInvariantException(
            "Organization lookup by tax id is not allowed: " + url.encodedPath());
    }
}
