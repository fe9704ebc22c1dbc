package uk.gegc.costcentre.shared.api.problem;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.context.request.WebRequest;

import java.net.URI;
import java.time.Instant;

/**
 * Builds the RFC 7807 bodies returned by every error path of the cost API.
 *
 * <p>Each problem carries a {@code timestamp} and an {@code errorCode}, the last path segment of its
 * type URI, so clients can branch on a short stable string.
 */
public final class ProblemDetailBuilder {

    private ProblemDetailBuilder() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static ProblemDetail create(HttpStatus status, URI type, String title, String detail,
                                       HttpServletRequest request) {
        return build(status, type, title, detail, request != null ? request.getRequestURI() : null);
    }

    /**
     * Variant for {@code ResponseEntityExceptionHandler} overrides, which only expose a {@link WebRequest}.
     */
    public static ProblemDetail create(HttpStatus status, URI type, String title, String detail,
                                       WebRequest request) {
        String path = null;
        if (request != null) {
            String description = request.getDescription(false);
            path = description != null && description.startsWith("uri=") ? description.substring(4) : description;
        }
        return build(status, type, title, detail, path);
    }

    private static ProblemDetail build(HttpStatus status, URI type, String title, String detail, String path) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setType(type);
        problem.setTitle(title);
        if (path != null && !path.isBlank()) {
            problem.setInstance(URI.create(path));
        }
        problem.setProperty("errorCode", errorCode(type));
        problem.setProperty("timestamp", Instant.now());
        return problem;
    }

    static String errorCode(URI type) {
        String path = type.getPath();
        if (path == null || path.isEmpty()) {
            return "unknown";
        }
        return path.substring(path.lastIndexOf('/') + 1);
    }
}
